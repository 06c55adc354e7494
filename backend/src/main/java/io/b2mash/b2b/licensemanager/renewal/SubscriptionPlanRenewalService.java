package io.b2mash.b2b.licensemanager.renewal;

import io.b2mash.b2b.licensemanager.audit.AuditEventBuilder;
import io.b2mash.b2b.licensemanager.audit.AuditService;
import io.b2mash.b2b.licensemanager.exception.InvalidStateException;
import io.b2mash.b2b.licensemanager.exception.ResourceConflictException;
import io.b2mash.b2b.licensemanager.exception.ResourceNotFoundException;
import io.b2mash.b2b.licensemanager.exception.SubmissionRejectedException;
import io.b2mash.b2b.licensemanager.renewal.dto.CreateRenewalRequest;
import io.b2mash.b2b.licensemanager.renewal.dto.RenewalResponse;
import io.b2mash.b2b.licensemanager.renewal.dto.UpdateRenewalRequest;
import io.b2mash.b2b.licensemanager.subscription.SubscriptionPlan;
import io.b2mash.b2b.licensemanager.subscription.SubscriptionPlanRepository;
import io.b2mash.b2b.licensemanager.validation.PlanValidator;
import io.b2mash.b2b.licensemanager.validation.RenewalCandidate;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class SubscriptionPlanRenewalService {

  private static final Logger log = LoggerFactory.getLogger(SubscriptionPlanRenewalService.class);

  private static final String ENTITY_LABEL = "subscription plan renewal";

  private final SubscriptionPlanRenewalRepository renewalRepository;
  private final SubscriptionPlanRepository planRepository;
  private final PlanValidator planValidator;
  private final AuditService auditService;
  private final Clock clock;

  public SubscriptionPlanRenewalService(
      SubscriptionPlanRenewalRepository renewalRepository,
      SubscriptionPlanRepository planRepository,
      PlanValidator planValidator,
      AuditService auditService,
      Clock clock) {
    this.renewalRepository = renewalRepository;
    this.planRepository = planRepository;
    this.planValidator = planValidator;
    this.auditService = auditService;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public List<RenewalResponse> listRenewals() {
    return renewalRepository.findAllByOrderByEffectiveDateAsc().stream()
        .map(RenewalResponse::from)
        .toList();
  }

  @Transactional(readOnly = true)
  public RenewalResponse getRenewal(UUID id) {
    return RenewalResponse.from(requireRenewal(id));
  }

  @Transactional(readOnly = true)
  public SubscriptionPlanRenewal requireRenewal(UUID id) {
    return renewalRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("SubscriptionPlanRenewal", id));
  }

  @Transactional
  public RenewalResponse createRenewal(CreateRenewalRequest request) {
    var priorPlan = requirePriorPlan(request.priorSubscriptionPlan());
    if (renewalRepository.existsByPriorSubscriptionPlanId(priorPlan.getId())) {
      throw new ResourceConflictException(
          "Duplicate renewal", "Subscription plan " + priorPlan.getId() + " is already renewed");
    }

    checkRenewal(
        new RenewalCandidate(request.effectiveDate(), request.renewedExpirationDate()), priorPlan);

    var renewal =
        renewalRepository.save(
            new SubscriptionPlanRenewal(
                priorPlan.getId(),
                request.renewedPlanTitle(),
                request.salesforceOpportunityId(),
                request.numberOfLicenses(),
                request.effectiveDate(),
                request.renewedExpirationDate()));

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("renewal.created")
            .entityType("SUBSCRIPTION_PLAN_RENEWAL")
            .entityId(renewal.getId())
            .details(snapshot(renewal))
            .build());

    log.info(
        "Created renewal: id={}, priorPlan={}, effective={}",
        renewal.getId(),
        priorPlan.getId(),
        renewal.getEffectiveDate());
    return RenewalResponse.from(renewal);
  }

  @Transactional
  public RenewalResponse updateRenewal(UUID id, UpdateRenewalRequest request) {
    var renewal = requireRenewal(id);
    if (renewal.isProcessed()) {
      throw new InvalidStateException(
          "Renewal already processed", "Renewal " + id + " was processed and can not be changed");
    }
    var priorPlan = requirePriorPlan(renewal.getPriorSubscriptionPlanId());

    checkRenewal(
        new RenewalCandidate(request.effectiveDate(), request.renewedExpirationDate()), priorPlan);

    renewal.reschedule(
        request.renewedPlanTitle(),
        request.salesforceOpportunityId(),
        request.numberOfLicenses(),
        request.effectiveDate(),
        request.renewedExpirationDate());
    renewalRepository.save(renewal);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("renewal.updated")
            .entityType("SUBSCRIPTION_PLAN_RENEWAL")
            .entityId(renewal.getId())
            .details(snapshot(renewal))
            .build());

    log.info("Updated renewal: id={}, effective={}", renewal.getId(), renewal.getEffectiveDate());
    return RenewalResponse.from(renewal);
  }

  private void checkRenewal(RenewalCandidate candidate, SubscriptionPlan priorPlan) {
    var outcome = planValidator.validateRenewal(candidate, priorPlan, clock.instant());
    if (!outcome.accepted()) {
      throw new SubmissionRejectedException(ENTITY_LABEL, outcome);
    }
  }

  private SubscriptionPlan requirePriorPlan(UUID id) {
    return planRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("SubscriptionPlan", id));
  }

  private static Map<String, Object> snapshot(SubscriptionPlanRenewal renewal) {
    var details = new HashMap<String, Object>();
    details.put("prior_subscription_plan", renewal.getPriorSubscriptionPlanId().toString());
    details.put("number_of_licenses", renewal.getNumberOfLicenses());
    details.put("effective_date", renewal.getEffectiveDate().toString());
    details.put("renewed_expiration_date", renewal.getRenewedExpirationDate().toString());
    return details;
  }
}
