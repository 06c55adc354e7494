package io.b2mash.b2b.licensemanager.customeragreement;

import io.b2mash.b2b.licensemanager.audit.AuditEventBuilder;
import io.b2mash.b2b.licensemanager.audit.AuditService;
import io.b2mash.b2b.licensemanager.customeragreement.dto.AutoApplyChoicesResponse;
import io.b2mash.b2b.licensemanager.customeragreement.dto.CreateCustomerAgreementRequest;
import io.b2mash.b2b.licensemanager.customeragreement.dto.CustomerAgreementResponse;
import io.b2mash.b2b.licensemanager.customeragreement.dto.UpdateCustomerAgreementRequest;
import io.b2mash.b2b.licensemanager.exception.ResourceConflictException;
import io.b2mash.b2b.licensemanager.exception.ResourceNotFoundException;
import io.b2mash.b2b.licensemanager.exception.SubmissionRejectedException;
import io.b2mash.b2b.licensemanager.subscription.SubscriptionLimits;
import io.b2mash.b2b.licensemanager.subscription.SubscriptionPlanRepository;
import io.b2mash.b2b.licensemanager.validation.AutoApplyChoices;
import io.b2mash.b2b.licensemanager.validation.PlanValidator;
import io.b2mash.b2b.licensemanager.validation.ValidationOutcome;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Admin operations on customer agreements, including the choice of the plan whose licenses are
 * auto-applied.
 */
@Service
public class CustomerAgreementService {

  private static final Logger log = LoggerFactory.getLogger(CustomerAgreementService.class);

  static final String AUTO_APPLY_FIELD = "subscription_for_auto_applied_licenses";

  private final CustomerAgreementRepository agreementRepository;
  private final SubscriptionPlanRepository subscriptionPlanRepository;
  private final PlanValidator planValidator;
  private final SubscriptionLimits limits;
  private final AuditService auditService;
  private final Clock clock;

  public CustomerAgreementService(
      CustomerAgreementRepository agreementRepository,
      SubscriptionPlanRepository subscriptionPlanRepository,
      PlanValidator planValidator,
      SubscriptionLimits limits,
      AuditService auditService,
      Clock clock) {
    this.agreementRepository = agreementRepository;
    this.subscriptionPlanRepository = subscriptionPlanRepository;
    this.planValidator = planValidator;
    this.limits = limits;
    this.auditService = auditService;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public List<CustomerAgreementResponse> listAgreements() {
    return agreementRepository.findAllByOrderByEnterpriseCustomerNameAsc().stream()
        .map(this::toResponse)
        .toList();
  }

  @Transactional(readOnly = true)
  public CustomerAgreementResponse getAgreement(UUID id) {
    return toResponse(requireAgreement(id));
  }

  @Transactional(readOnly = true)
  public CustomerAgreement requireAgreement(UUID id) {
    return agreementRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("CustomerAgreement", id));
  }

  @Transactional(readOnly = true)
  public AutoApplyChoicesResponse getAutoApplyChoices(UUID id) {
    var agreement = requireAgreement(id);
    return AutoApplyChoicesResponse.from(
        planValidator.deriveAutoApplyChoices(agreement, clock.instant()));
  }

  @Transactional
  public CustomerAgreementResponse createAgreement(CreateCustomerAgreementRequest request) {
    if (agreementRepository.existsByEnterpriseCustomerUuid(request.enterpriseCustomerUuid())) {
      throw new ResourceConflictException(
          "Duplicate customer agreement",
          "Enterprise customer " + request.enterpriseCustomerUuid() + " already has an agreement");
    }
    if (request.enterpriseCustomerSlug() != null
        && agreementRepository.existsByEnterpriseCustomerSlug(request.enterpriseCustomerSlug())) {
      throw new ResourceConflictException(
          "Duplicate customer agreement",
          "Slug '" + request.enterpriseCustomerSlug() + "' is already in use");
    }

    var purgeDuration =
        request.licenseDurationBeforePurgeDays() != null
            ? Duration.ofDays(request.licenseDurationBeforePurgeDays())
            : limits.defaultLicenseDurationBeforePurge();

    var agreement =
        agreementRepository.save(
            new CustomerAgreement(
                request.enterpriseCustomerUuid(),
                request.enterpriseCustomerSlug(),
                request.enterpriseCustomerName(),
                request.defaultEnterpriseCatalogUuid(),
                request.disableExpirationNotifications(),
                purgeDuration));

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("customer_agreement.created")
            .entityType("CUSTOMER_AGREEMENT")
            .entityId(agreement.getId())
            .details(snapshot(agreement))
            .build());

    log.info(
        "Created customer agreement: id={}, enterpriseCustomer={}",
        agreement.getId(),
        agreement.getEnterpriseCustomerUuid());
    return CustomerAgreementResponse.from(agreement, null);
  }

  @Transactional
  public CustomerAgreementResponse updateAgreement(
      UUID id, UpdateCustomerAgreementRequest request) {
    var agreement = requireAgreement(id);

    if (request.enterpriseCustomerSlug() != null
        && agreementRepository.existsByEnterpriseCustomerSlugAndIdNot(
            request.enterpriseCustomerSlug(), id)) {
      throw new ResourceConflictException(
          "Duplicate customer agreement",
          "Slug '" + request.enterpriseCustomerSlug() + "' is already in use");
    }

    var now = clock.instant();
    var choices = planValidator.deriveAutoApplyChoices(agreement, now);
    var requestedPlan = normalizeChoice(request.subscriptionForAutoAppliedLicenses());
    if (requestedPlan != null && !choices.offers(requestedPlan)) {
      throw new SubmissionRejectedException(
          "customer agreement",
          ValidationOutcome.reject(
              AUTO_APPLY_FIELD,
              "Select a valid choice. " + requestedPlan + " is not one of the available choices."));
    }

    agreement.updateTerms(
        request.enterpriseCustomerSlug(),
        request.enterpriseCustomerName(),
        request.defaultEnterpriseCatalogUuid(),
        request.disableExpirationNotifications(),
        Duration.ofDays(request.licenseDurationBeforePurgeDays()));
    agreementRepository.save(agreement);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("customer_agreement.updated")
            .entityType("CUSTOMER_AGREEMENT")
            .entityId(agreement.getId())
            .details(snapshot(agreement))
            .build());

    UUID autoApplicable = currentSelection(choices);
    if (requestedPlan != null && !requestedPlan.equals(choices.selected().value())) {
      autoApplicable = applyAutoApplySelection(agreement, requestedPlan, choices);
    }

    log.info("Updated customer agreement: id={}", agreement.getId());
    return CustomerAgreementResponse.from(agreement, autoApplicable);
  }

  /**
   * Flags the chosen plan for auto-applied licenses and clears the flag on every other plan of the
   * agreement. An empty choice clears the flag everywhere.
   */
  private UUID applyAutoApplySelection(
      CustomerAgreement agreement, String requestedPlan, AutoApplyChoices previous) {
    UUID chosenPlanId = requestedPlan.isEmpty() ? null : UUID.fromString(requestedPlan);

    for (var plan :
        subscriptionPlanRepository.findByCustomerAgreementIdAndShouldAutoApplyLicensesTrue(
            agreement.getId())) {
      if (!plan.getId().equals(chosenPlanId)) {
        plan.disableAutoApply();
        subscriptionPlanRepository.save(plan);
      }
    }
    if (chosenPlanId != null) {
      var chosen =
          subscriptionPlanRepository
              .findById(chosenPlanId)
              .orElseThrow(() -> new ResourceNotFoundException("SubscriptionPlan", chosenPlanId));
      chosen.enableAutoApply();
      subscriptionPlanRepository.save(chosen);
    }

    var details = new HashMap<String, Object>();
    details.put("previous_plan", previous.selected().value());
    details.put("new_plan", requestedPlan);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("customer_agreement.auto_apply_changed")
            .entityType("CUSTOMER_AGREEMENT")
            .entityId(agreement.getId())
            .details(details)
            .build());

    log.info(
        "Changed auto-apply plan: agreement={}, previous={}, new={}",
        agreement.getId(),
        previous.selected().value(),
        requestedPlan);
    return chosenPlanId;
  }

  private CustomerAgreementResponse toResponse(CustomerAgreement agreement) {
    var choices = planValidator.deriveAutoApplyChoices(agreement, clock.instant());
    return CustomerAgreementResponse.from(agreement, currentSelection(choices));
  }

  /** Plan ids are compared in their canonical lower-case form. */
  private static String normalizeChoice(String value) {
    if (value == null || value.isEmpty()) {
      return value;
    }
    try {
      return UUID.fromString(value).toString();
    } catch (IllegalArgumentException ex) {
      // not a plan id, so it can never match an offered choice
      return value;
    }
  }

  private static UUID currentSelection(AutoApplyChoices choices) {
    var selected = choices.selected();
    return selected.isEmpty() ? null : UUID.fromString(selected.value());
  }

  private static Map<String, Object> snapshot(CustomerAgreement agreement) {
    var details = new HashMap<String, Object>();
    details.put("enterprise_customer_uuid", agreement.getEnterpriseCustomerUuid().toString());
    details.put(
        "enterprise_customer_slug", Objects.toString(agreement.getEnterpriseCustomerSlug(), ""));
    details.put(
        "license_duration_before_purge_days", agreement.getLicenseDurationBeforePurge().toDays());
    var catalog = agreement.getDefaultEnterpriseCatalogUuid();
    if (catalog != null) {
      details.put("default_enterprise_catalog_uuid", catalog.toString());
    }
    return details;
  }
}
