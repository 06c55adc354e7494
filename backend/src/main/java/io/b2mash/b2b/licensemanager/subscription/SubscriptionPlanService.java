package io.b2mash.b2b.licensemanager.subscription;

import io.b2mash.b2b.licensemanager.audit.AuditEventBuilder;
import io.b2mash.b2b.licensemanager.audit.AuditService;
import io.b2mash.b2b.licensemanager.customeragreement.CustomerAgreement;
import io.b2mash.b2b.licensemanager.customeragreement.CustomerAgreementRepository;
import io.b2mash.b2b.licensemanager.exception.ResourceNotFoundException;
import io.b2mash.b2b.licensemanager.exception.SubmissionRejectedException;
import io.b2mash.b2b.licensemanager.product.PlanType;
import io.b2mash.b2b.licensemanager.product.PlanTypeRepository;
import io.b2mash.b2b.licensemanager.product.Product;
import io.b2mash.b2b.licensemanager.product.ProductRepository;
import io.b2mash.b2b.licensemanager.subscription.dto.SubscriptionPlanRequest;
import io.b2mash.b2b.licensemanager.subscription.dto.SubscriptionPlanResponse;
import io.b2mash.b2b.licensemanager.validation.PlanValidator;
import io.b2mash.b2b.licensemanager.validation.SubscriptionPlanCandidate;
import io.b2mash.b2b.licensemanager.validation.ValidationOutcome;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Admin operations on subscription plans. Every create and update runs the field checks, then the
 * plan rules of {@link PlanValidator}; a rejected submission is never saved.
 */
@Service
public class SubscriptionPlanService {

  private static final Logger log = LoggerFactory.getLogger(SubscriptionPlanService.class);

  private static final String ENTITY_LABEL = "subscription plan";

  private final SubscriptionPlanRepository planRepository;
  private final CustomerAgreementRepository agreementRepository;
  private final ProductRepository productRepository;
  private final PlanTypeRepository planTypeRepository;
  private final PlanValidator planValidator;
  private final SubscriptionLimits limits;
  private final AuditService auditService;
  private final Clock clock;

  public SubscriptionPlanService(
      SubscriptionPlanRepository planRepository,
      CustomerAgreementRepository agreementRepository,
      ProductRepository productRepository,
      PlanTypeRepository planTypeRepository,
      PlanValidator planValidator,
      SubscriptionLimits limits,
      AuditService auditService,
      Clock clock) {
    this.planRepository = planRepository;
    this.agreementRepository = agreementRepository;
    this.productRepository = productRepository;
    this.planTypeRepository = planTypeRepository;
    this.planValidator = planValidator;
    this.limits = limits;
    this.auditService = auditService;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public List<SubscriptionPlanResponse> listPlans(UUID customerAgreementId) {
    var plans =
        customerAgreementId != null
            ? planRepository.findByCustomerAgreementIdOrderByStartDateAsc(customerAgreementId)
            : planRepository.findAllByOrderByStartDateDesc();
    return plans.stream().map(SubscriptionPlanResponse::from).toList();
  }

  @Transactional(readOnly = true)
  public SubscriptionPlanResponse getPlan(UUID id) {
    return SubscriptionPlanResponse.from(requirePlan(id));
  }

  @Transactional(readOnly = true)
  public SubscriptionPlan requirePlan(UUID id) {
    return planRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("SubscriptionPlan", id));
  }

  @Transactional
  public SubscriptionPlanResponse createPlan(SubscriptionPlanRequest request) {
    var agreement = requireAgreement(request.customerAgreement());
    var product = loadProduct(request.product());
    var planType = product != null ? requirePlanType(product.getPlanTypeId()) : null;

    int revokeMaxPercentage =
        request.revokeMaxPercentage() != null
            ? request.revokeMaxPercentage()
            : limits.defaultRevokeMaxPercentage();

    checkFields(request);
    var outcome =
        planValidator.validateSubscriptionPlan(
            toCandidate(request, revokeMaxPercentage, agreement, product, planType),
            true,
            clock.instant());
    if (!outcome.accepted()) {
      throw new SubmissionRejectedException(ENTITY_LABEL, outcome);
    }

    var plan =
        planRepository.save(
            new SubscriptionPlan(
                request.title(),
                agreement.getId(),
                product.getId(),
                effectiveCatalog(request, agreement),
                request.startDate(),
                request.expirationDate(),
                request.active() == null || request.active(),
                request.numLicenses(),
                request.forInternalUseOnly(),
                request.revocationCapEnabled(),
                revokeMaxPercentage,
                blankToNull(request.salesforceOpportunityId())));

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("subscription_plan.created")
            .entityType("SUBSCRIPTION_PLAN")
            .entityId(plan.getId())
            .details(snapshot(plan, request.changeReason()))
            .build());

    log.info(
        "Created subscription plan: id={}, agreement={}, licenses={}, reason={}",
        plan.getId(),
        agreement.getId(),
        plan.getNumLicenses(),
        request.changeReason());
    return SubscriptionPlanResponse.from(plan);
  }

  @Transactional
  public SubscriptionPlanResponse updatePlan(UUID id, SubscriptionPlanRequest request) {
    var plan = requirePlan(id);
    var agreement = requireAgreement(request.customerAgreement());
    var product = loadProduct(request.product());
    var planType = product != null ? requirePlanType(product.getPlanTypeId()) : null;
    boolean newAgreementLink = !plan.getCustomerAgreementId().equals(agreement.getId());

    int revokeMaxPercentage =
        request.revokeMaxPercentage() != null
            ? request.revokeMaxPercentage()
            : plan.getRevokeMaxPercentage();

    checkFields(request);
    var outcome =
        planValidator.validateSubscriptionPlan(
            toCandidate(request, revokeMaxPercentage, agreement, product, planType),
            newAgreementLink,
            clock.instant());
    if (!outcome.accepted()) {
      throw new SubmissionRejectedException(ENTITY_LABEL, outcome);
    }

    plan.updateTerms(
        request.title(),
        agreement.getId(),
        product.getId(),
        effectiveCatalog(request, agreement),
        request.startDate(),
        request.expirationDate(),
        request.active() != null ? request.active() : plan.isActive(),
        request.numLicenses(),
        request.forInternalUseOnly(),
        request.revocationCapEnabled(),
        revokeMaxPercentage,
        blankToNull(request.salesforceOpportunityId()));
    // a plan moved to another agreement can not stay that agreement's auto-apply plan
    if (newAgreementLink && plan.isShouldAutoApplyLicenses()) {
      plan.disableAutoApply();
    }
    planRepository.save(plan);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("subscription_plan.updated")
            .entityType("SUBSCRIPTION_PLAN")
            .entityId(plan.getId())
            .details(snapshot(plan, request.changeReason()))
            .build());

    log.info(
        "Updated subscription plan: id={}, agreementChanged={}, reason={}",
        plan.getId(),
        newAgreementLink,
        request.changeReason());
    return SubscriptionPlanResponse.from(plan);
  }

  /** Field-level checks that run before the business rules. */
  private void checkFields(SubscriptionPlanRequest request) {
    if (request.numLicenses() < limits.minNumLicenses()) {
      throw new SubmissionRejectedException(
          ENTITY_LABEL,
          ValidationOutcome.reject(
              "num_licenses",
              "Ensure this value is greater than or equal to " + limits.minNumLicenses() + "."));
    }
    if (request.expirationDate().isBefore(request.startDate())) {
      throw new SubmissionRejectedException(
          ENTITY_LABEL,
          ValidationOutcome.reject(
              "expiration_date", "A subscription can not expire before it starts."));
    }
  }

  private static SubscriptionPlanCandidate toCandidate(
      SubscriptionPlanRequest request,
      int revokeMaxPercentage,
      CustomerAgreement agreement,
      Product product,
      PlanType planType) {
    return new SubscriptionPlanCandidate(
        request.numLicenses(),
        request.forInternalUseOnly(),
        request.revocationCapEnabled(),
        revokeMaxPercentage,
        request.enterpriseCatalogUuid(),
        agreement,
        product,
        planType,
        request.salesforceOpportunityId());
  }

  private static UUID effectiveCatalog(
      SubscriptionPlanRequest request, CustomerAgreement agreement) {
    return request.enterpriseCatalogUuid() != null
        ? request.enterpriseCatalogUuid()
        : agreement.getDefaultEnterpriseCatalogUuid();
  }

  private CustomerAgreement requireAgreement(UUID id) {
    return agreementRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("CustomerAgreement", id));
  }

  private Product loadProduct(UUID id) {
    if (id == null) {
      return null;
    }
    return productRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Product", id));
  }

  private PlanType requirePlanType(UUID id) {
    return planTypeRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("PlanType", id));
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }

  private static Map<String, Object> snapshot(
      SubscriptionPlan plan, SubscriptionPlanChangeReason reason) {
    var details = new HashMap<String, Object>();
    details.put("change_reason", reason.name());
    details.put("title", plan.getTitle());
    details.put("customer_agreement", plan.getCustomerAgreementId().toString());
    details.put("product", plan.getProductId().toString());
    details.put("num_licenses", plan.getNumLicenses());
    details.put("is_active", plan.isActive());
    details.put("for_internal_use_only", plan.isForInternalUseOnly());
    details.put("start_date", plan.getStartDate().toString());
    details.put("expiration_date", plan.getExpirationDate().toString());
    return details;
  }
}
