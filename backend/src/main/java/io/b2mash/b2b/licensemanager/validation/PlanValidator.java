package io.b2mash.b2b.licensemanager.validation;

import io.b2mash.b2b.licensemanager.customeragreement.CustomerAgreement;
import io.b2mash.b2b.licensemanager.subscription.SubscriptionLimits;
import io.b2mash.b2b.licensemanager.subscription.SubscriptionPlan;
import io.b2mash.b2b.licensemanager.subscription.SubscriptionPlanRepository;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Business rules checked before an admin submission is committed. Each operation evaluates a fixed,
 * ordered rule chain against a snapshot of the submission and stops at the first failing rule.
 *
 * <p>Holds no mutable state. Rejections are returned as a {@link ValidationOutcome}, never thrown;
 * callers decide how to surface them and must not persist a rejected candidate.
 */
@Component
@EnableConfigurationProperties(SubscriptionLimits.class)
public class PlanValidator {

  private static final Logger log = LoggerFactory.getLogger(PlanValidator.class);

  private final SubscriptionPlanRepository subscriptionPlanRepository;
  private final RuleChain<PlanSubmission> planRules;
  private final RuleChain<RenewalSubmission> renewalRules;
  private final RuleChain<ProductCandidate> productRules;

  public PlanValidator(
      SubscriptionLimits limits, SubscriptionPlanRepository subscriptionPlanRepository) {
    this.subscriptionPlanRepository = subscriptionPlanRepository;
    this.planRules = subscriptionPlanRules(limits);
    this.renewalRules = renewalRules();
    this.productRules = productRules();
  }

  /**
   * Checks a submitted subscription plan.
   *
   * @param candidate the submitted plan and its related records
   * @param isNewAgreementLink true when the customer agreement link was set by this submission
   * @param now submission time
   */
  public ValidationOutcome validateSubscriptionPlan(
      SubscriptionPlanCandidate candidate, boolean isNewAgreementLink, Instant now) {
    return planRules.evaluate(new PlanSubmission(candidate, isNewAgreementLink, now));
  }

  /**
   * Checks a submitted renewal against the plan it renews. Dates must be ordered as {@code now <=
   * effective_date <= renewed_expiration_date} and {@code prior expiration_date <= effective_date}.
   * A missing prior plan is rejected on {@code prior_subscription_plan}.
   */
  public ValidationOutcome validateRenewal(
      RenewalCandidate candidate, SubscriptionPlan priorPlan, Instant now) {
    return renewalRules.evaluate(new RenewalSubmission(candidate, priorPlan, now));
  }

  public ValidationOutcome validateProduct(ProductCandidate candidate) {
    return productRules.evaluate(candidate);
  }

  /**
   * Lists the plans an agreement may use for auto-applied licenses at {@code now}: its active plans
   * running at {@code now}. The plan currently flagged for auto-apply is preselected.
   */
  @Transactional(readOnly = true)
  public AutoApplyChoices deriveAutoApplyChoices(CustomerAgreement agreement, Instant now) {
    var activePlans = subscriptionPlanRepository.findActiveForAgreement(agreement.getId(), now);
    var currentPlanId =
        activePlans.stream()
            .filter(SubscriptionPlan::isShouldAutoApplyLicenses)
            .map(SubscriptionPlan::getId)
            .findFirst()
            .orElse(null);
    log.debug(
        "Derived auto-apply choices: agreement={}, plans={}, current={}",
        agreement.getId(),
        activePlans.size(),
        currentPlanId);
    return AutoApplyChoices.present(activePlans, currentPlanId);
  }

  private static RuleChain<PlanSubmission> subscriptionPlanRules(SubscriptionLimits limits) {
    int maxNumLicenses = limits.maxNumLicenses();
    return RuleChain.<PlanSubmission>builder("subscription_plan")
        .rule(
            "enterprise_catalog_uuid",
            s -> s.newAgreementLink() && !s.candidate().hasCatalogFromItselfOrAgreement(),
            "The subscription must have an enterprise catalog uuid from itself or its customer"
                + " agreement")
        .rule(
            "num_licenses",
            s ->
                s.candidate().licenseCount() > maxNumLicenses
                    && !s.candidate().forInternalUseOnly(),
            "Non-test subscriptions may not have more than " + maxNumLicenses + " licenses")
        .rule(
            "revoke_max_percentage",
            s -> s.candidate().revocationCapEnabled() && !isPercentage(s.candidate()),
            "Must be a valid percentage (0-100).")
        .rule("product", s -> s.candidate().product() == null, "You must specify a product.")
        .rule(
            "salesforce_opportunity_id",
            s ->
                s.candidate().productPlanType() != null
                    && s.candidate().productPlanType().isSfIdRequired()
                    && !s.candidate().hasSalesforceOpportunityId(),
            "You must specify Salesforce ID for selected product.")
        .build();
  }

  private static RuleChain<RenewalSubmission> renewalRules() {
    return RuleChain.<RenewalSubmission>builder("subscription_plan_renewal")
        .rule("prior_subscription_plan", s -> s.priorPlan() == null, "This field is required.")
        .rule(
            "effective_date",
            s -> s.candidate().effectiveDate().isBefore(s.now()),
            "A subscription renewal can not be scheduled to become effective in the past.")
        .rule(
            "renewed_expiration_date",
            s -> s.candidate().renewedExpirationDate().isBefore(s.candidate().effectiveDate()),
            "A subscription renewal can not expire before it becomes effective.")
        .rule(
            "effective_date",
            s -> s.candidate().effectiveDate().isBefore(s.priorPlan().getExpirationDate()),
            "A subscription renewal can not take effect before a subscription expires.")
        .build();
  }

  private static RuleChain<ProductCandidate> productRules() {
    return RuleChain.<ProductCandidate>builder("product")
        .rule(
            "netsuite_id",
            c -> c.planType().isNsIdRequired() && !c.hasNetsuiteId(),
            "You must specify Netsuite ID for selected plan type.")
        .build();
  }

  private static boolean isPercentage(SubscriptionPlanCandidate candidate) {
    var percentage = candidate.revokeMaxPercentage();
    // unset means the stored default applies
    return percentage == null || (percentage >= 0 && percentage <= 100);
  }

  private record PlanSubmission(
      SubscriptionPlanCandidate candidate, boolean newAgreementLink, Instant now) {}

  private record RenewalSubmission(
      RenewalCandidate candidate, SubscriptionPlan priorPlan, Instant now) {}
}
