package io.b2mash.b2b.licensemanager.subscription.dto;

import io.b2mash.b2b.licensemanager.subscription.SubscriptionPlan;
import java.time.Instant;
import java.util.UUID;

public record SubscriptionPlanResponse(
    UUID id,
    String title,
    UUID customerAgreement,
    UUID product,
    UUID enterpriseCatalogUuid,
    Instant startDate,
    Instant expirationDate,
    boolean expirationProcessed,
    boolean active,
    boolean forInternalUseOnly,
    boolean shouldAutoApplyLicenses,
    boolean revocationCapEnabled,
    int revokeMaxPercentage,
    int numRevocationsApplied,
    Integer numRevocationsRemaining,
    int numLicenses,
    String salesforceOpportunityId,
    Instant createdAt,
    Instant updatedAt) {

  public static SubscriptionPlanResponse from(SubscriptionPlan plan) {
    return new SubscriptionPlanResponse(
        plan.getId(),
        plan.getTitle(),
        plan.getCustomerAgreementId(),
        plan.getProductId(),
        plan.getEnterpriseCatalogUuid(),
        plan.getStartDate(),
        plan.getExpirationDate(),
        plan.isExpirationProcessed(),
        plan.isActive(),
        plan.isForInternalUseOnly(),
        plan.isShouldAutoApplyLicenses(),
        plan.isRevocationCapEnabled(),
        plan.getRevokeMaxPercentage(),
        plan.getNumRevocationsApplied(),
        plan.getNumRevocationsRemaining(),
        plan.getNumLicenses(),
        plan.getSalesforceOpportunityId(),
        plan.getCreatedAt(),
        plan.getUpdatedAt());
  }
}
