package io.b2mash.b2b.licensemanager.renewal.dto;

import io.b2mash.b2b.licensemanager.renewal.SubscriptionPlanRenewal;
import java.time.Instant;
import java.util.UUID;

public record RenewalResponse(
    UUID id,
    UUID priorSubscriptionPlan,
    UUID renewedSubscriptionPlan,
    String renewedPlanTitle,
    String salesforceOpportunityId,
    int numberOfLicenses,
    Instant effectiveDate,
    Instant renewedExpirationDate,
    boolean processed,
    Instant processedDatetime,
    Instant createdAt,
    Instant updatedAt) {

  public static RenewalResponse from(SubscriptionPlanRenewal renewal) {
    return new RenewalResponse(
        renewal.getId(),
        renewal.getPriorSubscriptionPlanId(),
        renewal.getRenewedSubscriptionPlanId(),
        renewal.getRenewedPlanTitle(),
        renewal.getSalesforceOpportunityId(),
        renewal.getNumberOfLicenses(),
        renewal.getEffectiveDate(),
        renewal.getRenewedExpirationDate(),
        renewal.isProcessed(),
        renewal.getProcessedDatetime(),
        renewal.getCreatedAt(),
        renewal.getUpdatedAt());
  }
}
