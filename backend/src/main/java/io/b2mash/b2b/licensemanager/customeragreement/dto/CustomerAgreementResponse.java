package io.b2mash.b2b.licensemanager.customeragreement.dto;

import io.b2mash.b2b.licensemanager.customeragreement.CustomerAgreement;
import java.time.Instant;
import java.util.UUID;

public record CustomerAgreementResponse(
    UUID id,
    UUID enterpriseCustomerUuid,
    String enterpriseCustomerSlug,
    String enterpriseCustomerName,
    UUID defaultEnterpriseCatalogUuid,
    boolean disableExpirationNotifications,
    long licenseDurationBeforePurgeDays,
    UUID autoApplicableSubscription,
    Instant createdAt,
    Instant updatedAt) {

  public static CustomerAgreementResponse from(
      CustomerAgreement agreement, UUID autoApplicableSubscription) {
    return new CustomerAgreementResponse(
        agreement.getId(),
        agreement.getEnterpriseCustomerUuid(),
        agreement.getEnterpriseCustomerSlug(),
        agreement.getEnterpriseCustomerName(),
        agreement.getDefaultEnterpriseCatalogUuid(),
        agreement.isDisableExpirationNotifications(),
        agreement.getLicenseDurationBeforePurge().toDays(),
        autoApplicableSubscription,
        agreement.getCreatedAt(),
        agreement.getUpdatedAt());
  }
}
