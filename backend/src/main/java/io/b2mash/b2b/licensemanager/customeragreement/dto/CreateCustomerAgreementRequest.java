package io.b2mash.b2b.licensemanager.customeragreement.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.util.UUID;

/**
 * Body of a customer agreement create submission.
 *
 * @param licenseDurationBeforePurgeDays days after which unclaimed, revoked or expired licenses of
 *     the agreement have user data retired; null applies the configured default
 */
public record CreateCustomerAgreementRequest(
    @NotNull UUID enterpriseCustomerUuid,
    @Size(max = 128) String enterpriseCustomerSlug,
    @Size(max = 255) String enterpriseCustomerName,
    UUID defaultEnterpriseCatalogUuid,
    boolean disableExpirationNotifications,
    @PositiveOrZero Long licenseDurationBeforePurgeDays) {}
