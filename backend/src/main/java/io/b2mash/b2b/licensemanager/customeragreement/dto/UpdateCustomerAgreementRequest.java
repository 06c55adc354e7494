package io.b2mash.b2b.licensemanager.customeragreement.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.util.UUID;

/**
 * Body of a customer agreement update submission.
 *
 * @param subscriptionForAutoAppliedLicenses id of the plan to use for auto-applied licenses, the
 *     empty string to stop auto-applying, or null to leave the current choice unchanged
 */
public record UpdateCustomerAgreementRequest(
    @Size(max = 128) String enterpriseCustomerSlug,
    @Size(max = 255) String enterpriseCustomerName,
    UUID defaultEnterpriseCatalogUuid,
    boolean disableExpirationNotifications,
    @NotNull @PositiveOrZero Long licenseDurationBeforePurgeDays,
    String subscriptionForAutoAppliedLicenses) {}
