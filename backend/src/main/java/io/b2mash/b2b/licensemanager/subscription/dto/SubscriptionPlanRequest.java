package io.b2mash.b2b.licensemanager.subscription.dto;

import io.b2mash.b2b.licensemanager.subscription.SubscriptionPlanChangeReason;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.UUID;

/**
 * Body of subscription plan create and update submissions. A missing {@code product} is left to
 * the business rules so it is reported like the other plan rejections.
 *
 * @param active null keeps the current flag on update and means active on create
 * @param revokeMaxPercentage null applies the configured default on create and keeps the current
 *     value on update
 */
public record SubscriptionPlanRequest(
    @NotBlank @Size(max = 128) String title,
    @NotNull UUID customerAgreement,
    UUID product,
    UUID enterpriseCatalogUuid,
    @NotNull Instant startDate,
    @NotNull Instant expirationDate,
    Boolean active,
    @NotNull Integer numLicenses,
    boolean forInternalUseOnly,
    boolean revocationCapEnabled,
    @PositiveOrZero Integer revokeMaxPercentage,
    @Size(max = 18) String salesforceOpportunityId,
    @NotNull SubscriptionPlanChangeReason changeReason) {}
