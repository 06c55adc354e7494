package io.b2mash.b2b.licensemanager.renewal.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.UUID;

public record CreateRenewalRequest(
    @NotNull UUID priorSubscriptionPlan,
    @Size(max = 128) String renewedPlanTitle,
    @Size(max = 18) String salesforceOpportunityId,
    @NotNull @PositiveOrZero Integer numberOfLicenses,
    @NotNull Instant effectiveDate,
    @NotNull Instant renewedExpirationDate) {}
