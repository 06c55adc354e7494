package io.b2mash.b2b.licensemanager.product.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreatePlanTypeRequest(
    @NotBlank @Size(max = 128) String label,
    String description,
    boolean paidSubscription,
    boolean sfIdRequired,
    boolean nsIdRequired,
    boolean internalUseOnly) {}
