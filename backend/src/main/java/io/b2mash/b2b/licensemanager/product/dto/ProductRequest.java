package io.b2mash.b2b.licensemanager.product.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.util.UUID;

/** Body of product create and update submissions. */
public record ProductRequest(
    @NotBlank @Size(max = 255) String name,
    String description,
    @NotNull UUID planType,
    @PositiveOrZero Integer netsuiteId) {}
