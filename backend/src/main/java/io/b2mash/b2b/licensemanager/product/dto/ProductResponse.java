package io.b2mash.b2b.licensemanager.product.dto;

import io.b2mash.b2b.licensemanager.product.PlanType;
import io.b2mash.b2b.licensemanager.product.Product;
import java.time.Instant;
import java.util.UUID;

public record ProductResponse(
    UUID id,
    String name,
    String description,
    UUID planType,
    String planTypeLabel,
    Integer netsuiteId,
    Instant createdAt,
    Instant updatedAt) {

  public static ProductResponse from(Product product, PlanType planType) {
    return new ProductResponse(
        product.getId(),
        product.getName(),
        product.getDescription(),
        product.getPlanTypeId(),
        planType != null ? planType.getLabel() : null,
        product.getNetsuiteId(),
        product.getCreatedAt(),
        product.getUpdatedAt());
  }
}
