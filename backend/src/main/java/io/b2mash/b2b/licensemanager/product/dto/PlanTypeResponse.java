package io.b2mash.b2b.licensemanager.product.dto;

import io.b2mash.b2b.licensemanager.product.PlanType;
import java.util.UUID;

public record PlanTypeResponse(
    UUID id,
    String label,
    String description,
    boolean paidSubscription,
    boolean sfIdRequired,
    boolean nsIdRequired,
    boolean internalUseOnly) {

  public static PlanTypeResponse from(PlanType planType) {
    return new PlanTypeResponse(
        planType.getId(),
        planType.getLabel(),
        planType.getDescription(),
        planType.isPaidSubscription(),
        planType.isSfIdRequired(),
        planType.isNsIdRequired(),
        planType.isInternalUseOnly());
  }
}
