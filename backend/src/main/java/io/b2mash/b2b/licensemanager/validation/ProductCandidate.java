package io.b2mash.b2b.licensemanager.validation;

import io.b2mash.b2b.licensemanager.product.PlanType;
import java.util.Objects;

/**
 * Submitted product fields the product rules read.
 *
 * @param planType the product's plan type
 * @param netsuiteId submitted NetSuite id; null and zero both count as absent
 */
public record ProductCandidate(PlanType planType, Integer netsuiteId) {

  public ProductCandidate {
    Objects.requireNonNull(planType, "planType");
  }

  boolean hasNetsuiteId() {
    return netsuiteId != null && netsuiteId != 0;
  }
}
