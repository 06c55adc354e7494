package io.b2mash.b2b.licensemanager.validation;

import java.time.Instant;
import java.util.Objects;

/** Submitted dates of a subscription plan renewal. */
public record RenewalCandidate(Instant effectiveDate, Instant renewedExpirationDate) {

  public RenewalCandidate {
    Objects.requireNonNull(effectiveDate, "effectiveDate");
    Objects.requireNonNull(renewedExpirationDate, "renewedExpirationDate");
  }
}
