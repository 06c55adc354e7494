package io.b2mash.b2b.licensemanager.subscription.dto;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.licensemanager.subscription.SubscriptionPlanChangeReason;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class SubscriptionPlanRequestTest {

  private static ValidatorFactory factory;
  private static Validator validator;

  @BeforeAll
  static void setUpValidator() {
    factory = Validation.buildDefaultValidatorFactory();
    validator = factory.getValidator();
  }

  @AfterAll
  static void closeValidator() {
    factory.close();
  }

  @Test
  void negativeRevocationPercentage_violatesConstraintWithCapDisabled() {
    var violations = validator.validate(request(false, -5));

    assertThat(violations)
        .extracting(v -> v.getPropertyPath().toString())
        .containsExactly("revokeMaxPercentage");
  }

  @Test
  void zeroOrUnsetRevocationPercentage_isValid() {
    assertThat(validator.validate(request(true, 0))).isEmpty();
    assertThat(validator.validate(request(false, null))).isEmpty();
  }

  @Test
  void percentageAboveHundred_isLeftToBusinessRules() {
    assertThat(validator.validate(request(true, 101))).isEmpty();
  }

  private static SubscriptionPlanRequest request(
      boolean revocationCapEnabled, Integer revokeMaxPercentage) {
    var start = Instant.parse("2026-03-01T00:00:00Z");
    return new SubscriptionPlanRequest(
        "Acme 2026",
        UUID.randomUUID(),
        UUID.randomUUID(),
        null,
        start,
        start.plus(365, ChronoUnit.DAYS),
        null,
        25,
        false,
        revocationCapEnabled,
        revokeMaxPercentage,
        null,
        SubscriptionPlanChangeReason.NEW);
  }
}
