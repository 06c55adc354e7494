package io.b2mash.b2b.licensemanager.validation;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * One business rule: a predicate that detects a violation, plus the field and message reported
 * when it does.
 *
 * @param field the field blamed when the rule fails
 * @param violation returns true when the subject breaks the rule
 * @param message the message reported when the rule fails
 * @param <T> the submission type the rule inspects
 */
public record ValidationRule<T>(String field, Predicate<T> violation, String message) {

  public ValidationRule {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(violation, "violation");
    Objects.requireNonNull(message, "message");
  }

  public boolean isViolatedBy(T subject) {
    return violation.test(subject);
  }

  public FieldRejection toRejection() {
    return new FieldRejection(field, message);
  }
}
