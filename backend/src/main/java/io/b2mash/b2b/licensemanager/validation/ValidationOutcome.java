package io.b2mash.b2b.licensemanager.validation;

import java.util.List;
import java.util.Optional;

/**
 * Verdict of the plan validator for one submission. An outcome is accepted when it carries no
 * rejections. Rule chains stop at the first failure, so a rejected outcome produced by a chain
 * holds exactly one rejection.
 *
 * @param rejections the rejected fields, empty when accepted
 */
public record ValidationOutcome(List<FieldRejection> rejections) {

  private static final ValidationOutcome ACCEPTED = new ValidationOutcome(List.of());

  public ValidationOutcome {
    rejections = List.copyOf(rejections);
  }

  public static ValidationOutcome accept() {
    return ACCEPTED;
  }

  public static ValidationOutcome reject(String field, String message) {
    return new ValidationOutcome(List.of(new FieldRejection(field, message)));
  }

  public boolean accepted() {
    return rejections.isEmpty();
  }

  public Optional<FieldRejection> firstRejection() {
    return rejections.stream().findFirst();
  }
}
