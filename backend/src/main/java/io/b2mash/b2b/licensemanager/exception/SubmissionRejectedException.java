package io.b2mash.b2b.licensemanager.exception;

import io.b2mash.b2b.licensemanager.validation.FieldRejection;
import io.b2mash.b2b.licensemanager.validation.ValidationOutcome;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown by the admin services when the plan validator rejects a submission. The candidate is not
 * persisted. Results in HTTP 422 with an {@code errors} list of field/message pairs.
 */
public class SubmissionRejectedException extends ErrorResponseException {

  private final String entityType;
  private final List<FieldRejection> rejections;

  public SubmissionRejectedException(String entityType, ValidationOutcome outcome) {
    this(entityType, outcome.rejections());
  }

  public SubmissionRejectedException(String entityType, List<FieldRejection> rejections) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(entityType, rejections), null);
    if (rejections.isEmpty()) {
      throw new IllegalArgumentException("A rejected submission needs at least one rejection");
    }
    this.entityType = entityType;
    this.rejections = List.copyOf(rejections);
  }

  public String getEntityType() {
    return entityType;
  }

  public List<FieldRejection> getRejections() {
    return rejections;
  }

  private static ProblemDetail createProblem(String entityType, List<FieldRejection> rejections) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Submission rejected");
    problem.setDetail(
        "The " + entityType + " was not saved: " + rejections.size() + " field(s) rejected");
    problem.setProperty(
        "errors",
        rejections.stream()
            .map(r -> Map.of("field", r.field(), "message", r.message()))
            .toList());
    return problem;
  }
}
