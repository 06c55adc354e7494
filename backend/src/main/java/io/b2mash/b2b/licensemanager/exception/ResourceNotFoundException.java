package io.b2mash.b2b.licensemanager.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when a submission references a record that does not exist. Results in HTTP 404. */
public class ResourceNotFoundException extends ErrorResponseException {

  private final String resourceType;

  public ResourceNotFoundException(String resourceType, Object id) {
    super(
        HttpStatus.NOT_FOUND,
        createProblem(resourceType + " not found", "No " + resourceType + " found with id " + id),
        null);
    this.resourceType = resourceType;
  }

  public String getResourceType() {
    return resourceType;
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
