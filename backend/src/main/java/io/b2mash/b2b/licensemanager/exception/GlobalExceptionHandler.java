package io.b2mash.b2b.licensemanager.exception;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private static final PropertyNamingStrategies.SnakeCaseStrategy SNAKE_CASE =
      new PropertyNamingStrategies.SnakeCaseStrategy();

  @ExceptionHandler(SubmissionRejectedException.class)
  public ResponseEntity<ProblemDetail> handleSubmissionRejected(
      SubmissionRejectedException ex, HttpServletRequest request) {
    log.warn(
        "Submission rejected: path={}, entity={}, field={}, message={}",
        request.getRequestURI(),
        ex.getEntityType(),
        ex.getRejections().get(0).field(),
        ex.getRejections().get(0).message());
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(ex.getBody());
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleAccessDenied(
      AccessDeniedException ex, HttpServletRequest request) {
    log.warn(
        "Access denied: path={}, method={}, reason=insufficient_role",
        request.getRequestURI(),
        request.getMethod());

    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Access denied");
    problem.setDetail("Insufficient permissions for this operation");
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problem);
  }

  /** Bean validation failures use the same {@code errors} shape as rejected submissions. */
  @Override
  protected ResponseEntity<Object> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex,
      HttpHeaders headers,
      HttpStatusCode status,
      WebRequest request) {
    var errors =
        ex.getBindingResult().getFieldErrors().stream()
            .map(
                e ->
                    Map.of(
                        "field",
                        SNAKE_CASE.translate(e.getField()),
                        "message",
                        e.getDefaultMessage() != null ? e.getDefaultMessage() : "Invalid value"))
            .toList();
    log.warn("Invalid request: {} field error(s)", errors.size());

    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid request");
    problem.setDetail(errors.size() + " field(s) failed validation");
    problem.setProperty("errors", errors);
    return ResponseEntity.badRequest().headers(headers).body(problem);
  }
}
