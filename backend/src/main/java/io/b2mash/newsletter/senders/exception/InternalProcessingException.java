package io.b2mash.newsletter.senders.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Serialization or other unexpected processing failure. The response carries a generic message;
 * {@link #getReason()} keeps the internal description for logging.
 */
public class InternalProcessingException extends ErrorResponseException {

  private final String reason;

  public InternalProcessingException(String reason, Throwable cause) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, createProblem(), cause);
    this.reason = reason;
  }

  public String getReason() {
    return reason;
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Internal error");
    problem.setDetail("An unexpected error occurred");
    return problem;
  }
}
