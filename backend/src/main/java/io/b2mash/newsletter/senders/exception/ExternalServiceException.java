package io.b2mash.newsletter.senders.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A cloud collaborator (key-value store, mail provider) failed or timed out. The response carries a
 * generic message only; the cause is kept for logging.
 */
public class ExternalServiceException extends ErrorResponseException {

  private final String service;

  public ExternalServiceException(String service, Throwable cause) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, createProblem(), cause);
    this.service = service;
  }

  public String getService() {
    return service;
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Service unavailable");
    problem.setDetail("An upstream service failed. Please try again later.");
    return problem;
  }
}
