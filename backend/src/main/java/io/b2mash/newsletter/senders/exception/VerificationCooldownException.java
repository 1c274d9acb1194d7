package io.b2mash.newsletter.senders.exception;

import java.time.Duration;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A verification was re-sent too recently. Returns HTTP 429. */
public class VerificationCooldownException extends ErrorResponseException {

  public VerificationCooldownException(Duration retryAfter) {
    super(HttpStatus.TOO_MANY_REQUESTS, createProblem(retryAfter), null);
  }

  private static ProblemDetail createProblem(Duration retryAfter) {
    var problem = ProblemDetail.forStatus(HttpStatus.TOO_MANY_REQUESTS);
    problem.setTitle("Verification recently sent");
    problem.setDetail("Please wait before requesting another verification");
    problem.setProperty("retryAfterSeconds", Math.max(1, retryAfter.toSeconds()));
    return problem;
  }
}
