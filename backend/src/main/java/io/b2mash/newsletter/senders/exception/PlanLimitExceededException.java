package io.b2mash.newsletter.senders.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a tenant already holds as many senders as its tier allows. Returns HTTP 400 with an
 * upgrade prompt.
 */
public class PlanLimitExceededException extends ErrorResponseException {

  public PlanLimitExceededException(int maxSenders, String tier) {
    super(HttpStatus.BAD_REQUEST, createProblem(maxSenders, tier), null);
  }

  private static ProblemDetail createProblem(int maxSenders, String tier) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Sender limit exceeded");
    problem.setDetail(
        "Maximum sender limit reached (" + maxSenders + "). Current tier: " + tier);
    problem.setProperty("maxSenders", maxSenders);
    problem.setProperty("tier", tier);
    problem.setProperty("upgradeUrl", "/settings/billing");
    return problem;
  }
}
