package io.b2mash.newsletter.senders.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The tenant's tier does not permit the requested verification type. Returns HTTP 401. */
public class TierCapabilityException extends ErrorResponseException {

  public TierCapabilityException(String capability, String tier) {
    super(HttpStatus.UNAUTHORIZED, createProblem(capability, tier), null);
  }

  private static ProblemDetail createProblem(String capability, String tier) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNAUTHORIZED);
    problem.setTitle("Tier capability missing");
    problem.setDetail(capability + " not available for your tier. Current tier: " + tier);
    problem.setProperty("tier", tier);
    problem.setProperty("upgradeUrl", "/settings/billing");
    return problem;
  }
}
