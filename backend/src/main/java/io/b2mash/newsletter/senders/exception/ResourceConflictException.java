package io.b2mash.newsletter.senders.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Duplicate create, invalid status transition or a lost optimistic write. Returns HTTP 409; the
 * caller may resubmit the request.
 */
public class ResourceConflictException extends ErrorResponseException {

  public ResourceConflictException(String title, String detail) {
    super(HttpStatus.CONFLICT, createProblem(title, detail), null);
  }

  public static ResourceConflictException concurrentModification(String resourceType) {
    return new ResourceConflictException(
        "Concurrent modification",
        resourceType + " was modified concurrently. Please retry.");
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
