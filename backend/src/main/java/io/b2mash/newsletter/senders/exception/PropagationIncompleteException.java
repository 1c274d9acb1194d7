package io.b2mash.newsletter.senders.exception;

/**
 * A domain status change was stored but some senders on the domain could not be aligned with it.
 * Returns HTTP 409; resubmitting completes the remaining senders.
 */
public class PropagationIncompleteException extends ResourceConflictException {

  public PropagationIncompleteException(String domain, int failed, int total) {
    super(
        "Domain status propagation incomplete",
        "Verification status of "
            + failed
            + " of "
            + total
            + " senders on "
            + domain
            + " could not be updated. Retry to complete.");
  }
}
