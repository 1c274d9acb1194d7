package io.b2mash.newsletter.senders.sender;

import io.b2mash.newsletter.senders.exception.InvalidRequestException;
import io.b2mash.newsletter.senders.exception.ResourceConflictException;

/**
 * Verification lifecycle of a sender or domain. {@code PENDING} is the initial state; the other
 * states are terminal for one verification attempt and are only left through an explicit
 * re-verification.
 */
public enum VerificationStatus {
  PENDING("pending"),
  VERIFIED("verified"),
  FAILED("failed"),
  VERIFICATION_TIMED_OUT("verification_timed_out");

  private final String wireValue;

  VerificationStatus(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }

  public boolean isTerminal() {
    return this != PENDING;
  }

  /**
   * Whether a collaborator-driven transition to {@code target} is allowed. Re-verification is not a
   * transition in this sense and is handled separately.
   */
  public boolean canTransitionTo(VerificationStatus target) {
    return switch (this) {
      case PENDING -> target != PENDING;
      case VERIFIED, FAILED, VERIFICATION_TIMED_OUT -> false;
    };
  }

  /** Throws a conflict when {@link #canTransitionTo(VerificationStatus)} does not hold. */
  public void requireTransitionTo(VerificationStatus target) {
    if (!canTransitionTo(target)) {
      throw new ResourceConflictException(
          "Invalid status transition",
          "Cannot change verification status from " + wireValue + " to " + target.wireValue);
    }
  }

  public static VerificationStatus fromWire(String value) {
    for (var status : values()) {
      if (status.wireValue.equals(value)) {
        return status;
      }
    }
    throw new InvalidRequestException(
        "Invalid verification status", "Unsupported verificationStatus '" + value + "'");
  }
}
