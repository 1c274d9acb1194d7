package io.b2mash.newsletter.senders.verification;

import io.b2mash.newsletter.senders.sender.VerificationStatus;

/** Identity status as reported by the mail provider. */
public enum ProviderVerificationStatus {
  SUCCESS,
  FAILED,
  PENDING,
  NOT_FOUND;

  /**
   * Status a pending sender or domain moves to, or {@code null} when the report resolves nothing.
   */
  public VerificationStatus resolvedStatus() {
    return switch (this) {
      case SUCCESS -> VerificationStatus.VERIFIED;
      case FAILED -> VerificationStatus.FAILED;
      case PENDING, NOT_FOUND -> null;
    };
  }

  public String wireValue() {
    return name().toLowerCase();
  }
}
