package io.b2mash.newsletter.senders.sender.dto;

import io.b2mash.newsletter.senders.sender.Sender;
import java.time.Instant;

public record SenderResponse(
    String senderId,
    String email,
    String name,
    String verificationType,
    String verificationStatus,
    boolean isDefault,
    String domain,
    String identityReference,
    long emailsSent,
    Instant lastSentAt,
    Instant createdAt,
    Instant updatedAt,
    Instant verifiedAt,
    String failureReason,
    Instant lastVerificationSent) {

  public static SenderResponse from(Sender sender) {
    return new SenderResponse(
        sender.getSenderId(),
        sender.getEmail(),
        sender.getName(),
        sender.getVerificationType().wireValue(),
        sender.getVerificationStatus().wireValue(),
        sender.isDefault(),
        sender.getDomain(),
        sender.getIdentityReference(),
        sender.getEmailsSent(),
        sender.getLastSentAt(),
        sender.getCreatedAt(),
        sender.getUpdatedAt(),
        sender.getVerifiedAt(),
        sender.getFailureReason(),
        sender.getLastVerificationSent());
  }
}
