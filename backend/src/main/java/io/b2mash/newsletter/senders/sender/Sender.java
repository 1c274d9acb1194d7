package io.b2mash.newsletter.senders.sender;

import java.time.Instant;
import java.util.UUID;

/**
 * A tenant's send-from identity. Email, verification type and domain are fixed at creation; the
 * verification status only moves through {@link #applyStatus}, {@link #restartVerification} and
 * {@link #inheritDomainStatus}.
 */
public class Sender {

  private final String senderId;
  private final String tenantId;
  private final String email;
  private String name;
  private final VerificationType verificationType;
  private VerificationStatus verificationStatus;
  private boolean isDefault;
  private final String domain;
  private String identityReference;
  private long emailsSent;
  private Instant lastSentAt;
  private final Instant createdAt;
  private Instant updatedAt;
  private Instant verifiedAt;
  private String failureReason;
  private Instant lastVerificationSent;
  private long version;

  /** Creates a new, unsaved sender in {@code PENDING} state. */
  public Sender(
      String tenantId,
      String email,
      String name,
      VerificationType verificationType,
      String domain,
      boolean isDefault,
      Instant now) {
    this.senderId = UUID.randomUUID().toString();
    this.tenantId = tenantId;
    this.email = email;
    this.name = name;
    this.verificationType = verificationType;
    this.verificationStatus = VerificationStatus.PENDING;
    this.isDefault = isDefault;
    this.domain = domain;
    this.emailsSent = 0;
    this.createdAt = now;
    this.updatedAt = now;
    this.lastVerificationSent = now;
    this.version = 0;
  }

  Sender(
      String senderId,
      String tenantId,
      String email,
      String name,
      VerificationType verificationType,
      VerificationStatus verificationStatus,
      boolean isDefault,
      String domain,
      String identityReference,
      long emailsSent,
      Instant lastSentAt,
      Instant createdAt,
      Instant updatedAt,
      Instant verifiedAt,
      String failureReason,
      Instant lastVerificationSent,
      long version) {
    this.senderId = senderId;
    this.tenantId = tenantId;
    this.email = email;
    this.name = name;
    this.verificationType = verificationType;
    this.verificationStatus = verificationStatus;
    this.isDefault = isDefault;
    this.domain = domain;
    this.identityReference = identityReference;
    this.emailsSent = emailsSent;
    this.lastSentAt = lastSentAt;
    this.createdAt = createdAt;
    this.updatedAt = updatedAt;
    this.verifiedAt = verifiedAt;
    this.failureReason = failureReason;
    this.lastVerificationSent = lastVerificationSent;
    this.version = version;
  }

  /**
   * Moves the sender to {@code target} as reported by the verification collaborator. Returns
   * {@code false} without changes when the sender already has that status.
   *
   * @throws io.b2mash.newsletter.senders.exception.ResourceConflictException if the transition is
   *     not allowed
   */
  public boolean applyStatus(VerificationStatus target, String reason, Instant now) {
    if (verificationStatus == target) {
      return false;
    }
    verificationStatus.requireTransitionTo(target);
    this.verificationStatus = target;
    switch (target) {
      case VERIFIED -> {
        this.verifiedAt = now;
        this.failureReason = null;
      }
      case FAILED, VERIFICATION_TIMED_OUT -> this.failureReason = reason;
      case PENDING -> {}
    }
    return true;
  }

  /** Starts a fresh verification attempt. The only way out of a terminal status. */
  public void restartVerification(Instant now) {
    this.verificationStatus = VerificationStatus.PENDING;
    this.verifiedAt = null;
    this.failureReason = null;
    this.lastVerificationSent = now;
  }

  /**
   * Aligns a domain sender with the status of its domain record. A sender left in a different
   * terminal status by an earlier attempt is restarted first. Returns {@code false} when already
   * aligned.
   */
  public boolean inheritDomainStatus(
      VerificationStatus domainStatus, String reason, Instant attemptStartedAt, Instant now) {
    if (verificationStatus == domainStatus) {
      return false;
    }
    if (verificationStatus.isTerminal()) {
      restartVerification(attemptStartedAt != null ? attemptStartedAt : now);
      if (domainStatus == VerificationStatus.PENDING) {
        return true;
      }
    }
    return applyStatus(domainStatus, reason, now);
  }

  /** Marks a sender created against an already verified domain. */
  public void markVerifiedByDomain(String domainIdentityReference, Instant now) {
    this.identityReference = domainIdentityReference;
    this.verificationStatus = VerificationStatus.VERIFIED;
    this.verifiedAt = now;
  }

  public void rename(String name) {
    this.name = name;
  }

  public void markDefault(boolean isDefault) {
    this.isDefault = isDefault;
  }

  public void assignIdentityReference(String identityReference) {
    this.identityReference = identityReference;
  }

  /** Identity the verification collaborator tracks: the email, or the domain for domain senders. */
  public String verificationIdentity() {
    return verificationType == VerificationType.DOMAIN ? domain : email;
  }

  void touch(Instant now, long newVersion) {
    this.updatedAt = now;
    this.version = newVersion;
  }

  public String getSenderId() {
    return senderId;
  }

  public String getTenantId() {
    return tenantId;
  }

  public String getEmail() {
    return email;
  }

  public String getName() {
    return name;
  }

  public VerificationType getVerificationType() {
    return verificationType;
  }

  public VerificationStatus getVerificationStatus() {
    return verificationStatus;
  }

  public boolean isDefault() {
    return isDefault;
  }

  public String getDomain() {
    return domain;
  }

  public String getIdentityReference() {
    return identityReference;
  }

  public long getEmailsSent() {
    return emailsSent;
  }

  public Instant getLastSentAt() {
    return lastSentAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public Instant getVerifiedAt() {
    return verifiedAt;
  }

  public String getFailureReason() {
    return failureReason;
  }

  public Instant getLastVerificationSent() {
    return lastVerificationSent;
  }

  public long getVersion() {
    return version;
  }
}
