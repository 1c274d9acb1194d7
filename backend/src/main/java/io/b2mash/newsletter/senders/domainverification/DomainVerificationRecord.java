package io.b2mash.newsletter.senders.domainverification;

import io.b2mash.newsletter.senders.sender.VerificationStatus;
import java.time.Instant;
import java.util.List;

/**
 * DNS-based verification of a domain shared by the tenant's domain senders. The DNS record set of
 * an attempt never changes; {@link #reissue} replaces it as a whole.
 */
public class DomainVerificationRecord {

  private final String tenantId;
  private final String domain;
  private VerificationStatus verificationStatus;
  private List<DnsRecord> dnsRecords;
  private String identityReference;
  private final Instant createdAt;
  private Instant updatedAt;
  private Instant verifiedAt;
  private Instant lastVerificationSent;
  private String failureReason;
  private long version;

  public DomainVerificationRecord(
      String tenantId,
      String domain,
      List<DnsRecord> dnsRecords,
      String identityReference,
      Instant now) {
    this.tenantId = tenantId;
    this.domain = domain;
    this.verificationStatus = VerificationStatus.PENDING;
    this.dnsRecords = List.copyOf(dnsRecords);
    this.identityReference = identityReference;
    this.createdAt = now;
    this.updatedAt = now;
    this.lastVerificationSent = now;
    this.version = 0;
  }

  DomainVerificationRecord(
      String tenantId,
      String domain,
      VerificationStatus verificationStatus,
      List<DnsRecord> dnsRecords,
      String identityReference,
      Instant createdAt,
      Instant updatedAt,
      Instant verifiedAt,
      Instant lastVerificationSent,
      String failureReason,
      long version) {
    this.tenantId = tenantId;
    this.domain = domain;
    this.verificationStatus = verificationStatus;
    this.dnsRecords = List.copyOf(dnsRecords);
    this.identityReference = identityReference;
    this.createdAt = createdAt;
    this.updatedAt = updatedAt;
    this.verifiedAt = verifiedAt;
    this.lastVerificationSent = lastVerificationSent;
    this.failureReason = failureReason;
    this.version = version;
  }

  /** Starts a new attempt with a fresh DNS record set. */
  public void reissue(List<DnsRecord> dnsRecords, String identityReference, Instant now) {
    this.dnsRecords = List.copyOf(dnsRecords);
    this.identityReference = identityReference;
    this.verificationStatus = VerificationStatus.PENDING;
    this.verifiedAt = null;
    this.failureReason = null;
    this.lastVerificationSent = now;
  }

  /**
   * Moves the record to {@code target}. Returns {@code false} when it already has that status.
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
    if (target == VerificationStatus.VERIFIED) {
      this.verifiedAt = now;
      this.failureReason = null;
    } else {
      this.failureReason = reason;
    }
    return true;
  }

  public boolean isVerified() {
    return verificationStatus == VerificationStatus.VERIFIED;
  }

  void touch(Instant now, long newVersion) {
    this.updatedAt = now;
    this.version = newVersion;
  }

  public String getTenantId() {
    return tenantId;
  }

  public String getDomain() {
    return domain;
  }

  public VerificationStatus getVerificationStatus() {
    return verificationStatus;
  }

  public List<DnsRecord> getDnsRecords() {
    return dnsRecords;
  }

  public String getIdentityReference() {
    return identityReference;
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

  public Instant getLastVerificationSent() {
    return lastVerificationSent;
  }

  public String getFailureReason() {
    return failureReason;
  }

  public long getVersion() {
    return version;
  }
}
