package io.b2mash.newsletter.senders.domainverification.dto;

import io.b2mash.newsletter.senders.domainverification.DnsRecord;
import io.b2mash.newsletter.senders.domainverification.DomainVerificationRecord;
import io.b2mash.newsletter.senders.sender.VerificationStatus;
import java.time.Instant;
import java.util.List;

public record DomainVerificationResponse(
    String domain,
    String verificationStatus,
    List<DnsRecord> dnsRecords,
    String identityReference,
    Instant createdAt,
    Instant updatedAt,
    Instant verifiedAt,
    Instant lastVerificationSent,
    String failureReason,
    List<String> instructions,
    String estimatedVerificationTime,
    List<String> troubleshooting) {

  public static DomainVerificationResponse from(DomainVerificationRecord record) {
    return new DomainVerificationResponse(
        record.getDomain(),
        record.getVerificationStatus().wireValue(),
        record.getDnsRecords(),
        record.getIdentityReference(),
        record.getCreatedAt(),
        record.getUpdatedAt(),
        record.getVerifiedAt(),
        record.getLastVerificationSent(),
        record.getFailureReason(),
        instructions(record),
        estimatedVerificationTime(record.getVerificationStatus()),
        troubleshooting(record.getVerificationStatus()));
  }

  private static List<String> instructions(DomainVerificationRecord record) {
    return switch (record.getVerificationStatus()) {
      case PENDING ->
          List.of(
              "Sign in to the DNS provider that hosts " + record.getDomain() + ".",
              "Add each of the "
                  + record.getDnsRecords().size()
                  + " records below exactly as shown, using the record type given.",
              "Keep the records in place after verification; removing them stops DKIM signing.",
              "Check back here once the records have propagated.");
      case VERIFIED ->
          List.of(
              "Your domain is verified. Any address at " + record.getDomain() + " can send.");
      case FAILED, VERIFICATION_TIMED_OUT ->
          List.of(
              "Verification did not complete. Confirm the records below are published.",
              "Start a new verification attempt to receive a fresh set of records.");
    };
  }

  private static String estimatedVerificationTime(VerificationStatus status) {
    return status == VerificationStatus.PENDING
        ? "DNS changes usually verify within 72 hours, often within minutes"
        : null;
  }

  private static List<String> troubleshooting(VerificationStatus status) {
    if (status == VerificationStatus.VERIFIED) {
      return List.of();
    }
    return List.of(
        "Some DNS providers append the domain to record names automatically; enter only the part"
            + " before your domain if so.",
        "CNAME values must not carry a trailing dot unless your provider requires one.",
        "Use a DNS lookup tool to confirm each record resolves to the expected value.",
        "Records added with a long TTL can take longer to become visible.");
  }
}
