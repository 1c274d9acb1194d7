package io.b2mash.newsletter.senders.domainverification;

import io.b2mash.newsletter.senders.config.SenderProperties;
import io.b2mash.newsletter.senders.event.SenderEventPublisher;
import io.b2mash.newsletter.senders.event.SenderEvents;
import io.b2mash.newsletter.senders.exception.ExternalServiceException;
import io.b2mash.newsletter.senders.exception.PropagationIncompleteException;
import io.b2mash.newsletter.senders.exception.ResourceConflictException;
import io.b2mash.newsletter.senders.exception.TierCapabilityException;
import io.b2mash.newsletter.senders.sender.Addresses;
import io.b2mash.newsletter.senders.sender.Sender;
import io.b2mash.newsletter.senders.sender.SenderRepository;
import io.b2mash.newsletter.senders.sender.VerificationStatus;
import io.b2mash.newsletter.senders.sender.VerificationType;
import io.b2mash.newsletter.senders.tier.TierPolicy;
import io.b2mash.newsletter.senders.verification.ProviderVerificationStatus;
import io.b2mash.newsletter.senders.verification.VerificationProvider;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Issues and resolves domain verification attempts. Every status change of a domain record is
 * propagated to the tenant's senders on that domain with one conditional write per sender; a
 * propagation that fails part way is reported as a conflict and completed by resubmitting.
 */
@Service
public class DomainVerificationService {

  private static final Logger log = LoggerFactory.getLogger(DomainVerificationService.class);

  private final DomainVerificationRepository domainRepository;
  private final SenderRepository senderRepository;
  private final VerificationProvider verificationProvider;
  private final SenderEventPublisher eventPublisher;
  private final SenderProperties properties;
  private final Clock clock;

  public DomainVerificationService(
      DomainVerificationRepository domainRepository,
      SenderRepository senderRepository,
      VerificationProvider verificationProvider,
      SenderEventPublisher eventPublisher,
      SenderProperties properties,
      Clock clock) {
    this.domainRepository = domainRepository;
    this.senderRepository = senderRepository;
    this.verificationProvider = verificationProvider;
    this.eventPublisher = eventPublisher;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Starts verification of {@code domain}, or re-issues it when a previous attempt is pending or
   * failed.
   */
  public DomainVerificationRecord initiateDomainVerification(
      String tenantId, String tier, String domain) {
    String normalized = Addresses.requireDomain(domain);
    var limits = TierPolicy.resolveLimits(tier, 0);
    if (!limits.canUseDNS()) {
      log.warn("DNS verification refused: tenantId={}, tier={}", tenantId, limits.tier());
      throw new TierCapabilityException("DNS verification", limits.tier());
    }
    var existing = domainRepository.findByDomain(tenantId, normalized);
    if (existing.isPresent() && existing.get().isVerified()) {
      throw new ResourceConflictException(
          "Domain already verified", "Domain " + normalized + " is already verified");
    }
    return issueAttempt(tenantId, normalized, existing);
  }

  /**
   * Registers the domain with the provider and stores the new DNS record set, replacing any
   * previous attempt in one write. Dependent senders restart verification with the record.
   */
  public DomainVerificationRecord issueAttempt(
      String tenantId, String domain, Optional<DomainVerificationRecord> existing) {
    List<DnsRecord> dnsRecords = verificationProvider.initiateDomainVerification(domain);
    String reference = verificationProvider.identityReference(domain);
    Instant now = clock.instant();

    DomainVerificationRecord record;
    if (existing.isPresent()) {
      record = existing.get();
      record.reissue(dnsRecords, reference, now);
    } else {
      record = new DomainVerificationRecord(tenantId, domain, dnsRecords, reference, now);
    }
    domainRepository.upsert(record);
    log.info(
        "Issued domain verification: tenantId={}, domain={}, records={}",
        tenantId,
        domain,
        dnsRecords.size());
    eventPublisher.publish(SenderEvents.domainStatusChanged(record, now));

    propagate(record);
    return record;
  }

  /** Returns the record after checking a pending attempt against the provider. */
  public DomainVerificationRecord getDomainVerification(String tenantId, String domain) {
    return refresh(tenantId, domain).record();
  }

  /**
   * Polls the provider for a pending record and applies the outcome: success verifies, rejection
   * fails, and an attempt older than the verification timeout times out. The record's status is
   * then propagated to every dependent sender.
   */
  public DomainRefresh refresh(String tenantId, String domain) {
    var record = domainRepository.getByDomain(tenantId, Addresses.requireDomain(domain));
    Instant now = clock.instant();
    ProviderVerificationStatus providerStatus = null;
    boolean changed = false;

    if (record.getVerificationStatus() == VerificationStatus.PENDING) {
      providerStatus = verificationProvider.pollVerificationStatus(record.getDomain());
      VerificationStatus target = providerStatus.resolvedStatus();
      String reason = null;
      if (target == VerificationStatus.FAILED) {
        reason = "DNS verification was rejected by the mail provider";
      } else if (target == null && timedOut(record, now)) {
        target = VerificationStatus.VERIFICATION_TIMED_OUT;
        reason =
            "DNS records were not verified within "
                + properties.verificationTimeout().toHours()
                + " hours";
      }
      if (target != null) {
        changed = applyDomainStatus(record, target, reason, now);
      }
    }

    propagate(record);
    return new DomainRefresh(record, changed, providerStatus, now);
  }

  /**
   * Moves the domain record to {@code target} and persists it. Returns {@code false} when the
   * record already had that status.
   */
  boolean applyDomainStatus(
      DomainVerificationRecord record, VerificationStatus target, String reason, Instant now) {
    if (!record.applyStatus(target, reason, now)) {
      return false;
    }
    domainRepository.upsert(record);
    log.info(
        "Domain verification status changed: tenantId={}, domain={}, status={}",
        record.getTenantId(),
        record.getDomain(),
        target.wireValue());
    eventPublisher.publish(SenderEvents.domainStatusChanged(record, now));
    if (target == VerificationStatus.VERIFICATION_TIMED_OUT) {
      releaseDomainIdentity(record.getTenantId(), record.getDomain());
    }
    return true;
  }

  /**
   * Applies an outcome the provider reported on its own for the tenant's domain. Only a pending
   * record moves; the record's status is then propagated to its senders either way, completing an
   * earlier partial propagation. Returns whether the record changed.
   */
  public boolean applyReportedOutcome(
      String tenantId, String domain, VerificationStatus target, String reason) {
    var record = domainRepository.getByDomain(tenantId, domain);
    boolean changed = false;
    if (record.getVerificationStatus() == VerificationStatus.PENDING) {
      changed = applyDomainStatus(record, target, reason, clock.instant());
    } else {
      log.debug(
          "Reported domain outcome ignored: tenantId={}, domain={}, status={}",
          tenantId,
          domain,
          record.getVerificationStatus().wireValue());
    }
    propagate(record);
    return changed;
  }

  /**
   * Provider identities are shared by every tenant. The domain identity is removed only when no
   * other tenant keeps a verification record for the domain.
   */
  public void releaseDomainIdentity(String tenantId, String domain) {
    boolean shared;
    try {
      shared =
          domainRepository.findAllByDomain(domain).stream()
              .anyMatch(other -> !other.getTenantId().equals(tenantId));
    } catch (ExternalServiceException e) {
      log.warn("Identity kept, usage could not be checked: identity={}", domain);
      return;
    }
    if (shared) {
      log.info("Identity kept, still used by another tenant: identity={}", domain);
      return;
    }
    removeIdentityQuietly(domain);
  }

  /**
   * Aligns every sender on the record's domain with the record's status. Senders already aligned
   * are skipped, so a retry only writes what an earlier run missed.
   *
   * @throws PropagationIncompleteException if some senders could not be updated
   */
  void propagate(DomainVerificationRecord record) {
    Instant now = clock.instant();
    var dependents = dependentsOf(record);
    int failed = 0;
    for (var sender : dependents) {
      try {
        boolean statusChanged =
            sender.inheritDomainStatus(
                record.getVerificationStatus(),
                record.getFailureReason(),
                record.getLastVerificationSent(),
                now);
        boolean referenceChanged =
            record.getIdentityReference() != null
                && !record.getIdentityReference().equals(sender.getIdentityReference());
        if (referenceChanged) {
          sender.assignIdentityReference(record.getIdentityReference());
        }
        if (statusChanged || referenceChanged) {
          senderRepository.update(sender);
        }
        if (statusChanged) {
          eventPublisher.publish(SenderEvents.statusChanged(sender, now));
        }
      } catch (ResourceConflictException | ExternalServiceException e) {
        failed++;
        log.warn(
            "Domain status not applied to sender: tenantId={}, domain={}, senderId={}, reason={}",
            record.getTenantId(),
            record.getDomain(),
            sender.getSenderId(),
            e.getMessage());
      }
    }
    if (failed > 0) {
      throw new PropagationIncompleteException(record.getDomain(), failed, dependents.size());
    }
  }

  private List<Sender> dependentsOf(DomainVerificationRecord record) {
    return senderRepository.listByTenant(record.getTenantId()).stream()
        .filter(sender -> sender.getVerificationType() == VerificationType.DOMAIN)
        .filter(sender -> record.getDomain().equalsIgnoreCase(sender.getDomain()))
        .toList();
  }

  private boolean timedOut(DomainVerificationRecord record, Instant now) {
    Instant started =
        record.getLastVerificationSent() != null
            ? record.getLastVerificationSent()
            : record.getCreatedAt();
    return !now.isBefore(started.plus(properties.verificationTimeout()));
  }

  private void removeIdentityQuietly(String identity) {
    try {
      verificationProvider.deleteIdentity(identity);
    } catch (ExternalServiceException e) {
      log.warn("Best-effort identity cleanup failed: identity={}", identity);
    }
  }
}
