package io.b2mash.newsletter.senders.sender;

import io.b2mash.newsletter.senders.config.SenderProperties;
import io.b2mash.newsletter.senders.domainverification.DomainVerificationRecord;
import io.b2mash.newsletter.senders.domainverification.DomainVerificationRepository;
import io.b2mash.newsletter.senders.domainverification.DomainVerificationService;
import io.b2mash.newsletter.senders.event.SenderEventPublisher;
import io.b2mash.newsletter.senders.event.SenderEvents;
import io.b2mash.newsletter.senders.exception.ExternalServiceException;
import io.b2mash.newsletter.senders.exception.InvalidRequestException;
import io.b2mash.newsletter.senders.exception.PlanLimitExceededException;
import io.b2mash.newsletter.senders.exception.PropagationIncompleteException;
import io.b2mash.newsletter.senders.exception.ResourceConflictException;
import io.b2mash.newsletter.senders.exception.ResourceNotFoundException;
import io.b2mash.newsletter.senders.exception.TierCapabilityException;
import io.b2mash.newsletter.senders.exception.VerificationCooldownException;
import io.b2mash.newsletter.senders.tier.TierPolicy;
import io.b2mash.newsletter.senders.verification.ProviderVerificationStatus;
import io.b2mash.newsletter.senders.verification.VerificationProvider;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Sender lifecycle: quota-checked creation, updates, deletion with default promotion, and the
 * verification state machine.
 */
@Service
public class SenderService {

  private static final Logger log = LoggerFactory.getLogger(SenderService.class);

  /** Preferred replacement when the default sender is deleted. */
  static final Comparator<Sender> PROMOTION_ORDER =
      Comparator.comparing((Sender s) -> s.getVerificationStatus() != VerificationStatus.VERIFIED)
          .thenComparing(Sender::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
          .thenComparing(Sender::getSenderId);

  private final SenderRepository senderRepository;
  private final DomainVerificationRepository domainRepository;
  private final DomainVerificationService domainVerificationService;
  private final VerificationProvider verificationProvider;
  private final SenderEventPublisher eventPublisher;
  private final SenderProperties properties;
  private final Clock clock;

  public SenderService(
      SenderRepository senderRepository,
      DomainVerificationRepository domainRepository,
      DomainVerificationService domainVerificationService,
      VerificationProvider verificationProvider,
      SenderEventPublisher eventPublisher,
      SenderProperties properties,
      Clock clock) {
    this.senderRepository = senderRepository;
    this.domainRepository = domainRepository;
    this.domainVerificationService = domainVerificationService;
    this.verificationProvider = verificationProvider;
    this.eventPublisher = eventPublisher;
    this.properties = properties;
    this.clock = clock;
  }

  public SenderOverview listSenders(String tenantId, String tier) {
    var senders =
        senderRepository.listByTenant(tenantId).stream()
            .sorted(
                Comparator.comparing(
                    Sender::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
            .toList();
    return new SenderOverview(senders, TierPolicy.resolveLimits(tier, senders.size()));
  }

  public Sender getSender(String tenantId, String senderId) {
    return senderRepository.getById(tenantId, senderId);
  }

  /**
   * Creates a sender after checking quota, tier capability and email uniqueness. The first sender
   * of a tenant becomes its default. Verification is initiated after the sender is stored; if that
   * call fails the error is returned and the sender stays pending.
   */
  public Sender createSender(
      String tenantId,
      String tier,
      String email,
      String name,
      String verificationType,
      String domain) {
    String normalizedEmail = Addresses.requireEmail(email);
    VerificationType type = VerificationType.fromWire(verificationType);
    String senderDomain =
        type == VerificationType.DOMAIN ? resolveDomain(normalizedEmail, domain) : null;
    String senderName = name != null && !name.isBlank() ? name.trim() : null;

    var ledger = senderRepository.loadLedger(tenantId);
    var limits = TierPolicy.resolveLimits(tier, ledger.senderCount());
    if (limits.quotaReached()) {
      log.warn(
          "Sender quota reached: tenantId={}, tier={}, max={}",
          tenantId,
          limits.tier(),
          limits.maxSenders());
      throw new PlanLimitExceededException(limits.maxSenders(), limits.tier());
    }
    if (type == VerificationType.DOMAIN && !limits.canUseDNS()) {
      log.warn("DNS verification refused: tenantId={}, tier={}", tenantId, limits.tier());
      throw new TierCapabilityException("DNS verification", limits.tier());
    }
    if (type == VerificationType.MAILBOX && !limits.canUseMailbox()) {
      throw new TierCapabilityException("Mailbox verification", limits.tier());
    }
    if (senderRepository.isEmailConfigured(tenantId, normalizedEmail)) {
      throw new ResourceConflictException("Duplicate sender", "Email address already configured");
    }

    Instant now = clock.instant();
    var sender =
        new Sender(
            tenantId,
            normalizedEmail,
            senderName,
            type,
            senderDomain,
            ledger.senderCount() == 0,
            now);
    Optional<DomainVerificationRecord> domainRecord =
        type == VerificationType.DOMAIN
            ? domainRepository.findByDomain(tenantId, senderDomain)
            : Optional.empty();
    if (domainRecord.isPresent() && domainRecord.get().isVerified()) {
      sender.markVerifiedByDomain(domainRecord.get().getIdentityReference(), now);
    } else {
      sender.assignIdentityReference(
          verificationProvider.identityReference(sender.verificationIdentity()));
    }

    senderRepository.create(sender, ledger);
    log.info(
        "Created sender: tenantId={}, senderId={}, type={}, status={}, isDefault={}",
        tenantId,
        sender.getSenderId(),
        type.wireValue(),
        sender.getVerificationStatus().wireValue(),
        sender.isDefault());
    eventPublisher.publish(SenderEvents.created(sender, now));

    if (sender.getVerificationStatus() == VerificationStatus.PENDING) {
      initiateVerification(sender, domainRecord);
    }
    return sender;
  }

  /**
   * Updates the name and/or default flag. Email, verification type and domain are fixed at
   * creation; naming a different value for any of them is rejected.
   */
  public Sender updateSender(
      String tenantId,
      String senderId,
      String name,
      Boolean isDefault,
      String email,
      String verificationType,
      String domain) {
    var sender = senderRepository.getById(tenantId, senderId);
    rejectIdentityChange(sender, email, verificationType, domain);
    if (name == null && isDefault == null) {
      throw new InvalidRequestException(
          "Invalid update", "At least one field must be provided for update");
    }

    boolean renamed = false;
    if (name != null) {
      String trimmed = name.trim();
      if (trimmed.isEmpty()) {
        throw new InvalidRequestException("Invalid update", "Name cannot be empty");
      }
      if (!trimmed.equals(sender.getName())) {
        sender.rename(trimmed);
        renamed = true;
      }
    }

    if (Boolean.FALSE.equals(isDefault) && sender.isDefault()) {
      throw new InvalidRequestException(
          "Invalid update",
          "The default sender cannot be unset. Make another sender the default instead");
    }

    if (Boolean.TRUE.equals(isDefault) && !sender.isDefault()) {
      var ledger = senderRepository.loadLedger(tenantId);
      var previous = currentDefault(tenantId, ledger, senderId);
      senderRepository.changeDefault(sender, previous, ledger);
      log.info(
          "Changed default sender: tenantId={}, senderId={}, previousDefault={}",
          tenantId,
          senderId,
          previous != null ? previous.getSenderId() : null);
      eventPublisher.publish(SenderEvents.updated(sender, clock.instant()));
      return sender;
    }

    if (renamed) {
      senderRepository.update(sender);
      log.info("Updated sender: tenantId={}, senderId={}", tenantId, senderId);
      eventPublisher.publish(SenderEvents.updated(sender, clock.instant()));
    }
    return sender;
  }

  /**
   * Deletes a sender. When it was the default and others remain, one of them is promoted in the
   * same write: verified senders first, then the earliest created. Provider identities that are no
   * longer referenced are removed on a best-effort basis.
   */
  public void deleteSender(String tenantId, String senderId) {
    var sender = senderRepository.getById(tenantId, senderId);
    var ledger = senderRepository.loadLedger(tenantId);
    var remaining =
        senderRepository.listByTenant(tenantId).stream()
            .filter(other -> !other.getSenderId().equals(senderId))
            .toList();

    Sender promoted = null;
    if (sender.isDefault() && !remaining.isEmpty()) {
      promoted = remaining.stream().min(PROMOTION_ORDER).orElseThrow();
    }
    senderRepository.delete(sender, promoted, ledger);
    log.info(
        "Deleted sender: tenantId={}, senderId={}, promotedDefault={}",
        tenantId,
        senderId,
        promoted != null ? promoted.getSenderId() : null);
    Instant now = clock.instant();
    eventPublisher.publish(
        SenderEvents.deleted(sender, promoted != null ? promoted.getSenderId() : null, now));

    cleanUpIdentity(sender, remaining);
  }

  /**
   * Checks a pending sender against the provider. Domain senders follow their domain record;
   * mailbox senders are resolved directly and time out once the verification window has passed.
   */
  public StatusRefresh refreshStatus(String tenantId, String senderId) {
    var sender = senderRepository.getById(tenantId, senderId);
    Instant now = clock.instant();

    if (sender.getVerificationType() == VerificationType.DOMAIN) {
      if (domainRepository.findByDomain(tenantId, sender.getDomain()).isEmpty()) {
        return refreshWithoutDomainRecord(sender, now);
      }
      var domainRefresh = domainVerificationService.refresh(tenantId, sender.getDomain());
      var current = senderRepository.getById(tenantId, senderId);
      return new StatusRefresh(
          current,
          current.getVerificationStatus() != sender.getVerificationStatus(),
          domainRefresh.providerStatus(),
          now);
    }

    if (sender.getVerificationStatus().isTerminal()) {
      return new StatusRefresh(sender, false, null, now);
    }

    var providerStatus = verificationProvider.pollVerificationStatus(sender.getEmail());
    VerificationStatus target = providerStatus.resolvedStatus();
    String reason = null;
    if (target == VerificationStatus.FAILED) {
      reason = "Verification was rejected by the mail provider";
    } else if (target == null && timedOut(sender, now)) {
      target = VerificationStatus.VERIFICATION_TIMED_OUT;
      reason = timeoutReason();
    }
    if (target == null) {
      return new StatusRefresh(sender, false, providerStatus, now);
    }

    boolean changed = recordStatus(sender, target, reason, now);
    if (changed && target == VerificationStatus.VERIFICATION_TIMED_OUT) {
      releaseMailboxIdentity(sender);
    }
    return new StatusRefresh(sender, changed, providerStatus, now);
  }

  /**
   * Applies an outcome the provider reported on its own for a mailbox sender. Only a pending sender
   * moves; a sender in a terminal status is left for re-verification. Returns whether the sender
   * changed.
   */
  public boolean applyReportedOutcome(
      String tenantId, String senderId, VerificationStatus target, String reason) {
    var sender = senderRepository.getById(tenantId, senderId);
    if (sender.getVerificationType() != VerificationType.MAILBOX
        || sender.getVerificationStatus() != VerificationStatus.PENDING) {
      log.debug(
          "Reported outcome ignored: tenantId={}, senderId={}, status={}",
          tenantId,
          senderId,
          sender.getVerificationStatus().wireValue());
      return false;
    }
    return recordStatus(sender, target, reason, clock.instant());
  }

  /**
   * Re-verifies a sender: the one transition out of a terminal status. Mailbox senders get a new
   * verification email; domain senders re-issue the domain attempt, which resets every sender on
   * that domain.
   */
  public Sender resendVerification(String tenantId, String senderId) {
    var sender = senderRepository.getById(tenantId, senderId);
    Instant now = clock.instant();
    if (sender.getLastVerificationSent() != null) {
      Instant nextAllowed = sender.getLastVerificationSent().plus(properties.resendCooldown());
      if (now.isBefore(nextAllowed)) {
        log.warn("Verification resend throttled: tenantId={}, senderId={}", tenantId, senderId);
        throw new VerificationCooldownException(Duration.between(now, nextAllowed));
      }
    }

    if (sender.getVerificationType() == VerificationType.MAILBOX) {
      verificationProvider.initiateMailboxVerification(sender.getEmail());
      sender.restartVerification(now);
      senderRepository.update(sender);
    } else {
      var existing = domainRepository.findByDomain(tenantId, sender.getDomain());
      var record = domainVerificationService.issueAttempt(tenantId, sender.getDomain(), existing);
      sender = senderRepository.getById(tenantId, senderId);
      if (sender.getVerificationStatus() != VerificationStatus.PENDING) {
        sender.restartVerification(record.getLastVerificationSent());
        senderRepository.update(sender);
      }
    }
    log.info("Restarted sender verification: tenantId={}, senderId={}", tenantId, senderId);
    eventPublisher.publish(SenderEvents.statusChanged(sender, now));
    return sender;
  }

  /**
   * A domain sender whose attempt never produced a domain record, because the provider refused the
   * registration, times out on the same schedule as any other attempt.
   */
  private StatusRefresh refreshWithoutDomainRecord(Sender sender, Instant now) {
    boolean changed = false;
    if (sender.getVerificationStatus() == VerificationStatus.PENDING && timedOut(sender, now)) {
      changed =
          recordStatus(sender, VerificationStatus.VERIFICATION_TIMED_OUT, timeoutReason(), now);
    }
    return new StatusRefresh(sender, changed, ProviderVerificationStatus.NOT_FOUND, now);
  }

  private boolean recordStatus(
      Sender sender, VerificationStatus target, String reason, Instant now) {
    if (!sender.applyStatus(target, reason, now)) {
      return false;
    }
    senderRepository.update(sender);
    log.info(
        "Sender verification status changed: tenantId={}, senderId={}, status={}",
        sender.getTenantId(),
        sender.getSenderId(),
        target.wireValue());
    eventPublisher.publish(SenderEvents.statusChanged(sender, now));
    return true;
  }

  private String timeoutReason() {
    return "Verification was not completed within "
        + properties.verificationTimeout().toHours()
        + " hours";
  }

  private void initiateVerification(
      Sender sender, Optional<DomainVerificationRecord> domainRecord) {
    try {
      if (sender.getVerificationType() == VerificationType.MAILBOX) {
        verificationProvider.initiateMailboxVerification(sender.getEmail());
      } else {
        domainVerificationService.issueAttempt(
            sender.getTenantId(), sender.getDomain(), domainRecord);
      }
    } catch (ExternalServiceException e) {
      log.error(
          "Verification initiation failed, sender stays pending: tenantId={}, senderId={}",
          sender.getTenantId(),
          sender.getSenderId());
      throw e;
    } catch (PropagationIncompleteException e) {
      // the sender exists; other senders on the domain converge on the next status check
      log.warn(
          "Domain attempt issued with incomplete propagation: tenantId={}, domain={}",
          sender.getTenantId(),
          sender.getDomain());
    } catch (ResourceConflictException e) {
      // a concurrent attempt for the same domain won the write and propagates to this sender
      log.warn(
          "Domain attempt superseded by a concurrent attempt: tenantId={}, domain={}",
          sender.getTenantId(),
          sender.getDomain());
    }
  }

  private String resolveDomain(String email, String requestedDomain) {
    String emailDomain = Addresses.domainOf(email);
    if (requestedDomain == null || requestedDomain.isBlank()) {
      return Addresses.requireDomain(emailDomain);
    }
    String domain = Addresses.requireDomain(requestedDomain);
    if (!domain.equals(emailDomain)) {
      throw new InvalidRequestException(
          "Invalid domain", "Email address must belong to domain " + domain);
    }
    return domain;
  }

  private void rejectIdentityChange(
      Sender sender, String email, String verificationType, String domain) {
    if (email != null && !email.trim().equalsIgnoreCase(sender.getEmail())) {
      throw new InvalidRequestException(
          "Immutable field", "Email cannot be changed after creation");
    }
    if (verificationType != null
        && VerificationType.fromWire(verificationType) != sender.getVerificationType()) {
      throw new InvalidRequestException(
          "Immutable field", "Verification type cannot be changed after creation");
    }
    if (domain != null && !domain.trim().equalsIgnoreCase(String.valueOf(sender.getDomain()))) {
      throw new InvalidRequestException(
          "Immutable field", "Domain cannot be changed after creation");
    }
  }

  private Sender currentDefault(String tenantId, SenderLedger ledger, String newDefaultId) {
    String defaultId = ledger.defaultSenderId();
    if (defaultId == null || defaultId.equals(newDefaultId)) {
      return null;
    }
    try {
      return senderRepository.getById(tenantId, defaultId);
    } catch (ResourceNotFoundException e) {
      log.warn(
          "Ledger names missing default sender: tenantId={}, senderId={}", tenantId, defaultId);
      return null;
    }
  }

  private void cleanUpIdentity(Sender sender, List<Sender> remaining) {
    if (sender.getVerificationType() == VerificationType.MAILBOX) {
      releaseMailboxIdentity(sender);
      return;
    }
    boolean domainInUse =
        remaining.stream()
            .anyMatch(
                other ->
                    other.getVerificationType() == VerificationType.DOMAIN
                        && sender.getDomain().equalsIgnoreCase(other.getDomain()));
    if (domainInUse) {
      return;
    }
    try {
      domainRepository.delete(sender.getTenantId(), sender.getDomain());
    } catch (ExternalServiceException e) {
      log.warn(
          "Best-effort domain record cleanup failed: tenantId={}, domain={}",
          sender.getTenantId(),
          sender.getDomain());
    }
    domainVerificationService.releaseDomainIdentity(sender.getTenantId(), sender.getDomain());
  }

  private boolean timedOut(Sender sender, Instant now) {
    Instant started =
        sender.getLastVerificationSent() != null
            ? sender.getLastVerificationSent()
            : sender.getCreatedAt();
    return !now.isBefore(started.plus(properties.verificationTimeout()));
  }

  /**
   * Provider identities are shared by every tenant. The address identity is removed only when no
   * other sender of any tenant is registered for it.
   */
  private void releaseMailboxIdentity(Sender sender) {
    boolean shared;
    try {
      shared =
          senderRepository.findMailboxSendersByEmail(sender.getEmail()).stream()
              .anyMatch(other -> !other.getSenderId().equals(sender.getSenderId()));
    } catch (ExternalServiceException e) {
      log.warn("Identity kept, usage could not be checked: identity={}", sender.getEmail());
      return;
    }
    if (shared) {
      log.info("Identity kept, still used by another sender: identity={}", sender.getEmail());
      return;
    }
    removeIdentityQuietly(sender.getEmail());
  }

  private void removeIdentityQuietly(String identity) {
    try {
      verificationProvider.deleteIdentity(identity);
    } catch (ExternalServiceException e) {
      log.warn("Best-effort identity cleanup failed: identity={}", identity);
    }
  }
}
