package io.b2mash.newsletter.senders.sender;

import io.b2mash.newsletter.senders.domainverification.DomainVerificationRepository;
import io.b2mash.newsletter.senders.domainverification.DomainVerificationService;
import io.b2mash.newsletter.senders.multitenancy.TenantMdc;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled job that re-checks every pending verification across all tenants. Pending domain
 * records are refreshed first, which also settles their senders; every other pending sender is
 * then refreshed on its own. Attempts past the verification timeout move to {@code
 * verification_timed_out} without anyone calling the status endpoint.
 */
@Component
@ConditionalOnProperty(
    name = "senders.status-sweep.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class VerificationStatusSweep {

  private static final Logger log = LoggerFactory.getLogger(VerificationStatusSweep.class);

  private final SenderRepository senderRepository;
  private final DomainVerificationRepository domainRepository;
  private final SenderService senderService;
  private final DomainVerificationService domainVerificationService;

  public VerificationStatusSweep(
      SenderRepository senderRepository,
      DomainVerificationRepository domainRepository,
      SenderService senderService,
      DomainVerificationService domainVerificationService) {
    this.senderRepository = senderRepository;
    this.domainRepository = domainRepository;
    this.senderService = senderService;
    this.domainVerificationService = domainVerificationService;
  }

  @Scheduled(
      fixedDelayString = "${senders.status-sweep.interval:3600000}",
      initialDelayString = "${senders.status-sweep.initial-delay:60000}")
  public void sweepPendingVerifications() {
    log.info("Verification status sweep started");
    Set<String> checkedDomains = new HashSet<>();
    int changed = 0;
    int failed = 0;

    for (var record : domainRepository.listPendingVerification()) {
      checkedDomains.add(domainKey(record.getTenantId(), record.getDomain()));
      try {
        boolean statusChanged =
            TenantMdc.call(
                record.getTenantId(),
                () ->
                    domainVerificationService
                        .refresh(record.getTenantId(), record.getDomain())
                        .statusChanged());
        if (statusChanged) {
          changed++;
        }
      } catch (RuntimeException e) {
        failed++;
        log.error(
            "Domain status check failed: tenantId={}, domain={}",
            record.getTenantId(),
            record.getDomain(),
            e);
      }
    }

    for (var sender : senderRepository.listPendingVerification()) {
      if (sender.getVerificationType() == VerificationType.DOMAIN
          && checkedDomains.contains(domainKey(sender.getTenantId(), sender.getDomain()))) {
        continue;
      }
      try {
        boolean statusChanged =
            TenantMdc.call(
                sender.getTenantId(),
                () ->
                    senderService
                        .refreshStatus(sender.getTenantId(), sender.getSenderId())
                        .statusChanged());
        if (statusChanged) {
          changed++;
        }
      } catch (RuntimeException e) {
        failed++;
        log.error(
            "Sender status check failed: tenantId={}, senderId={}",
            sender.getTenantId(),
            sender.getSenderId(),
            e);
      }
    }

    if (changed > 0 || failed > 0) {
      log.info(
          "Verification status sweep completed: {} statuses changed, {} checks failed",
          changed,
          failed);
    } else {
      log.info("Verification status sweep completed: no status changed");
    }
  }

  private static String domainKey(String tenantId, String domain) {
    return tenantId + "|" + domain.toLowerCase(Locale.ROOT);
  }
}
