package io.b2mash.newsletter.senders.verification;

import io.b2mash.newsletter.senders.domainverification.DnsRecord;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * No-op provider for local development. Logs what would be registered and keeps every identity
 * pending.
 */
@Component
@ConditionalOnProperty(name = "senders.verification.provider", havingValue = "noop")
public class NoOpVerificationProvider implements VerificationProvider {

  private static final Logger log = LoggerFactory.getLogger(NoOpVerificationProvider.class);

  @Override
  public String providerId() {
    return "noop";
  }

  @Override
  public String identityReference(String identity) {
    return "noop:identity/" + identity;
  }

  @Override
  public void initiateMailboxVerification(String email) {
    log.info("NoOp verification: would send verification email to {}", email);
  }

  @Override
  public List<DnsRecord> initiateDomainVerification(String domain) {
    log.info("NoOp verification: would register domain {}", domain);
    var records = new ArrayList<DnsRecord>();
    for (int i = 1; i <= 3; i++) {
      String token =
          UUID.nameUUIDFromBytes((domain + "#" + i).getBytes(StandardCharsets.UTF_8))
              .toString()
              .replace("-", "")
              .toLowerCase(Locale.ROOT);
      records.add(DkimRecords.cname(domain, token, i));
    }
    return records;
  }

  @Override
  public ProviderVerificationStatus pollVerificationStatus(String identity) {
    return ProviderVerificationStatus.PENDING;
  }

  @Override
  public void deleteIdentity(String identity) {
    log.info("NoOp verification: would delete identity {}", identity);
  }
}
