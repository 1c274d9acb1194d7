package io.b2mash.newsletter.senders.domainverification;

import io.b2mash.newsletter.senders.exception.InternalProcessingException;
import io.b2mash.newsletter.senders.exception.ResourceConflictException;
import io.b2mash.newsletter.senders.exception.ResourceNotFoundException;
import io.b2mash.newsletter.senders.sender.VerificationStatus;
import io.b2mash.newsletter.senders.store.ConditionalWriteFailedException;
import io.b2mash.newsletter.senders.store.KeyPatterns;
import io.b2mash.newsletter.senders.store.KeyValueStore;
import io.b2mash.newsletter.senders.store.StoreCalls;
import io.b2mash.newsletter.senders.store.StoreIndex;
import io.b2mash.newsletter.senders.store.WriteCondition;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

@Repository
public class KeyValueDomainVerificationRepository implements DomainVerificationRepository {

  private static final Logger log =
      LoggerFactory.getLogger(KeyValueDomainVerificationRepository.class);

  private static final String VERSION = "version";
  private static final String ITEM_TYPE = "domain";

  private final KeyValueStore store;
  private final Clock clock;

  public KeyValueDomainVerificationRepository(KeyValueStore store, Clock clock) {
    this.store = store;
    this.clock = clock;
  }

  @Override
  public DomainVerificationRecord upsert(DomainVerificationRecord record) {
    Instant now = clock.instant();
    long next = record.getVersion() + 1;
    WriteCondition condition =
        record.getVersion() == 0
            ? WriteCondition.itemAbsent()
            : WriteCondition.attributeEquals(VERSION, record.getVersion());
    try {
      StoreCalls.run(
          "upsertDomainVerification",
          () ->
              store.putItem(
                  KeyPatterns.domain(record.getTenantId(), record.getDomain()),
                  toAttributes(record, now, next),
                  condition));
    } catch (ConditionalWriteFailedException e) {
      log.warn(
          "Domain verification write lost race: tenantId={}, domain={}, version={}",
          record.getTenantId(),
          record.getDomain(),
          record.getVersion());
      throw ResourceConflictException.concurrentModification("Domain verification");
    }
    record.touch(now, next);
    return record;
  }

  @Override
  public Optional<DomainVerificationRecord> findByDomain(String tenantId, String domain) {
    return StoreCalls.call(
            "getDomainVerification", () -> store.getItem(KeyPatterns.domain(tenantId, domain)))
        .map(DomainItems::fromAttributes)
        .filter(record -> tenantId.equals(record.getTenantId()));
  }

  @Override
  public DomainVerificationRecord getByDomain(String tenantId, String domain) {
    return findByDomain(tenantId, domain)
        .orElseThrow(() -> new ResourceNotFoundException("Domain verification", domain));
  }

  @Override
  public List<DomainVerificationRecord> findAllByDomain(String domain) {
    return queryRecords(
            "findDomainVerifications",
            StoreIndex.IDENTITY,
            KeyPatterns.identityIndexPartition(domain))
        .stream()
        .filter(record -> record.getDomain().equalsIgnoreCase(domain))
        .toList();
  }

  @Override
  public List<DomainVerificationRecord> listPendingVerification() {
    return queryRecords(
            "listPendingDomainVerifications",
            StoreIndex.PENDING_VERIFICATION,
            KeyPatterns.PENDING_VERIFICATION_PARTITION)
        .stream()
        .filter(record -> record.getVerificationStatus() == VerificationStatus.PENDING)
        .toList();
  }

  @Override
  public void delete(String tenantId, String domain) {
    StoreCalls.run(
        "deleteDomainVerification",
        () -> store.deleteItem(KeyPatterns.domain(tenantId, domain), WriteCondition.none()));
  }

  private List<DomainVerificationRecord> queryRecords(
      String operation, StoreIndex index, String partition) {
    var items = StoreCalls.call(operation, () -> store.queryByIndex(index, partition));
    var records = new ArrayList<DomainVerificationRecord>();
    for (var item : items) {
      if (!ITEM_TYPE.equals(item.get("itemType"))) {
        continue;
      }
      try {
        records.add(DomainItems.fromAttributes(item));
      } catch (InternalProcessingException e) {
        log.warn(
            "Skipping undecodable domain item: partition={}, sk={}", partition, item.get("sk"));
      }
    }
    return records;
  }

  private static Map<String, Object> toAttributes(
      DomainVerificationRecord record, Instant updatedAt, long version) {
    var dnsRecords = new ArrayList<Map<String, Object>>();
    for (var dnsRecord : record.getDnsRecords()) {
      var attributes = new LinkedHashMap<String, Object>();
      attributes.put("name", dnsRecord.name());
      attributes.put("type", dnsRecord.type());
      attributes.put("value", dnsRecord.value());
      attributes.put("description", dnsRecord.description());
      dnsRecords.add(attributes);
    }
    var attributes = new LinkedHashMap<String, Object>();
    attributes.put("itemType", ITEM_TYPE);
    attributes.put(
        KeyPatterns.IDENTITY_INDEX_KEY, KeyPatterns.identityIndexPartition(record.getDomain()));
    if (record.getVerificationStatus() == VerificationStatus.PENDING) {
      attributes.put(KeyPatterns.PENDING_INDEX_KEY, KeyPatterns.PENDING_VERIFICATION_PARTITION);
    }
    attributes.put("tenantId", record.getTenantId());
    attributes.put("domain", record.getDomain());
    attributes.put("verificationStatus", record.getVerificationStatus().wireValue());
    attributes.put("dnsRecords", dnsRecords);
    attributes.put("identityReference", record.getIdentityReference());
    attributes.put("createdAt", format(record.getCreatedAt()));
    attributes.put("updatedAt", format(updatedAt));
    attributes.put("verifiedAt", format(record.getVerifiedAt()));
    attributes.put("lastVerificationSent", format(record.getLastVerificationSent()));
    attributes.put("failureReason", record.getFailureReason());
    attributes.put(VERSION, version);
    return attributes;
  }

  private static String format(Instant instant) {
    return instant != null ? instant.toString() : null;
  }

  /** Decoding of stored domain items. */
  private static final class DomainItems {

    static DomainVerificationRecord fromAttributes(Map<String, Object> item) {
      try {
        var dnsRecords = new ArrayList<DnsRecord>();
        if (item.get("dnsRecords") instanceof List<?> stored) {
          for (var element : stored) {
            var map = (Map<?, ?>) element;
            dnsRecords.add(
                new DnsRecord(
                    (String) map.get("name"),
                    (String) map.get("type"),
                    (String) map.get("value"),
                    (String) map.get("description")));
          }
        }
        return new DomainVerificationRecord(
            (String) item.get("tenantId"),
            (String) item.get("domain"),
            VerificationStatus.fromWire((String) item.get("verificationStatus")),
            dnsRecords,
            (String) item.get("identityReference"),
            instant(item.get("createdAt")),
            instant(item.get("updatedAt")),
            instant(item.get("verifiedAt")),
            instant(item.get("lastVerificationSent")),
            (String) item.get("failureReason"),
            item.get(VERSION) instanceof Number n ? n.longValue() : 0L);
      } catch (RuntimeException e) {
        throw new InternalProcessingException("Malformed domain item " + item.get("sk"), e);
      }
    }

    private static Instant instant(Object value) {
      return value != null ? Instant.parse(value.toString()) : null;
    }
  }
}
