package io.b2mash.newsletter.senders.sender;

import io.b2mash.newsletter.senders.exception.InternalProcessingException;
import io.b2mash.newsletter.senders.exception.ResourceConflictException;
import io.b2mash.newsletter.senders.exception.ResourceNotFoundException;
import io.b2mash.newsletter.senders.store.ConditionalWriteFailedException;
import io.b2mash.newsletter.senders.store.ItemKey;
import io.b2mash.newsletter.senders.store.KeyPatterns;
import io.b2mash.newsletter.senders.store.KeyValueStore;
import io.b2mash.newsletter.senders.store.StoreCalls;
import io.b2mash.newsletter.senders.store.StoreIndex;
import io.b2mash.newsletter.senders.store.WriteCondition;
import io.b2mash.newsletter.senders.store.WriteRequest;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

@Repository
public class KeyValueSenderRepository implements SenderRepository {

  private static final Logger log = LoggerFactory.getLogger(KeyValueSenderRepository.class);

  private final KeyValueStore store;
  private final Clock clock;

  public KeyValueSenderRepository(KeyValueStore store, Clock clock) {
    this.store = store;
    this.clock = clock;
  }

  @Override
  public Sender create(Sender sender, SenderLedger observedLedger) {
    Instant now = clock.instant();
    var writes =
        List.<WriteRequest>of(
            new WriteRequest.Put(
                KeyPatterns.sender(sender.getTenantId(), sender.getSenderId()),
                SenderItemMapper.toAttributes(sender, now, 1),
                WriteCondition.itemAbsent()),
            new WriteRequest.Put(
                KeyPatterns.emailClaim(sender.getTenantId(), sender.getEmail()),
                SenderItemMapper.toEmailClaimAttributes(sender),
                WriteCondition.itemAbsent()),
            ledgerWrite(observedLedger.withSenderAdded(sender), observedLedger, now));
    commit("createSender", writes);
    sender.touch(now, 1);
    return sender;
  }

  @Override
  public Sender getById(String tenantId, String senderId) {
    var item =
        StoreCalls.call("getSender", () -> store.getItem(KeyPatterns.sender(tenantId, senderId)))
            .orElseThrow(() -> new ResourceNotFoundException("Sender", senderId));
    var sender = SenderItemMapper.fromAttributes(item);
    if (!tenantId.equals(sender.getTenantId())) {
      log.warn("Sender tenant mismatch: senderId={}, requestedTenant={}", senderId, tenantId);
      throw new ResourceNotFoundException("Sender", senderId);
    }
    return sender;
  }

  @Override
  public List<Sender> listByTenant(String tenantId) {
    return querySenders(
            "listSenders", StoreIndex.TENANT, KeyPatterns.senderIndexPartition(tenantId))
        .stream()
        .filter(sender -> tenantId.equals(sender.getTenantId()))
        .toList();
  }

  @Override
  public List<Sender> findMailboxSendersByEmail(String email) {
    return querySenders(
            "findSendersByEmail", StoreIndex.IDENTITY, KeyPatterns.identityIndexPartition(email))
        .stream()
        .filter(sender -> sender.getVerificationType() == VerificationType.MAILBOX)
        .filter(sender -> sender.getEmail().equalsIgnoreCase(email))
        .toList();
  }

  @Override
  public List<Sender> listPendingVerification() {
    return querySenders(
            "listPendingSenders",
            StoreIndex.PENDING_VERIFICATION,
            KeyPatterns.PENDING_VERIFICATION_PARTITION)
        .stream()
        .filter(sender -> sender.getVerificationStatus() == VerificationStatus.PENDING)
        .toList();
  }

  @Override
  public Sender update(Sender sender) {
    Instant now = clock.instant();
    long next = sender.getVersion() + 1;
    try {
      StoreCalls.run(
          "updateSender",
          () ->
              store.putItem(
                  KeyPatterns.sender(sender.getTenantId(), sender.getSenderId()),
                  SenderItemMapper.toAttributes(sender, now, next),
                  versionCondition(sender)));
    } catch (ConditionalWriteFailedException e) {
      log.warn(
          "Sender update lost race: tenantId={}, senderId={}, version={}",
          sender.getTenantId(),
          sender.getSenderId(),
          sender.getVersion());
      throw ResourceConflictException.concurrentModification("Sender");
    }
    sender.touch(now, next);
    return sender;
  }

  @Override
  public void delete(Sender sender, Sender promotedDefault, SenderLedger observedLedger) {
    Instant now = clock.instant();
    var writes = new ArrayList<WriteRequest>();
    writes.add(
        new WriteRequest.Delete(
            KeyPatterns.sender(sender.getTenantId(), sender.getSenderId()),
            versionCondition(sender)));
    writes.add(
        new WriteRequest.Delete(
            KeyPatterns.emailClaim(sender.getTenantId(), sender.getEmail()),
            WriteCondition.none()));
    if (promotedDefault != null) {
      promotedDefault.markDefault(true);
      writes.add(senderWrite(promotedDefault, now));
    }
    writes.add(
        ledgerWrite(
            observedLedger.withSenderRemoved(sender, promotedDefault), observedLedger, now));
    commit("deleteSender", writes);
    if (promotedDefault != null) {
      promotedDefault.touch(now, promotedDefault.getVersion() + 1);
    }
  }

  @Override
  public void changeDefault(
      Sender newDefault, Sender previousDefault, SenderLedger observedLedger) {
    Instant now = clock.instant();
    var writes = new ArrayList<WriteRequest>();
    newDefault.markDefault(true);
    writes.add(senderWrite(newDefault, now));
    if (previousDefault != null) {
      previousDefault.markDefault(false);
      writes.add(senderWrite(previousDefault, now));
    }
    writes.add(
        ledgerWrite(observedLedger.withDefault(newDefault.getSenderId()), observedLedger, now));
    commit("changeDefaultSender", writes);
    newDefault.touch(now, newDefault.getVersion() + 1);
    if (previousDefault != null) {
      previousDefault.touch(now, previousDefault.getVersion() + 1);
    }
  }

  @Override
  public SenderLedger loadLedger(String tenantId) {
    var item =
        StoreCalls.call("getSenderLedger", () -> store.getItem(KeyPatterns.senderLedger(tenantId)));
    if (item.isPresent()) {
      return SenderItemMapper.ledgerFromAttributes(tenantId, item.get());
    }
    var senders = listByTenant(tenantId);
    String defaultSenderId =
        senders.stream()
            .filter(Sender::isDefault)
            .map(Sender::getSenderId)
            .findFirst()
            .orElse(null);
    return new SenderLedger(tenantId, senders.size(), defaultSenderId, 0, false);
  }

  @Override
  public boolean isEmailConfigured(String tenantId, String email) {
    return StoreCalls.call(
            "getEmailClaim", () -> store.getItem(KeyPatterns.emailClaim(tenantId, email)))
        .isPresent();
  }

  private WriteRequest senderWrite(Sender sender, Instant now) {
    return new WriteRequest.Put(
        KeyPatterns.sender(sender.getTenantId(), sender.getSenderId()),
        SenderItemMapper.toAttributes(sender, now, sender.getVersion() + 1),
        versionCondition(sender));
  }

  private static WriteRequest ledgerWrite(SenderLedger next, SenderLedger observed, Instant now) {
    ItemKey key = KeyPatterns.senderLedger(next.tenantId());
    Map<String, Object> attributes = SenderItemMapper.toLedgerAttributes(next, now);
    WriteCondition condition =
        observed.persisted()
            ? WriteCondition.attributeEquals(SenderItemMapper.VERSION, observed.version())
            : WriteCondition.itemAbsent();
    return new WriteRequest.Put(key, attributes, condition);
  }

  private static WriteCondition versionCondition(Sender sender) {
    return WriteCondition.attributeEquals(SenderItemMapper.VERSION, sender.getVersion());
  }

  /** Decodes the sender items of an index partition; other item types sharing it are ignored. */
  private List<Sender> querySenders(String operation, StoreIndex index, String partition) {
    var items = StoreCalls.call(operation, () -> store.queryByIndex(index, partition));
    var senders = new ArrayList<Sender>(items.size());
    for (var item : items) {
      if (!SenderItemMapper.SENDER_TYPE.equals(item.get(SenderItemMapper.ITEM_TYPE))) {
        continue;
      }
      try {
        senders.add(SenderItemMapper.fromAttributes(item));
      } catch (InternalProcessingException e) {
        log.warn(
            "Skipping undecodable sender item: partition={}, sk={}", partition, item.get("sk"));
      }
    }
    return senders;
  }

  private void commit(String operation, List<WriteRequest> writes) {
    try {
      StoreCalls.run(operation, () -> store.transactWrite(writes));
    } catch (ConditionalWriteFailedException e) {
      log.warn("Sender transaction lost race: operation={}, items={}", operation, writes.size());
      throw ResourceConflictException.concurrentModification("Sender");
    }
  }
}
