package io.b2mash.newsletter.senders.sender;

/**
 * Authoritative per-tenant sender membership: how many senders exist and which one is the default.
 * Every create, delete and default change rewrites the ledger conditioned on the version read, so
 * two racing writers cannot both succeed.
 *
 * @param persisted {@code false} when derived from the sender list because no ledger item exists
 *     yet
 */
public record SenderLedger(
    String tenantId, int senderCount, String defaultSenderId, long version, boolean persisted) {

  SenderLedger withSenderAdded(Sender sender) {
    return new SenderLedger(
        tenantId,
        senderCount + 1,
        sender.isDefault() ? sender.getSenderId() : defaultSenderId,
        version + 1,
        true);
  }

  SenderLedger withSenderRemoved(Sender removed, Sender promoted) {
    String nextDefault = defaultSenderId;
    if (removed.getSenderId().equals(defaultSenderId) || removed.isDefault()) {
      nextDefault = promoted != null ? promoted.getSenderId() : null;
    }
    return new SenderLedger(
        tenantId, Math.max(0, senderCount - 1), nextDefault, version + 1, true);
  }

  SenderLedger withDefault(String senderId) {
    return new SenderLedger(tenantId, senderCount, senderId, version + 1, true);
  }
}
