package io.b2mash.newsletter.senders.sender;

import io.b2mash.newsletter.senders.exception.InternalProcessingException;
import io.b2mash.newsletter.senders.store.KeyPatterns;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/** Maps senders and ledgers to store attributes and back. */
final class SenderItemMapper {

  static final String ITEM_TYPE = "itemType";
  static final String SENDER_TYPE = "sender";
  static final String LEDGER_TYPE = "sender-ledger";
  static final String EMAIL_CLAIM_TYPE = "sender-email";
  static final String VERSION = "version";

  private SenderItemMapper() {}

  static Map<String, Object> toAttributes(Sender sender, Instant updatedAt, long version) {
    var attributes = new LinkedHashMap<String, Object>();
    attributes.put(ITEM_TYPE, SENDER_TYPE);
    attributes.put(
        KeyPatterns.INDEX_PARTITION_KEY, KeyPatterns.senderIndexPartition(sender.getTenantId()));
    attributes.put(KeyPatterns.INDEX_SORT_KEY, sender.getEmail());
    if (sender.getVerificationType() == VerificationType.MAILBOX) {
      attributes.put(
          KeyPatterns.IDENTITY_INDEX_KEY, KeyPatterns.identityIndexPartition(sender.getEmail()));
    }
    if (sender.getVerificationStatus() == VerificationStatus.PENDING) {
      attributes.put(KeyPatterns.PENDING_INDEX_KEY, KeyPatterns.PENDING_VERIFICATION_PARTITION);
    }
    attributes.put("senderId", sender.getSenderId());
    attributes.put("tenantId", sender.getTenantId());
    attributes.put("email", sender.getEmail());
    attributes.put("name", sender.getName());
    attributes.put("verificationType", sender.getVerificationType().wireValue());
    attributes.put("verificationStatus", sender.getVerificationStatus().wireValue());
    attributes.put("isDefault", sender.isDefault());
    attributes.put("domain", sender.getDomain());
    attributes.put("identityReference", sender.getIdentityReference());
    attributes.put("emailsSent", sender.getEmailsSent());
    attributes.put("lastSentAt", format(sender.getLastSentAt()));
    attributes.put("createdAt", format(sender.getCreatedAt()));
    attributes.put("updatedAt", format(updatedAt));
    attributes.put("verifiedAt", format(sender.getVerifiedAt()));
    attributes.put("failureReason", sender.getFailureReason());
    attributes.put("lastVerificationSent", format(sender.getLastVerificationSent()));
    attributes.put(VERSION, version);
    return attributes;
  }

  static Sender fromAttributes(Map<String, Object> item) {
    try {
      return new Sender(
          requireString(item, "senderId"),
          requireString(item, "tenantId"),
          requireString(item, "email"),
          string(item, "name"),
          VerificationType.fromWire(requireString(item, "verificationType")),
          VerificationStatus.fromWire(requireString(item, "verificationStatus")),
          Boolean.TRUE.equals(item.get("isDefault")),
          string(item, "domain"),
          string(item, "identityReference"),
          number(item, "emailsSent"),
          instant(item, "lastSentAt"),
          instant(item, "createdAt"),
          instant(item, "updatedAt"),
          instant(item, "verifiedAt"),
          string(item, "failureReason"),
          instant(item, "lastVerificationSent"),
          number(item, VERSION));
    } catch (RuntimeException e) {
      throw new InternalProcessingException("Malformed sender item " + item.get("sk"), e);
    }
  }

  static Map<String, Object> toLedgerAttributes(SenderLedger ledger, Instant updatedAt) {
    var attributes = new LinkedHashMap<String, Object>();
    attributes.put(ITEM_TYPE, LEDGER_TYPE);
    attributes.put("tenantId", ledger.tenantId());
    attributes.put("senderCount", (long) ledger.senderCount());
    attributes.put("defaultSenderId", ledger.defaultSenderId());
    attributes.put("updatedAt", format(updatedAt));
    attributes.put(VERSION, ledger.version());
    return attributes;
  }

  static SenderLedger ledgerFromAttributes(String tenantId, Map<String, Object> item) {
    return new SenderLedger(
        tenantId,
        (int) number(item, "senderCount"),
        string(item, "defaultSenderId"),
        number(item, VERSION),
        true);
  }

  static Map<String, Object> toEmailClaimAttributes(Sender sender) {
    var attributes = new LinkedHashMap<String, Object>();
    attributes.put(ITEM_TYPE, EMAIL_CLAIM_TYPE);
    attributes.put("tenantId", sender.getTenantId());
    attributes.put("senderId", sender.getSenderId());
    attributes.put("email", sender.getEmail());
    return attributes;
  }

  private static String format(Instant instant) {
    return instant != null ? instant.toString() : null;
  }

  private static String string(Map<String, Object> item, String name) {
    Object value = item.get(name);
    return value != null ? value.toString() : null;
  }

  private static String requireString(Map<String, Object> item, String name) {
    String value = string(item, name);
    if (value == null) {
      throw new IllegalStateException("Missing attribute " + name);
    }
    return value;
  }

  private static long number(Map<String, Object> item, String name) {
    Object value = item.get(name);
    return value instanceof Number n ? n.longValue() : 0L;
  }

  private static Instant instant(Map<String, Object> item, String name) {
    String value = string(item, name);
    if (value == null) {
      return null;
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException e) {
      throw new IllegalStateException("Invalid timestamp in attribute " + name, e);
    }
  }
}
