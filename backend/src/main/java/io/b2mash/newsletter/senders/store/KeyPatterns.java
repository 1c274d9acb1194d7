package io.b2mash.newsletter.senders.store;

import java.util.Locale;

/**
 * Key layout of the senders table. Items are partitioned by tenant; the sort key carries the item
 * type. Sender items are additionally indexed under {@code sender#<tenantId>} for tenant listing.
 * Mailbox senders and domain records carry {@code identity#<identity>} so provider notifications
 * can be routed without knowing the tenant, and pending items carry {@code verification#pending}
 * until their attempt resolves.
 */
public final class KeyPatterns {

  public static final String PARTITION_KEY = "pk";
  public static final String SORT_KEY = "sk";
  public static final String INDEX_PARTITION_KEY = "GSI1PK";
  public static final String INDEX_SORT_KEY = "GSI1SK";
  public static final String IDENTITY_INDEX_KEY = "GSI2PK";
  public static final String PENDING_INDEX_KEY = "GSI3PK";

  /** Index partition holding every item with a pending verification attempt. */
  public static final String PENDING_VERIFICATION_PARTITION = "verification#pending";

  private static final String SENDER_PREFIX = "sender#";
  private static final String DOMAIN_PREFIX = "domain#";
  private static final String EMAIL_CLAIM_PREFIX = "sender-email#";
  private static final String SENDER_LEDGER = "sender-ledger";
  private static final String IDENTITY_PREFIX = "identity#";

  private KeyPatterns() {}

  public static ItemKey sender(String tenantId, String senderId) {
    return new ItemKey(tenantId, SENDER_PREFIX + senderId);
  }

  /** Index partition under which all senders of a tenant are listed. */
  public static String senderIndexPartition(String tenantId) {
    return SENDER_PREFIX + tenantId;
  }

  /** Index partition of everything referencing a provider identity (an address or a domain). */
  public static String identityIndexPartition(String identity) {
    return IDENTITY_PREFIX + identity.toLowerCase(Locale.ROOT);
  }

  public static ItemKey domain(String tenantId, String domain) {
    return new ItemKey(tenantId, DOMAIN_PREFIX + domain.toLowerCase(Locale.ROOT));
  }

  /** Uniqueness marker reserving an email address within a tenant. */
  public static ItemKey emailClaim(String tenantId, String email) {
    return new ItemKey(tenantId, EMAIL_CLAIM_PREFIX + email.toLowerCase(Locale.ROOT));
  }

  /** Per-tenant membership record (sender count and default sender). */
  public static ItemKey senderLedger(String tenantId) {
    return new ItemKey(tenantId, SENDER_LEDGER);
  }
}
