package io.b2mash.newsletter.senders.store;

/**
 * Secondary indexes of the senders table. Each index is keyed by one partition attribute; items
 * without that attribute are not indexed.
 */
public enum StoreIndex {

  /** Senders of one tenant. */
  TENANT(KeyPatterns.INDEX_PARTITION_KEY),

  /** Mailbox senders and domain records of every tenant, by the identity the provider tracks. */
  IDENTITY(KeyPatterns.IDENTITY_INDEX_KEY),

  /** Senders and domain records whose verification attempt is still pending. */
  PENDING_VERIFICATION(KeyPatterns.PENDING_INDEX_KEY);

  private final String partitionAttribute;

  StoreIndex(String partitionAttribute) {
    this.partitionAttribute = partitionAttribute;
  }

  public String partitionAttribute() {
    return partitionAttribute;
  }
}
