package io.b2mash.newsletter.senders.store;

import java.util.Objects;

/** Composite primary key of an item in the single logical table. */
public record ItemKey(String partitionKey, String sortKey) {

  public ItemKey {
    Objects.requireNonNull(partitionKey, "partitionKey");
    Objects.requireNonNull(sortKey, "sortKey");
  }
}
