package io.b2mash.newsletter.senders.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single-table key-value store. Attribute maps hold {@code String}, {@code Long}, {@code Boolean},
 * lists and nested maps; {@code null} values are not stored.
 *
 * <p>System-wide: selected via {@code senders.store.provider}, not per-tenant. Every call is
 * bounded by the configured store timeout; failures surface as {@link StoreUnavailableException},
 * rejected preconditions as {@link ConditionalWriteFailedException}.
 */
public interface KeyValueStore {

  /** Strongly consistent read of a single item. Returned maps include the key attributes. */
  Optional<Map<String, Object>> getItem(ItemKey key);

  void putItem(ItemKey key, Map<String, Object> attributes, WriteCondition condition);

  /**
   * Returns every item whose partition attribute of {@code index} equals {@code indexPartition}.
   * Index reads are eventually consistent and unordered.
   */
  List<Map<String, Object>> queryByIndex(StoreIndex index, String indexPartition);

  void deleteItem(ItemKey key, WriteCondition condition);

  /** Applies all writes or none. Any failed condition rejects the whole batch. */
  void transactWrite(List<WriteRequest> writes);
}
