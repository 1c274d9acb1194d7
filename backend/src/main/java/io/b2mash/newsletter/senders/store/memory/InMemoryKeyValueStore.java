package io.b2mash.newsletter.senders.store.memory;

import io.b2mash.newsletter.senders.store.ConditionalWriteFailedException;
import io.b2mash.newsletter.senders.store.ItemKey;
import io.b2mash.newsletter.senders.store.KeyPatterns;
import io.b2mash.newsletter.senders.store.KeyValueStore;
import io.b2mash.newsletter.senders.store.StoreIndex;
import io.b2mash.newsletter.senders.store.WriteCondition;
import io.b2mash.newsletter.senders.store.WriteRequest;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Process-local {@link KeyValueStore} for local development and tests. Items are copied on the way
 * in and out so callers never share mutable state with the store.
 */
@Component
@ConditionalOnProperty(name = "senders.store.provider", havingValue = "memory")
public class InMemoryKeyValueStore implements KeyValueStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryKeyValueStore.class);

  private final Map<ItemKey, Map<String, Object>> items = new HashMap<>();

  public InMemoryKeyValueStore() {
    log.info("Using in-memory key-value store; data is lost on restart");
  }

  @Override
  public synchronized Optional<Map<String, Object>> getItem(ItemKey key) {
    return Optional.ofNullable(items.get(key)).map(InMemoryKeyValueStore::copy);
  }

  @Override
  public synchronized void putItem(
      ItemKey key, Map<String, Object> attributes, WriteCondition condition) {
    check(key, condition);
    items.put(key, withKey(key, attributes));
  }

  @Override
  public synchronized List<Map<String, Object>> queryByIndex(
      StoreIndex index, String indexPartition) {
    var result = new ArrayList<Map<String, Object>>();
    for (var item : items.values()) {
      if (indexPartition.equals(item.get(index.partitionAttribute()))) {
        result.add(copy(item));
      }
    }
    return result;
  }

  @Override
  public synchronized void deleteItem(ItemKey key, WriteCondition condition) {
    check(key, condition);
    items.remove(key);
  }

  @Override
  public synchronized void transactWrite(List<WriteRequest> writes) {
    var seen = new HashSet<ItemKey>();
    for (var write : writes) {
      if (!seen.add(write.key())) {
        throw new IllegalArgumentException(
            "Transaction touches item more than once: " + write.key());
      }
      check(write.key(), write.condition());
    }
    for (var write : writes) {
      if (write instanceof WriteRequest.Put put) {
        items.put(put.key(), withKey(put.key(), put.attributes()));
      } else {
        items.remove(write.key());
      }
    }
  }

  /** Removes every item. Intended for test isolation. */
  public synchronized void clear() {
    items.clear();
  }

  private void check(ItemKey key, WriteCondition condition) {
    if (!condition.isSatisfiedBy(items.get(key))) {
      throw new ConditionalWriteFailedException("Condition failed for item " + key);
    }
  }

  private static Map<String, Object> withKey(ItemKey key, Map<String, Object> attributes) {
    var stored = copy(attributes);
    stored.put(KeyPatterns.PARTITION_KEY, key.partitionKey());
    stored.put(KeyPatterns.SORT_KEY, key.sortKey());
    return stored;
  }

  private static Map<String, Object> copy(Map<?, ?> source) {
    var target = new LinkedHashMap<String, Object>();
    source.forEach(
        (name, value) -> {
          if (value != null) {
            target.put((String) name, copyValue(value));
          }
        });
    return target;
  }

  private static Object copyValue(Object value) {
    if (value instanceof Map<?, ?> map) {
      return copy(map);
    }
    if (value instanceof List<?> list) {
      var copied = new ArrayList<Object>(list.size());
      for (var element : list) {
        copied.add(copyValue(element));
      }
      return copied;
    }
    if (value instanceof Integer number) {
      return number.longValue();
    }
    return value;
  }
}
