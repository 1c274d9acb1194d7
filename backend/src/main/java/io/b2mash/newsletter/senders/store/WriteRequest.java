package io.b2mash.newsletter.senders.store;

import java.util.Map;

/** One element of a multi-item transactional write. */
public sealed interface WriteRequest permits WriteRequest.Put, WriteRequest.Delete {

  ItemKey key();

  WriteCondition condition();

  record Put(ItemKey key, Map<String, Object> attributes, WriteCondition condition)
      implements WriteRequest {}

  record Delete(ItemKey key, WriteCondition condition) implements WriteRequest {}
}
