package io.b2mash.newsletter.senders.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Notification about a committed sender or domain change, consumed by downstream systems. */
public record SenderEvent(
    String eventType, String tenantId, Map<String, Object> detail, Instant occurredAt) {

  public static final String SENDER_CREATED = "sender.created";
  public static final String SENDER_UPDATED = "sender.updated";
  public static final String SENDER_DELETED = "sender.deleted";
  public static final String SENDER_VERIFICATION_STATUS_CHANGED =
      "sender.verification-status-changed";
  public static final String DOMAIN_VERIFICATION_STATUS_CHANGED =
      "domain.verification-status-changed";

  public SenderEvent {
    var copy = new LinkedHashMap<String, Object>();
    detail.forEach(
        (name, value) -> {
          if (value != null) {
            copy.put(name, value);
          }
        });
    detail = Collections.unmodifiableMap(copy);
  }

  /** Detail payload including tenant id and timestamp, as published on the bus. */
  public Map<String, Object> payload() {
    var payload = new LinkedHashMap<String, Object>();
    payload.put("tenantId", tenantId);
    payload.putAll(detail);
    payload.put("occurredAt", occurredAt.toString());
    return payload;
  }
}
