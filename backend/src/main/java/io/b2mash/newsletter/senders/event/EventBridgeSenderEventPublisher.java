package io.b2mash.newsletter.senders.event;

import io.b2mash.newsletter.senders.config.SenderProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.eventbridge.EventBridgeClient;
import software.amazon.awssdk.services.eventbridge.model.PutEventsRequest;
import software.amazon.awssdk.services.eventbridge.model.PutEventsRequestEntry;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

@Component
@ConditionalOnProperty(
    name = "senders.events.provider",
    havingValue = "eventbridge",
    matchIfMissing = true)
public class EventBridgeSenderEventPublisher implements SenderEventPublisher {

  private static final Logger log = LoggerFactory.getLogger(EventBridgeSenderEventPublisher.class);

  private final EventBridgeClient eventBridge;
  private final ObjectMapper objectMapper;
  private final String eventBusName;
  private final String source;

  public EventBridgeSenderEventPublisher(
      EventBridgeClient eventBridge, ObjectMapper objectMapper, SenderProperties properties) {
    this.eventBridge = eventBridge;
    this.objectMapper = objectMapper;
    this.eventBusName = properties.eventBusName();
    this.source = properties.eventSource();
  }

  @Override
  public void publish(SenderEvent event) {
    try {
      var entry =
          PutEventsRequestEntry.builder()
              .eventBusName(eventBusName)
              .source(source)
              .detailType(event.eventType())
              .detail(objectMapper.writeValueAsString(event.payload()))
              .build();
      var response = eventBridge.putEvents(PutEventsRequest.builder().entries(entry).build());
      if (response.failedEntryCount() != null && response.failedEntryCount() > 0) {
        log.warn(
            "Event rejected by bus: type={}, tenantId={}, error={}",
            event.eventType(),
            event.tenantId(),
            response.hasEntries() ? response.entries().get(0).errorMessage() : null);
        return;
      }
      log.debug("Published event: type={}, tenantId={}", event.eventType(), event.tenantId());
    } catch (JacksonException | SdkException e) {
      log.warn(
          "Failed to publish event: type={}, tenantId={}", event.eventType(), event.tenantId(), e);
    }
  }
}
