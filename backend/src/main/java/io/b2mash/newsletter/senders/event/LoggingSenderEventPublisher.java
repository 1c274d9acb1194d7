package io.b2mash.newsletter.senders.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Publisher for local development and tests. Writes events to the log instead of a bus. */
@Component
@ConditionalOnProperty(name = "senders.events.provider", havingValue = "log")
public class LoggingSenderEventPublisher implements SenderEventPublisher {

  private static final Logger log = LoggerFactory.getLogger(LoggingSenderEventPublisher.class);

  @Override
  public void publish(SenderEvent event) {
    log.info(
        "Sender event: type={}, tenantId={}, detail={}",
        event.eventType(),
        event.tenantId(),
        event.detail());
  }
}
