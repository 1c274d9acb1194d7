package io.b2mash.newsletter.senders.event;

/**
 * Fire-and-forget publication of {@link SenderEvent}s. Implementations log failures and never
 * throw, so a lost notification never fails the request that caused it.
 */
public interface SenderEventPublisher {

  void publish(SenderEvent event);
}
