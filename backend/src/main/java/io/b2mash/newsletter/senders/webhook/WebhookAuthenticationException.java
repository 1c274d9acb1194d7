package io.b2mash.newsletter.senders.webhook;

/** Thrown when the webhook secret is missing, wrong or not configured. */
public class WebhookAuthenticationException extends RuntimeException {

  public WebhookAuthenticationException(String message) {
    super(message);
  }
}
