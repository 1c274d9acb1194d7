package io.b2mash.newsletter.senders.webhook;

/** Thrown when a webhook body is not a readable provider event. */
public class WebhookPayloadException extends RuntimeException {

  public WebhookPayloadException(String message) {
    super(message);
  }

  public WebhookPayloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
