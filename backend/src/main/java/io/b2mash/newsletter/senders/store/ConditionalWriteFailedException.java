package io.b2mash.newsletter.senders.store;

/** A conditional write was rejected because the stored item no longer matched. */
public class ConditionalWriteFailedException extends RuntimeException {

  public ConditionalWriteFailedException(String message) {
    super(message);
  }

  public ConditionalWriteFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
