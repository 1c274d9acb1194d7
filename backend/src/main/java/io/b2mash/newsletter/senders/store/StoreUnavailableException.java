package io.b2mash.newsletter.senders.store;

/** The store could not be reached, timed out or rejected the call for a non-conditional reason. */
public class StoreUnavailableException extends RuntimeException {

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
