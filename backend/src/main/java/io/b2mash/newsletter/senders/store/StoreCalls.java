package io.b2mash.newsletter.senders.store;

import io.b2mash.newsletter.senders.exception.ExternalServiceException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs store calls and translates infrastructure failures into {@link ExternalServiceException}.
 * Conditional-write failures pass through so that callers can map them to their own conflict.
 */
public final class StoreCalls {

  private static final Logger log = LoggerFactory.getLogger(StoreCalls.class);

  private static final String SERVICE = "key-value-store";

  private StoreCalls() {}

  public static <T> T call(String operation, Supplier<T> call) {
    try {
      return call.get();
    } catch (StoreUnavailableException e) {
      log.error("Store call failed: operation={}", operation, e);
      throw new ExternalServiceException(SERVICE, e);
    }
  }

  public static void run(String operation, Runnable call) {
    call(
        operation,
        () -> {
          call.run();
          return null;
        });
  }
}
