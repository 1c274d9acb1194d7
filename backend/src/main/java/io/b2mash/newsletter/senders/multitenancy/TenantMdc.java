package io.b2mash.newsletter.senders.multitenancy;

import java.util.function.Supplier;
import org.slf4j.MDC;

/** Tags log lines with a tenant for work that runs outside a tenant request. */
public final class TenantMdc {

  static final String MDC_TENANT_ID = "tenantId";

  private TenantMdc() {}

  public static <T> T call(String tenantId, Supplier<T> work) {
    MDC.put(MDC_TENANT_ID, tenantId);
    try {
      return work.get();
    } finally {
      MDC.remove(MDC_TENANT_ID);
    }
  }
}
