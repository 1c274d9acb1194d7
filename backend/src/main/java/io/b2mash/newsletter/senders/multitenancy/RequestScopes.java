package io.b2mash.newsletter.senders.multitenancy;

import io.b2mash.newsletter.senders.exception.MissingTenantContextException;

/**
 * Request-bound caller context. Bound by {@link TenantFilter} for the duration of one request and
 * read by controllers.
 */
public final class RequestScopes {

  private static final ThreadLocal<UserContext> USER_CONTEXT = new ThreadLocal<>();

  private RequestScopes() {}

  static void bind(UserContext context) {
    USER_CONTEXT.set(context);
  }

  static void clear() {
    USER_CONTEXT.remove();
  }

  /** Returns the caller context, or {@code null} outside an authenticated tenant request. */
  public static UserContext getUserContext() {
    return USER_CONTEXT.get();
  }

  /** Returns the caller context. Throws if the caller has no tenant. */
  public static UserContext requireUserContext() {
    UserContext context = USER_CONTEXT.get();
    if (context == null) {
      throw new MissingTenantContextException();
    }
    return context;
  }
}
