package io.b2mash.newsletter.senders.multitenancy;

/** Authenticated caller of a request, resolved from token claims before any handler runs. */
public record UserContext(String tenantId, String userId, String tier) {}
