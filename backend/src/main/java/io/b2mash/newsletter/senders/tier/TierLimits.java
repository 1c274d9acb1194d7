package io.b2mash.newsletter.senders.tier;

/**
 * Quota and capabilities of a tier, together with the tenant's current sender count. Derived on
 * demand and never persisted.
 */
public record TierLimits(
    String tier, int maxSenders, int currentCount, boolean canUseDNS, boolean canUseMailbox) {

  public boolean quotaReached() {
    return currentCount >= maxSenders;
  }
}
