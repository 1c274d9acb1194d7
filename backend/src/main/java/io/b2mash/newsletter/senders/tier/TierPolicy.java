package io.b2mash.newsletter.senders.tier;

/** Static tier table. Consumed by sender and domain verification services. */
public final class TierPolicy {

  public static final String FREE_TIER = "free-tier";
  public static final String CREATOR_TIER = "creator-tier";
  public static final String PRO_TIER = "pro-tier";

  private TierPolicy() {}

  /**
   * Resolves the limits for {@code tier}. An unrecognized tier gets free-tier limits while the
   * result keeps the given label for display.
   */
  public static TierLimits resolveLimits(String tier, int currentCount) {
    var definition = TierDefinition.of(tier);
    return new TierLimits(
        tier != null ? tier : FREE_TIER,
        definition.maxSenders,
        currentCount,
        definition.canUseDNS,
        definition.canUseMailbox);
  }

  private enum TierDefinition {
    FREE(1, false, true),
    CREATOR(2, true, true),
    PRO(5, true, true);

    private final int maxSenders;
    private final boolean canUseDNS;
    private final boolean canUseMailbox;

    TierDefinition(int maxSenders, boolean canUseDNS, boolean canUseMailbox) {
      this.maxSenders = maxSenders;
      this.canUseDNS = canUseDNS;
      this.canUseMailbox = canUseMailbox;
    }

    static TierDefinition of(String tier) {
      if (tier == null) {
        return FREE;
      }
      return switch (tier) {
        case CREATOR_TIER -> CREATOR;
        case PRO_TIER -> PRO;
        default -> FREE;
      };
    }
  }
}
