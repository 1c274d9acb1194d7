package io.b2mash.newsletter.senders.sender;

import io.b2mash.newsletter.senders.tier.TierLimits;
import java.util.List;

/** A tenant's senders together with the limits of its tier. */
public record SenderOverview(List<Sender> senders, TierLimits tierLimits) {}
