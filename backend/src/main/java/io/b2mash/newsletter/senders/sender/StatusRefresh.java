package io.b2mash.newsletter.senders.sender;

import io.b2mash.newsletter.senders.verification.ProviderVerificationStatus;
import java.time.Instant;

/**
 * Outcome of a sender status check.
 *
 * @param providerStatus {@code null} when the provider was not asked
 */
public record StatusRefresh(
    Sender sender,
    boolean statusChanged,
    ProviderVerificationStatus providerStatus,
    Instant lastChecked) {}
