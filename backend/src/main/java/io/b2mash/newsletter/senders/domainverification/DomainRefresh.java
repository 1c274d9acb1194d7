package io.b2mash.newsletter.senders.domainverification;

import io.b2mash.newsletter.senders.verification.ProviderVerificationStatus;
import java.time.Instant;

/**
 * Outcome of checking a domain against the provider.
 *
 * @param providerStatus {@code null} when the record was already resolved and the provider was not
 *     asked
 */
public record DomainRefresh(
    DomainVerificationRecord record,
    boolean statusChanged,
    ProviderVerificationStatus providerStatus,
    Instant checkedAt) {}
