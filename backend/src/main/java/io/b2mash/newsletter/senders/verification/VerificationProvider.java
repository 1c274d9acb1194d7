package io.b2mash.newsletter.senders.verification;

import io.b2mash.newsletter.senders.domainverification.DnsRecord;
import java.util.List;

/**
 * Port for the mail provider that proves control of an address or domain. Every method is one
 * remote attempt; failures surface as {@link
 * io.b2mash.newsletter.senders.exception.ExternalServiceException} and are not retried here.
 *
 * <p>System-wide: selected via {@code senders.verification.provider}, not per-tenant.
 */
public interface VerificationProvider {

  String providerId();

  /** Provider reference recorded on senders and domain records for the given identity. */
  String identityReference(String identity);

  /** Registers the address and sends (or re-sends) the verification email. */
  void initiateMailboxVerification(String email);

  /** Registers the domain and returns the DNS records the tenant must publish. */
  List<DnsRecord> initiateDomainVerification(String domain);

  ProviderVerificationStatus pollVerificationStatus(String identity);

  /** Removes the identity. Removing an unknown identity is not an error. */
  void deleteIdentity(String identity);
}
