package io.b2mash.newsletter.senders.domainverification;

import java.util.List;
import java.util.Optional;

public interface DomainVerificationRepository {

  /**
   * Creates or replaces the record in one conditional write. A record read from the store is
   * replaced only if unchanged since the read; a new record only if none exists.
   */
  DomainVerificationRecord upsert(DomainVerificationRecord record);

  Optional<DomainVerificationRecord> findByDomain(String tenantId, String domain);

  /**
   * @throws io.b2mash.newsletter.senders.exception.ResourceNotFoundException if absent
   */
  DomainVerificationRecord getByDomain(String tenantId, String domain);

  /** Records of every tenant for {@code domain}, read from an eventually consistent index. */
  List<DomainVerificationRecord> findAllByDomain(String domain);

  /** Records of every tenant whose attempt is pending, read from the same kind of index. */
  List<DomainVerificationRecord> listPendingVerification();

  void delete(String tenantId, String domain);
}
