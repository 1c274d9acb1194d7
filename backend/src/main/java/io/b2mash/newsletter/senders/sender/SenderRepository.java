package io.b2mash.newsletter.senders.sender;

import java.util.List;

/**
 * Tenant-scoped persistence of senders. Membership changes (create, delete, default swap) are
 * committed together with the tenant's {@link SenderLedger} so they either all apply or none do.
 */
public interface SenderRepository {

  /**
   * Persists a new sender and advances the ledger observed by the caller.
   *
   * @throws io.b2mash.newsletter.senders.exception.ResourceConflictException if the sender key or
   *     its email already exists, or the ledger changed since it was read
   */
  Sender create(Sender sender, SenderLedger observedLedger);

  /**
   * @throws io.b2mash.newsletter.senders.exception.ResourceNotFoundException if the tenant owns no
   *     sender with that id
   */
  Sender getById(String tenantId, String senderId);

  /** All senders of the tenant, in no particular order. */
  List<Sender> listByTenant(String tenantId);

  /**
   * Mailbox senders of every tenant registered for {@code email}. Read from an eventually
   * consistent index; re-read a sender by id before changing it.
   */
  List<Sender> findMailboxSendersByEmail(String email);

  /** Senders of every tenant whose verification attempt is pending, from the same kind of index. */
  List<Sender> listPendingVerification();

  /** Writes an existing sender, conditioned on the version it was read at. */
  Sender update(Sender sender);

  /**
   * Removes a sender, promoting {@code promotedDefault} (may be {@code null}) in the same
   * operation.
   */
  void delete(Sender sender, Sender promotedDefault, SenderLedger observedLedger);

  /**
   * Makes {@code newDefault} the tenant's default sender and clears the flag on {@code
   * previousDefault} (may be {@code null}) in the same operation.
   */
  void changeDefault(Sender newDefault, Sender previousDefault, SenderLedger observedLedger);

  /** Reads the tenant ledger, deriving it from the sender list when none was written yet. */
  SenderLedger loadLedger(String tenantId);

  boolean isEmailConfigured(String tenantId, String email);
}
