package io.b2mash.newsletter.senders.sender;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.newsletter.senders.exception.ResourceConflictException;
import io.b2mash.newsletter.senders.exception.ResourceNotFoundException;
import io.b2mash.newsletter.senders.store.KeyPatterns;
import io.b2mash.newsletter.senders.store.WriteCondition;
import io.b2mash.newsletter.senders.store.memory.InMemoryKeyValueStore;
import io.b2mash.newsletter.senders.testsupport.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class KeyValueSenderRepositoryTest {

  private static final String TENANT = "tenant-1";
  private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

  private InMemoryKeyValueStore store;
  private MutableClock clock;
  private KeyValueSenderRepository repository;

  @BeforeEach
  void setUp() {
    store = new InMemoryKeyValueStore();
    clock = new MutableClock(START);
    repository = new KeyValueSenderRepository(store, clock);
  }

  private Sender mailbox(String email, boolean isDefault) {
    return new Sender(
        TENANT, email, null, VerificationType.MAILBOX, null, isDefault, clock.instant());
  }

  private Sender created(String email, boolean isDefault) {
    return repository.create(mailbox(email, isDefault), repository.loadLedger(TENANT));
  }

  @Test
  void create_persistsSenderEmailClaimAndLedger() {
    var sender = created("news@example.com", true);

    var stored = repository.getById(TENANT, sender.getSenderId());
    assertThat(stored.getEmail()).isEqualTo("news@example.com");
    assertThat(stored.getVersion()).isEqualTo(1);
    assertThat(stored.isDefault()).isTrue();
    assertThat(repository.isEmailConfigured(TENANT, "NEWS@example.com")).isTrue();

    var ledger = repository.loadLedger(TENANT);
    assertThat(ledger.senderCount()).isEqualTo(1);
    assertThat(ledger.defaultSenderId()).isEqualTo(sender.getSenderId());
    assertThat(ledger.persisted()).isTrue();
    assertThat(ledger.version()).isEqualTo(1);
  }

  @Test
  void create_withStaleLedgerIsRejected() {
    var observed = repository.loadLedger(TENANT);
    repository.create(mailbox("first@example.com", true), observed);

    var second = mailbox("second@example.com", true);
    assertThatThrownBy(() -> repository.create(second, observed))
        .isInstanceOfSatisfying(
            ResourceConflictException.class,
            e -> assertThat(e.getStatusCode().value()).isEqualTo(409));

    assertThat(repository.listByTenant(TENANT)).hasSize(1);
    assertThat(repository.isEmailConfigured(TENANT, "second@example.com")).isFalse();
  }

  @Test
  void create_duplicateEmailIsRejected() {
    created("news@example.com", true);

    assertThatThrownBy(() -> created("news@example.com", false))
        .isInstanceOf(ResourceConflictException.class);
    assertThat(repository.loadLedger(TENANT).senderCount()).isEqualTo(1);
  }

  @Test
  void getById_otherTenantIsNotFound() {
    var sender = created("news@example.com", true);

    assertThatThrownBy(() -> repository.getById("tenant-2", sender.getSenderId()))
        .isInstanceOfSatisfying(
            ResourceNotFoundException.class,
            e -> assertThat(e.getStatusCode().value()).isEqualTo(404));
  }

  @Test
  void update_bumpsVersionAndTimestamp() {
    var sender = created("news@example.com", true);
    clock.advance(Duration.ofMinutes(1));

    sender.rename("Weekly");
    repository.update(sender);

    var stored = repository.getById(TENANT, sender.getSenderId());
    assertThat(stored.getName()).isEqualTo("Weekly");
    assertThat(stored.getVersion()).isEqualTo(2);
    assertThat(stored.getUpdatedAt()).isEqualTo(START.plus(Duration.ofMinutes(1)));
    assertThat(stored.getCreatedAt()).isEqualTo(START);
  }

  @Test
  void update_fromStaleReadIsRejected() {
    var sender = created("news@example.com", true);
    var first = repository.getById(TENANT, sender.getSenderId());
    var second = repository.getById(TENANT, sender.getSenderId());

    first.rename("First");
    repository.update(first);
    second.rename("Second");

    assertThatThrownBy(() -> repository.update(second))
        .isInstanceOf(ResourceConflictException.class);
    assertThat(repository.getById(TENANT, sender.getSenderId()).getName()).isEqualTo("First");
  }

  @Test
  void delete_promotesReplacementAndReleasesEmail() {
    var first = created("first@example.com", true);
    var second = created("second@example.com", false);

    repository.delete(first, second, repository.loadLedger(TENANT));

    assertThat(repository.listByTenant(TENANT))
        .singleElement()
        .satisfies(
            remaining -> {
              assertThat(remaining.getSenderId()).isEqualTo(second.getSenderId());
              assertThat(remaining.isDefault()).isTrue();
            });
    var ledger = repository.loadLedger(TENANT);
    assertThat(ledger.senderCount()).isEqualTo(1);
    assertThat(ledger.defaultSenderId()).isEqualTo(second.getSenderId());
    assertThat(repository.isEmailConfigured(TENANT, "first@example.com")).isFalse();
  }

  @Test
  void delete_lastSenderClearsDefault() {
    var only = created("only@example.com", true);

    repository.delete(only, null, repository.loadLedger(TENANT));

    assertThat(repository.listByTenant(TENANT)).isEmpty();
    var ledger = repository.loadLedger(TENANT);
    assertThat(ledger.senderCount()).isZero();
    assertThat(ledger.defaultSenderId()).isNull();
  }

  @Test
  void changeDefault_swapsFlagsTogether() {
    var first = created("first@example.com", true);
    var second = created("second@example.com", false);

    repository.changeDefault(second, first, repository.loadLedger(TENANT));

    assertThat(repository.getById(TENANT, first.getSenderId()).isDefault()).isFalse();
    assertThat(repository.getById(TENANT, second.getSenderId()).isDefault()).isTrue();
    assertThat(repository.loadLedger(TENANT).defaultSenderId()).isEqualTo(second.getSenderId());
  }

  @Test
  void loadLedger_derivesFromSendersWhenNoLedgerWasWritten() {
    var first = mailbox("first@example.com", true);
    var second = mailbox("second@example.com", false);
    for (var sender : new Sender[] {first, second}) {
      store.putItem(
          KeyPatterns.sender(TENANT, sender.getSenderId()),
          SenderItemMapper.toAttributes(sender, START, 1),
          WriteCondition.none());
    }

    var ledger = repository.loadLedger(TENANT);

    assertThat(ledger.senderCount()).isEqualTo(2);
    assertThat(ledger.defaultSenderId()).isEqualTo(first.getSenderId());
    assertThat(ledger.persisted()).isFalse();
  }

  @Test
  void listByTenant_skipsUndecodableItems() {
    var sender = created("news@example.com", true);
    store.putItem(
        KeyPatterns.sender(TENANT, "broken"),
        Map.of(
            "itemType",
            "sender",
            KeyPatterns.INDEX_PARTITION_KEY,
            KeyPatterns.senderIndexPartition(TENANT),
            "verificationStatus",
            "unknown"),
        WriteCondition.none());

    assertThat(repository.listByTenant(TENANT))
        .extracting(Sender::getSenderId)
        .containsExactly(sender.getSenderId());
  }

  @Test
  void findMailboxSendersByEmail_spansTenants() {
    var own = created("news@example.com", true);
    var other =
        repository.create(
            new Sender(
                "tenant-2",
                "news@example.com",
                null,
                VerificationType.MAILBOX,
                null,
                true,
                clock.instant()),
            repository.loadLedger("tenant-2"));
    created("other@example.com", false);

    assertThat(repository.findMailboxSendersByEmail("NEWS@example.com"))
        .extracting(Sender::getSenderId)
        .containsExactlyInAnyOrder(own.getSenderId(), other.getSenderId());
  }

  @Test
  void listPendingVerification_dropsSendersOnceResolved() {
    var verified = created("verified@example.com", true);
    var pending = created("pending@example.com", false);
    verified.applyStatus(VerificationStatus.VERIFIED, null, clock.instant());
    repository.update(verified);

    assertThat(repository.listPendingVerification())
        .extracting(Sender::getSenderId)
        .containsExactly(pending.getSenderId());
  }
}
