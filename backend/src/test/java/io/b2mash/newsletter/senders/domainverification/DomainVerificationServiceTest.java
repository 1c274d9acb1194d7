package io.b2mash.newsletter.senders.domainverification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.newsletter.senders.event.SenderEvent;
import io.b2mash.newsletter.senders.event.SenderEventPublisher;
import io.b2mash.newsletter.senders.exception.InvalidRequestException;
import io.b2mash.newsletter.senders.exception.PropagationIncompleteException;
import io.b2mash.newsletter.senders.exception.ResourceConflictException;
import io.b2mash.newsletter.senders.exception.ResourceNotFoundException;
import io.b2mash.newsletter.senders.exception.TierCapabilityException;
import io.b2mash.newsletter.senders.sender.KeyValueSenderRepository;
import io.b2mash.newsletter.senders.sender.Sender;
import io.b2mash.newsletter.senders.sender.VerificationStatus;
import io.b2mash.newsletter.senders.sender.VerificationType;
import io.b2mash.newsletter.senders.store.memory.InMemoryKeyValueStore;
import io.b2mash.newsletter.senders.testsupport.MutableClock;
import io.b2mash.newsletter.senders.testsupport.TestProperties;
import io.b2mash.newsletter.senders.tier.TierPolicy;
import io.b2mash.newsletter.senders.verification.ProviderVerificationStatus;
import io.b2mash.newsletter.senders.verification.VerificationProvider;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DomainVerificationServiceTest {

  private static final String TENANT = "tenant-1";
  private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");
  private static final List<DnsRecord> FIRST_ATTEMPT =
      List.of(new DnsRecord("t1._domainkey.example.com", "CNAME", "t1.dkim.example", "DKIM"));
  private static final List<DnsRecord> SECOND_ATTEMPT =
      List.of(new DnsRecord("t2._domainkey.example.com", "CNAME", "t2.dkim.example", "DKIM"));

  private MutableClock clock;
  private KeyValueSenderRepository senderRepository;
  private KeyValueDomainVerificationRepository domainRepository;
  private VerificationProvider provider;
  private SenderEventPublisher publisher;
  private DomainVerificationService service;

  @BeforeEach
  void setUp() {
    var store = new InMemoryKeyValueStore();
    clock = new MutableClock(START);
    senderRepository = spy(new KeyValueSenderRepository(store, clock));
    domainRepository = new KeyValueDomainVerificationRepository(store, clock);
    provider = mock(VerificationProvider.class);
    publisher = mock(SenderEventPublisher.class);
    when(provider.identityReference(anyString()))
        .thenAnswer(invocation -> TestProperties.ARN_PREFIX + invocation.getArgument(0));
    when(provider.pollVerificationStatus(anyString()))
        .thenReturn(ProviderVerificationStatus.PENDING);
    when(provider.initiateDomainVerification(anyString()))
        .thenReturn(FIRST_ATTEMPT)
        .thenReturn(SECOND_ATTEMPT);
    service =
        new DomainVerificationService(
            domainRepository,
            senderRepository,
            provider,
            publisher,
            TestProperties.senderProperties(),
            clock);
  }

  private Sender storedDomainSender(String email, boolean isDefault) {
    var sender =
        new Sender(
            TENANT, email, null, VerificationType.DOMAIN, "example.com", isDefault, START);
    return senderRepository.create(sender, senderRepository.loadLedger(TENANT));
  }

  private VerificationStatus statusOf(Sender sender) {
    return senderRepository.getById(TENANT, sender.getSenderId()).getVerificationStatus();
  }

  @Test
  void initiate_storesPendingRecordAndLinksSenders() {
    var sender = storedDomainSender("a@example.com", true);

    var record = service.initiateDomainVerification(TENANT, TierPolicy.PRO_TIER, "Example.COM");

    assertThat(record.getDomain()).isEqualTo("example.com");
    assertThat(record.getVerificationStatus()).isEqualTo(VerificationStatus.PENDING);
    assertThat(record.getDnsRecords()).isEqualTo(FIRST_ATTEMPT);
    assertThat(senderRepository.getById(TENANT, sender.getSenderId()).getIdentityReference())
        .isEqualTo(TestProperties.ARN_PREFIX + "example.com");
    verify(publisher)
        .publish(
            argThat(
                event ->
                    SenderEvent.DOMAIN_VERIFICATION_STATUS_CHANGED.equals(event.eventType())));
  }

  @Test
  void initiate_requiresDnsCapableTier() {
    assertThatThrownBy(
            () -> service.initiateDomainVerification(TENANT, TierPolicy.FREE_TIER, "example.com"))
        .isInstanceOfSatisfying(
            TierCapabilityException.class,
            e -> assertThat(e.getStatusCode().value()).isEqualTo(401));
  }

  @Test
  void initiate_rejectsMalformedDomain() {
    assertThatThrownBy(
            () -> service.initiateDomainVerification(TENANT, TierPolicy.PRO_TIER, "not a domain"))
        .isInstanceOf(InvalidRequestException.class);
  }

  @Test
  void initiate_pendingDomainReissuesRecordSet() {
    service.initiateDomainVerification(TENANT, TierPolicy.PRO_TIER, "example.com");
    clock.advance(Duration.ofHours(1));

    var record = service.initiateDomainVerification(TENANT, TierPolicy.PRO_TIER, "example.com");

    assertThat(record.getDnsRecords()).isEqualTo(SECOND_ATTEMPT);
    assertThat(record.getLastVerificationSent()).isEqualTo(START.plus(Duration.ofHours(1)));
    assertThat(domainRepository.getByDomain(TENANT, "example.com").getDnsRecords())
        .isEqualTo(SECOND_ATTEMPT);
  }

  @Test
  void initiate_verifiedDomainIsConflict() {
    service.initiateDomainVerification(TENANT, TierPolicy.PRO_TIER, "example.com");
    when(provider.pollVerificationStatus("example.com"))
        .thenReturn(ProviderVerificationStatus.SUCCESS);
    service.getDomainVerification(TENANT, "example.com");

    assertThatThrownBy(
            () -> service.initiateDomainVerification(TENANT, TierPolicy.PRO_TIER, "example.com"))
        .isInstanceOfSatisfying(
            ResourceConflictException.class,
            e ->
                assertThat(e.getBody().getDetail())
                    .isEqualTo("Domain example.com is already verified"));
  }

  @Test
  void getDomainVerification_unknownDomainIsNotFound() {
    assertThatThrownBy(() -> service.getDomainVerification(TENANT, "example.com"))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void refresh_successVerifiesRecordAndEverySender() {
    var first = storedDomainSender("a@example.com", true);
    var second = storedDomainSender("b@example.com", false);
    service.initiateDomainVerification(TENANT, TierPolicy.PRO_TIER, "example.com");
    when(provider.pollVerificationStatus("example.com"))
        .thenReturn(ProviderVerificationStatus.SUCCESS);

    var refresh = service.refresh(TENANT, "example.com");

    assertThat(refresh.statusChanged()).isTrue();
    assertThat(refresh.record().isVerified()).isTrue();
    assertThat(statusOf(first)).isEqualTo(VerificationStatus.VERIFIED);
    assertThat(statusOf(second)).isEqualTo(VerificationStatus.VERIFIED);
  }

  @Test
  void refresh_rejectionFailsSendersWithReason() {
    var sender = storedDomainSender("a@example.com", true);
    service.initiateDomainVerification(TENANT, TierPolicy.PRO_TIER, "example.com");
    when(provider.pollVerificationStatus("example.com"))
        .thenReturn(ProviderVerificationStatus.FAILED);

    service.refresh(TENANT, "example.com");

    var stored = senderRepository.getById(TENANT, sender.getSenderId());
    assertThat(stored.getVerificationStatus()).isEqualTo(VerificationStatus.FAILED);
    assertThat(stored.getFailureReason()).contains("DNS verification");
  }

  @Test
  void refresh_pendingPastTimeoutTimesOutAndRemovesIdentity() {
    var sender = storedDomainSender("a@example.com", true);
    service.initiateDomainVerification(TENANT, TierPolicy.PRO_TIER, "example.com");
    clock.advance(Duration.ofHours(24));

    var refresh = service.refresh(TENANT, "example.com");

    assertThat(refresh.record().getVerificationStatus())
        .isEqualTo(VerificationStatus.VERIFICATION_TIMED_OUT);
    assertThat(statusOf(sender)).isEqualTo(VerificationStatus.VERIFICATION_TIMED_OUT);
    verify(provider).deleteIdentity("example.com");
  }

  @Test
  void refresh_resolvedRecordIsNotPolledAgain() {
    service.initiateDomainVerification(TENANT, TierPolicy.PRO_TIER, "example.com");
    when(provider.pollVerificationStatus("example.com"))
        .thenReturn(ProviderVerificationStatus.SUCCESS);
    service.refresh(TENANT, "example.com");

    var again = service.refresh(TENANT, "example.com");

    assertThat(again.statusChanged()).isFalse();
    assertThat(again.providerStatus()).isNull();
    verify(provider, times(1)).pollVerificationStatus("example.com");
  }

  @Test
  void reissue_afterTimeoutRestartsSenders() {
    var sender = storedDomainSender("a@example.com", true);
    service.initiateDomainVerification(TENANT, TierPolicy.PRO_TIER, "example.com");
    clock.advance(Duration.ofHours(25));
    service.refresh(TENANT, "example.com");

    service.initiateDomainVerification(TENANT, TierPolicy.PRO_TIER, "example.com");

    var stored = senderRepository.getById(TENANT, sender.getSenderId());
    assertThat(stored.getVerificationStatus()).isEqualTo(VerificationStatus.PENDING);
    assertThat(stored.getFailureReason()).isNull();
    assertThat(stored.getLastVerificationSent()).isEqualTo(START.plus(Duration.ofHours(25)));
  }

  @Test
  void refresh_partialPropagationIsReportedAndCompletedOnRetry() {
    var first = storedDomainSender("a@example.com", true);
    var second = storedDomainSender("b@example.com", false);
    service.initiateDomainVerification(TENANT, TierPolicy.PRO_TIER, "example.com");
    when(provider.pollVerificationStatus("example.com"))
        .thenReturn(ProviderVerificationStatus.SUCCESS);
    doThrow(ResourceConflictException.concurrentModification("Sender"))
        .doCallRealMethod()
        .when(senderRepository)
        .update(argThat(sender -> sender != null && "b@example.com".equals(sender.getEmail())));

    assertThatThrownBy(() -> service.refresh(TENANT, "example.com"))
        .isInstanceOfSatisfying(
            PropagationIncompleteException.class,
            e -> {
              assertThat(e.getBody().getTitle()).isEqualTo("Domain status propagation incomplete");
              assertThat(e.getStatusCode().value()).isEqualTo(409);
            });
    assertThat(domainRepository.getByDomain(TENANT, "example.com").isVerified()).isTrue();
    assertThat(statusOf(first)).isEqualTo(VerificationStatus.VERIFIED);
    assertThat(statusOf(second)).isEqualTo(VerificationStatus.PENDING);

    var retry = service.getDomainVerification(TENANT, "example.com");

    assertThat(retry.isVerified()).isTrue();
    assertThat(statusOf(second)).isEqualTo(VerificationStatus.VERIFIED);
    verify(provider, times(1)).pollVerificationStatus("example.com");
  }

  @Test
  void refresh_timeoutKeepsIdentityStillUsedByAnotherTenant() {
    service.initiateDomainVerification(TENANT, TierPolicy.PRO_TIER, "example.com");
    service.initiateDomainVerification("tenant-2", TierPolicy.PRO_TIER, "example.com");
    clock.advance(Duration.ofHours(24));

    var refresh = service.refresh(TENANT, "example.com");

    assertThat(refresh.record().getVerificationStatus())
        .isEqualTo(VerificationStatus.VERIFICATION_TIMED_OUT);
    verify(provider, never()).deleteIdentity(anyString());
  }

  @Test
  void applyReportedOutcome_verifiesPendingDomainAndItsSenders() {
    var first = storedDomainSender("a@example.com", true);
    var second = storedDomainSender("b@example.com", false);
    service.initiateDomainVerification(TENANT, TierPolicy.PRO_TIER, "example.com");

    boolean changed =
        service.applyReportedOutcome(TENANT, "example.com", VerificationStatus.VERIFIED, null);

    assertThat(changed).isTrue();
    assertThat(domainRepository.getByDomain(TENANT, "example.com").isVerified()).isTrue();
    assertThat(statusOf(first)).isEqualTo(VerificationStatus.VERIFIED);
    assertThat(statusOf(second)).isEqualTo(VerificationStatus.VERIFIED);
    verify(provider, never()).pollVerificationStatus(anyString());
  }

  @Test
  void applyReportedOutcome_leavesResolvedDomainAlone() {
    service.initiateDomainVerification(TENANT, TierPolicy.PRO_TIER, "example.com");
    service.applyReportedOutcome(TENANT, "example.com", VerificationStatus.VERIFIED, null);

    boolean changed =
        service.applyReportedOutcome(
            TENANT, "example.com", VerificationStatus.FAILED, "DKIM records missing");

    assertThat(changed).isFalse();
    assertThat(domainRepository.getByDomain(TENANT, "example.com").isVerified()).isTrue();
  }
}
