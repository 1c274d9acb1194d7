package io.b2mash.newsletter.senders.webhook;

import io.b2mash.newsletter.senders.domainverification.DomainVerificationRepository;
import io.b2mash.newsletter.senders.domainverification.DomainVerificationService;
import io.b2mash.newsletter.senders.exception.ExternalServiceException;
import io.b2mash.newsletter.senders.exception.ResourceConflictException;
import io.b2mash.newsletter.senders.exception.ResourceNotFoundException;
import io.b2mash.newsletter.senders.multitenancy.TenantMdc;
import io.b2mash.newsletter.senders.sender.SenderRepository;
import io.b2mash.newsletter.senders.sender.SenderService;
import io.b2mash.newsletter.senders.sender.VerificationStatus;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Applies identity verification outcomes that the mail provider reports through EventBridge.
 * Mailbox identities settle the matching mailbox senders of every tenant; domain identities settle
 * the domain record of every tenant and propagate to its senders.
 */
@Service
public class SesEventWebhookService {

  private static final Logger log = LoggerFactory.getLogger(SesEventWebhookService.class);

  static final String IDENTITY_VERIFICATION_SUCCESS = "identityVerificationSuccess";
  static final String IDENTITY_VERIFICATION_FAILURE = "identityVerificationFailure";
  static final String DOMAIN_VERIFICATION = "domainVerification";

  private final SenderRepository senderRepository;
  private final DomainVerificationRepository domainRepository;
  private final SenderService senderService;
  private final DomainVerificationService domainVerificationService;
  private final ObjectMapper objectMapper;
  private final String webhookSecret;

  public SesEventWebhookService(
      SenderRepository senderRepository,
      DomainVerificationRepository domainRepository,
      SenderService senderService,
      DomainVerificationService domainVerificationService,
      ObjectMapper objectMapper,
      @Value("${senders.webhook.ses-secret:}") String webhookSecret) {
    this.senderRepository = senderRepository;
    this.domainRepository = domainRepository;
    this.senderService = senderService;
    this.domainVerificationService = domainVerificationService;
    this.objectMapper = objectMapper;
    this.webhookSecret = webhookSecret;
  }

  /**
   * Verifies the shared secret and applies every identity event in the payload. Events of other
   * types are skipped.
   *
   * @throws WebhookAuthenticationException if the secret is missing, wrong or not configured
   * @throws WebhookPayloadException if the payload is not JSON
   * @throws ResourceConflictException if some outcomes could not be stored; redelivery completes
   *     them
   */
  public void processWebhook(String payload, String secret) {
    verifySecret(secret);

    int failed = 0;
    for (var event : parseEvents(payload)) {
      failed += apply(event);
    }
    if (failed > 0) {
      throw new ResourceConflictException(
          "Identity event partially applied",
          failed + " verification updates could not be stored. Redeliver the event to complete.");
    }
  }

  private void verifySecret(String secret) {
    if (webhookSecret == null || webhookSecret.isBlank()) {
      throw new WebhookAuthenticationException("Webhook secret is not configured");
    }
    if (secret == null
        || !MessageDigest.isEqual(
            webhookSecret.getBytes(StandardCharsets.UTF_8),
            secret.getBytes(StandardCharsets.UTF_8))) {
      throw new WebhookAuthenticationException("Invalid webhook secret");
    }
  }

  private List<IdentityEvent> parseEvents(String payload) {
    Map<String, Object> body;
    try {
      body = objectMapper.readValue(payload, new TypeReference<Map<String, Object>>() {});
    } catch (JacksonException e) {
      throw new WebhookPayloadException("Webhook payload is not a JSON object", e);
    }
    if (body == null) {
      throw new WebhookPayloadException("Webhook payload is empty");
    }

    List<?> records = body.get("Records") instanceof List<?> list ? list : List.of(body);
    var events = new ArrayList<IdentityEvent>();
    for (Object record : records) {
      var event = IdentityEvent.from(record);
      if (event == null) {
        log.warn("Skipping webhook record without identity detail");
      } else {
        events.add(event);
      }
    }
    return events;
  }

  private int apply(IdentityEvent event) {
    if (event.identity().contains("@")) {
      var outcome = mailboxOutcome(event);
      if (outcome == null) {
        log.debug("Unhandled identity event: type={}", event.eventType());
        return 0;
      }
      return applyToMailboxSenders(event.identity(), outcome);
    }
    var outcome = domainOutcome(event);
    if (outcome == null) {
      log.debug("Unhandled identity event: type={}", event.eventType());
      return 0;
    }
    return applyToDomainRecords(event.identity(), outcome);
  }

  private int applyToMailboxSenders(String email, Outcome outcome) {
    int failed = 0;
    for (var sender : senderRepository.findMailboxSendersByEmail(email)) {
      try {
        boolean changed =
            TenantMdc.call(
                sender.getTenantId(),
                () ->
                    senderService.applyReportedOutcome(
                        sender.getTenantId(),
                        sender.getSenderId(),
                        outcome.status(),
                        outcome.reason()));
        if (changed) {
          log.info(
              "Reported outcome applied: tenantId={}, senderId={}, status={}",
              sender.getTenantId(),
              sender.getSenderId(),
              outcome.status().wireValue());
        }
      } catch (ResourceNotFoundException e) {
        log.debug("Sender removed before outcome applied: senderId={}", sender.getSenderId());
      } catch (ResourceConflictException | ExternalServiceException e) {
        failed++;
        log.warn(
            "Reported outcome not stored: tenantId={}, senderId={}",
            sender.getTenantId(),
            sender.getSenderId(),
            e);
      }
    }
    return failed;
  }

  private int applyToDomainRecords(String domain, Outcome outcome) {
    int failed = 0;
    for (var record : domainRepository.findAllByDomain(domain)) {
      try {
        boolean changed =
            TenantMdc.call(
                record.getTenantId(),
                () ->
                    domainVerificationService.applyReportedOutcome(
                        record.getTenantId(),
                        record.getDomain(),
                        outcome.status(),
                        outcome.reason()));
        if (changed) {
          log.info(
              "Reported domain outcome applied: tenantId={}, domain={}, status={}",
              record.getTenantId(),
              record.getDomain(),
              outcome.status().wireValue());
        }
      } catch (ResourceNotFoundException e) {
        log.debug("Domain record removed before outcome applied: domain={}", record.getDomain());
      } catch (ResourceConflictException | ExternalServiceException e) {
        failed++;
        log.warn(
            "Reported domain outcome not stored: tenantId={}, domain={}",
            record.getTenantId(),
            record.getDomain(),
            e);
      }
    }
    return failed;
  }

  private static Outcome mailboxOutcome(IdentityEvent event) {
    return switch (event.eventType()) {
      case IDENTITY_VERIFICATION_SUCCESS -> new Outcome(VerificationStatus.VERIFIED, null);
      case IDENTITY_VERIFICATION_FAILURE ->
          new Outcome(VerificationStatus.FAILED, event.reasonOr("Email verification failed"));
      default -> null;
    };
  }

  private static Outcome domainOutcome(IdentityEvent event) {
    String failure = event.reasonOr("Domain verification failed");
    return switch (event.eventType()) {
      case IDENTITY_VERIFICATION_SUCCESS -> new Outcome(VerificationStatus.VERIFIED, null);
      case IDENTITY_VERIFICATION_FAILURE -> new Outcome(VerificationStatus.FAILED, failure);
      case DOMAIN_VERIFICATION -> {
        if ("success".equalsIgnoreCase(event.status())) {
          yield new Outcome(VerificationStatus.VERIFIED, null);
        }
        if ("failure".equalsIgnoreCase(event.status())) {
          yield new Outcome(VerificationStatus.FAILED, failure);
        }
        yield null;
      }
      default -> null;
    };
  }

  private record Outcome(VerificationStatus status, String reason) {}

  /** The {@code detail} of one provider identity event. */
  private record IdentityEvent(String eventType, String identity, String status, String reason) {

    static IdentityEvent from(Object record) {
      if (!(record instanceof Map<?, ?> event)
          || !(event.get("detail") instanceof Map<?, ?> detail)) {
        return null;
      }
      String eventType = text(detail.get("event-type"));
      String identity = text(detail.get("identity"));
      if (eventType == null || identity == null || identity.isBlank()) {
        return null;
      }
      return new IdentityEvent(
          eventType, identity.trim(), text(detail.get("status")), text(detail.get("reason")));
    }

    String reasonOr(String fallback) {
      return reason == null || reason.isBlank() ? fallback : reason;
    }

    private static String text(Object value) {
      return value == null ? null : value.toString();
    }
  }
}
