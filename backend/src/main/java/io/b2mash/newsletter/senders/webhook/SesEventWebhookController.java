package io.b2mash.newsletter.senders.webhook;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives mail provider identity events forwarded by an EventBridge API destination. No JWT is
 * required; the shared secret header is checked instead.
 */
@RestController
@RequestMapping("/api/webhooks/ses")
public class SesEventWebhookController {

  private static final Logger log = LoggerFactory.getLogger(SesEventWebhookController.class);

  private final SesEventWebhookService webhookService;

  public SesEventWebhookController(SesEventWebhookService webhookService) {
    this.webhookService = webhookService;
  }

  @PostMapping
  public ResponseEntity<Map<String, String>> handleIdentityEvent(
      @RequestBody String payload,
      @RequestHeader(value = "X-Webhook-Secret", required = false) String secret) {
    try {
      webhookService.processWebhook(payload, secret);
      return ResponseEntity.ok(Map.of("message", "Event processed"));
    } catch (WebhookAuthenticationException e) {
      log.warn("Identity webhook rejected: {}", e.getMessage());
      return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("message", e.getMessage()));
    } catch (WebhookPayloadException e) {
      log.warn("Identity webhook payload unreadable: {}", e.getMessage());
      return ResponseEntity.badRequest().body(Map.of("message", e.getMessage()));
    }
  }
}
