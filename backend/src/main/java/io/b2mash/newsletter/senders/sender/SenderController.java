package io.b2mash.newsletter.senders.sender;

import io.b2mash.newsletter.senders.multitenancy.RequestScopes;
import io.b2mash.newsletter.senders.sender.dto.CreateSenderRequest;
import io.b2mash.newsletter.senders.sender.dto.SenderListResponse;
import io.b2mash.newsletter.senders.sender.dto.SenderResponse;
import io.b2mash.newsletter.senders.sender.dto.SenderStatusResponse;
import io.b2mash.newsletter.senders.sender.dto.UpdateSenderRequest;
import jakarta.validation.Valid;
import java.net.URI;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/senders")
public class SenderController {

  private final SenderService senderService;

  public SenderController(SenderService senderService) {
    this.senderService = senderService;
  }

  @GetMapping
  public ResponseEntity<SenderListResponse> listSenders() {
    var context = RequestScopes.requireUserContext();
    return ResponseEntity.ok(
        SenderListResponse.from(senderService.listSenders(context.tenantId(), context.tier())));
  }

  @PostMapping
  public ResponseEntity<SenderResponse> createSender(
      @Valid @RequestBody CreateSenderRequest request) {
    var context = RequestScopes.requireUserContext();
    var sender =
        senderService.createSender(
            context.tenantId(),
            context.tier(),
            request.email(),
            request.name(),
            request.verificationType(),
            request.domain());
    return ResponseEntity.created(URI.create("/api/senders/" + sender.getSenderId()))
        .body(SenderResponse.from(sender));
  }

  @GetMapping("/{senderId}")
  public ResponseEntity<SenderResponse> getSender(@PathVariable String senderId) {
    var context = RequestScopes.requireUserContext();
    return ResponseEntity.ok(
        SenderResponse.from(senderService.getSender(context.tenantId(), senderId)));
  }

  @PutMapping("/{senderId}")
  public ResponseEntity<SenderResponse> updateSender(
      @PathVariable String senderId, @Valid @RequestBody UpdateSenderRequest request) {
    var context = RequestScopes.requireUserContext();
    var sender =
        senderService.updateSender(
            context.tenantId(),
            senderId,
            request.name(),
            request.isDefault(),
            request.email(),
            request.verificationType(),
            request.domain());
    return ResponseEntity.ok(SenderResponse.from(sender));
  }

  @DeleteMapping("/{senderId}")
  public ResponseEntity<Void> deleteSender(@PathVariable String senderId) {
    var context = RequestScopes.requireUserContext();
    senderService.deleteSender(context.tenantId(), senderId);
    return ResponseEntity.noContent().build();
  }

  @PutMapping("/{senderId}/status")
  public ResponseEntity<SenderStatusResponse> refreshStatus(@PathVariable String senderId) {
    var context = RequestScopes.requireUserContext();
    return ResponseEntity.ok(
        SenderStatusResponse.from(senderService.refreshStatus(context.tenantId(), senderId)));
  }

  @PostMapping("/{senderId}/verification")
  public ResponseEntity<SenderResponse> resendVerification(@PathVariable String senderId) {
    var context = RequestScopes.requireUserContext();
    return ResponseEntity.ok(
        SenderResponse.from(senderService.resendVerification(context.tenantId(), senderId)));
  }
}
