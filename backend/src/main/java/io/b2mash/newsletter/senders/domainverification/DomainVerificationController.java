package io.b2mash.newsletter.senders.domainverification;

import io.b2mash.newsletter.senders.domainverification.dto.DomainVerificationResponse;
import io.b2mash.newsletter.senders.domainverification.dto.InitiateDomainVerificationRequest;
import io.b2mash.newsletter.senders.multitenancy.RequestScopes;
import jakarta.validation.Valid;
import java.net.URI;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/senders/domain")
public class DomainVerificationController {

  private final DomainVerificationService domainVerificationService;

  public DomainVerificationController(DomainVerificationService domainVerificationService) {
    this.domainVerificationService = domainVerificationService;
  }

  @PostMapping
  public ResponseEntity<DomainVerificationResponse> initiateDomainVerification(
      @Valid @RequestBody InitiateDomainVerificationRequest request) {
    var context = RequestScopes.requireUserContext();
    var record =
        domainVerificationService.initiateDomainVerification(
            context.tenantId(), context.tier(), request.domain());
    return ResponseEntity.created(URI.create("/api/senders/domain/" + record.getDomain()))
        .body(DomainVerificationResponse.from(record));
  }

  @GetMapping("/{domain}")
  public ResponseEntity<DomainVerificationResponse> getDomainVerification(
      @PathVariable String domain) {
    var context = RequestScopes.requireUserContext();
    return ResponseEntity.ok(
        DomainVerificationResponse.from(
            domainVerificationService.getDomainVerification(context.tenantId(), domain)));
  }
}
