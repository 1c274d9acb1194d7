package io.b2mash.newsletter.senders.domainverification.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record InitiateDomainVerificationRequest(@NotBlank @Size(max = 253) String domain) {}
