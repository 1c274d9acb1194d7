package io.b2mash.newsletter.senders.sender.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateSenderRequest(
    @NotBlank @Size(max = 254) String email,
    @Size(max = 100) String name,
    String verificationType,
    @Size(max = 253) String domain) {}
