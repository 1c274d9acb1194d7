package io.b2mash.newsletter.senders.sender.dto;

import jakarta.validation.constraints.Size;

/**
 * Only {@code name} and {@code isDefault} are mutable. The identity fields are accepted so that an
 * attempt to change them is rejected explicitly instead of being ignored.
 */
public record UpdateSenderRequest(
    @Size(max = 100) String name,
    Boolean isDefault,
    String email,
    String verificationType,
    String domain) {}
