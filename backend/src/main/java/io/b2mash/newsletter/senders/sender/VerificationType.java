package io.b2mash.newsletter.senders.sender;

import io.b2mash.newsletter.senders.exception.InvalidRequestException;

public enum VerificationType {
  MAILBOX("mailbox"),
  DOMAIN("domain");

  private final String wireValue;

  VerificationType(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }

  /** Parses a wire value. A missing value defaults to mailbox; unknown values are rejected. */
  public static VerificationType fromWire(String value) {
    if (value == null || value.isBlank()) {
      return MAILBOX;
    }
    for (var type : values()) {
      if (type.wireValue.equals(value)) {
        return type;
      }
    }
    throw new InvalidRequestException(
        "Invalid verification type",
        "Unsupported verificationType '" + value + "'. Expected 'mailbox' or 'domain'");
  }
}
