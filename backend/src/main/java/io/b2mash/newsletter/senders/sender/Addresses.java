package io.b2mash.newsletter.senders.sender;

import io.b2mash.newsletter.senders.exception.InvalidRequestException;
import java.util.Locale;
import java.util.regex.Pattern;

/** Validation and normalization of sender email addresses and domains. */
public final class Addresses {

  private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

  private static final Pattern DOMAIN =
      Pattern.compile(
          "^(?=.{1,253}$)([a-z0-9](?:[a-z0-9-]{0,61}[a-z0-9])?\\.)+[a-z][a-z0-9-]{0,62}$");

  private Addresses() {}

  /** Trims and validates an email address. The local part keeps its case. */
  public static String requireEmail(String email) {
    String trimmed = email != null ? email.trim() : "";
    if (!EMAIL.matcher(trimmed).matches() || trimmed.length() > 254) {
      throw new InvalidRequestException("Invalid email", "Invalid email address format");
    }
    int at = trimmed.lastIndexOf('@');
    return trimmed.substring(0, at + 1) + trimmed.substring(at + 1).toLowerCase(Locale.ROOT);
  }

  /** Lower-cases and validates a DNS domain name. */
  public static String requireDomain(String domain) {
    String normalized = domain != null ? domain.trim().toLowerCase(Locale.ROOT) : "";
    if (normalized.endsWith(".")) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }
    if (!DOMAIN.matcher(normalized).matches()) {
      throw new InvalidRequestException("Invalid domain", "Invalid domain name: " + domain);
    }
    return normalized;
  }

  /** Domain part of an already validated email address. */
  public static String domainOf(String email) {
    return email.substring(email.lastIndexOf('@') + 1).toLowerCase(Locale.ROOT);
  }
}
