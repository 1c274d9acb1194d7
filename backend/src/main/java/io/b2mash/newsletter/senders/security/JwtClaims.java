package io.b2mash.newsletter.senders.security;

import io.b2mash.newsletter.senders.tier.TierPolicy;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Reads tenant claims from identity-provider tokens. Custom attributes arrive as {@code
 * custom:tenant_id} and {@code custom:tier}; plain {@code tenantId} and {@code tier} are accepted
 * as fallbacks.
 */
public final class JwtClaims {

  /** Extracts the tenant id, or {@code null} when the user has no tenant yet. */
  public static String extractTenantId(Jwt jwt) {
    return firstPresent(jwt, "custom:tenant_id", "tenantId");
  }

  /** Extracts the subscription tier, defaulting to {@code free-tier}. */
  public static String extractTier(Jwt jwt) {
    String tier = firstPresent(jwt, "custom:tier", "tier");
    return tier != null ? tier : TierPolicy.FREE_TIER;
  }

  private static String firstPresent(Jwt jwt, String... claims) {
    for (String claim : claims) {
      Object value = jwt.getClaim(claim);
      if (value instanceof String str && !str.isBlank()) {
        return str;
      }
    }
    return null;
  }

  private JwtClaims() {}
}
