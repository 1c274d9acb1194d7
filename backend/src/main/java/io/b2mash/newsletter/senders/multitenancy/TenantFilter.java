package io.b2mash.newsletter.senders.multitenancy;

import io.b2mash.newsletter.senders.security.JwtClaims;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/** Binds the {@link UserContext} of an authenticated request from its JWT claims. */
@Component
public class TenantFilter extends OncePerRequestFilter {

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

    if (authentication instanceof JwtAuthenticationToken jwtAuth) {
      Jwt jwt = jwtAuth.getToken();
      String tenantId = JwtClaims.extractTenantId(jwt);

      if (tenantId != null) {
        RequestScopes.bind(new UserContext(tenantId, jwt.getSubject(), JwtClaims.extractTier(jwt)));
        try {
          filterChain.doFilter(request, response);
        } finally {
          RequestScopes.clear();
        }
        return;
      }
    }

    // No JWT or no tenant claim: continue unbound, handlers reject tenant-less callers
    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return request.getRequestURI().startsWith("/actuator/");
  }
}
