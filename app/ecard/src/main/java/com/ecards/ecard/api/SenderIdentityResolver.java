package com.ecards.ecard.api;

import com.ecards.ecard.model.SenderIdentity;
import com.ecards.ecard.service.InvalidCardRequestException;
import java.util.Locale;
import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

// Normalizes the bearer token principal into the sender identity used by card operations.
@Component
public class SenderIdentityResolver {

  public SenderIdentity resolve(Authentication authentication) {
    if (!(authentication instanceof JwtAuthenticationToken jwtAuth)) {
      throw new IllegalArgumentException("authentication must be JwtAuthenticationToken");
    }
    final Jwt jwt = jwtAuth.getToken();
    final String email =
        firstNonBlank(jwt.getClaimAsString("email"), jwt.getClaimAsString("preferred_username"));
    if (email == null) {
      throw new InvalidCardRequestException("token carries no email claim");
    }
    final String normalizedEmail = email.trim().toLowerCase(Locale.ROOT);
    final String name = firstNonBlank(jwt.getClaimAsString("name"), normalizedEmail);
    return new SenderIdentity(normalizedEmail, name.trim());
  }

  private String firstNonBlank(String first, String second) {
    if (first != null && !first.isBlank()) {
      return first;
    }
    if (second != null && !second.isBlank()) {
      return second;
    }
    return null;
  }
}
