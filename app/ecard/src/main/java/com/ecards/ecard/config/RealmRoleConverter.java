package com.ecards.ecard.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtGrantedAuthoritiesConverter;

// Maps realm_access.roles of the identity provider token to ROLE_* authorities, keeping scopes.
public class RealmRoleConverter implements Converter<Jwt, Collection<GrantedAuthority>> {

  private static final String REALM_ACCESS_CLAIM = "realm_access";
  private static final String ROLES_KEY = "roles";
  private static final String ROLE_PREFIX = "ROLE_";

  private final JwtGrantedAuthoritiesConverter scopeConverter = new JwtGrantedAuthoritiesConverter();

  @Override
  public Collection<GrantedAuthority> convert(Jwt jwt) {
    final List<GrantedAuthority> authorities = new ArrayList<>(scopeConverter.convert(jwt));
    final Object realmAccess = jwt.getClaims().get(REALM_ACCESS_CLAIM);
    if (!(realmAccess instanceof Map<?, ?> realmAccessMap)) {
      return authorities;
    }
    if (!(realmAccessMap.get(ROLES_KEY) instanceof Collection<?> roles)) {
      return authorities;
    }
    for (Object role : roles) {
      if (role instanceof String value && !value.isBlank()) {
        authorities.add(new SimpleGrantedAuthority(ROLE_PREFIX + value));
      }
    }
    return authorities;
  }
}
