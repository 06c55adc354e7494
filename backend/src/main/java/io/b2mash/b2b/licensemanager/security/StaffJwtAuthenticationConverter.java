package io.b2mash.b2b.licensemanager.security;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/** Maps the staff roles of a bearer token to Spring authorities. Unknown roles are ignored. */
@Component
public class StaffJwtAuthenticationConverter
    implements Converter<Jwt, AbstractAuthenticationToken> {

  private static final Map<String, String> ROLE_MAPPING =
      Map.of(
          Roles.LICENSE_ADMIN, Roles.AUTHORITY_LICENSE_ADMIN,
          Roles.LICENSE_VIEWER, Roles.AUTHORITY_LICENSE_VIEWER);

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    return new JwtAuthenticationToken(jwt, extractAuthorities(jwt), jwt.getSubject());
  }

  private Collection<GrantedAuthority> extractAuthorities(Jwt jwt) {
    List<String> roles = jwt.getClaimAsStringList(Roles.ROLES_CLAIM);
    if (roles == null) {
      return List.of();
    }
    return roles.stream()
        .map(ROLE_MAPPING::get)
        .filter(Objects::nonNull)
        .distinct()
        .<GrantedAuthority>map(SimpleGrantedAuthority::new)
        .toList();
  }
}
