package io.b2mash.b2b.licensemanager.security;

/**
 * Role constants shared by authentication and {@code @PreAuthorize} checks.
 *
 * <p>Staff roles arrive in the JWT {@code roles} claim. Spring authorities are the {@code ROLE_}
 * prefixed versions.
 */
public final class Roles {

  public static final String ROLES_CLAIM = "roles";

  // JWT "roles" claim values
  public static final String LICENSE_ADMIN = "license_admin";
  public static final String LICENSE_VIEWER = "license_viewer";

  // Spring Security granted authorities
  public static final String AUTHORITY_LICENSE_ADMIN = "ROLE_LICENSE_ADMIN";
  public static final String AUTHORITY_LICENSE_VIEWER = "ROLE_LICENSE_VIEWER";

  private Roles() {}
}
