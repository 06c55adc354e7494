package io.b2mash.b2b.licensemanager.audit;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builds an {@link AuditEventRecord}. Actor, source and IP address are taken from the current
 * security and request context unless set explicitly.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("product.created")
 *     .entityType("PRODUCT")
 *     .entityId(product.getId())
 *     .details(Map.of("name", product.getName()))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private String eventType;
  private String entityType;
  private UUID entityId;
  private String actor;
  private boolean actorExplicitlySet;
  private Map<String, Object> details;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder actor(String actor) {
    this.actor = actor;
    this.actorExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  /**
   * Builds the record. When not set explicitly, {@code actor} is the name of the authenticated
   * principal (the JWT subject); {@code actorType} is USER when there is one, SYSTEM otherwise;
   * {@code source} is API inside an HTTP request and INTERNAL outside.
   */
  public AuditEventRecord build() {
    if (eventType == null || entityType == null || entityId == null) {
      throw new IllegalStateException("eventType, entityType and entityId are required");
    }
    String resolvedActor = actorExplicitlySet ? actor : resolveAuthenticatedActor();
    String actorType = resolvedActor != null ? "USER" : "SYSTEM";

    HttpServletRequest request = resolveHttpRequest();
    String source = request != null ? "API" : "INTERNAL";
    String ipAddress = request != null ? request.getRemoteAddr() : null;

    return new AuditEventRecord(
        eventType, entityType, entityId, resolvedActor, actorType, source, ipAddress, details);
  }

  private static String resolveAuthenticatedActor() {
    var authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication == null
        || !authentication.isAuthenticated()
        || authentication instanceof AnonymousAuthenticationToken) {
      return null;
    }
    return authentication.getName();
  }

  private static HttpServletRequest resolveHttpRequest() {
    var attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletAttrs) {
      return servletAttrs.getRequest();
    }
    return null;
  }
}
