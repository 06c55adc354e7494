package io.b2mash.b2b.licensemanager.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA value passed to {@link AuditService#log(AuditEventRecord)}. Built by {@link
 * AuditEventBuilder}, which fills in actor and request metadata.
 *
 * @param eventType {@code {entity}.{action}}, e.g. {@code subscription_plan.updated}
 * @param entityType the kind of record affected, e.g. {@code SUBSCRIPTION_PLAN}
 * @param entityId id of the affected record
 * @param actor subject of the authenticated staff user; null for system-initiated events
 * @param actorType USER or SYSTEM
 * @param source API or INTERNAL
 * @param ipAddress client IP; null outside an HTTP request
 * @param details changed fields and change reason; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    String actor,
    String actorType,
    String source,
    String ipAddress,
    Map<String, Object> details) {}
