package io.b2mash.b2b.licensemanager.audit;

import java.util.UUID;

/**
 * Optional filters for {@link AuditService#findEvents}. Null means no filter on that field.
 *
 * @param entityType e.g. {@code SUBSCRIPTION_PLAN}
 * @param entityId a specific record
 * @param eventType event type prefix, e.g. {@code renewal.} matches renewal.created and
 *     renewal.updated
 */
public record AuditEventFilter(String entityType, UUID entityId, String eventType) {}
