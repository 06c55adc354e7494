package io.b2mash.b2b.licensemanager.audit;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/audit-events")
public class AuditEventController {

  private static final int MAX_PAGE_SIZE = 200;

  private final AuditService auditService;

  public AuditEventController(AuditService auditService) {
    this.auditService = auditService;
  }

  @GetMapping
  @PreAuthorize("hasAnyRole('LICENSE_ADMIN', 'LICENSE_VIEWER')")
  public ResponseEntity<List<AuditEventResponse>> listAuditEvents(
      @RequestParam(required = false) String entityType,
      @RequestParam(required = false) UUID entityId,
      @RequestParam(required = false) String eventType,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "50") int size) {
    var filter = new AuditEventFilter(entityType, entityId, eventType);
    var pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE));
    var events = auditService.findEvents(filter, pageable);
    return ResponseEntity.ok(events.stream().map(AuditEventResponse::from).toList());
  }

  public record AuditEventResponse(
      UUID id,
      String eventType,
      String entityType,
      UUID entityId,
      String actor,
      String actorType,
      String source,
      Map<String, Object> details,
      Instant occurredAt) {

    public static AuditEventResponse from(AuditEvent event) {
      return new AuditEventResponse(
          event.getId(),
          event.getEventType(),
          event.getEntityType(),
          event.getEntityId(),
          event.getActor(),
          event.getActorType(),
          event.getSource(),
          event.getDetails(),
          event.getOccurredAt());
    }
  }
}
