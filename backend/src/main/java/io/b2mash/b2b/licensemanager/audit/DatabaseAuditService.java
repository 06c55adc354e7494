package io.b2mash.b2b.licensemanager.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** {@link AuditService} backed by the {@code audit_events} table. */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private final AuditEventRepository auditEventRepository;

  public DatabaseAuditService(AuditEventRepository auditEventRepository) {
    this.auditEventRepository = auditEventRepository;
  }

  @Override
  @Transactional
  public void log(AuditEventRecord record) {
    auditEventRepository.save(new AuditEvent(record));
    log.debug(
        "Recorded audit event: type={}, entity={}/{}, actor={}",
        record.eventType(),
        record.entityType(),
        record.entityId(),
        record.actor());
  }

  @Override
  @Transactional(readOnly = true)
  public Page<AuditEvent> findEvents(AuditEventFilter filter, Pageable pageable) {
    return auditEventRepository.findByFilter(
        filter.entityType(), filter.entityId(), filter.eventType(), pageable);
  }
}
