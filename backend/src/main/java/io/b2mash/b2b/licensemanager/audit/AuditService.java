package io.b2mash.b2b.licensemanager.audit;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

/** Records and queries audit events of accepted admin changes. */
public interface AuditService {

  /**
   * Records an event within the current transaction. If the enclosing transaction rolls back, the
   * event rolls back with it.
   */
  void log(AuditEventRecord record);

  Page<AuditEvent> findEvents(AuditEventFilter filter, Pageable pageable);
}
