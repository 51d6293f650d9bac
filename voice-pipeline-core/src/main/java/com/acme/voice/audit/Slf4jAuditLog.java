package com.acme.voice.audit;

import com.acme.voice.core.Jsons;
import com.acme.voice.spi.AuditLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes audit events to the dedicated AUDIT logger as key=value fields. */
public class Slf4jAuditLog implements AuditLog {
  static final String AUDIT_LOGGER = "AUDIT";

  private final Logger audit;

  public Slf4jAuditLog() {
    this(LoggerFactory.getLogger(AUDIT_LOGGER));
  }

  Slf4jAuditLog(Logger audit) {
    this.audit = audit;
  }

  @Override
  public void record(AuditEvent event) {
    String metadata;
    try {
      metadata = event.metadata().isEmpty() ? "{}" : Jsons.toJson(event.metadata());
    } catch (RuntimeException e) {
      metadata = String.valueOf(event.metadata());
    }
    if (event.kind() == AuditEventKind.INTERNAL_ERROR) {
      audit.error(
          "event=\"{}\" status={} tenant={} user={} reason=\"{}\" metadata={}",
          event.kind().label(),
          event.status(),
          event.tenant(),
          event.user(),
          event.reason(),
          metadata);
    } else {
      audit.warn(
          "event=\"{}\" status={} tenant={} user={} reason=\"{}\" metadata={}",
          event.kind().label(),
          event.status(),
          event.tenant(),
          event.user(),
          event.reason(),
          metadata);
    }
  }
}
