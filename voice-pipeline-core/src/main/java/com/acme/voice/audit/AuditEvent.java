package com.acme.voice.audit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured security/processing event.
 *
 * @param kind what happened
 * @param status outcome label, e.g. rejected, retrying, failed
 * @param tenant tenant id, may be null when the message did not carry one
 * @param user user id, may be null
 * @param reason human readable reason
 * @param metadata extra fields, never null
 */
public record AuditEvent(
    AuditEventKind kind,
    String status,
    String tenant,
    String user,
    String reason,
    Map<String, Object> metadata) {

  public static final String STATUS_REJECTED = "rejected";
  public static final String STATUS_RETRYING = "retrying";
  public static final String STATUS_FAILED = "failed";

  public AuditEvent {
    metadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static AuditEvent rejected(AuditEventKind kind, String tenant, String user, String reason) {
    return new AuditEvent(kind, STATUS_REJECTED, tenant, user, reason, Map.of());
  }

  public static AuditEvent rejected(
      AuditEventKind kind, String tenant, String user, String reason, Map<String, Object> metadata) {
    return new AuditEvent(kind, STATUS_REJECTED, tenant, user, reason, metadata);
  }
}
