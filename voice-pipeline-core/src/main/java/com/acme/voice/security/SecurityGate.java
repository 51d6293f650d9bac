package com.acme.voice.security;

import static com.acme.voice.domain.CommandEnvelope.*;

import com.acme.voice.audit.AuditEvent;
import com.acme.voice.audit.AuditEventKind;
import com.acme.voice.spi.AuditLog;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First line of defense for queued messages: key whitelist, required keys, then prompt screening
 * of the supplied text. Every rejection is audited. Never throws.
 */
public class SecurityGate {
  private static final Logger log = LoggerFactory.getLogger(SecurityGate.class);

  public static final Set<String> ALLOWED_KEYS =
      Set.of(
          TENANT_ID,
          USER_ID,
          NODE_ID,
          AUDIO_URL,
          TRANSCRIBED_TEXT,
          TIMESTAMP,
          RECORD_ID,
          COMMAND_TYPE,
          RETRY_COUNT);

  public static final List<String> REQUIRED_KEYS = List.of(TENANT_ID, USER_ID, TIMESTAMP);

  private final AuditLog auditLog;
  private final PromptSanitizer sanitizer;

  public SecurityGate(AuditLog auditLog, PromptSanitizer sanitizer) {
    this.auditLog = auditLog;
    this.sanitizer = sanitizer;
  }

  public GateDecision evaluate(Map<String, Object> message) {
    try {
      return doEvaluate(message);
    } catch (RuntimeException e) {
      log.error("Security gate failed unexpectedly, rejecting message", e);
      return GateDecision.reject(AuditEventKind.INVALID_ENVELOPE, "Unreadable message");
    }
  }

  private GateDecision doEvaluate(Map<String, Object> message) {
    if (message == null) {
      return reject(AuditEventKind.INVALID_ENVELOPE, null, null, "Empty message", Map.of());
    }
    String tenant = idOf(message.get(TENANT_ID));
    String user = idOf(message.get(USER_ID));

    Set<String> unknown = new TreeSet<>();
    for (String key : message.keySet()) {
      if (!ALLOWED_KEYS.contains(key)) {
        unknown.add(key);
      }
    }
    if (!unknown.isEmpty()) {
      return reject(
          AuditEventKind.INVALID_KEYS,
          tenant,
          user,
          "Unexpected keys: " + unknown,
          Map.of("keys", List.copyOf(unknown)));
    }

    Set<String> missing = new TreeSet<>();
    for (String key : REQUIRED_KEYS) {
      if (message.get(key) == null) {
        missing.add(key);
      }
    }
    if (!missing.isEmpty()) {
      return reject(
          AuditEventKind.MISSING_KEYS,
          tenant,
          user,
          "Missing required keys: " + missing,
          Map.of("keys", List.copyOf(missing)));
    }

    if (message.containsKey(TRANSCRIBED_TEXT) && message.get(TRANSCRIBED_TEXT) != null) {
      SanitizationResult result = sanitizer.check(message.get(TRANSCRIBED_TEXT));
      if (!result.allowed()) {
        return reject(
            AuditEventKind.PROMPT_BLOCKED,
            tenant,
            user,
            result.reason(),
            Map.of("pattern", result.violation()));
      }
    }
    return GateDecision.accept();
  }

  private GateDecision reject(
      AuditEventKind kind, String tenant, String user, String reason, Map<String, Object> metadata) {
    log.warn("Message rejected: {} tenant={} user={} reason={}", kind.label(), tenant, user, reason);
    auditLog.record(AuditEvent.rejected(kind, tenant, user, reason, metadata));
    return GateDecision.reject(kind, reason);
  }

  private static String idOf(Object value) {
    return value == null ? null : String.valueOf(value);
  }
}
