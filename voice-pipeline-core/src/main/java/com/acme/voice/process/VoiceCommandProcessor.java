package com.acme.voice.process;

import com.acme.voice.audit.AuditEvent;
import com.acme.voice.audit.AuditEventKind;
import com.acme.voice.audit.CommandMdc;
import com.acme.voice.core.EnvelopeFormatException;
import com.acme.voice.core.Jsons;
import com.acme.voice.domain.CommandEnvelope;
import com.acme.voice.domain.ProcessingStatus;
import com.acme.voice.security.GateDecision;
import com.acme.voice.security.SecurityGate;
import com.acme.voice.spi.AuditLog;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Entry point for one queued message: gate, envelope parsing, then the retrying pipeline. */
public class VoiceCommandProcessor {
  private static final Logger log = LoggerFactory.getLogger(VoiceCommandProcessor.class);

  private final SecurityGate gate;
  private final RetryController retryController;
  private final AuditLog auditLog;

  public VoiceCommandProcessor(SecurityGate gate, RetryController retryController, AuditLog auditLog) {
    this.gate = gate;
    this.retryController = retryController;
    this.auditLog = auditLog;
  }

  /** Process a raw JSON message body. Malformed bodies are audited and dropped. */
  public ProcessingOutcome handleJson(String body) {
    Map<String, Object> message;
    try {
      message = Jsons.readMap(body);
    } catch (IllegalArgumentException e) {
      log.warn("Dropping unreadable message: {}", e.getMessage());
      auditLog.record(
          AuditEvent.rejected(AuditEventKind.INVALID_ENVELOPE, null, null, e.getMessage()));
      return ProcessingOutcome.INVALID;
    }
    return handle(message);
  }

  public ProcessingOutcome handle(Map<String, Object> message) {
    GateDecision decision = gate.evaluate(message);
    if (!decision.accepted()) {
      return ProcessingOutcome.REJECTED;
    }

    CommandEnvelope envelope;
    try {
      envelope = CommandEnvelope.fromMap(message);
    } catch (EnvelopeFormatException e) {
      log.warn("Dropping malformed envelope: {}", e.getMessage());
      auditLog.record(
          AuditEvent.rejected(
              AuditEventKind.INVALID_ENVELOPE,
              stringOrNull(message.get(CommandEnvelope.TENANT_ID)),
              stringOrNull(message.get(CommandEnvelope.USER_ID)),
              e.getMessage()));
      return ProcessingOutcome.INVALID;
    }

    try (CommandMdc ignored = CommandMdc.open(envelope)) {
      log.info(
          "Voice command processing started: record={} kind={} retry={}",
          envelope.recordId(),
          envelope.kind().wire(),
          envelope.retryCount());
      ProcessingStatus status = retryController.execute(envelope);
      log.info("Voice command processing finished: record={} status={}", envelope.recordId(), status.value());
      return status == ProcessingStatus.COMPLETED
          ? ProcessingOutcome.COMPLETED
          : ProcessingOutcome.FAILED;
    }
  }

  private static String stringOrNull(Object value) {
    return value == null ? null : String.valueOf(value);
  }
}
