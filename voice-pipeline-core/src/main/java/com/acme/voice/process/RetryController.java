package com.acme.voice.process;

import com.acme.voice.audit.AuditEvent;
import com.acme.voice.audit.AuditEventKind;
import com.acme.voice.config.PipelineConfig;
import com.acme.voice.core.InternalConsistencyException;
import com.acme.voice.core.Jsons;
import com.acme.voice.core.PermanentException;
import com.acme.voice.domain.CommandEnvelope;
import com.acme.voice.domain.ProcessingStatus;
import com.acme.voice.repository.DeadLetterRepository;
import com.acme.voice.spi.AuditLog;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the state machine with a bounded retry budget. Transient failures are retried while the
 * envelope's retry counter is below the budget; permanent and internal-consistency failures are
 * terminal at once. Envelopes that end in failure are parked in the dead letter store.
 */
public class RetryController {
  private static final Logger log = LoggerFactory.getLogger(RetryController.class);

  private final CommandStateMachine stateMachine;
  private final AuditLog auditLog;
  private final DeadLetterRepository deadLetters;
  private final PipelineConfig config;

  public RetryController(
      CommandStateMachine stateMachine,
      AuditLog auditLog,
      DeadLetterRepository deadLetters,
      PipelineConfig config) {
    this.stateMachine = stateMachine;
    this.auditLog = auditLog;
    this.deadLetters = deadLetters;
    this.config = config;
  }

  /** @return the terminal status of the record, FAILED when the controller gave up */
  public ProcessingStatus execute(CommandEnvelope envelope) {
    CommandEnvelope current = envelope;
    while (true) {
      try {
        return stateMachine.run(current);
      } catch (InternalConsistencyException e) {
        log.error("FATAL internal consistency error for command {}", current.recordId(), e);
        auditLog.record(
            new AuditEvent(
                AuditEventKind.INTERNAL_ERROR,
                AuditEvent.STATUS_FAILED,
                current.tenantId(),
                current.userId(),
                e.getMessage(),
                Map.of("record_id", current.recordId())));
        giveUp(current, e);
        return ProcessingStatus.FAILED;
      } catch (PermanentException e) {
        log.error("Permanent failure for command {}: {}", current.recordId(), e.getMessage());
        giveUp(current, e);
        return ProcessingStatus.FAILED;
      } catch (RuntimeException e) {
        if (current.retryCount() >= config.getMaxRetries()) {
          log.error(
              "Command {} failed after {} attempt(s)", current.recordId(), current.retryCount() + 1, e);
          giveUp(current, e);
          return ProcessingStatus.FAILED;
        }
        current = current.withRetryCount(current.retryCount() + 1);
        log.warn(
            "Retrying command {} (retry {}/{}): {}",
            current.recordId(),
            current.retryCount(),
            config.getMaxRetries(),
            e.getMessage());
        auditLog.record(
            new AuditEvent(
                AuditEventKind.RETRY,
                AuditEvent.STATUS_RETRYING,
                current.tenantId(),
                current.userId(),
                reasonOf(e),
                Map.of("retry_count", current.retryCount(), "record_id", current.recordId())));
      }
    }
  }

  private void giveUp(CommandEnvelope envelope, RuntimeException cause) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("envelope", envelope.toWireMap());
    metadata.put("error_class", cause.getClass().getName());
    metadata.put("attempts", envelope.retryCount() + 1);
    auditLog.record(
        new AuditEvent(
            AuditEventKind.PROCESSING_FAILED,
            AuditEvent.STATUS_FAILED,
            envelope.tenantId(),
            envelope.userId(),
            reasonOf(cause),
            metadata));

    if (!config.getDeadLetter().isEnabled() || deadLetters == null) {
      return;
    }
    try {
      deadLetters.park(
          envelope.recordId(),
          envelope.tenantId(),
          envelope.userId(),
          Jsons.toJson(envelope.toWireMap()),
          cause.getClass().getName(),
          reasonOf(cause),
          envelope.retryCount() + 1,
          config.getDeadLetter().getParkedBy());
      log.info("Parked command {} in the dead letter store", envelope.recordId());
    } catch (RuntimeException e) {
      log.error("Failed to park command {} in the dead letter store", envelope.recordId(), e);
    }
  }

  private static String reasonOf(Throwable e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
