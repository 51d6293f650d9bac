package com.acme.voice.process;

import com.acme.voice.audit.AuditEvent;
import com.acme.voice.audit.AuditEventKind;
import com.acme.voice.core.PermanentException;
import com.acme.voice.dispatch.ActionDispatcher;
import com.acme.voice.dispatch.ActionResult;
import com.acme.voice.domain.CommandEnvelope;
import com.acme.voice.domain.CommandRecord;
import com.acme.voice.domain.ProcessingStatus;
import com.acme.voice.intent.Action;
import com.acme.voice.intent.CommandContext;
import com.acme.voice.intent.IntentAnalyzer;
import com.acme.voice.repository.CommandRecordRepository;
import com.acme.voice.response.ResponseSynthesizer;
import com.acme.voice.security.PromptSanitizer;
import com.acme.voice.security.SanitizationResult;
import com.acme.voice.spi.AuditLog;
import com.acme.voice.transcription.TranscriptionResolver;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one command record through its lifecycle:
 *
 * <pre>
 * received -> [transcribing ->] analyzing -> completed | failed
 * </pre>
 *
 * Every status change is persisted before the next stage starts. Whatever happens after the
 * record is loaded, the record is never left in transcribing or analyzing.
 */
public class CommandStateMachine {
  private static final Logger log = LoggerFactory.getLogger(CommandStateMachine.class);

  private final CommandRecordRepository records;
  private final TranscriptionResolver transcriptionResolver;
  private final PromptSanitizer sanitizer;
  private final IntentAnalyzer analyzer;
  private final ActionDispatcher dispatcher;
  private final ResponseSynthesizer synthesizer;
  private final AuditLog auditLog;

  public CommandStateMachine(
      CommandRecordRepository records,
      TranscriptionResolver transcriptionResolver,
      PromptSanitizer sanitizer,
      IntentAnalyzer analyzer,
      ActionDispatcher dispatcher,
      ResponseSynthesizer synthesizer,
      AuditLog auditLog) {
    this.records = records;
    this.transcriptionResolver = transcriptionResolver;
    this.sanitizer = sanitizer;
    this.analyzer = analyzer;
    this.dispatcher = dispatcher;
    this.synthesizer = synthesizer;
    this.auditLog = auditLog;
  }

  /**
   * Run the pipeline for the envelope's record.
   *
   * @return the terminal status written to the record
   * @throws PermanentException if the record is missing or belongs to another tenant
   * @throws RuntimeException any stage failure, after the record has been marked failed
   */
  public ProcessingStatus run(CommandEnvelope envelope) {
    long id = envelope.recordId();
    CommandRecord record =
        records
            .findById(id)
            .orElseThrow(() -> new PermanentException("Command record not found: " + id));
    if (!Objects.equals(record.getTenantId(), envelope.tenantId())) {
      throw new PermanentException(
          "Command record " + id + " does not belong to tenant " + envelope.tenantId());
    }
    if (record.getStatus() == ProcessingStatus.COMPLETED) {
      log.info("Command record {} already completed, skipping redelivered message", id);
      return ProcessingStatus.COMPLETED;
    }

    try {
      return process(envelope, record);
    } catch (RuntimeException e) {
      markFailed(id, e);
      throw e;
    }
  }

  private ProcessingStatus process(CommandEnvelope envelope, CommandRecord record) {
    long id = record.getId();
    if (envelope.isAudio()) {
      records.transition(id, ProcessingStatus.TRANSCRIBING);
      log.info("Command record {} transcribing", id);
    }

    Optional<String> resolved = transcriptionResolver.resolve(envelope, record);
    if (resolved.isEmpty()) {
      log.warn("No text to process for command record {}", id);
      records.recordResponse(id, ResponseSynthesizer.NO_TEXT, ProcessingStatus.FAILED);
      return ProcessingStatus.FAILED;
    }
    String text = resolved.get();

    SanitizationResult screening = sanitizer.check(text);
    if (!screening.allowed()) {
      log.warn("Text of command record {} blocked: {}", id, screening.reason());
      auditLog.record(
          AuditEvent.rejected(
              AuditEventKind.PROMPT_BLOCKED,
              envelope.tenantId(),
              envelope.userId(),
              screening.reason(),
              Map.of("pattern", screening.violation(), "record_id", id)));
      records.recordResponse(id, ResponseSynthesizer.BLOCKED, ProcessingStatus.FAILED);
      return ProcessingStatus.FAILED;
    }

    records.recordInputText(id, text, ProcessingStatus.ANALYZING);
    log.info("Command record {} analyzing", id);

    CommandContext context = CommandContext.of(envelope, record);
    List<Action> actions = analyzer.analyze(text, context);
    List<ActionResult> results = dispatcher.dispatch(actions, context);
    String response = synthesizer.synthesize(results);

    records.recordResponse(id, response, ProcessingStatus.COMPLETED);
    log.info("Command record {} completed with {} action(s)", id, results.size());
    return ProcessingStatus.COMPLETED;
  }

  private void markFailed(long id, RuntimeException cause) {
    try {
      records.recordResponse(id, ResponseSynthesizer.PROCESSING_ERROR, ProcessingStatus.FAILED);
      log.warn("Command record {} failed: {}", id, cause.getMessage());
    } catch (RuntimeException e) {
      log.error("Could not mark command record {} as failed", id, e);
      cause.addSuppressed(e);
    }
  }
}
