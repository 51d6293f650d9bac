package com.acme.voice.process;

import com.acme.voice.audit.AuditEvent;
import com.acme.voice.audit.AuditEventKind;
import com.acme.voice.config.PipelineConfig;
import com.acme.voice.core.InternalConsistencyException;
import com.acme.voice.core.PermanentException;
import com.acme.voice.core.TransientException;
import com.acme.voice.domain.CommandEnvelope;
import com.acme.voice.domain.CommandKind;
import com.acme.voice.domain.ProcessingStatus;
import com.acme.voice.repository.DeadLetterRepository;
import com.acme.voice.spi.AuditLog;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RetryControllerTest {

    @Mock
    private CommandStateMachine stateMachine;
    @Mock
    private AuditLog auditLog;
    @Mock
    private DeadLetterRepository deadLetters;

    private PipelineConfig config;
    private RetryController controller;

    private final CommandEnvelope envelope = new CommandEnvelope(
            "T1", "U1", null, null, "aiuto", Instant.parse("2024-05-01T10:00:00Z"), 5L, CommandKind.TEXT, 0);

    @BeforeEach
    void setUp() {
        config = new PipelineConfig();
        controller = new RetryController(stateMachine, auditLog, deadLetters, config);
    }

    private List<AuditEvent> auditedEvents(int count) {
        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditLog, times(count)).record(captor.capture());
        return captor.getAllValues();
    }

    @Test
    @DisplayName("execute - should return the state machine status on first success")
    void testFirstAttemptSucceeds() {
        when(stateMachine.run(envelope)).thenReturn(ProcessingStatus.COMPLETED);

        assertThat(controller.execute(envelope)).isEqualTo(ProcessingStatus.COMPLETED);
        verifyNoInteractions(auditLog, deadLetters);
    }

    @Test
    @DisplayName("execute - should retry a transient failure once with an incremented counter")
    void testRetryOnce() {
        when(stateMachine.run(envelope)).thenThrow(new TransientException("connection reset"));
        when(stateMachine.run(envelope.withRetryCount(1))).thenReturn(ProcessingStatus.COMPLETED);

        assertThat(controller.execute(envelope)).isEqualTo(ProcessingStatus.COMPLETED);

        List<AuditEvent> events = auditedEvents(1);
        assertThat(events.get(0).kind()).isEqualTo(AuditEventKind.RETRY);
        assertThat(events.get(0).status()).isEqualTo(AuditEvent.STATUS_RETRYING);
        assertThat(events.get(0).metadata()).containsEntry("retry_count", 1).containsEntry("record_id", 5L);
        verifyNoInteractions(deadLetters);
    }

    @Test
    @DisplayName("execute - should give up after the retry budget and park the last envelope")
    void testBudgetExhausted() {
        when(stateMachine.run(any())).thenThrow(new TransientException("connection reset"));

        assertThat(controller.execute(envelope)).isEqualTo(ProcessingStatus.FAILED);

        verify(stateMachine, times(2)).run(any());
        List<AuditEvent> events = auditedEvents(2);
        assertThat(events).extracting(AuditEvent::kind)
                .containsExactly(AuditEventKind.RETRY, AuditEventKind.PROCESSING_FAILED);
        AuditEvent failed = events.get(1);
        assertThat(failed.metadata()).containsEntry("attempts", 2)
                .containsEntry("error_class", TransientException.class.getName());
        assertThat(failed.metadata().get("envelope"))
                .asInstanceOf(InstanceOfAssertFactories.MAP)
                .containsEntry("_retry_count", 1);
        verify(deadLetters).park(eq(5L), eq("T1"), eq("U1"), anyString(),
                eq(TransientException.class.getName()), eq("connection reset"), eq(2),
                eq("voice-pipeline-worker"));
    }

    @Test
    @DisplayName("execute - should honour a larger retry budget")
    void testConfiguredBudget() {
        config.setMaxRetries(3);
        when(stateMachine.run(any())).thenThrow(new TransientException("timeout"));

        assertThat(controller.execute(envelope)).isEqualTo(ProcessingStatus.FAILED);

        verify(stateMachine, times(4)).run(any());
    }

    @Test
    @DisplayName("execute - should not retry a permanent failure")
    void testPermanentNotRetried() {
        when(stateMachine.run(envelope)).thenThrow(new PermanentException("Command record not found: 5"));

        assertThat(controller.execute(envelope)).isEqualTo(ProcessingStatus.FAILED);

        verify(stateMachine, times(1)).run(any());
        assertThat(auditedEvents(1)).extracting(AuditEvent::kind)
                .containsExactly(AuditEventKind.PROCESSING_FAILED);
        verify(deadLetters).park(eq(5L), eq("T1"), eq("U1"), anyString(),
                eq(PermanentException.class.getName()), eq("Command record not found: 5"), eq(1), anyString());
    }

    @Test
    @DisplayName("execute - should audit an internal consistency error before giving up")
    void testInternalConsistency() {
        when(stateMachine.run(envelope))
                .thenThrow(new InternalConsistencyException("No handler registered for action type: help"));

        assertThat(controller.execute(envelope)).isEqualTo(ProcessingStatus.FAILED);

        verify(stateMachine, times(1)).run(any());
        assertThat(auditedEvents(2)).extracting(AuditEvent::kind)
                .containsExactly(AuditEventKind.INTERNAL_ERROR, AuditEventKind.PROCESSING_FAILED);
    }

    @Test
    @DisplayName("execute - should still report failure when parking fails")
    void testParkFailure() {
        when(stateMachine.run(envelope)).thenThrow(new PermanentException("bad record"));
        doThrow(new TransientException("dlq down")).when(deadLetters)
                .park(anyLong(), any(), any(), any(), any(), any(), anyInt(), any());

        assertThat(controller.execute(envelope)).isEqualTo(ProcessingStatus.FAILED);
    }

    @Test
    @DisplayName("execute - should not park when the dead letter store is disabled")
    void testDeadLetterDisabled() {
        config.getDeadLetter().setEnabled(false);
        when(stateMachine.run(envelope)).thenThrow(new PermanentException("bad record"));

        assertThat(controller.execute(envelope)).isEqualTo(ProcessingStatus.FAILED);

        verifyNoInteractions(deadLetters);
    }
}
