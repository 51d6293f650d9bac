package com.acme.voice.audit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.Logger;

import java.util.Map;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class Slf4jAuditLogTest {

    private static final String FORMAT = "event=\"{}\" status={} tenant={} user={} reason=\"{}\" metadata={}";

    @Mock
    private Logger logger;

    @Test
    void testRejectionLoggedAsWarning() {
        new Slf4jAuditLog(logger).record(AuditEvent.rejected(
                AuditEventKind.PROMPT_BLOCKED, "T1", "U1", "Blocked: instruction override",
                Map.of("pattern", "instruction override")));

        verify(logger).warn(FORMAT, "prompt blocked", "rejected", "T1", "U1",
                "Blocked: instruction override", "{\"pattern\":\"instruction override\"}");
        verifyNoMoreInteractions(logger);
    }

    @Test
    void testInternalErrorLoggedAsError() {
        new Slf4jAuditLog(logger).record(new AuditEvent(
                AuditEventKind.INTERNAL_ERROR, AuditEvent.STATUS_FAILED, "T1", "U1", "No handler", Map.of()));

        verify(logger).error(FORMAT, "internal error", "failed", "T1", "U1", "No handler", "{}");
        verifyNoMoreInteractions(logger);
    }
}
