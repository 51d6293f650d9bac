package com.acme.voice.domain;

import com.acme.voice.core.EnvelopeFormatException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class CommandEnvelopeTest {

    private static Map<String, Object> wire() {
        Map<String, Object> m = new HashMap<>();
        m.put("tenant_id", "T1");
        m.put("user_id", 7);
        m.put("timestamp", "2024-05-01T10:00:00Z");
        m.put("audiolog_id", 5);
        return m;
    }

    @Nested
    @DisplayName("fromMap Tests")
    class FromMapTests {

        @Test
        @DisplayName("fromMap - should apply defaults for optional keys")
        void testDefaults() {
            CommandEnvelope envelope = CommandEnvelope.fromMap(wire());

            assertThat(envelope.tenantId()).isEqualTo("T1");
            assertThat(envelope.userId()).isEqualTo("7");
            assertThat(envelope.recordId()).isEqualTo(5L);
            assertThat(envelope.kind()).isEqualTo(CommandKind.TEXT);
            assertThat(envelope.retryCount()).isZero();
            assertThat(envelope.nodeId()).isNull();
            assertThat(envelope.timestamp()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        }

        @Test
        @DisplayName("fromMap - should read audio commands and retry counters")
        void testAudio() {
            Map<String, Object> m = wire();
            m.put("command_type", "AUDIO");
            m.put("audio_url", "bucket/clip.wav");
            m.put("node_id", "12");
            m.put("_retry_count", 1);

            CommandEnvelope envelope = CommandEnvelope.fromMap(m);

            assertThat(envelope.isAudio()).isTrue();
            assertThat(envelope.audioUrl()).isEqualTo("bucket/clip.wav");
            assertThat(envelope.nodeId()).isEqualTo(12L);
            assertThat(envelope.retryCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("fromMap - should read zone-less timestamps as UTC")
        void testLocalTimestamp() {
            Map<String, Object> m = wire();
            m.put("timestamp", "2024-05-01T10:00:00.123456");

            assertThat(CommandEnvelope.fromMap(m).timestamp())
                    .isEqualTo(Instant.parse("2024-05-01T10:00:00.123456Z"));
        }

        @Test
        @DisplayName("fromMap - should read offset timestamps")
        void testOffsetTimestamp() {
            Map<String, Object> m = wire();
            m.put("timestamp", "2024-05-01T12:00:00+02:00");

            assertThat(CommandEnvelope.fromMap(m).timestamp())
                    .isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        }

        @Test
        @DisplayName("fromMap - should reject malformed values")
        void testMalformed() {
            Map<String, Object> badTimestamp = wire();
            badTimestamp.put("timestamp", "yesterday");
            Map<String, Object> badKind = wire();
            badKind.put("command_type", "video");
            Map<String, Object> noRecord = wire();
            noRecord.remove("audiolog_id");
            Map<String, Object> badRecord = wire();
            badRecord.put("audiolog_id", "five");
            Map<String, Object> negativeRetry = wire();
            negativeRetry.put("_retry_count", -1);

            assertThatThrownBy(() -> CommandEnvelope.fromMap(badTimestamp))
                    .isInstanceOf(EnvelopeFormatException.class);
            assertThatThrownBy(() -> CommandEnvelope.fromMap(badKind))
                    .isInstanceOf(EnvelopeFormatException.class)
                    .hasMessageContaining("video");
            assertThatThrownBy(() -> CommandEnvelope.fromMap(noRecord))
                    .isInstanceOf(EnvelopeFormatException.class)
                    .hasMessageContaining("audiolog_id");
            assertThatThrownBy(() -> CommandEnvelope.fromMap(badRecord))
                    .isInstanceOf(EnvelopeFormatException.class);
            assertThatThrownBy(() -> CommandEnvelope.fromMap(negativeRetry))
                    .isInstanceOf(EnvelopeFormatException.class);
        }

        @Test
        @DisplayName("fromMap - should reject retry counters that do not fit an int")
        void testOversizedRetryCount() {
            Map<String, Object> wrapsToZero = wire();
            wrapsToZero.put("_retry_count", 4294967296L);
            Map<String, Object> wrapsNegative = wire();
            wrapsNegative.put("_retry_count", 2147483648L);
            Map<String, Object> largest = wire();
            largest.put("_retry_count", (long) Integer.MAX_VALUE);

            assertThatThrownBy(() -> CommandEnvelope.fromMap(wrapsToZero))
                    .isInstanceOf(EnvelopeFormatException.class)
                    .hasMessageContaining("_retry_count");
            assertThatThrownBy(() -> CommandEnvelope.fromMap(wrapsNegative))
                    .isInstanceOf(EnvelopeFormatException.class);
            assertThat(CommandEnvelope.fromMap(largest).retryCount()).isEqualTo(Integer.MAX_VALUE);
        }
    }

    @Test
    @DisplayName("withRetryCount - should only change the counter")
    void testWithRetryCount() {
        CommandEnvelope envelope = CommandEnvelope.fromMap(wire());

        CommandEnvelope retried = envelope.withRetryCount(1);

        assertThat(retried.retryCount()).isEqualTo(1);
        assertThat(retried.withRetryCount(0)).isEqualTo(envelope);
    }

    @Test
    @DisplayName("toWireMap - should produce a map the envelope can be rebuilt from")
    void testToWireMap() {
        Map<String, Object> m = wire();
        m.put("transcribed_text", "aiuto");
        CommandEnvelope envelope = CommandEnvelope.fromMap(m).withRetryCount(1);

        Map<String, Object> wire = envelope.toWireMap();

        assertThat(wire).containsEntry("_retry_count", 1).containsEntry("command_type", "text");
        assertThat(wire).doesNotContainKey("node_id");
        assertThat(CommandEnvelope.fromMap(wire)).isEqualTo(envelope);
    }
}
