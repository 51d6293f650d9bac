package com.acme.voice.transcription;

import com.acme.voice.core.TransientException;
import com.acme.voice.spi.TranscriptionProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProviderChainTranscriptionServiceTest {

    @Mock
    private TranscriptionProvider primary;

    @Mock
    private TranscriptionProvider fallback;

    @Test
    @DisplayName("isAvailable - should require providers and the enabled flag")
    void testAvailability() {
        assertThat(new ProviderChainTranscriptionService(List.of(), true).isAvailable()).isFalse();
        assertThat(new ProviderChainTranscriptionService(List.of(primary), false).isAvailable()).isFalse();
        assertThat(new ProviderChainTranscriptionService(List.of(primary), true).isAvailable()).isTrue();
    }

    @Test
    @DisplayName("transcribe - should move to the next provider after a failure")
    void testFallback() {
        when(primary.name()).thenReturn("primary");
        when(primary.transcribe("a.wav", "it-IT")).thenThrow(new RuntimeException("quota"));
        when(fallback.transcribe("a.wav", "it-IT")).thenReturn(TranscriptionResult.of("aiuto", 0.8, "fallback"));
        when(fallback.name()).thenReturn("fallback");

        TranscriptionResult result =
                new ProviderChainTranscriptionService(List.of(primary, fallback), true).transcribe("a.wav", "it-IT");

        assertThat(result.text()).isEqualTo("aiuto");
        assertThat(result.engineName()).isEqualTo("fallback");
    }

    @Test
    @DisplayName("transcribe - should return the blank result when nobody recognized speech")
    void testBlank() {
        when(primary.name()).thenReturn("primary");
        when(primary.transcribe("a.wav", "it-IT")).thenReturn(TranscriptionResult.of("", 0.0, "primary"));

        TranscriptionResult result =
                new ProviderChainTranscriptionService(List.of(primary), true).transcribe("a.wav", "it-IT");

        assertThat(result.isBlank()).isTrue();
    }

    @Test
    @DisplayName("transcribe - should raise a transient error when every provider failed")
    void testAllFailed() {
        when(primary.name()).thenReturn("primary");
        when(primary.transcribe("a.wav", "it-IT")).thenThrow(new RuntimeException("down"));
        ProviderChainTranscriptionService service = new ProviderChainTranscriptionService(List.of(primary), true);

        assertThatThrownBy(() -> service.transcribe("a.wav", "it-IT"))
                .isInstanceOf(TransientException.class)
                .hasRootCauseMessage("down");
    }

    @Test
    @DisplayName("TranscriptionResult - should validate confidence")
    void testResultValidation() {
        assertThatThrownBy(() -> TranscriptionResult.of("x", 1.5, "e")).isInstanceOf(IllegalArgumentException.class);
    }
}
