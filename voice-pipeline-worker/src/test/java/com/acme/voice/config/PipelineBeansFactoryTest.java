package com.acme.voice.config;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.acme.voice.dispatch.ActionHandlerRegistry;
import com.acme.voice.intent.ActionType;
import com.acme.voice.repository.BimModelRepository;
import com.acme.voice.repository.BookingRepository;
import com.acme.voice.repository.DocumentRepository;
import com.acme.voice.repository.MaintenanceRepository;
import com.acme.voice.repository.NodeRepository;
import com.acme.voice.security.PromptSanitizer;
import com.acme.voice.security.SanitizationResult;
import com.acme.voice.spi.ConversionTrigger;
import com.acme.voice.spi.TranscriptionService;
import java.time.Clock;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PipelineBeansFactoryTest {

    private final PipelineBeansFactory factory = new PipelineBeansFactory();

    @Nested
    @DisplayName("actionHandlerRegistry")
    class ActionHandlerRegistryTests {

        @Test
        @DisplayName("actionHandlerRegistry - should register a handler for every action type")
        void testAllActionTypesRegistered() {
            ActionHandlerRegistry registry = factory.actionHandlerRegistry(
                    new PipelineConfig(),
                    Clock.systemUTC(),
                    mock(NodeRepository.class),
                    mock(BimModelRepository.class),
                    mock(DocumentRepository.class),
                    mock(MaintenanceRepository.class),
                    mock(BookingRepository.class),
                    mock(ConversionTrigger.class));

            assertThat(registry.registeredTypes()).containsExactlyInAnyOrder(ActionType.values());
        }
    }

    @Nested
    @DisplayName("configuration defaults")
    class ConfigurationDefaultsTests {

        @Test
        @DisplayName("pipelineConfig - should default to one retry and a 500 character prompt limit")
        void testPipelineDefaults() {
            PipelineConfig config = factory.pipelineConfig();

            assertThat(config.getMaxRetries()).isEqualTo(1);
            assertThat(config.getMaxTextLength()).isEqualTo(500);
            assertThat(config.getDeadLetter().isEnabled()).isTrue();
            assertThat(config.getIdempotency().isEnabled()).isTrue();
        }

        @Test
        @DisplayName("messagingConfig - should derive the conversion queue from the command name")
        void testConversionQueue() {
            MessagingConfig config = factory.messagingConfig();

            assertThat(config.conversionQueue()).isEqualTo("APP.CMD.BIMCONVERSION.Q");
        }
    }

    @Nested
    @DisplayName("transcriptionService")
    class TranscriptionServiceTests {

        @Test
        @DisplayName("transcriptionService - should be unavailable when no provider is configured")
        void testNoProviders() {
            PipelineConfig config = new PipelineConfig();
            config.getTranscription().setEnabled(true);

            TranscriptionService service = factory.transcriptionService(List.of(), config);

            assertThat(service.isAvailable()).isFalse();
        }

        @Test
        @DisplayName("promptSanitizer - should block text longer than the configured maximum")
        void testSanitizerLimit() {
            PipelineConfig config = new PipelineConfig();
            config.setMaxTextLength(10);

            PromptSanitizer sanitizer = factory.promptSanitizer(config);

            assertThat(sanitizer.maxLength()).isEqualTo(10);
            assertThat(sanitizer.check("abcdefghijklmnop").violation()).isEqualTo(SanitizationResult.TOO_LONG);
        }
    }
}
