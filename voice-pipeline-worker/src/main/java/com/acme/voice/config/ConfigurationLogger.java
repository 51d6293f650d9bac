package com.acme.voice.config;

import com.acme.voice.mq.VoiceCommandConsumer;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/**
 * Logs the effective configuration once the context has started.
 * Disabled in the test environment.
 */
@Slf4j
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<StartupEvent> {

    private final PipelineConfig pipelineConfig;
    private final MessagingConfig messagingConfig;

    @Property(name = "datasources.default.url")
    private String datasourceUrl;

    @Property(name = "datasources.default.maximum-pool-size", defaultValue = "10")
    private int maxPoolSize;

    @Property(name = "db.dialect")
    private String dialect;

    @Property(name = "jms.consumers.enabled", defaultValue = "false")
    private boolean jmsConsumersEnabled;

    public ConfigurationLogger(PipelineConfig pipelineConfig, MessagingConfig messagingConfig) {
        this.pipelineConfig = pipelineConfig;
        this.messagingConfig = messagingConfig;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        log.info("═══════════════════════════════════════════════════════════════════════════════");
        log.info("                    VOICE PIPELINE EFFECTIVE CONFIGURATION                      ");
        log.info("═══════════════════════════════════════════════════════════════════════════════");

        log.info("━━━ Database ━━━");
        log.info("  JDBC URL:           {}", datasourceUrl);
        log.info("  Dialect:            {}", dialect);
        log.info("  Max Pool Size:      {}", maxPoolSize);

        log.info("━━━ Messaging ━━━");
        log.info("  JMS Consumers:      {}", jmsConsumersEnabled ? "ENABLED" : "DISABLED");
        log.info("  Voice Queue:        {}", VoiceCommandConsumer.VOICE_COMMAND_QUEUE);
        log.info("  Conversion Queue:   {}", messagingConfig.conversionQueue());

        log.info("━━━ Pipeline ━━━");
        log.info("  Max Retries:        {}", pipelineConfig.getMaxRetries());
        log.info("  Max Text Length:    {}", pipelineConfig.getMaxTextLength());
        log.info("  Transcription:      {} ({})",
                pipelineConfig.getTranscription().isEnabled() ? "ENABLED" : "PLACEHOLDER",
                pipelineConfig.getTranscription().getLanguageCode());
        log.info("  Dead Letter Store:  {} (parked by {})",
                pipelineConfig.getDeadLetter().isEnabled() ? "ENABLED" : "DISABLED",
                pipelineConfig.getDeadLetter().getParkedBy());
        log.info("  Action Ledger:      {}", pipelineConfig.getIdempotency().isEnabled() ? "ENABLED" : "DISABLED");
        log.info("  List Limits:        documents={} records={}",
                pipelineConfig.getDocumentListLimit(), pipelineConfig.getRecordListLimit());

        log.info("═══════════════════════════════════════════════════════════════════════════════");
    }
}
