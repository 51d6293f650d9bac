package com.acme.voice.config;

import com.acme.voice.audit.Slf4jAuditLog;
import com.acme.voice.dispatch.ActionDispatcher;
import com.acme.voice.dispatch.ActionHandlerRegistry;
import com.acme.voice.dispatch.handler.BimConversionHandler;
import com.acme.voice.dispatch.handler.BimStatusHandler;
import com.acme.voice.dispatch.handler.BookingCreateHandler;
import com.acme.voice.dispatch.handler.BookingListHandler;
import com.acme.voice.dispatch.handler.DocumentListHandler;
import com.acme.voice.dispatch.handler.DocumentSearchHandler;
import com.acme.voice.dispatch.handler.HelpHandler;
import com.acme.voice.dispatch.handler.IotControlHandler;
import com.acme.voice.dispatch.handler.MaintenanceCreateHandler;
import com.acme.voice.dispatch.handler.MaintenanceStatusHandler;
import com.acme.voice.dispatch.handler.SensorReadHandler;
import com.acme.voice.dispatch.handler.SystemStatusHandler;
import com.acme.voice.intent.IntentAnalyzer;
import com.acme.voice.process.CommandStateMachine;
import com.acme.voice.process.RetryController;
import com.acme.voice.process.VoiceCommandProcessor;
import com.acme.voice.repository.ActionLedgerRepository;
import com.acme.voice.repository.BimModelRepository;
import com.acme.voice.repository.BookingRepository;
import com.acme.voice.repository.CommandRecordRepository;
import com.acme.voice.repository.DeadLetterRepository;
import com.acme.voice.repository.DocumentRepository;
import com.acme.voice.repository.MaintenanceRepository;
import com.acme.voice.repository.NodeRepository;
import com.acme.voice.response.ResponseSynthesizer;
import com.acme.voice.security.PromptSanitizer;
import com.acme.voice.security.SecurityGate;
import com.acme.voice.spi.AuditLog;
import com.acme.voice.spi.ConversionTrigger;
import com.acme.voice.spi.TranscriptionProvider;
import com.acme.voice.spi.TranscriptionService;
import com.acme.voice.transcription.ProviderChainTranscriptionService;
import com.acme.voice.transcription.TranscriptionResolver;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;

import java.time.Clock;
import java.util.List;

/**
 * Wires the framework-free pipeline components into Micronaut. The core module stays free of
 * DI annotations; configuration is bound onto its POJOs here.
 */
@Factory
public class PipelineBeansFactory {

    /** pipeline.* properties */
    @Singleton
    @ConfigurationProperties("pipeline")
    public PipelineConfig pipelineConfig() {
        return new PipelineConfig();
    }

    /** messaging.* properties */
    @Singleton
    @ConfigurationProperties("messaging")
    public MessagingConfig messagingConfig() {
        return new MessagingConfig();
    }

    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Singleton
    public AuditLog auditLog() {
        return new Slf4jAuditLog();
    }

    @Singleton
    public PromptSanitizer promptSanitizer(PipelineConfig config) {
        return new PromptSanitizer(config.getMaxTextLength());
    }

    @Singleton
    public SecurityGate securityGate(AuditLog auditLog, PromptSanitizer sanitizer) {
        return new SecurityGate(auditLog, sanitizer);
    }

    /** Providers are tried in bean order; with none registered, audio falls back to placeholder transcripts. */
    @Singleton
    public TranscriptionService transcriptionService(List<TranscriptionProvider> providers, PipelineConfig config) {
        return new ProviderChainTranscriptionService(providers, config.getTranscription().isEnabled());
    }

    @Singleton
    public TranscriptionResolver transcriptionResolver(TranscriptionService service, PipelineConfig config) {
        return new TranscriptionResolver(service, config.getTranscription().getLanguageCode());
    }

    @Singleton
    public IntentAnalyzer intentAnalyzer(NodeRepository nodes, BimModelRepository bimModels) {
        return new IntentAnalyzer(nodes, bimModels);
    }

    @Singleton
    public ActionHandlerRegistry actionHandlerRegistry(
            PipelineConfig config,
            Clock clock,
            NodeRepository nodes,
            BimModelRepository bimModels,
            DocumentRepository documents,
            MaintenanceRepository maintenance,
            BookingRepository bookings,
            ConversionTrigger conversionTrigger) {
        ActionHandlerRegistry registry = new ActionHandlerRegistry();
        registry.register(new IotControlHandler());
        registry.register(new BimConversionHandler(conversionTrigger));
        registry.register(new BimStatusHandler(bimModels));
        registry.register(new DocumentListHandler(documents, config.getDocumentListLimit()));
        registry.register(new DocumentSearchHandler(documents, config.getDocumentListLimit()));
        registry.register(new MaintenanceStatusHandler(maintenance, config.getRecordListLimit()));
        registry.register(new MaintenanceCreateHandler(maintenance, clock));
        registry.register(new BookingCreateHandler(bookings, clock));
        registry.register(new BookingListHandler(bookings, config.getRecordListLimit()));
        registry.register(new SensorReadHandler(clock));
        registry.register(new SystemStatusHandler(nodes, maintenance, clock));
        registry.register(new HelpHandler());
        return registry;
    }

    @Singleton
    public ActionDispatcher actionDispatcher(
            ActionHandlerRegistry registry, ActionLedgerRepository ledger, PipelineConfig config) {
        return new ActionDispatcher(registry, ledger, config.getIdempotency().isEnabled());
    }

    @Singleton
    public ResponseSynthesizer responseSynthesizer() {
        return new ResponseSynthesizer();
    }

    @Singleton
    public CommandStateMachine commandStateMachine(
            CommandRecordRepository records,
            TranscriptionResolver resolver,
            PromptSanitizer sanitizer,
            IntentAnalyzer analyzer,
            ActionDispatcher dispatcher,
            ResponseSynthesizer synthesizer,
            AuditLog auditLog) {
        return new CommandStateMachine(records, resolver, sanitizer, analyzer, dispatcher, synthesizer, auditLog);
    }

    @Singleton
    public RetryController retryController(
            CommandStateMachine stateMachine,
            AuditLog auditLog,
            DeadLetterRepository deadLetters,
            PipelineConfig config) {
        return new RetryController(stateMachine, auditLog, deadLetters, config);
    }

    @Singleton
    public VoiceCommandProcessor voiceCommandProcessor(
            SecurityGate gate, RetryController retryController, AuditLog auditLog) {
        return new VoiceCommandProcessor(gate, retryController, auditLog);
    }
}
