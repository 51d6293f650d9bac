package com.acme.voice.mq;

import com.acme.voice.config.MessagingConfig;
import com.acme.voice.core.Jsons;
import com.acme.voice.spi.CommandQueue;
import com.acme.voice.spi.ConversionTrigger;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/** Queues a BIM conversion job for the conversion worker and returns the job id. */
@Slf4j
@Singleton
@Requires(beans = CommandQueue.class)
public class JmsConversionTrigger implements ConversionTrigger {

    private final CommandQueue commandQueue;
    private final MessagingConfig messagingConfig;

    public JmsConversionTrigger(CommandQueue commandQueue, MessagingConfig messagingConfig) {
        this.commandQueue = commandQueue;
        this.messagingConfig = messagingConfig;
    }

    @Override
    public String trigger(long modelId, String conversionType) {
        String jobId = UUID.randomUUID().toString();

        Map<String, Object> job = new LinkedHashMap<>();
        job.put("model_id", modelId);
        job.put("conversion_type", conversionType);
        job.put("job_id", jobId);

        String queue = messagingConfig.conversionQueue();
        commandQueue.send(queue, Jsons.toJson(job), Map.of(
                JmsCommandQueue.HEADER_CORRELATION_ID, jobId,
                "commandType", messagingConfig.getConversionCommand()));

        log.info("Queued {} conversion of BIM model {} on {} (job {})", conversionType, modelId, queue, jobId);
        return jobId;
    }
}
