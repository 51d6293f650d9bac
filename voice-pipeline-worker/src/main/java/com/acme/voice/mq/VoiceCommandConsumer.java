package com.acme.voice.mq;

import com.acme.voice.process.VoiceCommandProcessor;
import io.micronaut.context.annotation.Requires;
import io.micronaut.jms.annotations.JMSListener;
import io.micronaut.jms.annotations.Message;
import io.micronaut.jms.annotations.Queue;
import io.micronaut.messaging.annotation.MessageBody;

@Requires(beans = IbmMqFactoryProvider.class)
@Requires(property = "jms.consumers.enabled", value = "true", defaultValue = "false")
@JMSListener("mqConnectionFactory")
public class VoiceCommandConsumer extends BaseVoiceCommandConsumer {

    public static final String VOICE_COMMAND_QUEUE = "APP.VOICE.COMMAND.Q";

    public VoiceCommandConsumer(VoiceCommandProcessor processor) {
        super(processor);
    }

    // one message at a time per worker, scale out with more workers
    @Queue(VOICE_COMMAND_QUEUE)
    public void onVoiceCommand(@MessageBody String body, @Message jakarta.jms.Message m) {
        process(body, m);
    }
}
