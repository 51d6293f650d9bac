package com.acme.voice.mq;

import com.acme.voice.process.ProcessingOutcome;
import com.acme.voice.process.VoiceCommandProcessor;
import jakarta.jms.JMSException;
import jakarta.jms.Message;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for JMS listeners that feed the voice command pipeline. The processor audits and
 * drops bad messages itself, so every delivery is consumed once it returns.
 */
@Slf4j
public abstract class BaseVoiceCommandConsumer {

    static final String DELIVERY_COUNT = "JMSXDeliveryCount";

    private final VoiceCommandProcessor processor;

    protected BaseVoiceCommandConsumer(VoiceCommandProcessor processor) {
        this.processor = processor;
    }

    protected ProcessingOutcome process(String body, Message message) {
        String messageId = messageId(message);
        if (redelivered(message)) {
            log.warn("Redelivered voice command message {} (delivery {})", messageId, deliveryCount(message));
        } else {
            log.debug("Received voice command message {}", messageId);
        }

        try {
            ProcessingOutcome outcome = processor.handleJson(body);
            log.info("Voice command message {} -> {}", messageId, outcome);
            return outcome;
        } catch (RuntimeException e) {
            log.error("Unexpected failure processing voice command message {}", messageId, e);
            throw e;
        }
    }

    private static String messageId(Message message) {
        try {
            return message.getJMSMessageID();
        } catch (JMSException e) {
            log.debug("Message id not readable", e);
            return "unknown";
        }
    }

    private static boolean redelivered(Message message) {
        try {
            return message.getJMSRedelivered();
        } catch (JMSException e) {
            log.debug("Redelivered flag not readable", e);
            return false;
        }
    }

    private static int deliveryCount(Message message) {
        try {
            return message.propertyExists(DELIVERY_COUNT) ? message.getIntProperty(DELIVERY_COUNT) : 0;
        } catch (JMSException e) {
            log.debug("Delivery count not readable", e);
            return 0;
        }
    }
}
