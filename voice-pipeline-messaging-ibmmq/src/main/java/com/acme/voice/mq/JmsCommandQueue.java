package com.acme.voice.mq;

import com.acme.voice.core.TransientException;
import com.acme.voice.spi.CommandQueue;
import io.micronaut.context.annotation.Requires;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import jakarta.jms.Connection;
import jakarta.jms.ConnectionFactory;
import jakarta.jms.JMSException;
import jakarta.jms.MessageProducer;
import jakarta.jms.Queue;
import jakarta.jms.Session;
import jakarta.jms.TextMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Sends text messages over one shared JMS connection, keeping a session and an
 * anonymous producer per thread.
 */
@Slf4j
@Singleton
@Requires(beans = IbmMqFactoryProvider.class)
public class JmsCommandQueue implements CommandQueue {

    static final String HEADER_CORRELATION_ID = "correlationId";
    static final String HEADER_REPLY_TO = "replyTo";

    private final Connection connection;
    private final ThreadLocal<SessionHolder> sessions;

    public JmsCommandQueue(@Named("mqConnectionFactory") ConnectionFactory cf) {
        try {
            this.connection = cf.createConnection();
            this.connection.start();
            log.info("JMS connection started");
        } catch (JMSException e) {
            throw new IllegalStateException("Failed to initialize JMS connection", e);
        }
        this.sessions = ThreadLocal.withInitial(this::openSession);
    }

    @Override
    public void send(String queue, String body, Map<String, String> headers) {
        SessionHolder holder = sessions.get();
        try {
            Queue destination = holder.session.createQueue(queue);
            TextMessage message = holder.session.createTextMessage(body);
            if (headers != null) {
                applyHeaders(holder.session, message, headers);
            }
            holder.producer.send(destination, message);
            log.debug("Sent message to {}", queue);

        } catch (JMSException e) {
            // the session may be broken, open a fresh one on the next send
            holder.close();
            sessions.remove();
            log.error("Failed to send message to queue {}", queue, e);
            throw new TransientException("Failed to send message to queue: " + queue, e);
        }
    }

    private static void applyHeaders(Session session, TextMessage message, Map<String, String> headers)
            throws JMSException {
        for (Map.Entry<String, String> header : headers.entrySet()) {
            String key = header.getKey();
            if (HEADER_CORRELATION_ID.equals(key)) {
                message.setJMSCorrelationID(header.getValue());
            } else if (HEADER_REPLY_TO.equals(key)) {
                message.setJMSReplyTo(session.createQueue(header.getValue()));
            } else if (!key.startsWith("JMS_IBM_") && !key.startsWith("JMSX")) {
                message.setStringProperty(key, header.getValue());
            }
        }
    }

    private SessionHolder openSession() {
        try {
            log.debug("Opening JMS session for thread {}", Thread.currentThread().getName());
            return new SessionHolder(connection.createSession(false, Session.AUTO_ACKNOWLEDGE));
        } catch (JMSException e) {
            throw new TransientException("Failed to create JMS session", e);
        }
    }

    @PreDestroy
    void shutdown() {
        log.info("Closing JMS connection");
        sessions.remove();
        try {
            connection.close();
        } catch (JMSException e) {
            log.warn("Error closing JMS connection", e);
        }
    }

    private static final class SessionHolder {
        final Session session;
        final MessageProducer producer;

        SessionHolder(Session session) throws JMSException {
            this.session = session;
            this.producer = session.createProducer(null);
        }

        void close() {
            try {
                producer.close();
            } catch (JMSException e) {
                log.debug("Error closing producer", e);
            }
            try {
                session.close();
            } catch (JMSException e) {
                log.debug("Error closing session", e);
            }
        }
    }
}
