package com.acme.voice.mq;

import com.ibm.mq.jakarta.jms.MQConnectionFactory;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import io.micronaut.jms.annotations.JMSConnectionFactory;
import jakarta.jms.ConnectionFactory;
import jakarta.jms.JMSException;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

import static com.ibm.msg.client.jakarta.jms.JmsConstants.*;
import static com.ibm.msg.client.jakarta.wmq.common.CommonConstants.*;

/**
 * IBM MQ client connection used by the voice command listener and the queue sender.
 * Connection details come from the MQ_* environment variables.
 */
@Slf4j
@Requires(notEnv = "test")
@Factory
public class IbmMqFactoryProvider {

    static final String APP_NAME = "voice-pipeline";

    private final Map<String, String> env;

    public IbmMqFactoryProvider() {
        this(System.getenv());
    }

    IbmMqFactoryProvider(Map<String, String> env) {
        this.env = env;
    }

    @JMSConnectionFactory("mqConnectionFactory")
    public ConnectionFactory mqConnectionFactory() throws JMSException {
        MQConnectionFactory cf = new MQConnectionFactory();
        cf.setTransportType(WMQ_CM_CLIENT);
        cf.setHostName(setting("MQ_HOST", "localhost"));
        cf.setPort(Integer.parseInt(setting("MQ_PORT", "1414")));
        cf.setQueueManager(setting("MQ_QMGR", "QM1"));
        cf.setChannel(setting("MQ_CHANNEL", "DEV.APP.SVRCONN"));
        cf.setAppName(APP_NAME);
        cf.setBooleanProperty(USER_AUTHENTICATION_MQCSP, true);
        cf.setStringProperty(USERID, setting("MQ_USER", "app"));
        cf.setStringProperty(PASSWORD, setting("MQ_PASS", "passw0rd"));

        // reconnect after queue manager restarts instead of failing the listener
        cf.setIntProperty(WMQ_CLIENT_RECONNECT_OPTIONS, WMQ_CLIENT_RECONNECT);
        cf.setIntProperty(WMQ_SHARE_CONV_ALLOWED, WMQ_SHARE_CONV_ALLOWED_YES);

        log.info("IBM MQ connection factory: {}:{} qmgr={} channel={}",
                cf.getHostName(), cf.getPort(), cf.getQueueManager(), cf.getChannel());
        return cf;
    }

    String setting(String name, String defaultValue) {
        String value = env.get(name);
        return value == null || value.isBlank() ? defaultValue : value;
    }
}
