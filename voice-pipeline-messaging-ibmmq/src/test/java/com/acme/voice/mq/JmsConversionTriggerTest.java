package com.acme.voice.mq;

import com.acme.voice.config.MessagingConfig;
import com.acme.voice.core.Jsons;
import com.acme.voice.spi.CommandQueue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JmsConversionTriggerTest {

    @Mock
    private CommandQueue commandQueue;

    @Test
    @SuppressWarnings("unchecked")
    void testTriggerQueuesJob() {
        JmsConversionTrigger trigger = new JmsConversionTrigger(commandQueue, new MessagingConfig());

        String jobId = trigger.trigger(42L, "auto");

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Map<String, String>> headers = ArgumentCaptor.forClass(Map.class);
        verify(commandQueue).send(eq("APP.CMD.BIMCONVERSION.Q"), body.capture(), headers.capture());

        Map<String, Object> job = Jsons.readMap(body.getValue());
        assertThat(job).containsEntry("model_id", 42)
                .containsEntry("conversion_type", "auto")
                .containsEntry("job_id", jobId);
        assertThat(headers.getValue())
                .containsEntry("correlationId", jobId)
                .containsEntry("commandType", "BimConversion");
    }

    @Test
    void testCustomQueueNaming() {
        MessagingConfig config = new MessagingConfig();
        config.getQueueNaming().setCommandPrefix("DEV.CMD.");
        config.setConversionCommand("IfcConversion");

        new JmsConversionTrigger(commandQueue, config).trigger(1L, "ifc");

        verify(commandQueue).send(eq("DEV.CMD.IFCCONVERSION.Q"), anyString(), anyMap());
    }

    @Test
    void testSendFailurePropagates() {
        doThrow(new IllegalStateException("queue full")).when(commandQueue).send(anyString(), anyString(), anyMap());

        assertThatThrownBy(() -> new JmsConversionTrigger(commandQueue, new MessagingConfig()).trigger(1L, "auto"))
                .hasMessage("queue full");
    }
}
