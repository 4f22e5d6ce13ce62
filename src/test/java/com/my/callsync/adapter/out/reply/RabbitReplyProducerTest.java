package com.my.callsync.adapter.out.reply;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.callsync.domain.model.ReplyMessage;
import org.eclipse.microprofile.reactive.messaging.Emitter;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class RabbitReplyProducerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void send_serializes_reply_and_emits() throws Exception {
        @SuppressWarnings("unchecked")
        Emitter<String> emitter = (Emitter<String>) mock(Emitter.class);
        RabbitReplyProducer producer = new RabbitReplyProducer(emitter, objectMapper);

        producer.send(new ReplyMessage("user-1", "cmd-1", "ok", Map.of("synced", 1)));

        ArgumentCaptor<String> payloadCaptor = ArgumentCaptor.forClass(String.class);
        verify(emitter).send(payloadCaptor.capture());
        JsonNode json = objectMapper.readTree(payloadCaptor.getValue());
        assertThat(json.path("replyToUserId").asText()).isEqualTo("user-1");
        assertThat(json.path("commandId").asText()).isEqualTo("cmd-1");
        assertThat(json.path("status").asText()).isEqualTo("ok");
        assertThat(json.path("payload").path("synced").asInt()).isEqualTo(1);
    }
}
