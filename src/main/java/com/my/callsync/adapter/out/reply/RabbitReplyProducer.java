package com.my.callsync.adapter.out.reply;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.callsync.domain.model.ReplyMessage;
import com.my.callsync.domain.port.out.ReplyPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Channel;
import org.eclipse.microprofile.reactive.messaging.Emitter;

/**
 * 왜: 명령 응답을 RabbitMQ로 전달하는 기술적 구현을 분리하여 포트 계약을 지키기 위함.
 */
@ApplicationScoped
public class RabbitReplyProducer implements ReplyPort {

    private final Emitter<String> replyEmitter;
    private final ObjectMapper objectMapper;

    @Inject
    public RabbitReplyProducer(@Channel("calendar-replies") Emitter<String> replyEmitter, ObjectMapper objectMapper) {
        this.replyEmitter = replyEmitter;
        this.objectMapper = objectMapper;
    }

    @Override
    public void send(ReplyMessage replyMessage) {
        try {
            replyEmitter.send(objectMapper.writeValueAsString(replyMessage));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("응답 직렬화 실패: " + replyMessage.commandId(), e);
        }
    }
}
