package com.my.callsync.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.callsync.domain.exception.InvalidRequestException;
import com.my.callsync.domain.model.ReplyMessage;
import com.my.callsync.domain.port.out.ReplyPort;
import io.smallrye.mutiny.Uni;
import io.smallrye.reactive.messaging.annotations.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.io.IOException;

/**
 * 왜: 사용자가 요청한 캘린더 명령을 RabbitMQ에서 받아 디스패처로 넘기고 결과를 응답 채널로 돌려주는 단일 경로.
 * <p>
 * 명령 처리는 모두 동기 블로킹 호출이므로 워커 스레드에서 실행한다. 재시도는 하지 않는다.
 */
@ApplicationScoped
public class CalendarCommandConsumer {

    private static final Logger log = Logger.getLogger(CalendarCommandConsumer.class);

    private final CommandDispatcher dispatcher;
    private final ReplyPort replyPort;
    private final ObjectMapper objectMapper;

    @Inject
    public CalendarCommandConsumer(CommandDispatcher dispatcher, ReplyPort replyPort, ObjectMapper objectMapper) {
        this.dispatcher = dispatcher;
        this.replyPort = replyPort;
        this.objectMapper = objectMapper;
    }

    @Incoming("calendar-commands")
    @Blocking
    public Uni<Void> consume(Message<String> message) {
        return Uni.createFrom().item(() -> {
            handle(message.getPayload());
            return null;
        }).onItem().transformToUni(ignored -> Uni.createFrom().completionStage(message.ack()));
    }

    void handle(String payload) {
        IncomingCommand command;
        try {
            command = objectMapper.readValue(payload, IncomingCommand.class);
        } catch (IOException | InvalidRequestException e) {
            log.warnf("명령 파싱 실패로 처리 중단: %s", e.getMessage());
            return;
        }
        MDC.put("commandId", command.commandId());
        MDC.put("userId", command.userId());
        try {
            log.infof("명령 수신: %s", command.type());
            ReplyMessage reply = dispatcher.dispatch(command);
            replyPort.send(reply);
            log.infof("명령 처리 완료: %s -> %s", command.type(), reply.status());
        } finally {
            MDC.remove("commandId");
            MDC.remove("userId");
        }
    }
}
