package com.my.callsync.adapter.in.rabbitmq;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.my.callsync.domain.exception.InvalidRequestException;

import java.util.Objects;

/**
 * 큐에서 받은 명령 봉투. payload 해석은 명령 유형별로 {@link CommandDispatcher}가 맡는다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IncomingCommand(String commandId,
                              String userId,
                              String type,
                              JsonNode payload) {

    public IncomingCommand {
        Objects.requireNonNull(commandId, "commandId");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(type, "type");
        if (commandId.isBlank() || userId.isBlank() || type.isBlank()) {
            throw new InvalidRequestException("명령 필드가 비어 있습니다.");
        }
        payload = payload == null || payload.isNull() ? JsonNodeFactory.instance.objectNode() : payload;
    }

    public CommandType commandType() {
        return CommandType.parse(type);
    }
}
