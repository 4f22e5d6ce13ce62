package com.my.callsync.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.JsonNode;
import com.my.callsync.domain.exception.AuthExpiredException;
import com.my.callsync.domain.exception.AuthNotConnectedException;
import com.my.callsync.domain.exception.InvalidRequestException;
import com.my.callsync.domain.exception.LeaseUnavailableException;
import com.my.callsync.domain.exception.ProviderException;
import com.my.callsync.domain.model.ConfirmedAttendee;
import com.my.callsync.domain.model.ConnectionType;
import com.my.callsync.domain.model.PendingAttendee;
import com.my.callsync.domain.model.PushAction;
import com.my.callsync.domain.model.PushRequest;
import com.my.callsync.domain.model.ReplyMessage;
import com.my.callsync.domain.model.SyncRequest;
import com.my.callsync.domain.model.TimeRange;
import com.my.callsync.domain.port.in.AvailabilityUseCase;
import com.my.callsync.domain.port.in.CalendarConnectionUseCase;
import com.my.callsync.domain.port.in.ConfirmPendingContactsUseCase;
import com.my.callsync.domain.port.in.PushCallRecordUseCase;
import com.my.callsync.domain.port.in.SyncCallsUseCase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 왜: 명령 유형별 payload 해석과 도메인 예외의 응답 상태 변환을 한곳에 모아 소비자는 전송만 담당하게 하기 위함.
 */
@ApplicationScoped
public class CommandDispatcher {

    static final String STATUS_OK = "ok";
    static final String STATUS_NOT_CONNECTED = "not_connected";
    static final String STATUS_RECONNECT = "reconnect";
    static final String STATUS_RETRY = "retry";
    static final String STATUS_FAILED = "failed";
    static final String STATUS_INVALID = "invalid";

    private static final Logger log = Logger.getLogger(CommandDispatcher.class);

    private final CalendarConnectionUseCase connectionUseCase;
    private final SyncCallsUseCase syncCallsUseCase;
    private final PushCallRecordUseCase pushCallRecordUseCase;
    private final ConfirmPendingContactsUseCase confirmPendingContactsUseCase;
    private final AvailabilityUseCase availabilityUseCase;

    @Inject
    public CommandDispatcher(CalendarConnectionUseCase connectionUseCase,
                             SyncCallsUseCase syncCallsUseCase,
                             PushCallRecordUseCase pushCallRecordUseCase,
                             ConfirmPendingContactsUseCase confirmPendingContactsUseCase,
                             AvailabilityUseCase availabilityUseCase) {
        this.connectionUseCase = connectionUseCase;
        this.syncCallsUseCase = syncCallsUseCase;
        this.pushCallRecordUseCase = pushCallRecordUseCase;
        this.confirmPendingContactsUseCase = confirmPendingContactsUseCase;
        this.availabilityUseCase = availabilityUseCase;
    }

    public ReplyMessage dispatch(IncomingCommand command) {
        String userId = command.userId();
        try {
            Object result = execute(command.commandType(), userId, command.payload());
            return reply(command, STATUS_OK, result);
        } catch (InvalidRequestException e) {
            log.warnf("명령 검증 실패: %s", e.getMessage());
            return failure(command, STATUS_INVALID, e);
        } catch (AuthNotConnectedException e) {
            log.infof("캘린더 미연결 사용자: %s", userId);
            return failure(command, STATUS_NOT_CONNECTED, e);
        } catch (AuthExpiredException e) {
            log.warnf("토큰 갱신 실패로 재연결 필요: %s", userId);
            return failure(command, STATUS_RECONNECT, e);
        } catch (LeaseUnavailableException e) {
            log.warnf("다른 작업이 진행 중입니다: %s", e.leaseKey());
            return failure(command, STATUS_RETRY, e);
        } catch (ProviderException e) {
            log.warnf("캘린더 제공자 오류 status=%d: %s", e.status(), e.getMessage());
            return failure(command, e.isRetryable() ? STATUS_RETRY : STATUS_FAILED, e);
        } catch (RuntimeException e) {
            log.errorf(e, "명령 처리 실패: %s", command.commandId());
            return failure(command, STATUS_FAILED, e);
        }
    }

    private Object execute(CommandType type, String userId, JsonNode payload) {
        return switch (type) {
            case AUTH_URL -> Map.of("url", connectionUseCase.authorizationUrl(userId));
            case CONNECT -> {
                connectionUseCase.connect(userId, text(payload, "code"));
                yield Map.of("connected", true);
            }
            case DISCONNECT -> {
                connectionUseCase.disconnect(userId);
                yield Map.of("connected", false);
            }
            case SYNC -> syncCallsUseCase.sync(new SyncRequest(
                    userId,
                    text(payload, "ownerEmail"),
                    instant(payload, "timeMin"),
                    instant(payload, "timeMax")));
            case PUSH -> pushCallRecordUseCase.apply(new PushRequest(
                    userId,
                    requireText(payload, "callRecordId"),
                    PushAction.parse(text(payload, "action")),
                    text(payload, "attendeeEmail"),
                    payload.path("notifyAttendees").asBoolean(false)));
            case CONFIRM_CONTACTS -> confirmPendingContactsUseCase.confirm(userId, confirmedAttendees(payload));
            case AVAILABILITY -> availability(userId, payload);
        };
    }

    private Object availability(String userId, JsonNode payload) {
        LocalDate anchor = localDate(payload, "anchorDate");
        String draftBody = text(payload, "draftBody");
        if (draftBody != null) {
            return Map.of("body", availabilityUseCase.composeOutreach(userId, anchor, draftBody));
        }
        return Map.of("lines", availabilityUseCase.availability(userId, anchor));
    }

    private List<ConfirmedAttendee> confirmedAttendees(JsonNode payload) {
        JsonNode attendees = payload.path("attendees");
        if (!attendees.isArray()) {
            throw new InvalidRequestException("attendees 배열이 필요합니다.");
        }
        List<ConfirmedAttendee> approved = new ArrayList<>();
        for (JsonNode node : attendees) {
            PendingAttendee pending;
            try {
                pending = new PendingAttendee(
                        requireText(node, "email"),
                        text(node, "displayName"),
                        requireText(node, "externalEventId"),
                        text(node, "eventTitle"),
                        new TimeRange(instant(node, "start"), instant(node, "end")),
                        text(node, "location"),
                        text(node, "notes"));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new InvalidRequestException("보류 참석자 형식이 올바르지 않습니다.", e);
            }
            approved.add(new ConfirmedAttendee(
                    pending,
                    text(node, "name"),
                    text(node, "firm"),
                    text(node, "position"),
                    connectionType(text(node, "connectionType"))));
        }
        return approved;
    }

    private static ConnectionType connectionType(String value) {
        if (value == null) {
            return null;
        }
        try {
            return ConnectionType.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("지원하지 않는 connectionType입니다: " + value, e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static String requireText(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null) {
            throw new InvalidRequestException(field + " 필드가 필요합니다.");
        }
        return value;
    }

    private static Instant instant(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new InvalidRequestException(field + " 형식이 올바르지 않습니다: " + value, e);
        }
    }

    private static LocalDate localDate(JsonNode node, String field) {
        String value = requireText(node, field);
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new InvalidRequestException(field + " 형식이 올바르지 않습니다: " + value, e);
        }
    }

    private static ReplyMessage reply(IncomingCommand command, String status, Object payload) {
        return new ReplyMessage(command.userId(), command.commandId(), status, payload);
    }

    private static ReplyMessage failure(IncomingCommand command, String status, RuntimeException e) {
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        return reply(command, status, Map.of("message", message));
    }
}
