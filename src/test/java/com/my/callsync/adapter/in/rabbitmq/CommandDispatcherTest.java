package com.my.callsync.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.callsync.domain.exception.AuthExpiredException;
import com.my.callsync.domain.exception.AuthNotConnectedException;
import com.my.callsync.domain.exception.LeaseUnavailableException;
import com.my.callsync.domain.exception.ProviderException;
import com.my.callsync.domain.model.ConfirmResult;
import com.my.callsync.domain.model.ConfirmedAttendee;
import com.my.callsync.domain.model.ConnectionType;
import com.my.callsync.domain.model.PushAction;
import com.my.callsync.domain.model.PushRequest;
import com.my.callsync.domain.model.PushResult;
import com.my.callsync.domain.model.ReplyMessage;
import com.my.callsync.domain.model.SyncRequest;
import com.my.callsync.domain.model.SyncResult;
import com.my.callsync.domain.port.in.AvailabilityUseCase;
import com.my.callsync.domain.port.in.CalendarConnectionUseCase;
import com.my.callsync.domain.port.in.ConfirmPendingContactsUseCase;
import com.my.callsync.domain.port.in.PushCallRecordUseCase;
import com.my.callsync.domain.port.in.SyncCallsUseCase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CommandDispatcherTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private CalendarConnectionUseCase connectionUseCase;
    @Mock
    private SyncCallsUseCase syncCallsUseCase;
    @Mock
    private PushCallRecordUseCase pushCallRecordUseCase;
    @Mock
    private ConfirmPendingContactsUseCase confirmPendingContactsUseCase;
    @Mock
    private AvailabilityUseCase availabilityUseCase;

    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new CommandDispatcher(connectionUseCase, syncCallsUseCase, pushCallRecordUseCase,
                confirmPendingContactsUseCase, availabilityUseCase);
    }

    @Test
    void sync_command_passes_window_and_replies_ok() throws Exception {
        SyncResult result = new SyncResult(1, 2, List.of());
        when(syncCallsUseCase.sync(any())).thenReturn(result);

        ReplyMessage reply = dispatcher.dispatch(command("SYNC",
                "{\"ownerEmail\":\"me@example.com\",\"timeMin\":\"2026-02-01T00:00:00Z\",\"timeMax\":\"2026-03-01T00:00:00Z\"}"));

        ArgumentCaptor<SyncRequest> request = ArgumentCaptor.forClass(SyncRequest.class);
        verify(syncCallsUseCase).sync(request.capture());
        assertThat(request.getValue()).isEqualTo(new SyncRequest("user-1", "me@example.com",
                Instant.parse("2026-02-01T00:00:00Z"), Instant.parse("2026-03-01T00:00:00Z")));
        assertThat(reply.status()).isEqualTo(CommandDispatcher.STATUS_OK);
        assertThat(reply.commandId()).isEqualTo("cmd-1");
        assertThat(reply.replyToUserId()).isEqualTo("user-1");
        assertThat(reply.payload()).isEqualTo(result);
    }

    @Test
    void push_command_parses_action() throws Exception {
        when(pushCallRecordUseCase.apply(any())).thenReturn(new PushResult(PushAction.CREATE, "evt-1"));

        ReplyMessage reply = dispatcher.dispatch(command("PUSH",
                "{\"callRecordId\":\"rec-1\",\"action\":\"update\",\"attendeeEmail\":\"a@x.com\",\"notifyAttendees\":true}"));

        verify(pushCallRecordUseCase).apply(new PushRequest("user-1", "rec-1", PushAction.UPDATE, "a@x.com", true));
        assertThat(reply.status()).isEqualTo(CommandDispatcher.STATUS_OK);
    }

    @Test
    @SuppressWarnings("unchecked")
    void confirm_command_builds_approved_attendees() throws Exception {
        when(confirmPendingContactsUseCase.confirm(eq("user-1"), anyList())).thenReturn(new ConfirmResult(1, List.of()));

        ReplyMessage reply = dispatcher.dispatch(command("CONFIRM_CONTACTS", "{\"attendees\":[{"
                + "\"email\":\"Bob@y.com\",\"externalEventId\":\"evt-1\",\"eventTitle\":\"Coffee\","
                + "\"start\":\"2026-02-09T15:00:00Z\",\"end\":\"2026-02-09T15:30:00Z\","
                + "\"name\":\"Bob Lee\",\"firm\":\"Initech\",\"connectionType\":\"alumni\"}]}"));

        ArgumentCaptor<List<ConfirmedAttendee>> approved = ArgumentCaptor.forClass(List.class);
        verify(confirmPendingContactsUseCase).confirm(eq("user-1"), approved.capture());
        ConfirmedAttendee attendee = approved.getValue().get(0);
        assertThat(attendee.email()).isEqualTo("bob@y.com");
        assertThat(attendee.name()).isEqualTo("Bob Lee");
        assertThat(attendee.connectionType()).isEqualTo(ConnectionType.ALUMNI);
        assertThat(attendee.pending().externalEventId()).isEqualTo("evt-1");
        assertThat(reply.status()).isEqualTo(CommandDispatcher.STATUS_OK);
    }

    @Test
    void availability_with_draft_composes_body() throws Exception {
        when(availabilityUseCase.composeOutreach("user-1", LocalDate.of(2026, 2, 6), "Hi {{AVAILABILITY}}"))
                .thenReturn("Hi there");

        ReplyMessage reply = dispatcher.dispatch(command("AVAILABILITY",
                "{\"anchorDate\":\"2026-02-06\",\"draftBody\":\"Hi {{AVAILABILITY}}\"}"));

        assertThat(reply.payload()).isEqualTo(Map.of("body", "Hi there"));
    }

    @Test
    void auth_url_and_connect() throws Exception {
        when(connectionUseCase.authorizationUrl("user-1")).thenReturn("https://accounts.google.com/auth");

        ReplyMessage url = dispatcher.dispatch(command("AUTH_URL", "{}"));
        ReplyMessage connected = dispatcher.dispatch(command("CONNECT", "{\"code\":\"abc\"}"));

        assertThat(url.payload()).isEqualTo(Map.of("url", "https://accounts.google.com/auth"));
        verify(connectionUseCase).connect("user-1", "abc");
        assertThat(connected.status()).isEqualTo(CommandDispatcher.STATUS_OK);
    }

    @Test
    void exceptions_map_to_reply_statuses() throws Exception {
        assertThat(statusFor(new AuthNotConnectedException("user-1"))).isEqualTo(CommandDispatcher.STATUS_NOT_CONNECTED);
        assertThat(statusFor(new AuthExpiredException("user-1", null))).isEqualTo(CommandDispatcher.STATUS_RECONNECT);
        assertThat(statusFor(new ProviderException(503, "down"))).isEqualTo(CommandDispatcher.STATUS_RETRY);
        assertThat(statusFor(new ProviderException(403, "forbidden"))).isEqualTo(CommandDispatcher.STATUS_FAILED);
        assertThat(statusFor(new LeaseUnavailableException("sync:user-1"))).isEqualTo(CommandDispatcher.STATUS_RETRY);
        assertThat(statusFor(new IllegalStateException("db"))).isEqualTo(CommandDispatcher.STATUS_FAILED);
    }

    @Test
    void malformed_payload_is_invalid_without_calling_use_case() throws Exception {
        ReplyMessage badTime = dispatcher.dispatch(command("SYNC", "{\"timeMin\":\"yesterday\"}"));
        ReplyMessage missingRecord = dispatcher.dispatch(command("PUSH", "{\"action\":\"create\"}"));
        ReplyMessage badDate = dispatcher.dispatch(command("AVAILABILITY", "{\"anchorDate\":\"02/06\"}"));

        assertThat(badTime.status()).isEqualTo(CommandDispatcher.STATUS_INVALID);
        assertThat(missingRecord.status()).isEqualTo(CommandDispatcher.STATUS_INVALID);
        assertThat(badDate.status()).isEqualTo(CommandDispatcher.STATUS_INVALID);
        verifyNoInteractions(syncCallsUseCase, pushCallRecordUseCase, availabilityUseCase);
    }

    @Test
    void unknown_type_is_invalid() throws Exception {
        assertThat(dispatcher.dispatch(command("REBOOT", "{}")).status()).isEqualTo(CommandDispatcher.STATUS_INVALID);
    }

    private String statusFor(RuntimeException failure) throws Exception {
        doThrow(failure).when(connectionUseCase).authorizationUrl("user-1");
        return dispatcher.dispatch(command("AUTH_URL", "{}")).status();
    }

    private IncomingCommand command(String type, String payloadJson) throws Exception {
        return new IncomingCommand("cmd-1", "user-1", type, objectMapper.readTree(payloadJson));
    }
}
