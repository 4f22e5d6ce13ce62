package com.my.callsync.adapter.out.google;

import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.http.HttpResponseException;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.util.DateTime;
import com.google.api.services.calendar.Calendar;
import com.google.api.services.calendar.model.Event;
import com.google.api.services.calendar.model.EventAttendee;
import com.google.api.services.calendar.model.EventDateTime;
import com.google.api.services.calendar.model.Events;
import com.my.callsync.config.AppConfig;
import com.my.callsync.domain.exception.NotFoundIgnorableException;
import com.my.callsync.domain.exception.ProviderException;
import com.my.callsync.domain.model.EventDraft;
import com.my.callsync.domain.model.EventStatus;
import com.my.callsync.domain.model.ExternalAttendee;
import com.my.callsync.domain.model.ExternalEvent;
import com.my.callsync.domain.model.TimeRange;
import com.my.callsync.domain.port.out.CalendarPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * 왜: Google Calendar v3 이벤트 API를 도메인 포트 계약에 맞게 구현하여 UTC 시각 규칙과 오류 상태 매핑을 일관되게 적용하기 위함.
 * <p>
 * 자동 재시도는 하지 않는다. 재시도 여부는 {@link ProviderException#isRetryable()}을 보고 호출자가 판단한다.
 */
@ApplicationScoped
public class GoogleCalendarAdapter implements CalendarPort {

    private static final Logger log = Logger.getLogger(GoogleCalendarAdapter.class);

    private static final String UTC = "UTC";
    private static final String ORDER_BY_START = "startTime";
    private static final String SEND_UPDATES_ALL = "all";

    private final HttpTransport httpTransport;
    private final JsonFactory jsonFactory;
    private final String applicationName;

    @Inject
    public GoogleCalendarAdapter(AppConfig appConfig) {
        this(GoogleTransports.trustedTransport(), GoogleTransports.jsonFactory(), appConfig.google().applicationName());
    }

    GoogleCalendarAdapter(HttpTransport httpTransport, JsonFactory jsonFactory, String applicationName) {
        this.httpTransport = httpTransport;
        this.jsonFactory = jsonFactory;
        this.applicationName = applicationName;
    }

    @Override
    public List<ExternalEvent> listEvents(String accessToken, String calendarId, TimeRange window, int maxResults) {
        try {
            Events events = client(accessToken).events().list(calendarId)
                    .setTimeMin(new DateTime(window.start().toEpochMilli()))
                    .setTimeMax(new DateTime(window.end().toEpochMilli()))
                    .setSingleEvents(true)
                    .setOrderBy(ORDER_BY_START)
                    .setMaxResults(maxResults)
                    .execute();
            List<Event> items = Optional.ofNullable(events.getItems()).orElse(List.of());
            return items.stream()
                    .map(this::toDomain)
                    .flatMap(Optional::stream)
                    .toList();
        } catch (HttpResponseException e) {
            throw providerError(e, "캘린더 이벤트 조회 실패");
        } catch (IOException e) {
            throw new ProviderException(ProviderException.TRANSPORT_FAILURE, "캘린더 이벤트 조회 중 전송 실패", e);
        }
    }

    @Override
    public String insertEvent(String accessToken, String calendarId, EventDraft draft, boolean notifyAttendees) {
        try {
            Calendar.Events.Insert insert = client(accessToken).events().insert(calendarId, toGoogleEvent(draft));
            if (notifyAttendees) {
                insert.setSendUpdates(SEND_UPDATES_ALL);
            }
            return insert.execute().getId();
        } catch (HttpResponseException e) {
            throw providerError(e, "캘린더 이벤트 생성 실패");
        } catch (IOException e) {
            throw new ProviderException(ProviderException.TRANSPORT_FAILURE, "캘린더 이벤트 생성 중 전송 실패", e);
        }
    }

    @Override
    public String updateEvent(String accessToken, String calendarId, String externalEventId,
                              EventDraft draft, boolean notifyAttendees) {
        try {
            Calendar.Events.Update update = client(accessToken).events()
                    .update(calendarId, externalEventId, toGoogleEvent(draft));
            if (notifyAttendees) {
                update.setSendUpdates(SEND_UPDATES_ALL);
            }
            return update.execute().getId();
        } catch (HttpResponseException e) {
            throw providerError(e, "캘린더 이벤트 수정 실패");
        } catch (IOException e) {
            throw new ProviderException(ProviderException.TRANSPORT_FAILURE, "캘린더 이벤트 수정 중 전송 실패", e);
        }
    }

    @Override
    public void deleteEvent(String accessToken, String calendarId, String externalEventId) {
        try {
            client(accessToken).events().delete(calendarId, externalEventId).execute();
        } catch (HttpResponseException e) {
            if (NotFoundIgnorableException.matches(e.getStatusCode())) {
                throw new NotFoundIgnorableException(e.getStatusCode(), externalEventId);
            }
            throw providerError(e, "캘린더 이벤트 삭제 실패");
        } catch (IOException e) {
            throw new ProviderException(ProviderException.TRANSPORT_FAILURE, "캘린더 이벤트 삭제 중 전송 실패", e);
        }
    }

    private Calendar client(String accessToken) {
        HttpRequestInitializer initializer = request -> {
            request.getHeaders().setAuthorization("Bearer " + accessToken);
            request.setConnectTimeout(GoogleTransports.CONNECT_TIMEOUT_MILLIS);
            request.setReadTimeout(GoogleTransports.READ_TIMEOUT_MILLIS);
        };
        return new Calendar.Builder(httpTransport, jsonFactory, initializer)
                .setApplicationName(applicationName)
                .build();
    }

    private ProviderException providerError(HttpResponseException e, String message) {
        log.warnf("%s: status=%d", message, e.getStatusCode());
        return new ProviderException(e.getStatusCode(), message + " (status=" + e.getStatusCode() + ")", e);
    }

    Event toGoogleEvent(EventDraft draft) {
        Event event = new Event()
                .setSummary(draft.summary())
                .setDescription(draft.description())
                .setLocation(draft.location())
                .setStart(toEventDateTime(draft.timeRange().start()))
                .setEnd(toEventDateTime(draft.timeRange().end()));
        if (draft.hasAttendee()) {
            event.setAttendees(List.of(new EventAttendee().setEmail(draft.attendeeEmail())));
        }
        return event;
    }

    private EventDateTime toEventDateTime(Instant instant) {
        return new EventDateTime()
                .setDateTime(new DateTime(instant.toEpochMilli()))
                .setTimeZone(UTC);
    }

    Optional<ExternalEvent> toDomain(Event item) {
        if (item.getId() == null || item.getStart() == null) {
            return Optional.empty();
        }
        boolean allDay = item.getStart().getDateTime() == null;
        Optional<Instant> start = toInstant(item.getStart());
        if (start.isEmpty()) {
            return Optional.empty();
        }
        Instant end = Optional.ofNullable(item.getEnd()).flatMap(this::toInstant).orElse(start.get());
        if (end.isBefore(start.get())) {
            end = start.get();
        }
        List<ExternalAttendee> attendees = Optional.ofNullable(item.getAttendees()).orElse(List.of()).stream()
                .map(attendee -> new ExternalAttendee(
                        attendee.getEmail(),
                        attendee.getDisplayName(),
                        Boolean.TRUE.equals(attendee.getSelf())))
                .toList();
        return Optional.of(new ExternalEvent(
                item.getId(),
                item.getSummary(),
                new TimeRange(start.get(), end),
                allDay,
                item.getLocation(),
                item.getDescription(),
                attendees,
                EventStatus.fromProvider(item.getStatus())
        ));
    }

    private Optional<Instant> toInstant(EventDateTime value) {
        if (value.getDateTime() != null) {
            return Optional.of(Instant.ofEpochMilli(value.getDateTime().getValue()));
        }
        if (value.getDate() != null) {
            LocalDate date = LocalDate.parse(value.getDate().toStringRfc3339());
            return Optional.of(date.atStartOfDay(ZoneOffset.UTC).toInstant());
        }
        return Optional.empty();
    }
}
