package com.my.callsync.domain.port.out;

import com.my.callsync.domain.model.EventDraft;
import com.my.callsync.domain.model.ExternalEvent;
import com.my.callsync.domain.model.TimeRange;

import java.util.List;

/**
 * 왜: 외부 캘린더 REST 표면(list/insert/update/delete)을 SDK와 분리해 도메인이 베어러 토큰만 넘기도록 하기 위함.
 * <p>
 * HTTP 실패는 {@link com.my.callsync.domain.exception.ProviderException}, 삭제 시 404/410은
 * {@link com.my.callsync.domain.exception.NotFoundIgnorableException}으로 알린다.
 */
public interface CalendarPort {

    /**
     * 반복 일정을 개별 인스턴스로 펼치고 시작 시각 순으로 정렬된 이벤트를 최대 maxResults 건까지 반환한다. 페이지 순회는 하지 않는다.
     */
    List<ExternalEvent> listEvents(String accessToken, String calendarId, TimeRange window, int maxResults);

    /**
     * @return 생성된 외부 이벤트 ID
     */
    String insertEvent(String accessToken, String calendarId, EventDraft draft, boolean notifyAttendees);

    String updateEvent(String accessToken, String calendarId, String externalEventId, EventDraft draft, boolean notifyAttendees);

    void deleteEvent(String accessToken, String calendarId, String externalEventId);
}
