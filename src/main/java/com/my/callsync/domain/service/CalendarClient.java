package com.my.callsync.domain.service;

import com.my.callsync.domain.exception.NotFoundIgnorableException;
import com.my.callsync.domain.model.BusyInterval;
import com.my.callsync.domain.model.EventDraft;
import com.my.callsync.domain.model.ExternalEvent;
import com.my.callsync.domain.model.OAuthCredential;
import com.my.callsync.domain.model.TimeRange;
import com.my.callsync.domain.port.out.CalendarPort;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * 왜: 외부 캘린더 읽기/쓰기 전에 항상 유효한 베어러 토큰을 확보하고, 공급자 오류 규칙(삭제 시 not-found 허용)을 일관되게 적용하기 위함.
 */
public class CalendarClient {

    private static final Logger log = Logger.getLogger(CalendarClient.class);

    private final TokenVault tokenVault;
    private final CalendarPort calendarPort;
    private final int maxResults;

    public CalendarClient(TokenVault tokenVault, CalendarPort calendarPort, int maxResults) {
        this.tokenVault = tokenVault;
        this.calendarPort = calendarPort;
        this.maxResults = maxResults;
    }

    /**
     * 개별 인스턴스로 펼친 이벤트를 시작 순으로 반환한다. 취소 상태도 그대로 포함되므로 필요하면 호출자가 거른다.
     */
    public List<ExternalEvent> listEvents(OAuthCredential credential, String calendarId, TimeRange window) {
        OAuthCredential fresh = tokenVault.ensureFresh(credential);
        return calendarPort.listEvents(fresh.accessToken(), calendarId, window, maxResults);
    }

    /**
     * 취소되지 않았고 구체적인 시작/종료 시각을 가진 이벤트만 바쁜 구간으로 변환한다.
     */
    public List<BusyInterval> busyIntervals(OAuthCredential credential, String calendarId, TimeRange window) {
        return listEvents(credential, calendarId, window).stream()
                .filter(event -> !event.isCancelled())
                .filter(ExternalEvent::hasConcreteTimes)
                .map(BusyInterval::of)
                .toList();
    }

    public String createEvent(OAuthCredential credential, String calendarId, EventDraft draft, boolean notifyAttendees) {
        OAuthCredential fresh = tokenVault.ensureFresh(credential);
        return calendarPort.insertEvent(fresh.accessToken(), calendarId, draft, notifyAttendees && draft.hasAttendee());
    }

    public String updateEvent(OAuthCredential credential, String calendarId, EventDraft draft,
                              String externalEventId, boolean notifyAttendees) {
        OAuthCredential fresh = tokenVault.ensureFresh(credential);
        return calendarPort.updateEvent(fresh.accessToken(), calendarId, externalEventId, draft,
                notifyAttendees && draft.hasAttendee());
    }

    /**
     * @return 실제로 삭제했으면 true, 이미 사라져 있었으면 false
     */
    public boolean deleteEvent(OAuthCredential credential, String calendarId, String externalEventId) {
        OAuthCredential fresh = tokenVault.ensureFresh(credential);
        try {
            calendarPort.deleteEvent(fresh.accessToken(), calendarId, externalEventId);
            return true;
        } catch (NotFoundIgnorableException e) {
            log.infof("이미 삭제된 외부 이벤트입니다: eventId=%s, status=%d", externalEventId, e.status());
            return false;
        }
    }
}
