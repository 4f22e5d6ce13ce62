package com.my.callsync.domain.service;

import com.my.callsync.domain.exception.AuthExpiredException;
import com.my.callsync.domain.exception.AuthNotConnectedException;
import com.my.callsync.domain.exception.ProviderException;
import com.my.callsync.domain.model.BusyInterval;
import com.my.callsync.domain.model.OAuthCredential;
import com.my.callsync.domain.model.TimeRange;
import com.my.callsync.domain.model.WorkHourPolicy;
import com.my.callsync.domain.port.in.AvailabilityUseCase;
import com.my.callsync.domain.port.out.CredentialStorePort;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * 왜: 연결된 캘린더의 바쁜 구간으로 가용 시간을 계산하되, 캘린더를 쓸 수 없으면 전부 비어 있는 일정으로 낮춰 문구 생성이 멈추지 않게 하기 위함.
 */
public class AvailabilityService implements AvailabilityUseCase {

    private static final Logger log = Logger.getLogger(AvailabilityService.class);
    private static final LocalTime ANCHOR_TIME = LocalTime.NOON;

    private final CredentialStorePort credentialStore;
    private final CalendarClient calendarClient;
    private final AvailabilityComputer computer;
    private final OutreachComposer composer;
    private final WorkHourPolicy policy;
    private final int targetWeekdays;
    private final int maxScanDays;
    private final Duration lookahead;

    public AvailabilityService(CredentialStorePort credentialStore,
                               CalendarClient calendarClient,
                               AvailabilityComputer computer,
                               OutreachComposer composer,
                               WorkHourPolicy policy,
                               int targetWeekdays,
                               int maxScanDays,
                               Duration lookahead) {
        this.credentialStore = credentialStore;
        this.calendarClient = calendarClient;
        this.computer = computer;
        this.composer = composer;
        this.policy = policy;
        this.targetWeekdays = targetWeekdays;
        this.maxScanDays = maxScanDays;
        this.lookahead = lookahead;
    }

    @Override
    public List<String> availability(String userId, LocalDate anchor) {
        List<BusyInterval> busy = fetchBusy(userId, anchor);
        List<String> lines = computer.computeLines(busy, anchor, policy, targetWeekdays, maxScanDays);
        if (lines.isEmpty()) {
            return computer.computeLines(List.of(), anchor, policy, targetWeekdays, maxScanDays);
        }
        return lines;
    }

    @Override
    public String composeOutreach(String userId, LocalDate anchor, String draftBody) {
        return composer.compose(draftBody, availability(userId, anchor));
    }

    /**
     * {@code [anchor 12:00Z, +lookahead)}. 마지막 스캔일의 근무 종료 시각이 그보다 늦으면 그 시각까지 넓힌다.
     */
    TimeRange fetchWindow(LocalDate anchor) {
        Instant start = anchor.atTime(ANCHOR_TIME).toInstant(ZoneOffset.UTC);
        Instant lastScannedEnd = anchor.plusDays(maxScanDays)
                .atStartOfDay()
                .plusHours(policy.endHour())
                .toInstant(policy.utcOffset());
        Instant end = start.plus(lookahead);
        return new TimeRange(start, lastScannedEnd.isAfter(end) ? lastScannedEnd : end);
    }

    private List<BusyInterval> fetchBusy(String userId, LocalDate anchor) {
        Optional<OAuthCredential> credential = credentialStore.find(userId);
        if (credential.isEmpty()) {
            return List.of();
        }
        TimeRange window = fetchWindow(anchor);
        try {
            List<BusyInterval> busy = calendarClient.busyIntervals(credential.get(), credential.get().calendarId(), window);
            log.debugf("바쁜 구간 %d건을 조회했습니다: userId=%s", busy.size(), userId);
            return busy;
        } catch (AuthExpiredException | AuthNotConnectedException | ProviderException e) {
            log.warnf("캘린더 가용 시간 조회 실패, 전체 가용으로 계산합니다: userId=%s, cause=%s", userId, e.getMessage());
            return List.of();
        }
    }
}
