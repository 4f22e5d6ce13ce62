package com.my.callsync.domain.service;

import com.my.callsync.domain.exception.InvalidRequestException;
import com.my.callsync.domain.model.AvailabilityWindow;
import com.my.callsync.domain.model.BusyInterval;
import com.my.callsync.domain.model.FreeRange;
import com.my.callsync.domain.model.WorkHourPolicy;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 바쁜 구간을 평일별 빈 시간대로 바꾸는 순수 함수. 네트워크와 난수를 사용하지 않는다.
 * <p>
 * anchor 다음 날부터 최대 {@code maxScanDays}일을 훑으며 주말을 건너뛰고, 평일 {@code targetWeekdays}개를 살펴보면 멈춘다.
 * 일정이 꽉 찬 평일도 개수에 포함되지만 결과에는 나타나지 않는다.
 * 시간대는 정책의 고정 UTC 오프셋을 따르며 일광 절약 시간 전환은 반영하지 않는다.
 */
public class AvailabilityComputer {

    public List<String> computeLines(List<BusyInterval> busy, LocalDate anchor, WorkHourPolicy policy,
                                     int targetWeekdays, int maxScanDays) {
        return computeWindows(busy, anchor, policy, targetWeekdays, maxScanDays).stream()
                .map(window -> window.format(policy.zoneLabel()))
                .toList();
    }

    public List<AvailabilityWindow> computeWindows(List<BusyInterval> busy, LocalDate anchor, WorkHourPolicy policy,
                                                   int targetWeekdays, int maxScanDays) {
        if (anchor == null || policy == null) {
            throw new InvalidRequestException("anchor와 policy가 필요합니다.");
        }
        if (targetWeekdays <= 0 || maxScanDays <= 0) {
            throw new InvalidRequestException("평일 목표 개수와 탐색 일수는 양수여야 합니다.");
        }
        List<BusyInterval> intervals = busy == null ? List.of() : busy;
        List<AvailabilityWindow> windows = new ArrayList<>();
        int weekdaysFound = 0;
        for (int offset = 1; weekdaysFound < targetWeekdays && offset <= maxScanDays; offset++) {
            LocalDate day = anchor.plusDays(offset);
            if (isWeekend(day)) {
                continue;
            }
            weekdaysFound++;
            List<FreeRange> free = freeRanges(intervals, day, policy);
            if (free.isEmpty()) {
                continue;
            }
            boolean fullyFree = free.size() == 1
                    && free.get(0).startHour() == policy.startHour()
                    && free.get(0).endHour() == policy.endHour();
            windows.add(new AvailabilityWindow(day, free, fullyFree));
        }
        return windows;
    }

    private List<FreeRange> freeRanges(List<BusyInterval> intervals, LocalDate day, WorkHourPolicy policy) {
        List<FreeRange> ranges = new ArrayList<>();
        Integer rangeStart = null;
        for (int hour = policy.startHour(); hour < policy.endHour(); hour++) {
            if (!isBusy(intervals, day, hour, policy)) {
                if (rangeStart == null) {
                    rangeStart = hour;
                }
            } else if (rangeStart != null) {
                ranges.add(new FreeRange(rangeStart, hour));
                rangeStart = null;
            }
        }
        if (rangeStart != null) {
            ranges.add(new FreeRange(rangeStart, policy.endHour()));
        }
        return ranges;
    }

    private boolean isBusy(List<BusyInterval> intervals, LocalDate day, int hour, WorkHourPolicy policy) {
        LocalDateTime localSlotStart = day.atStartOfDay().plusHours(hour);
        Instant slotStart = localSlotStart.toInstant(policy.utcOffset());
        Instant slotEnd = localSlotStart.plusHours(1).toInstant(policy.utcOffset());
        for (BusyInterval interval : intervals) {
            if (interval.overlaps(slotStart, slotEnd)) {
                return true;
            }
        }
        return false;
    }

    private boolean isWeekend(LocalDate day) {
        DayOfWeek dayOfWeek = day.getDayOfWeek();
        return dayOfWeek == DayOfWeek.SATURDAY || dayOfWeek == DayOfWeek.SUNDAY;
    }
}
