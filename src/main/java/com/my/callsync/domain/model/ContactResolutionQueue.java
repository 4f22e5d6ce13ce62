package com.my.callsync.domain.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 왜: 미확인 참석자를 UI 프롬프트가 아닌 명시적 데이터로 보관해 해소 로직을 인터페이스와 독립적으로 검증하기 위함.
 * <p>
 * 이메일(소문자) 기준으로 중복을 제거하며 먼저 들어온 항목을 유지한다. 스레드 안전하지 않다.
 */
public final class ContactResolutionQueue {

    private final Map<String, PendingAttendee> entries = new LinkedHashMap<>();

    public ContactResolutionQueue() {
    }

    public ContactResolutionQueue(Collection<PendingAttendee> pending) {
        pending.forEach(this::offer);
    }

    /**
     * @return 새로 추가되었으면 true, 같은 이메일이 이미 있으면 false
     */
    public boolean offer(PendingAttendee attendee) {
        return entries.putIfAbsent(attendee.email(), attendee) == null;
    }

    public Optional<PendingAttendee> find(String email) {
        if (email == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(email.trim().toLowerCase(Locale.ROOT)));
    }

    public void resolve(String email) {
        entries.remove(email);
    }

    public List<PendingAttendee> pending() {
        return new ArrayList<>(entries.values());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
