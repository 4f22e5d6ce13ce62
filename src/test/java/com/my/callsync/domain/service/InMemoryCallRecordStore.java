package com.my.callsync.domain.service;

import com.my.callsync.domain.model.LocalCallRecord;
import com.my.callsync.domain.port.out.CallRecordStorePort;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * (사용자, 공급자, 외부 ID) 유일성을 SQLite와 같은 규칙으로 지키는 테스트용 저장소.
 */
class InMemoryCallRecordStore implements CallRecordStorePort {

    private final Map<String, LocalCallRecord> records = new LinkedHashMap<>();

    @Override
    public synchronized Optional<LocalCallRecord> findById(String userId, String recordId) {
        return Optional.ofNullable(records.get(recordId)).filter(record -> record.userId().equals(userId));
    }

    @Override
    public synchronized Set<String> findExternalEventIds(String userId, String provider) {
        return records.values().stream()
                .filter(record -> record.userId().equals(userId))
                .filter(record -> Objects.equals(record.externalProvider(), provider))
                .filter(LocalCallRecord::hasExternalEvent)
                .map(LocalCallRecord::externalEventId)
                .collect(Collectors.toSet());
    }

    @Override
    public synchronized boolean insertIfAbsent(LocalCallRecord record) {
        if (records.containsKey(record.id())) {
            return false;
        }
        if (record.hasExternalEvent() && findExternalEventIds(record.userId(), record.externalProvider())
                .contains(record.externalEventId())) {
            return false;
        }
        records.put(record.id(), record);
        return true;
    }

    @Override
    public synchronized void updateExternalEvent(String userId, String recordId, String provider, String externalEventId) {
        findById(userId, recordId).ifPresent(record ->
                records.put(recordId, record.withExternalEvent(provider, externalEventId)));
    }

    synchronized void put(LocalCallRecord record) {
        records.put(record.id(), record);
    }

    synchronized List<LocalCallRecord> all() {
        return new ArrayList<>(records.values());
    }
}
