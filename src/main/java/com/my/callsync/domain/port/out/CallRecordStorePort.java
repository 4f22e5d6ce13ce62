package com.my.callsync.domain.port.out;

import com.my.callsync.domain.model.LocalCallRecord;

import java.util.Optional;
import java.util.Set;

/**
 * 왜: 통화 기록 원장과 (사용자, 공급자, 외부 이벤트 ID) 유일성 제약을 저장소 계약으로 고정하기 위함.
 */
public interface CallRecordStorePort {

    Optional<LocalCallRecord> findById(String userId, String recordId);

    /**
     * 이미 미러링된 외부 이벤트 ID 집합. 매 동기화 패스마다 새로 조회한다.
     */
    Set<String> findExternalEventIds(String userId, String provider);

    /**
     * 유일성 제약을 원자적으로 검사하며 삽입한다.
     *
     * @return 같은 외부 이벤트가 이미 미러링되어 있어 삽입하지 않았으면 false
     */
    boolean insertIfAbsent(LocalCallRecord record);

    /**
     * provider와 externalEventId가 모두 null이면 외부 참조를 지운다.
     */
    void updateExternalEvent(String userId, String recordId, String provider, String externalEventId);
}
