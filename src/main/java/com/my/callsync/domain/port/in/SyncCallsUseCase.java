package com.my.callsync.domain.port.in;

import com.my.callsync.domain.model.SyncRequest;
import com.my.callsync.domain.model.SyncResult;

/**
 * 왜: 외부 캘린더 이벤트를 통화 기록으로 끌어오는 동기화 패스의 단일 진입점.
 */
public interface SyncCallsUseCase {
    SyncResult sync(SyncRequest request);
}
