package com.my.callsync.domain.port.in;

import com.my.callsync.domain.model.PushRequest;
import com.my.callsync.domain.model.PushResult;

public interface PushCallRecordUseCase {
    PushResult apply(PushRequest request);
}
