package com.my.callsync.domain.port.in;

import java.time.LocalDate;
import java.util.List;

public interface AvailabilityUseCase {

    /**
     * anchor 다음 날부터 평일 가용 시간 문구를 계산한다.
     */
    List<String> availability(String userId, LocalDate anchor);

    /**
     * 초안의 가용 시간 자리표시자를 계산된 문구로 치환한다.
     */
    String composeOutreach(String userId, LocalDate anchor, String draftBody);
}
