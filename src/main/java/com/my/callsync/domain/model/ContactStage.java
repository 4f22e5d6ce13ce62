package com.my.callsync.domain.model;

/**
 * 파이프라인 단계. 선언 순서가 곧 진행 순서다.
 */
public enum ContactStage {
    RESEARCHING,
    MESSAGED,
    SCHEDULED,
    CALL_DONE,
    STRONG_CONNECTION,
    REFERRAL_REQUESTED,
    INTERVIEW,
    OFFER;

    public boolean precedes(ContactStage other) {
        return ordinal() < other.ordinal();
    }
}
