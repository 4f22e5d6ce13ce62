package com.my.callsync.domain.exception;

/**
 * 같은 사용자에 대한 다른 작업이 리스를 쥐고 있어 제한 시간 안에 획득하지 못한 경우.
 */
public class LeaseUnavailableException extends RuntimeException {

    private final String leaseKey;

    public LeaseUnavailableException(String leaseKey) {
        super("리스를 획득하지 못했습니다: " + leaseKey);
        this.leaseKey = leaseKey;
    }

    public String leaseKey() {
        return leaseKey;
    }
}
