package com.my.callsync.domain.port.out;

/**
 * 왜: 사용자 단위 작업(동기화 패스, 토큰 갱신)을 프로세스 경계를 넘어 직렬화하기 위함.
 */
public interface UserLeasePort {

    /**
     * 제한 시간 안에 리스를 획득하지 못하면 {@link com.my.callsync.domain.exception.LeaseUnavailableException}.
     */
    Lease acquire(String leaseKey);

    interface Lease extends AutoCloseable {
        String key();

        @Override
        void close();
    }
}
