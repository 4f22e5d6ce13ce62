package com.my.callsync.domain.service;

import com.my.callsync.domain.port.out.UserLeasePort;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 키별 락으로 리스를 흉내 내고 획득한 키를 기록한다.
 */
class LockingUserLease implements UserLeasePort {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final List<String> acquired = new CopyOnWriteArrayList<>();

    @Override
    public Lease acquire(String leaseKey) {
        ReentrantLock lock = locks.computeIfAbsent(leaseKey, key -> new ReentrantLock());
        lock.lock();
        acquired.add(leaseKey);
        return new Lease() {
            @Override
            public String key() {
                return leaseKey;
            }

            @Override
            public void close() {
                lock.unlock();
            }
        };
    }

    List<String> acquiredKeys() {
        return acquired;
    }
}
