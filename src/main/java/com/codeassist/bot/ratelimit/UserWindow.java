package com.codeassist.bot.ratelimit;

import java.util.ArrayDeque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Request log for a single user key, guarded by its own lock.
 *
 * Timestamps are epoch milliseconds appended at the tail, so the deque is
 * always oldest-first. Every method except {@link #lock()} must be called
 * while holding the lock.
 *
 * A window removed by a sweep is marked retired before it leaves the map;
 * a caller that locks a retired window must look the key up again.
 */
final class UserWindow {

    private final ArrayDeque<Long> timestamps = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private boolean retired;

    ReentrantLock lock() {
        return lock;
    }

    void evictOlderThan(long nowMillis, long windowMillis) {
        while (!timestamps.isEmpty() && nowMillis - timestamps.peekFirst() > windowMillis) {
            timestamps.removeFirst();
        }
    }

    int size() {
        return timestamps.size();
    }

    boolean isEmpty() {
        return timestamps.isEmpty();
    }

    long oldest() {
        return timestamps.peekFirst();
    }

    /**
     * Appends a timestamp, clamped to the newest one so the deque stays
     * ordered when callers read their clocks before racing for the lock.
     */
    void record(long nowMillis) {
        Long newest = timestamps.peekLast();
        timestamps.addLast(newest == null ? nowMillis : Math.max(newest, nowMillis));
    }

    boolean isRetired() {
        return retired;
    }

    void retire() {
        retired = true;
    }
}
