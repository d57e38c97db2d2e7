package com.phillippitts.windowanalysis.service.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Call timestamps for one provider within the trailing window.
 *
 * <p>Eviction, the limit check and recording the new timestamp happen under one lock,
 * so the number of retained timestamps never exceeds {@code limit}.
 */
final class RateLimitWindow {

    private final Duration window;
    private final int limit;
    private final Deque<Instant> calls = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    RateLimitWindow(String providerId, Duration window, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive for provider " + providerId);
        }
        this.window = window;
        this.limit = limit;
    }

    boolean tryRecord(Instant now) {
        lock.lock();
        try {
            evictExpired(now);
            if (calls.size() >= limit) {
                return false;
            }
            calls.addLast(now);
            return true;
        } finally {
            lock.unlock();
        }
    }

    int remaining(Instant now) {
        lock.lock();
        try {
            evictExpired(now);
            return Math.max(0, limit - calls.size());
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return calls.size();
        } finally {
            lock.unlock();
        }
    }

    private void evictExpired(Instant now) {
        Instant windowStart = now.minus(window);
        while (!calls.isEmpty() && !calls.peekFirst().isAfter(windowStart)) {
            calls.pollFirst();
        }
    }

    Duration window() {
        return window;
    }

    int limit() {
        return limit;
    }
}
