package com.parcel.search.resilience;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Opens after {@code failureThreshold} consecutive failures and rejects calls for
 * {@code openDurationMs}; the first call after that window is let through again.
 */
public class CircuitBreaker {
    private final int failureThreshold;
    private final long openDurationMs;
    private final Clock clock;
    private final AtomicInteger failureCount = new AtomicInteger(0);
    private final AtomicLong openUntilMs = new AtomicLong(0L);

    public CircuitBreaker(int failureThreshold, long openDurationMs) {
        this(failureThreshold, openDurationMs, Clock.systemUTC());
    }

    public CircuitBreaker(int failureThreshold, long openDurationMs, Clock clock) {
        this.failureThreshold = Math.max(1, failureThreshold);
        this.openDurationMs = Math.max(1L, openDurationMs);
        this.clock = clock;
    }

    public boolean allowRequest() {
        return clock.millis() >= openUntilMs.get();
    }

    public boolean isOpen() {
        return !allowRequest();
    }

    public void recordSuccess() {
        failureCount.set(0);
    }

    public void recordFailure() {
        int failures = failureCount.incrementAndGet();
        if (failures >= failureThreshold) {
            openUntilMs.set(clock.millis() + openDurationMs);
            failureCount.set(0);
        }
    }
}
