package com.improvtoolkit.ingest.service.session;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-session health counters. Updated from hardware callback threads and read by the supervising
 * loop, hence atomics throughout.
 *
 * <p>{@code reconnectAttempts} counts failed opens and goes back to zero on a successful open.
 * {@code restartsSinceHealthy} counts restarts after an active run (degraded or lost) and only goes
 * back to zero once a run has reported healthy data, so a device that opens but never works is
 * still capped.
 */
public final class DeviceHealth {

    private final int maxReconnectAttempts;
    private final AtomicInteger consecutiveErrors = new AtomicInteger();
    private final AtomicLong totalErrors = new AtomicLong();
    private final AtomicLong lastHeartbeatNanos;
    private final AtomicInteger reconnectAttempts = new AtomicInteger();
    private final AtomicInteger restartsSinceHealthy = new AtomicInteger();

    public DeviceHealth(int maxReconnectAttempts, long nowNanos) {
        if (maxReconnectAttempts <= 0) {
            throw new IllegalArgumentException("maxReconnectAttempts must be positive: " + maxReconnectAttempts);
        }
        this.maxReconnectAttempts = maxReconnectAttempts;
        this.lastHeartbeatNanos = new AtomicLong(nowNanos);
    }

    /** Successful open: attempts and consecutive errors reset, heartbeat set to now. */
    public void onConnected(long nowNanos) {
        reconnectAttempts.set(0);
        consecutiveErrors.set(0);
        lastHeartbeatNanos.set(nowNanos);
    }

    public void heartbeat(long nowNanos) {
        lastHeartbeatNanos.set(nowNanos);
    }

    /** Records one error (xrun, read glitch). Returns the new consecutive count. */
    public int recordError() {
        totalErrors.incrementAndGet();
        return consecutiveErrors.incrementAndGet();
    }

    public void clearConsecutiveErrors() {
        consecutiveErrors.set(0);
    }

    /** Records a failed (re)connect. Returns the attempts used so far. */
    public int recordReconnectAttempt() {
        return reconnectAttempts.incrementAndGet();
    }

    public boolean isRetryBudgetExhausted() {
        return reconnectAttempts.get() >= maxReconnectAttempts;
    }

    /** Records a restart after an active run. Returns the restarts since the last healthy run. */
    public int recordRestart() {
        return restartsSinceHealthy.incrementAndGet();
    }

    /** The current run delivered good data. */
    public void markHealthy() {
        restartsSinceHealthy.set(0);
    }

    public boolean isRestartBudgetExhausted() {
        return restartsSinceHealthy.get() >= maxReconnectAttempts;
    }

    public long heartbeatAgeNanos(long nowNanos) {
        return nowNanos - lastHeartbeatNanos.get();
    }

    public int consecutiveErrors() {
        return consecutiveErrors.get();
    }

    public long totalErrors() {
        return totalErrors.get();
    }

    public long lastHeartbeatNanos() {
        return lastHeartbeatNanos.get();
    }

    public int reconnectAttempts() {
        return reconnectAttempts.get();
    }

    public int restartsSinceHealthy() {
        return restartsSinceHealthy.get();
    }

    public int maxReconnectAttempts() {
        return maxReconnectAttempts;
    }

    @Override
    public String toString() {
        return "DeviceHealth[consecutiveErrors=" + consecutiveErrors.get()
                + ", totalErrors=" + totalErrors.get()
                + ", reconnectAttempts=" + reconnectAttempts.get() + "/" + maxReconnectAttempts
                + ", restartsSinceHealthy=" + restartsSinceHealthy.get() + "]";
    }
}
