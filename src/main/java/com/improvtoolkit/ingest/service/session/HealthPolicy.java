package com.improvtoolkit.ingest.service.session;

import java.time.Duration;

/**
 * Device-specific definition of "degraded". Evaluated periodically by the supervising loop.
 */
@FunctionalInterface
public interface HealthPolicy {

    /** Verdict of a single health evaluation. */
    enum Verdict { HEALTHY, ERROR_BURST, HEARTBEAT_TIMEOUT }

    Verdict evaluate(DeviceHealth health, long nowNanos);

    /** Degraded once {@code threshold} consecutive errors have been recorded. */
    static HealthPolicy errorBurst(int threshold) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive: " + threshold);
        }
        return (health, now) -> health.consecutiveErrors() >= threshold ? Verdict.ERROR_BURST : Verdict.HEALTHY;
    }

    /** Degraded when no heartbeat arrived within {@code timeout}. */
    static HealthPolicy heartbeat(Duration timeout) {
        long limit = timeout.toNanos();
        return (health, now) -> health.heartbeatAgeNanos(now) > limit ? Verdict.HEARTBEAT_TIMEOUT : Verdict.HEALTHY;
    }

    /** Never degraded; hard I/O errors are the only failure signal. */
    static HealthPolicy none() {
        return (health, now) -> Verdict.HEALTHY;
    }

    /** First non-healthy verdict of this policy or {@code other}. */
    default HealthPolicy or(HealthPolicy other) {
        return (health, now) -> {
            Verdict first = evaluate(health, now);
            return first != Verdict.HEALTHY ? first : other.evaluate(health, now);
        };
    }
}
