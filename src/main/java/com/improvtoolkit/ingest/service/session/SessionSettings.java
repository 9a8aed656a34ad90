package com.improvtoolkit.ingest.service.session;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry and supervision settings shared by every device session.
 *
 * @param maxReconnectAttempts failed (re)connects tolerated before the device is declared dead
 * @param reconnectDelay       fixed backoff before each reattempt
 * @param superviseInterval    how often an active session re-evaluates health and cancellation
 */
public record SessionSettings(int maxReconnectAttempts, Duration reconnectDelay, Duration superviseInterval) {

    public SessionSettings {
        if (maxReconnectAttempts <= 0) {
            throw new IllegalArgumentException("maxReconnectAttempts must be positive: " + maxReconnectAttempts);
        }
        Objects.requireNonNull(reconnectDelay, "reconnectDelay");
        Objects.requireNonNull(superviseInterval, "superviseInterval");
        if (reconnectDelay.isNegative()) {
            throw new IllegalArgumentException("reconnectDelay must not be negative");
        }
        if (superviseInterval.isZero() || superviseInterval.isNegative()) {
            throw new IllegalArgumentException("superviseInterval must be positive");
        }
    }
}
