package com.improvtoolkit.ingest.config.properties;

import com.improvtoolkit.ingest.service.session.SessionSettings;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Reconnect and supervision policy shared by microphone and button sessions.
 */
@Validated
@ConfigurationProperties(prefix = "ingest.session")
public class DeviceSessionProperties {

    /** Failed (re)connects tolerated before a device is declared dead. */
    @Positive(message = "Max reconnect attempts must be positive")
    private int maxReconnectAttempts = 5;

    /** Fixed delay before each reconnect attempt, in milliseconds. */
    @Min(value = 0, message = "Reconnect delay must not be negative")
    private long reconnectDelayMs = 500;

    /** Liveness window: no device callback within this time forces a stream restart. */
    @Positive(message = "Heartbeat timeout must be positive")
    private long heartbeatTimeoutMs = 2_000;

    /** How often active sessions re-check health and cancellation. */
    @Positive(message = "Supervise interval must be positive")
    private long superviseIntervalMs = 500;

    public SessionSettings toSettings() {
        return new SessionSettings(maxReconnectAttempts,
                Duration.ofMillis(reconnectDelayMs),
                Duration.ofMillis(superviseIntervalMs));
    }

    public int getMaxReconnectAttempts() {
        return maxReconnectAttempts;
    }

    public void setMaxReconnectAttempts(int maxReconnectAttempts) {
        this.maxReconnectAttempts = maxReconnectAttempts;
    }

    public long getReconnectDelayMs() {
        return reconnectDelayMs;
    }

    public void setReconnectDelayMs(long reconnectDelayMs) {
        this.reconnectDelayMs = reconnectDelayMs;
    }

    public long getHeartbeatTimeoutMs() {
        return heartbeatTimeoutMs;
    }

    public void setHeartbeatTimeoutMs(long heartbeatTimeoutMs) {
        this.heartbeatTimeoutMs = heartbeatTimeoutMs;
    }

    public long getSuperviseIntervalMs() {
        return superviseIntervalMs;
    }

    public void setSuperviseIntervalMs(long superviseIntervalMs) {
        this.superviseIntervalMs = superviseIntervalMs;
    }
}
