package com.improvtoolkit.ingest.service.session;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HealthPolicyTest {

    @Test
    void errorBurstTripsAtThreshold() {
        DeviceHealth health = new DeviceHealth(5, 0L);
        HealthPolicy policy = HealthPolicy.errorBurst(3);

        health.recordError();
        health.recordError();
        assertThat(policy.evaluate(health, 0L)).isEqualTo(HealthPolicy.Verdict.HEALTHY);

        assertThat(health.recordError()).isEqualTo(3);
        assertThat(policy.evaluate(health, 0L)).isEqualTo(HealthPolicy.Verdict.ERROR_BURST);

        health.clearConsecutiveErrors();
        assertThat(policy.evaluate(health, 0L)).isEqualTo(HealthPolicy.Verdict.HEALTHY);
        assertThat(health.totalErrors()).isEqualTo(3);
    }

    @Test
    void heartbeatTimesOutOnStaleDevice() {
        DeviceHealth health = new DeviceHealth(5, 0L);
        HealthPolicy policy = HealthPolicy.heartbeat(Duration.ofSeconds(2));

        assertThat(policy.evaluate(health, Duration.ofSeconds(1).toNanos())).isEqualTo(HealthPolicy.Verdict.HEALTHY);
        assertThat(policy.evaluate(health, Duration.ofSeconds(3).toNanos()))
                .isEqualTo(HealthPolicy.Verdict.HEARTBEAT_TIMEOUT);

        health.heartbeat(Duration.ofSeconds(3).toNanos());
        assertThat(policy.evaluate(health, Duration.ofSeconds(4).toNanos())).isEqualTo(HealthPolicy.Verdict.HEALTHY);
    }

    @Test
    void combinedPolicyReportsFirstFailure() {
        DeviceHealth health = new DeviceHealth(5, 0L);
        health.recordError();
        HealthPolicy policy = HealthPolicy.errorBurst(1).or(HealthPolicy.heartbeat(Duration.ofMillis(1)));

        assertThat(policy.evaluate(health, Duration.ofSeconds(1).toNanos()))
                .isEqualTo(HealthPolicy.Verdict.ERROR_BURST);
        assertThat(HealthPolicy.none().evaluate(health, Long.MAX_VALUE)).isEqualTo(HealthPolicy.Verdict.HEALTHY);
    }

    @Test
    void successfulConnectResetsAttempts() {
        DeviceHealth health = new DeviceHealth(2, 0L);
        health.recordReconnectAttempt();
        health.recordReconnectAttempt();
        assertThat(health.isRetryBudgetExhausted()).isTrue();

        health.onConnected(10L);
        assertThat(health.reconnectAttempts()).isZero();
        assertThat(health.lastHeartbeatNanos()).isEqualTo(10L);
        assertThatThrownBy(() -> HealthPolicy.errorBurst(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
