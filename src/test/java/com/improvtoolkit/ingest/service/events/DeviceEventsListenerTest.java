package com.improvtoolkit.ingest.service.events;

import com.improvtoolkit.ingest.domain.DeviceStatus;
import com.improvtoolkit.ingest.service.metrics.PipelineMetrics;
import com.improvtoolkit.ingest.service.session.DeviceKind;
import com.improvtoolkit.ingest.service.session.SessionState;
import com.improvtoolkit.ingest.service.session.event.DeviceStateChangedEvent;
import com.improvtoolkit.ingest.service.session.event.DeviceStatusEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class DeviceEventsListenerTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final DeviceEventsListener listener = new DeviceEventsListener(new PipelineMetrics(registry));

    private static DeviceStateChangedEvent changed(SessionState from, SessionState to, String reason) {
        return new DeviceStateChangedEvent("microphone", DeviceKind.MICROPHONE, from, to, reason, Instant.now());
    }

    @Test
    void throttlesRepeatedKeys() {
        assertThat(listener.shouldLog("reset-DISCONNECTED")).isTrue();
        assertThat(listener.shouldLog("reset-DISCONNECTED")).isFalse();
        assertThat(listener.shouldLog("reset-CONNECTED")).isTrue();
    }

    @Test
    void countsResilienceTransitions() {
        listener.onStateChanged(changed(SessionState.CONNECTING, SessionState.DISCONNECTED, "open failed"));
        listener.onStateChanged(changed(SessionState.ACTIVE, SessionState.DEGRADED, "error-burst"));
        listener.onStateChanged(changed(SessionState.DISCONNECTED, SessionState.PERMANENTLY_FAILED, "retry budget exhausted"));
        listener.onStateChanged(changed(SessionState.CONNECTING, SessionState.ACTIVE, "opened"));

        assertThat(registry.get("ingest.device.reconnects").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("ingest.device.restarts").tag("reason", "error-burst").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("ingest.device.dead").counter().count()).isEqualTo(1.0);
    }

    @Test
    void statusEventsAreHandledWithoutError() {
        listener.onDeviceStatus(new DeviceStatusEvent("reset", DeviceKind.BUTTON, DeviceStatus.CONNECTED, "opened", Instant.now()));
        listener.onDeviceStatus(new DeviceStatusEvent("reset", DeviceKind.BUTTON, DeviceStatus.DEAD, "retry budget exhausted", Instant.now()));

        assertThat(listener.shouldLog("reset-CONNECTED")).isFalse();
        assertThat(listener.shouldLog("reset-DEAD")).isTrue();
    }
}
