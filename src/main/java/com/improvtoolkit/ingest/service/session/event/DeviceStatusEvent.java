package com.improvtoolkit.ingest.service.session.event;

import com.improvtoolkit.ingest.domain.DeviceStatus;
import com.improvtoolkit.ingest.service.session.DeviceKind;

import java.time.Instant;

/**
 * Published when a device session reports a connection status (connected, disconnected, dead).
 * {@code DEAD} is published at most once per session.
 */
public record DeviceStatusEvent(String deviceId, DeviceKind kind, DeviceStatus status, String reason, Instant at) {
    public DeviceStatusEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
