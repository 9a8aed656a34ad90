package com.improvtoolkit.ingest.service.session.event;

import com.improvtoolkit.ingest.service.session.DeviceKind;
import com.improvtoolkit.ingest.service.session.SessionState;

import java.time.Instant;

/**
 * Published on every session state transition. Diagnostic only; no PII.
 */
public record DeviceStateChangedEvent(String deviceId,
                                      DeviceKind kind,
                                      SessionState from,
                                      SessionState to,
                                      String reason,
                                      Instant at) {
    public DeviceStateChangedEvent {
        if (at == null) at = Instant.now();
    }
}
