package com.improvtoolkit.ingest.service.session;

/**
 * Lifecycle states of a {@link DeviceSession}. {@code PERMANENTLY_FAILED} is terminal.
 */
public enum SessionState {
    DISCONNECTED,
    CONNECTING,
    ACTIVE,
    DEGRADED,
    PERMANENTLY_FAILED
}
