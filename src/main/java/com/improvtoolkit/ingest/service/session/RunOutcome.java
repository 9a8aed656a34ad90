package com.improvtoolkit.ingest.service.session;

/**
 * Why an active device run ended. Returned by {@link DeviceSession#runActive(Object)} instead of
 * using exceptions as restart signals.
 */
public enum RunOutcome {
    /** Health check tripped (error burst, stalled heartbeat): restart the stream, not a hard failure. */
    DEGRADED,
    /** The device handle reported a hard I/O error: counts as a reconnect attempt. */
    DISCONNECTED,
    /** Cancellation was requested. */
    STOPPED
}
