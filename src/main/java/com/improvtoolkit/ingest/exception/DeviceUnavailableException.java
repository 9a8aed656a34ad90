package com.improvtoolkit.ingest.exception;

/**
 * Thrown by device drivers when a physical device cannot be opened or a read fails with a hard
 * I/O error (e.g., the device was unplugged).
 *
 * <p>Device sessions translate this into a reconnect attempt; it never escapes a session.
 */
public class DeviceUnavailableException extends IngestException {

    private final String deviceId;

    public DeviceUnavailableException(String deviceId, String message) {
        super("Device " + deviceId + " unavailable: " + message);
        this.deviceId = deviceId;
    }

    public DeviceUnavailableException(String deviceId, String message, Throwable cause) {
        super("Device " + deviceId + " unavailable: " + message, cause);
        this.deviceId = deviceId;
    }

    public String getDeviceId() {
        return deviceId;
    }
}
