package com.improvtoolkit.ingest.service.session;

import com.improvtoolkit.ingest.exception.DeviceUnavailableException;

/**
 * Capability object a {@link DeviceSession} uses to acquire and release one physical device.
 *
 * @param <H> open device handle type
 */
public interface DeviceDriver<H> {

    /**
     * Opens the device.
     *
     * @throws DeviceUnavailableException if the device is missing, busy or rejects the requested settings
     */
    H open();

    /** Releases the handle (ungrab, stop, close). Must not throw. */
    void close(H handle);
}
