package com.improvtoolkit.ingest.service.button;

import com.improvtoolkit.ingest.exception.DeviceUnavailableException;

import java.time.Duration;
import java.util.Optional;

/**
 * An opened control device.
 */
public interface ButtonDevice {

    /**
     * Waits up to {@code timeout} for the next key transition.
     *
     * @return the event, or empty if none arrived in time
     * @throws DeviceUnavailableException on a hard I/O error (e.g. the device was unplugged)
     * @throws InterruptedException if interrupted while waiting
     */
    Optional<ButtonInputEvent> poll(Duration timeout) throws InterruptedException;

    String path();

    /** Ungrabs (where grabbed) and releases the device. Idempotent. */
    void close();
}
