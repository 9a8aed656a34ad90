package com.improvtoolkit.ingest.service.audio.capture;

import com.improvtoolkit.ingest.domain.SampleFormat;
import com.improvtoolkit.ingest.exception.DeviceUnavailableException;

/**
 * An opened, running microphone stream with its negotiated format.
 */
public interface CaptureLine {

    /**
     * Blocks until one block is available.
     *
     * @throws DeviceUnavailableException if the device is gone
     */
    CaptureChunk read();

    /** Negotiated rate; differs from the requested one when {@link #resampleRequired()} is set. */
    int sampleRate();

    SampleFormat format();

    int channels();

    boolean resampleRequired();

    String deviceName();

    /** Stops and releases the line; unblocks a pending {@link #read()}. */
    void close();
}
