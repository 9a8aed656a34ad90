package com.improvtoolkit.ingest.service.audio.capture;

import com.improvtoolkit.ingest.domain.SampleFormat;
import com.improvtoolkit.ingest.exception.DeviceUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.TargetDataLine;
import java.util.Arrays;

/**
 * {@link CaptureLine} over a Java Sound {@link TargetDataLine}.
 *
 * <p>Xrun detection: an overrun is a backlog that already fills the whole line buffer before the
 * read (the driver is dropping data); an underrun is a read that returns fewer bytes than asked
 * while the line is still open.
 */
final class JavaSoundCaptureLine implements CaptureLine {

    private static final Logger LOG = LogManager.getLogger(JavaSoundCaptureLine.class);

    private final TargetDataLine line;
    private final String deviceName;
    private final int sampleRate;
    private final SampleFormat format;
    private final int channels;
    private final boolean resampleRequired;
    private final byte[] buffer;
    private volatile boolean closed;

    JavaSoundCaptureLine(TargetDataLine line,
                         String deviceName,
                         int sampleRate,
                         SampleFormat format,
                         int channels,
                         boolean resampleRequired,
                         int blockBytes) {
        this.line = line;
        this.deviceName = deviceName;
        this.sampleRate = sampleRate;
        this.format = format;
        this.channels = channels;
        this.resampleRequired = resampleRequired;
        this.buffer = new byte[blockBytes];
    }

    @Override
    public CaptureChunk read() {
        if (closed || !line.isOpen()) {
            throw new DeviceUnavailableException(deviceName, "capture line closed");
        }
        boolean overrun = line.available() >= line.getBufferSize();
        int n;
        try {
            n = line.read(buffer, 0, buffer.length);
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new DeviceUnavailableException(deviceName, "read failed: " + e.getMessage(), e);
        }
        if (!closed && !line.isOpen()) {
            throw new DeviceUnavailableException(deviceName, "capture line lost during read");
        }
        boolean underrun = n < buffer.length;
        return new CaptureChunk(Arrays.copyOf(buffer, Math.max(n, 0)), overrun || underrun);
    }

    @Override
    public int sampleRate() {
        return sampleRate;
    }

    @Override
    public SampleFormat format() {
        return format;
    }

    @Override
    public int channels() {
        return channels;
    }

    @Override
    public boolean resampleRequired() {
        return resampleRequired;
    }

    @Override
    public String deviceName() {
        return deviceName;
    }

    @Override
    public void close() {
        closed = true;
        try {
            line.stop();
            line.flush();
        } catch (RuntimeException e) {
            LOG.debug("Stopping capture line failed: {}", e.toString());
        }
        try {
            line.close();
        } catch (RuntimeException e) {
            LOG.debug("Closing capture line failed: {}", e.toString());
        }
    }
}
