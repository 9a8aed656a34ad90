package com.improvtoolkit.ingest.service.button.evdev;

import com.improvtoolkit.ingest.exception.DeviceUnavailableException;
import com.improvtoolkit.ingest.service.button.ButtonDevice;
import com.improvtoolkit.ingest.service.button.ButtonInputEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ReadableByteChannel;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Linux input event device ({@code /dev/input/event*}) read as a stream of {@code struct input_event}
 * records: {@code timeval} (two 64-bit longs), {@code u16 type}, {@code u16 code}, {@code s32 value},
 * 24 bytes in native byte order on 64-bit kernels.
 *
 * <p>A daemon reader thread blocks on the channel and hands key events to a queue that
 * {@link #poll} waits on with a timeout. Closing the channel unblocks the reader.
 */
public final class EvdevButtonDevice implements ButtonDevice {

    private static final Logger LOG = LogManager.getLogger(EvdevButtonDevice.class);

    static final int EVENT_SIZE = 24;
    static final int EV_KEY = 0x01;
    private static final int RECORDS_PER_READ = 64;

    private final String path;
    private final ReadableByteChannel channel;
    private final BlockingQueue<ButtonInputEvent> events = new LinkedBlockingQueue<>();
    private final Thread reader;
    private volatile String failure;
    private volatile boolean closed;

    EvdevButtonDevice(String path, ReadableByteChannel channel) {
        this.path = path;
        this.channel = channel;
        Map<String, String> context = ThreadContext.getImmutableContext();
        this.reader = new Thread(() -> {
            ThreadContext.putAll(context);
            try {
                readLoop();
            } finally {
                ThreadContext.clearAll();
            }
        }, "evdev-reader-" + path);
        this.reader.setDaemon(true);
    }

    void start() {
        reader.start();
    }

    @Override
    public Optional<ButtonInputEvent> poll(Duration timeout) throws InterruptedException {
        ButtonInputEvent next = events.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (next == null && failure != null) {
            throw new DeviceUnavailableException(path, failure);
        }
        return Optional.ofNullable(next);
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            channel.close();
        } catch (IOException e) {
            LOG.debug("Error closing {}: {}", path, e.toString());
        }
    }

    private void readLoop() {
        ByteBuffer buf = ByteBuffer.allocate(EVENT_SIZE * RECORDS_PER_READ).order(ByteOrder.nativeOrder());
        try {
            while (!closed) {
                int n = channel.read(buf);
                if (n < 0) {
                    failure = "device stream ended";
                    return;
                }
                buf.flip();
                while (buf.remaining() >= EVENT_SIZE) {
                    decode(buf).ifPresent(events::offer);
                }
                buf.compact();
            }
        } catch (ClosedChannelException e) {
            if (!closed) {
                failure = "device closed underneath the reader";
            }
        } catch (IOException e) {
            if (!closed) {
                failure = "read failed: " + e.getMessage();
                LOG.warn("I/O error on {}: {}", path, e.getMessage());
            }
        }
    }

    /**
     * Decodes one record at the buffer's position, advancing it by {@link #EVENT_SIZE}.
     *
     * @return the key transition, or empty for non-key records (sync, misc, scan codes)
     */
    static Optional<ButtonInputEvent> decode(ByteBuffer buf) {
        long seconds = buf.getLong();
        long micros = buf.getLong();
        int type = Short.toUnsignedInt(buf.getShort());
        int code = Short.toUnsignedInt(buf.getShort());
        int value = buf.getInt();
        if (type != EV_KEY) {
            return Optional.empty();
        }
        ButtonInputEvent.State state = switch (value) {
            case 0 -> ButtonInputEvent.State.UP;
            case 1 -> ButtonInputEvent.State.DOWN;
            case 2 -> ButtonInputEvent.State.REPEAT;
            default -> null;
        };
        if (state == null) {
            return Optional.empty();
        }
        return Optional.of(new ButtonInputEvent(code, state, seconds * 1000L + micros / 1000L));
    }
}
