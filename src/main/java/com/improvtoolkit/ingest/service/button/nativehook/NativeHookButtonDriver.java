package com.improvtoolkit.ingest.service.button.nativehook;

import com.improvtoolkit.ingest.exception.DeviceUnavailableException;
import com.improvtoolkit.ingest.service.button.ButtonDevice;
import com.improvtoolkit.ingest.service.button.ButtonInputEvent;
import com.improvtoolkit.ingest.service.session.DeviceDriver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Button driver for development machines: every configured device listens to the global keyboard
 * through one shared {@link KeyboardHook}, and each device's key map picks out its own keys.
 * The hook observes keys without consuming them, so {@code grab} has no effect.
 */
public class NativeHookButtonDriver implements DeviceDriver<ButtonDevice> {

    private static final Logger LOG = LogManager.getLogger(NativeHookButtonDriver.class);

    private final String deviceId;
    private final String path;
    private final KeyboardHook hook;

    public NativeHookButtonDriver(String deviceId, String path, KeyboardHook hook) {
        this.deviceId = deviceId;
        this.path = path;
        this.hook = Objects.requireNonNull(hook);
    }

    @Override
    public ButtonDevice open() {
        HookDevice device = new HookDevice(path, hook);
        try {
            hook.addListener(device.listener);
        } catch (SecurityException e) {
            throw new DeviceUnavailableException(deviceId, e.getMessage(), e);
        }
        LOG.info("Listening for '{}' keys on the global keyboard hook", deviceId);
        return device;
    }

    @Override
    public void close(ButtonDevice device) {
        device.close();
    }

    private static final class HookDevice implements ButtonDevice {

        private final String path;
        private final KeyboardHook hook;
        private final BlockingQueue<ButtonInputEvent> events = new LinkedBlockingQueue<>();
        private final Consumer<ButtonInputEvent> listener = events::offer;
        private volatile boolean closed;

        HookDevice(String path, KeyboardHook hook) {
            this.path = path;
            this.hook = hook;
        }

        @Override
        public Optional<ButtonInputEvent> poll(Duration timeout) throws InterruptedException {
            return Optional.ofNullable(events.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
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
            hook.removeListener(listener);
        }
    }
}
