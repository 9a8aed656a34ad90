package com.improvtoolkit.ingest.service.button.evdev;

import com.improvtoolkit.ingest.exception.DeviceUnavailableException;
import com.improvtoolkit.ingest.service.button.ButtonDevice;
import com.improvtoolkit.ingest.service.session.DeviceDriver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Opens a Linux evdev character device for one configured button box.
 *
 * <p>Exclusive grab needs the {@code EVIOCGRAB} ioctl, which the JVM cannot issue; a device
 * configured with {@code grab=true} is opened shared and a warning is logged once.
 */
public class EvdevButtonDriver implements DeviceDriver<ButtonDevice> {

    private static final Logger LOG = LogManager.getLogger(EvdevButtonDriver.class);

    private final String deviceId;
    private final String path;
    private final boolean grab;
    private volatile boolean grabWarned;

    public EvdevButtonDriver(String deviceId, String path, boolean grab) {
        this.deviceId = deviceId;
        this.path = path;
        this.grab = grab;
    }

    @Override
    public ButtonDevice open() {
        FileChannel channel;
        try {
            channel = FileChannel.open(Path.of(path), StandardOpenOption.READ);
        } catch (NoSuchFileException e) {
            throw new DeviceUnavailableException(deviceId, "no such device: " + path, e);
        } catch (AccessDeniedException e) {
            throw new DeviceUnavailableException(deviceId, "permission denied: " + path
                    + " (add the user to the 'input' group)", e);
        } catch (IOException e) {
            throw new DeviceUnavailableException(deviceId, "cannot open " + path + ": " + e.getMessage(), e);
        }
        if (grab && !grabWarned) {
            grabWarned = true;
            LOG.warn("Exclusive grab is not supported for evdev devices from the JVM; {} stays shared", path);
        }
        EvdevButtonDevice device = new EvdevButtonDevice(path, channel);
        device.start();
        LOG.info("Opened button device {}", path);
        return device;
    }

    @Override
    public void close(ButtonDevice device) {
        device.close();
        LOG.info("Closed button device {}", path);
    }
}
