package com.improvtoolkit.ingest.service.button;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Live button devices keyed by device path.
 *
 * <p>Shared between the monitor tasks; the lock is held only for the map update, never across
 * device I/O.
 */
public class DeviceRegistry {

    private static final Logger LOG = LogManager.getLogger(DeviceRegistry.class);

    private final Object lock = new Object();
    private final Map<String, ButtonDevice> devices = new LinkedHashMap<>();

    public void register(ButtonDevice device) {
        ButtonDevice previous;
        synchronized (lock) {
            previous = devices.put(device.path(), device);
        }
        if (previous != null && previous != device) {
            LOG.warn("Replaced stale registry entry for {}", device.path());
        }
    }

    /** Removes the entry for {@code path} if it still points at {@code device}. */
    public boolean remove(String path, ButtonDevice device) {
        synchronized (lock) {
            return devices.remove(path, device);
        }
    }

    public Optional<ButtonDevice> get(String path) {
        synchronized (lock) {
            return Optional.ofNullable(devices.get(path));
        }
    }

    public boolean contains(String path) {
        synchronized (lock) {
            return devices.containsKey(path);
        }
    }

    public Set<String> paths() {
        synchronized (lock) {
            return Set.copyOf(devices.keySet());
        }
    }

    public int size() {
        synchronized (lock) {
            return devices.size();
        }
    }
}
