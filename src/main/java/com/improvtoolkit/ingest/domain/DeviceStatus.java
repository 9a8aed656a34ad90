package com.improvtoolkit.ingest.domain;

import java.util.Locale;

/**
 * Connection status reported by a device session. {@code DEAD} is terminal.
 */
public enum DeviceStatus {
    CONNECTED,
    DISCONNECTED,
    DEAD;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
