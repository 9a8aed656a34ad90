package com.improvtoolkit.ingest.service.button;

/**
 * Per-device debounce window. An event is accepted when nothing was accepted before, or when it is
 * at least {@code windowMillis} after the last accepted one. Suppressed events do not move the window.
 *
 * <p>Confined to the monitor thread of its device.
 */
public final class Debouncer {

    private final long windowMillis;
    private long lastAccepted;
    private boolean seen;

    public Debouncer(long windowMillis) {
        if (windowMillis < 0) {
            throw new IllegalArgumentException("Debounce window must not be negative: " + windowMillis);
        }
        this.windowMillis = windowMillis;
    }

    public boolean accept(long timestampMillis) {
        if (seen && timestampMillis < lastAccepted + windowMillis) {
            return false;
        }
        seen = true;
        lastAccepted = timestampMillis;
        return true;
    }

    public long windowMillis() {
        return windowMillis;
    }
}
