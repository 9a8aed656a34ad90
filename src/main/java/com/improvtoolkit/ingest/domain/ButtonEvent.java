package com.improvtoolkit.ingest.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Event emitted by a button monitor: either a pressed action or a device status change.
 * Exactly one of {@code action} / {@code status} is populated, matching {@code kind}.
 */
public record ButtonEvent(String sourceId, Kind kind, ButtonAction action, DeviceStatus status, Instant timestamp) {

    public enum Kind { ACTION, STATUS }

    public ButtonEvent {
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("sourceId must not be blank");
        }
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(timestamp, "timestamp");
        if (kind == Kind.ACTION && (action == null || status != null)) {
            throw new IllegalArgumentException("ACTION event requires an action and no status");
        }
        if (kind == Kind.STATUS && (status == null || action != null)) {
            throw new IllegalArgumentException("STATUS event requires a status and no action");
        }
    }

    public static ButtonEvent action(String sourceId, ButtonAction action, Instant at) {
        return new ButtonEvent(sourceId, Kind.ACTION, action, null, at);
    }

    public static ButtonEvent status(String sourceId, DeviceStatus status, Instant at) {
        return new ButtonEvent(sourceId, Kind.STATUS, null, status, at);
    }
}
