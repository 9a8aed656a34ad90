package com.improvtoolkit.ingest.service.button;

import java.util.Optional;

/**
 * Raw key transition read from a control device, before filtering and mapping.
 * Keeps the monitor independent of the backend that produced it.
 *
 * @param rawCode    backend key code translated to the Linux numbering, or -1 if untranslatable
 * @param state      key transition
 * @param whenMillis event time in epoch milliseconds
 */
public record ButtonInputEvent(int rawCode, State state, long whenMillis) {

    public enum State { DOWN, UP, REPEAT }

    public ButtonInputEvent {
        if (state == null) {
            throw new IllegalArgumentException("state must not be null");
        }
    }

    public static ButtonInputEvent of(KeyCode key, State state, long whenMillis) {
        return new ButtonInputEvent(key.code(), state, whenMillis);
    }

    public Optional<KeyCode> key() {
        return KeyCode.fromCode(rawCode);
    }
}
