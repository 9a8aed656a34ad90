package com.improvtoolkit.ingest.domain;

import java.util.Locale;

/**
 * Show actions a physical button can trigger.
 */
public enum ButtonAction {
    RESET,
    SPEAK,
    UNSET,
    EXIT;

    /** Lower-case name used on the wire. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
