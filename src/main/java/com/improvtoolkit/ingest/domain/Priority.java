package com.improvtoolkit.ingest.domain;

/**
 * Dispatch priority. Lower numeric value is served first.
 */
public enum Priority {
    EMERGENCY(1),
    HIGH(10),
    MEDIUM(20),
    STANDARD(30),
    LOW(40);

    private final int value;

    Priority(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    /**
     * Priority rules for button events: reset actions and permanent failures are HIGH,
     * connect/disconnect is MEDIUM, every other action is STANDARD.
     */
    public static Priority of(ButtonEvent event) {
        if (event.kind() == ButtonEvent.Kind.ACTION) {
            return event.action() == ButtonAction.RESET ? HIGH : STANDARD;
        }
        return event.status() == DeviceStatus.DEAD ? HIGH : MEDIUM;
    }
}
