package com.improvtoolkit.ingest.exception;

/**
 * Thrown when ingest configuration is inconsistent (duplicate device paths, count mismatch,
 * unsupported rate or format). Always fatal at startup; never retried.
 */
public class InvalidConfigurationException extends IngestException {

    private final String property;

    public InvalidConfigurationException(String property, String message) {
        super("Invalid configuration '" + property + "': " + message);
        this.property = property;
    }

    public String getProperty() {
        return property;
    }
}
