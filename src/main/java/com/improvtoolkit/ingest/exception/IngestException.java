package com.improvtoolkit.ingest.exception;

/**
 * Base exception for all show-ingest application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class IngestException extends RuntimeException {

    public IngestException(String message) {
        super(message);
    }

    public IngestException(String message, Throwable cause) {
        super(message, cause);
    }

    public IngestException(Throwable cause) {
        super(cause);
    }
}
