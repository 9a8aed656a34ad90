package com.improvtoolkit.ingest.exception;

/**
 * Signals that a queue has been shut down. This is a clean termination signal, not a fault:
 * callers stop using the queue and exit their loop.
 */
public class QueueShutdownException extends IngestException {

    public QueueShutdownException(String queueName) {
        super("Queue '" + queueName + "' is shut down");
    }
}
