package com.improvtoolkit.ingest.exception;

/**
 * Thrown by a non-blocking (or timed-out) get on an empty queue.
 */
public class QueueEmptyException extends IngestException {

    public QueueEmptyException(String queueName) {
        super("Queue '" + queueName + "' is empty");
    }
}
