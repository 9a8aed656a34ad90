package com.improvtoolkit.ingest.service.dispatch;

import com.improvtoolkit.ingest.domain.PriorityEnvelope;
import com.improvtoolkit.ingest.exception.QueueShutdownException;
import com.improvtoolkit.ingest.service.metrics.PipelineMetrics;
import com.improvtoolkit.ingest.service.queue.PriorityDispatchQueue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.Objects;

/**
 * Single consumer of the priority dispatch queue. Delivers one envelope at a time; a failed delivery
 * is logged and dropped, never retried.
 */
public class PriorityDispatcher implements Runnable {

    private static final Logger LOG = LogManager.getLogger(PriorityDispatcher.class);

    private final PriorityDispatchQueue queue;
    private final TransportPublisher publisher;
    private final PipelineMetrics metrics;

    public PriorityDispatcher(PriorityDispatchQueue queue, TransportPublisher publisher, PipelineMetrics metrics) {
        this.queue = Objects.requireNonNull(queue);
        this.publisher = Objects.requireNonNull(publisher);
        this.metrics = Objects.requireNonNull(metrics);
    }

    @Override
    public void run() {
        ThreadContext.put("stage", "dispatch");
        LOG.info("Dispatcher started on queue '{}'", queue.name());
        try {
            while (!Thread.currentThread().isInterrupted()) {
                dispatch(queue.take());
            }
        } catch (QueueShutdownException e) {
            LOG.debug("Queue shut down; leaving dispatch loop");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            LOG.info("Dispatcher stopped");
            ThreadContext.remove("stage");
        }
    }

    /** Delivers one envelope. Returns false if the transport failed. */
    boolean dispatch(PriorityEnvelope envelope) {
        try {
            publisher.publish(envelope);
            metrics.incrementDispatched(envelope.priority().name());
            return true;
        } catch (RuntimeException e) {
            LOG.warn("Dropping {} event from {} after transport failure: {}",
                    envelope.priority(), envelope.payload().sourceId(), e.toString());
            metrics.incrementDispatchFailure("button");
            return false;
        }
    }
}
