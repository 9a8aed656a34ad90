package com.improvtoolkit.ingest.service.queue;

import com.improvtoolkit.ingest.domain.ButtonEvent;
import com.improvtoolkit.ingest.domain.Priority;
import com.improvtoolkit.ingest.domain.PriorityEnvelope;
import com.improvtoolkit.ingest.exception.QueueEmptyException;
import com.improvtoolkit.ingest.exception.QueueShutdownException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Multi-producer, single-consumer queue that hands out the highest-priority pending envelope
 * first (lowest numeric value), FIFO among equal priorities.
 *
 * <p>Enqueue sequence numbers are assigned under the queue lock, so the tie-break reflects the
 * order in which producers actually entered the queue.
 *
 * <p>The queue is bounded. When full, the envelope that would be served last is dropped:
 * either the incoming one, or the current tail if the incoming one ranks ahead of it.
 */
public final class PriorityDispatchQueue {

    private static final Logger LOG = LogManager.getLogger(PriorityDispatchQueue.class);

    private final String name;
    private final int capacity;
    private final PriorityQueue<PriorityEnvelope> heap = new PriorityQueue<>(PriorityEnvelope.DISPATCH_ORDER);
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();

    private long nextSeq;
    private long dropped;
    private boolean shutdown;

    public PriorityDispatchQueue(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Queue '" + name + "' capacity must be positive, got: " + capacity);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.capacity = capacity;
    }

    /** Enqueues a button event using the standard priority rules. */
    public PriorityEnvelope offer(ButtonEvent event) {
        return offer(Priority.of(event), event);
    }

    /**
     * Enqueues an event with an explicit priority.
     *
     * @return the envelope created for the event
     * @throws QueueShutdownException if the queue has been shut down
     */
    public PriorityEnvelope offer(Priority priority, ButtonEvent event) {
        lock.lock();
        try {
            if (shutdown) {
                throw new QueueShutdownException(name);
            }
            PriorityEnvelope envelope = new PriorityEnvelope(priority, event, nextSeq++);
            if (heap.size() == capacity) {
                PriorityEnvelope last = lastInOrder();
                if (PriorityEnvelope.DISPATCH_ORDER.compare(envelope, last) > 0) {
                    dropped++;
                    LOG.warn("Dispatch queue '{}' full; dropping incoming {} event from {}",
                            name, priority, event.sourceId());
                    return envelope;
                }
                heap.remove(last);
                dropped++;
                LOG.warn("Dispatch queue '{}' full; dropping queued {} event from {}",
                        name, last.priority(), last.payload().sourceId());
            }
            heap.add(envelope);
            notEmpty.signal();
            return envelope;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the next envelope in dispatch order, blocking until one is available.
     *
     * @throws QueueShutdownException if the queue is (or becomes) shut down
     * @throws InterruptedException if interrupted while waiting
     */
    public PriorityEnvelope take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (true) {
                if (shutdown) {
                    throw new QueueShutdownException(name);
                }
                PriorityEnvelope head = heap.poll();
                if (head != null) {
                    return head;
                }
                notEmpty.await();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the next envelope, waiting at most {@code timeout}.
     *
     * @throws QueueEmptyException if nothing arrived within the timeout
     */
    public PriorityEnvelope take(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (true) {
                if (shutdown) {
                    throw new QueueShutdownException(name);
                }
                PriorityEnvelope head = heap.poll();
                if (head != null) {
                    return head;
                }
                if (remaining <= 0L) {
                    throw new QueueEmptyException(name);
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
        } finally {
            lock.unlock();
        }
    }

    /** Terminal state: wakes the consumer and rejects further offers. Idempotent. */
    public void shutdown() {
        lock.lock();
        try {
            if (!shutdown) {
                shutdown = true;
                if (!heap.isEmpty()) {
                    LOG.info("Dispatch queue '{}' shut down with {} pending envelopes", name, heap.size());
                }
                heap.clear();
                notEmpty.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /** Pending envelopes in dispatch order. Visible for diagnostics and tests. */
    public List<PriorityEnvelope> snapshot() {
        lock.lock();
        try {
            List<PriorityEnvelope> out = new ArrayList<>(heap);
            out.sort(PriorityEnvelope.DISPATCH_ORDER);
            return out;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return heap.size();
        } finally {
            lock.unlock();
        }
    }

    public long dropped() {
        lock.lock();
        try {
            return dropped;
        } finally {
            lock.unlock();
        }
    }

    public boolean isShutdown() {
        lock.lock();
        try {
            return shutdown;
        } finally {
            lock.unlock();
        }
    }

    public String name() {
        return name;
    }

    // Caller holds the lock; heap is non-empty.
    private PriorityEnvelope lastInOrder() {
        Iterator<PriorityEnvelope> it = heap.iterator();
        PriorityEnvelope last = it.next();
        while (it.hasNext()) {
            PriorityEnvelope candidate = it.next();
            if (PriorityEnvelope.DISPATCH_ORDER.compare(candidate, last) > 0) {
                last = candidate;
            }
        }
        return last;
    }
}
