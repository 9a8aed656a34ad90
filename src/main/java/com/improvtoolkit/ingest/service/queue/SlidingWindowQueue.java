package com.improvtoolkit.ingest.service.queue;

import com.improvtoolkit.ingest.exception.QueueEmptyException;
import com.improvtoolkit.ingest.exception.QueueShutdownException;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO that drops its oldest element when full instead of blocking the producer.
 *
 * <p>This is the flow-control valve at every stage boundary: {@link #put(Object)} never blocks on a
 * full queue, trading data loss for liveness. Consumers block in {@link #get()} until an item
 * arrives or the queue is shut down.
 *
 * <p>Thread-safe for any number of producers and consumers. Evict-then-insert happens under a
 * single lock, so two producers racing on a full queue evict exactly two elements, never more.
 *
 * @param <T> element type
 */
public final class SlidingWindowQueue<T> {

    private final String name;
    private final int capacity;
    private final ArrayDeque<T> items;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();

    private boolean shutdown;
    private long evictions;

    /**
     * @param name     queue name used in logs and errors
     * @param capacity maximum number of held elements, must be positive
     * @throws IllegalArgumentException if capacity is zero or negative
     */
    public SlidingWindowQueue(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Queue '" + name + "' capacity must be positive, got: " + capacity);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.capacity = capacity;
        this.items = new ArrayDeque<>(capacity);
    }

    /**
     * Inserts at the tail, evicting the head first when the queue is full.
     *
     * @return true if an element was evicted to make room
     * @throws QueueShutdownException if the queue has been shut down
     */
    public boolean put(T item) {
        Objects.requireNonNull(item, "item");
        lock.lock();
        try {
            ensureOpen();
            boolean evicted = false;
            if (items.size() == capacity) {
                items.pollFirst();
                evictions++;
                evicted = true;
            }
            items.addLast(item);
            notEmpty.signal();
            return evicted;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the head, blocking until an element is available.
     *
     * @throws QueueShutdownException if the queue is (or becomes) shut down
     * @throws InterruptedException if interrupted while waiting
     */
    public T get() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (true) {
                ensureOpen();
                T head = items.pollFirst();
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
     * Removes the head, waiting at most {@code timeout}.
     *
     * @throws QueueEmptyException if nothing arrived within the timeout
     * @throws QueueShutdownException if the queue is (or becomes) shut down
     * @throws InterruptedException if interrupted while waiting
     */
    public T get(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (true) {
                ensureOpen();
                T head = items.pollFirst();
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

    /**
     * Removes the head without blocking.
     *
     * @throws QueueEmptyException if the queue is empty
     * @throws QueueShutdownException if the queue has been shut down
     */
    public T getNow() {
        lock.lock();
        try {
            ensureOpen();
            T head = items.pollFirst();
            if (head == null) {
                throw new QueueEmptyException(name);
            }
            return head;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves the queue to its terminal state and wakes every blocked consumer.
     * Idempotent. Remaining elements are discarded.
     */
    public void shutdown() {
        lock.lock();
        try {
            if (shutdown) {
                return;
            }
            shutdown = true;
            items.clear();
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Snapshot of current contents, head first. Visible for diagnostics and tests. */
    public List<T> snapshot() {
        lock.lock();
        try {
            return List.copyOf(items);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public long evictions() {
        lock.lock();
        try {
            return evictions;
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

    public int capacity() {
        return capacity;
    }

    public String name() {
        return name;
    }

    private void ensureOpen() {
        if (shutdown) {
            throw new QueueShutdownException(name);
        }
    }

    @Override
    public String toString() {
        return "SlidingWindowQueue[" + name + ", capacity=" + capacity + "]";
    }
}
