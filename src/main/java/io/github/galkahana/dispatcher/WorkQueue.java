package io.github.galkahana.dispatcher;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO handing admitted requests to workers.
 * <p>
 * Closing the queue is the stop broadcast for idle workers: {@link #take()} keeps returning queued items
 * after close so the queue drains, and returns empty once nothing is left.
 *
 * @param <T> Item type
 */
public class WorkQueue<T> {

    private final int capacity;
    private final ArrayDeque<T> items;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();

    private boolean closed = false;

    public WorkQueue(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        this.capacity = capacity;
        this.items = new ArrayDeque<>(capacity);
    }

    /**
     * Enqueue an item, waiting up to {@code timeout} for space.
     *
     * @return false if the queue stayed full for the whole timeout
     * @throws IllegalStateException If the queue is closed
     * @throws InterruptedException If interrupted while waiting for space
     */
    public boolean offer(T item, Duration timeout) throws InterruptedException {
        Objects.requireNonNull(item, "item");
        long remainingNanos = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (!closed && items.size() == capacity) {
                if (remainingNanos <= 0) return false;
                remainingNanos = notFull.awaitNanos(remainingNanos);
            }
            if (closed) throw new IllegalStateException("Work queue is closed");
            items.addLast(item);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Dequeue the oldest item, blocking while the queue is empty and open.
     *
     * @return The item, or empty once the queue is closed and drained
     */
    public Optional<T> take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (!closed && items.isEmpty()) {
                notEmpty.await();
            }
            T item = items.pollFirst();
            if (item != null) notFull.signal();
            return Optional.ofNullable(item);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Close the queue and wake every waiting taker and offerer. Idempotent.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove and return everything still queued.
     */
    public List<T> drain() {
        lock.lock();
        try {
            List<T> drained = new ArrayList<>(items);
            items.clear();
            notFull.signalAll();
            return drained;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
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

    public int capacity() {
        return capacity;
    }
}
