package io.github.galkahana.dispatcher;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import lombok.extern.slf4j.Slf4j;

/**
 * Counting permit pool bounding the number of in-flight requests.
 * <p>
 * Unlike a plain {@link java.util.concurrent.Semaphore} the gate can be closed: pending and future
 * acquisitions then fail with {@link GateClosedException} instead of blocking. Waiters are not served in
 * FIFO order, but every release wakes all of them so none is starved while permits keep coming back.
 */
@Slf4j
public class AdmissionGate {

    private final int limit;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition permitAvailable = lock.newCondition();
    private final Condition idle = lock.newCondition();

    private int available;
    private boolean closed = false;

    public AdmissionGate(int limit) {
        if (limit < 1) throw new IllegalArgumentException("limit must be >= 1, got " + limit);
        this.limit = limit;
        this.available = limit;
    }

    /**
     * Block until a permit is available.
     *
     * @throws GateClosedException If the gate is closed before a permit could be taken
     * @throws InterruptedException If interrupted while waiting
     */
    public Permit acquire() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (!closed && available == 0) {
                permitAvailable.await();
            }
            return take();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take a permit without waiting.
     *
     * @return The permit, or null when the limit is reached
     * @throws GateClosedException If the gate is closed
     */
    public Permit tryAcquire() {
        lock.lock();
        try {
            if (!closed && available == 0) return null;
            return take();
        } finally {
            lock.unlock();
        }
    }

    private Permit take() {
        if (closed) throw new GateClosedException();
        available--;
        return new Permit();
    }

    private void release() {
        lock.lock();
        try {
            if (available >= limit) {
                log.error("Permit accounting violation: {} permits available with a limit of {}", available + 1, limit);
                throw new IllegalStateException("Permit released more times than acquired");
            }
            available++;
            permitAvailable.signalAll();
            if (available == limit) idle.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Close the gate. Idempotent. Wakes every waiter so it can fail fast.
     */
    public void close() {
        lock.lock();
        try {
            if (closed) return;
            closed = true;
            permitAvailable.signalAll();
            log.debug("Admission gate closed with {} permits in use", limit - available);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait until every permit has been returned.
     *
     * @return true if idle, false if the timeout elapsed first
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long remainingNanos = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (available < limit) {
                if (remainingNanos <= 0) return false;
                remainingNanos = idle.awaitNanos(remainingNanos);
            }
            return true;
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

    public int availablePermits() {
        lock.lock();
        try {
            return available;
        } finally {
            lock.unlock();
        }
    }

    public int inFlight() {
        return limit - availablePermits();
    }

    public int limit() {
        return limit;
    }

    /**
     * One unit of admitted concurrency. Must be released exactly once.
     */
    public final class Permit implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit() {
        }

        /**
         * @throws IllegalStateException If this permit was already released
         */
        public void release() {
            if (!released.compareAndSet(false, true)) {
                throw new IllegalStateException("Permit already released");
            }
            AdmissionGate.this.release();
        }

        public boolean isReleased() {
            return released.get();
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                AdmissionGate.this.release();
            }
        }
    }
}
