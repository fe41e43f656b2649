package io.github.galkahana.dispatcher;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;

import lombok.extern.slf4j.Slf4j;

/**
 * Drives the dispatcher lifecycle: {@code NEW -> RUNNING -> DRAINING -> STOPPED}.
 * <p>
 * Shutdown closes admission, broadcasts the stop to idle workers by closing the work queue, and lets admitted
 * requests drain for the grace period. Whatever is still in flight afterwards is finished as
 * {@link Outcome.Status#ABORTED} and its processing is interrupted.
 */
@Slf4j
class ShutdownCoordinator<P, O> {

    static final Duration EXIT_TIMEOUT = Duration.ofSeconds(5);

    private final AdmissionGate gate;
    private final WorkQueue<AdmittedRequest<P, O>> queue;
    private final WorkerPool<P, O> workers;
    private final StatsAggregator stats;
    private final Collection<AdmittedRequest<P, O>> inFlight;
    private final Lock admissionBarrier;

    private final AtomicReference<DispatcherState> state = new AtomicReference<>(DispatcherState.NEW);
    private final CountDownLatch stopped = new CountDownLatch(1);

    ShutdownCoordinator(AdmissionGate gate, WorkQueue<AdmittedRequest<P, O>> queue, WorkerPool<P, O> workers,
                        StatsAggregator stats, Collection<AdmittedRequest<P, O>> inFlight,
                        Lock admissionBarrier) {
        this.gate = gate;
        this.queue = queue;
        this.workers = workers;
        this.stats = stats;
        this.inFlight = inFlight;
        this.admissionBarrier = admissionBarrier;
    }

    DispatcherState state() {
        return state.get();
    }

    /**
     * @return false if the dispatcher was already started or shut down
     */
    boolean markRunning() {
        return state.compareAndSet(DispatcherState.NEW, DispatcherState.RUNNING);
    }

    /**
     * Drain and stop. Blocks until {@link DispatcherState#STOPPED}, also when another thread is already
     * shutting down.
     *
     * @param gracePeriod Time allowed for in-flight requests to finish before they are aborted
     */
    void shutdown(Duration gracePeriod) throws InterruptedException {
        if (state.compareAndSet(DispatcherState.NEW, DispatcherState.STOPPED)) {
            gate.close();
            queue.close();
            stats.close();
            stopped.countDown();
            log.info("Dispatcher stopped before it was started");
            return;
        }
        if (!state.compareAndSet(DispatcherState.RUNNING, DispatcherState.DRAINING)) {
            stopped.await();
            return;
        }

        log.info("Shutdown requested, draining {} in-flight requests with a grace period of {}",
                gate.inFlight(), gracePeriod);
        gate.close();
        queue.close();

        try {
            boolean drained = false;
            try {
                drained = gate.awaitIdle(gracePeriod);
            } finally {
                if (!drained) abortInFlight();
            }
            if (!workers.awaitTermination(EXIT_TIMEOUT)) {
                log.warn("Some workers did not exit within {}", EXIT_TIMEOUT);
            }
            if (!gate.awaitIdle(EXIT_TIMEOUT)) {
                log.warn("{} permits still held after shutdown", gate.inFlight());
            }
        } finally {
            stop();
        }

        Stats finalStats = stats.snapshot();
        log.info("Dispatcher stopped. Stats: submitted={}, succeeded={}, failed={}, timedOut={}, rejected={}, aborted={}",
                finalStats.submitted(), finalStats.succeeded(), finalStats.failed(), finalStats.timedOut(),
                finalStats.rejected(), finalStats.aborted());
    }

    /**
     * Finalize the statistics once no submitter is half way through admission, then mark the dispatcher stopped.
     */
    private void stop() throws InterruptedException {
        boolean exclusive = false;
        try {
            exclusive = admissionBarrier.tryLock(EXIT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            if (!exclusive) log.warn("Submitters still admitting after {}", EXIT_TIMEOUT);
            stats.close();
        } finally {
            state.set(DispatcherState.STOPPED);
            stopped.countDown();
            if (exclusive) admissionBarrier.unlock();
        }
    }

    private void abortInFlight() {
        int queued = queue.drain().size();
        int aborted = 0;
        for (AdmittedRequest<P, O> admitted : List.copyOf(inFlight)) {
            try {
                if (admitted.finish(Outcome.aborted(admitted.request()))) aborted++;
            } catch (IllegalStateException e) {
                log.error("Failed to abort request {}", admitted.request().id(), e);
            }
        }
        workers.abort();
        log.warn("Grace period elapsed, aborted {} in-flight requests ({} had not started)", aborted, queued);
    }
}
