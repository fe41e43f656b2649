package io.github.galkahana.dispatcher;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import lombok.extern.slf4j.Slf4j;

/**
 * Bounded-concurrency request dispatcher.
 * <p>
 * A submitted payload first takes a permit from the {@link AdmissionGate}, which bounds the number of requests
 * in flight, then waits in the bounded {@link WorkQueue} until one of the workers picks it up. Every request
 * that is submitted ends with exactly one {@link Outcome}, and every outcome is counted in the {@link Stats}.
 * <pre>{@code
 * Dispatcher<String, Integer> dispatcher = new Dispatcher<>(
 *     DispatcherConfig.builder().workerCount(2).admissionLimit(2).build(),
 *     String::length);
 * dispatcher.start();
 *
 * Outcome<Integer> outcome = dispatcher.submit("hello", Duration.ofSeconds(1));
 *
 * dispatcher.shutdown();
 * Stats stats = dispatcher.statsSnapshot();
 * }</pre>
 *
 * @param <P> Payload type
 * @param <O> Result type
 */
@Slf4j
public class Dispatcher<P, O> implements AutoCloseable {

    private final DispatcherConfig config;
    private final AdmissionGate gate;
    private final WorkQueue<AdmittedRequest<P, O>> queue;
    private final StatsAggregator stats;
    private final WorkerPool<P, O> workers;
    private final ShutdownCoordinator<P, O> coordinator;

    private final Map<Long, AdmittedRequest<P, O>> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong lastRequestId = new AtomicLong(0);
    // Submitters hold the read side while admitting; shutdown takes the write side before finalizing stats
    private final ReentrantReadWriteLock admissions = new ReentrantReadWriteLock();

    /**
     * @param config Dispatcher configuration
     * @param processor Function applied to each payload by the workers
     */
    public Dispatcher(DispatcherConfig config, PayloadProcessor<P, O> processor) {
        this.config = Objects.requireNonNull(config, "config");
        Objects.requireNonNull(processor, "processor");

        this.gate = new AdmissionGate(config.admissionLimit());
        this.queue = new WorkQueue<>(config.queueCapacity());
        this.stats = new StatsAggregator();
        this.workers = new WorkerPool<>(config, queue, processor, this::haltOnFatalError);
        this.coordinator = new ShutdownCoordinator<>(gate, queue, workers, stats, inFlight.values(),
                admissions.writeLock());
    }

    /**
     * Start the workers. Call this before submitting any request.
     *
     * @throws IllegalStateException If already started or shut down
     */
    public synchronized void start() {
        if (!coordinator.markRunning()) throw new IllegalStateException("Already " + coordinator.state());
        workers.start();
        log.info("Started dispatcher with {} workers, admission limit {} and queue capacity {}",
                config.workerCount(), config.admissionLimit(), config.queueCapacity());
    }

    /**
     * Submit a payload with the configured default deadline and wait for its outcome.
     */
    public Outcome<O> submit(P payload) throws InterruptedException {
        return submit(payload, null);
    }

    /**
     * Submit a payload and wait for its outcome.
     * Thread-safe - can be called from multiple threads concurrently.
     *
     * @param payload Payload handed to the processing function
     * @param deadline Relative deadline, or null for the configured default
     * @return The request outcome. Rejection, timeouts and failures are reported here, not thrown.
     * @throws IllegalStateException If the dispatcher was never started
     * @throws InterruptedException If interrupted while waiting. The request itself still completes.
     */
    public Outcome<O> submit(P payload, Duration deadline) throws InterruptedException {
        return admit(payload, deadline).await();
    }

    public CompletableFuture<Outcome<O>> submitAsync(P payload) throws InterruptedException {
        return submitAsync(payload, null);
    }

    /**
     * Submit a payload without waiting for the outcome. Admission is synchronous and may block, depending on
     * the {@link AdmissionPolicy} and the work queue offer timeout.
     */
    public CompletableFuture<Outcome<O>> submitAsync(P payload, Duration deadline) throws InterruptedException {
        return admit(payload, deadline).future();
    }

    private ReplyChannel<O> admit(P payload, Duration deadline) throws InterruptedException {
        Objects.requireNonNull(payload, "payload");
        admissions.readLock().lock();
        try {
            return admitLocked(payload, deadline);
        } finally {
            admissions.readLock().unlock();
        }
    }

    private ReplyChannel<O> admitLocked(P payload, Duration deadline) throws InterruptedException {
        DispatcherState state = coordinator.state();
        if (state == DispatcherState.NEW) throw new IllegalStateException("Not running. Call start() first.");

        Request<P> request = Request.create(lastRequestId.incrementAndGet(), payload,
                deadline != null ? deadline : config.perRequestTimeout());
        stats.recordSubmitted();
        if (state != DispatcherState.RUNNING) {
            return reject(request, "Dispatcher is " + state);
        }

        AdmissionGate.Permit permit;
        try {
            permit = config.admissionPolicy() == AdmissionPolicy.WAIT ? gate.acquire() : gate.tryAcquire();
        } catch (GateClosedException e) {
            return reject(request, e.getMessage());
        } catch (InterruptedException e) {
            reject(request, "Interrupted while waiting for admission");
            throw e;
        }
        if (permit == null) {
            return reject(request, "Admission limit of " + gate.limit() + " reached");
        }

        AdmittedRequest<P, O> admitted = new AdmittedRequest<>(request, permit, stats,
                finished -> inFlight.remove(finished.request().id()));
        inFlight.put(request.id(), admitted);
        boolean queued;
        try {
            queued = queue.offer(admitted, config.queueOfferTimeout());
        } catch (IllegalStateException e) {
            admitted.finish(Outcome.rejected(request, "Dispatcher is shutting down"));
            return admitted.reply();
        } catch (InterruptedException e) {
            admitted.finish(Outcome.rejected(request, "Interrupted while waiting for work queue space"));
            throw e;
        }
        if (!queued) {
            log.warn("Request {} refused, work queue is full", request.id());
            admitted.finish(Outcome.queueFull(request));
        }
        return admitted.reply();
    }

    private ReplyChannel<O> reject(Request<P> request, String reason) {
        log.debug("Request {} rejected: {}", request.id(), reason);
        Outcome<O> outcome = Outcome.rejected(request, reason);
        stats.recordOutcomeAndWait(outcome);
        ReplyChannel<O> reply = new ReplyChannel<>();
        reply.publish(outcome);
        return reply;
    }

    /**
     * Current statistics. Never blocks. Final once {@link #shutdown()} returned.
     */
    public Stats statsSnapshot() {
        return stats.snapshot();
    }

    /**
     * Graceful shutdown with the configured grace period.
     */
    public void shutdown() throws InterruptedException {
        shutdown(config.shutdownGracePeriod());
    }

    /**
     * Stop admitting, let in-flight requests drain for up to {@code gracePeriod}, then abort the rest.
     * Blocks until all workers have stopped.
     */
    public void shutdown(Duration gracePeriod) throws InterruptedException {
        coordinator.shutdown(gracePeriod != null ? gracePeriod : config.shutdownGracePeriod());
    }

    @Override
    public void close() throws InterruptedException {
        shutdown();
    }

    public DispatcherState state() {
        return coordinator.state();
    }

    /**
     * Number of admission permits currently free.
     */
    public int availableSlots() {
        return gate.availablePermits();
    }

    public int inFlightRequests() {
        return gate.inFlight();
    }

    public int queuedRequests() {
        return queue.size();
    }

    public DispatcherConfig config() {
        return config;
    }

    private void haltOnFatalError() {
        Thread halter = new Thread(() -> {
            try {
                shutdown(Duration.ZERO);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("Interrupted while halting dispatcher");
            }
        }, "dispatcher-halt");
        halter.setDaemon(true);
        halter.start();
    }
}
