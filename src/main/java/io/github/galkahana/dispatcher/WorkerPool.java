package io.github.galkahana.dispatcher;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

/**
 * Fixed set of worker loops pulling admitted requests from the {@link WorkQueue}.
 * <p>
 * Each payload is processed on a separate processing thread so the worker can race it against the request
 * deadline. A processing failure becomes a {@link Outcome.Status#FAILED} outcome and the loop carries on.
 *
 * @param <P> Payload type
 * @param <O> Result type
 */
@Slf4j
class WorkerPool<P, O> {

    // TimeLimiter works in whole milliseconds
    static final Duration MIN_TIME_LIMIT = Duration.ofMillis(1);
    static final Duration MAX_TIME_LIMIT = Duration.ofMillis(Long.MAX_VALUE);

    private final int workerCount;
    private final WorkQueue<AdmittedRequest<P, O>> queue;
    private final PayloadProcessor<P, O> processor;
    private final Retry retry;
    private final Runnable onFatalError;

    private ExecutorService workers;
    private ExecutorService processing;
    private volatile boolean aborting = false;

    /**
     * @param onFatalError Invoked from a worker thread when permit accounting is found broken
     */
    WorkerPool(DispatcherConfig config, WorkQueue<AdmittedRequest<P, O>> queue,
               PayloadProcessor<P, O> processor, Runnable onFatalError) {
        this.workerCount = config.workerCount();
        this.queue = queue;
        this.processor = processor;
        this.onFatalError = onFatalError;

        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(config.maxRetries() + 1)
                .waitDuration(config.retryWait())
                .retryOnException(e -> !(e instanceof InterruptedException))
                .build();
        this.retry = Retry.of("request-retry", retryConfig);
    }

    void start() {
        workers = Executors.newFixedThreadPool(workerCount, namedThreads("dispatcher-worker-"));
        processing = Executors.newCachedThreadPool(namedThreads("dispatcher-processor-"));
        for (int slot = 0; slot < workerCount; slot++) {
            int workerSlot = slot;
            workers.execute(() -> workerLoop(workerSlot));
        }
        log.info("Started {} workers", workerCount);
    }

    /**
     * Interrupt every processing attempt. Workers report what they were doing as aborted and exit.
     */
    void abort() {
        aborting = true;
        if (processing != null) processing.shutdownNow();
    }

    /**
     * Wait for the worker loops to exit after the queue has been closed, interrupting them if they do not
     * finish within {@code timeout}.
     *
     * @return true if every worker exited
     */
    boolean awaitTermination(Duration timeout) throws InterruptedException {
        if (workers == null) return true;
        workers.shutdown();
        boolean terminated = workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!terminated) {
            log.warn("Workers did not exit in time, interrupting");
            abort();
            workers.shutdownNow();
            terminated = workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        processing.shutdown();
        return terminated;
    }

    private void workerLoop(int slot) {
        log.debug("Worker {} started", slot);
        try {
            while (true) {
                Optional<AdmittedRequest<P, O>> next = queue.take();
                if (next.isEmpty()) break;
                if (!handle(slot, next.get())) break;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Worker {} interrupted", slot);
        }
        log.debug("Worker {} exiting", slot);
    }

    /**
     * @return false if the worker should stop
     */
    private boolean handle(int slot, AdmittedRequest<P, O> admitted) {
        Request<P> request = admitted.request();
        try (MDC.MDCCloseable ignored = MDC.putCloseable("requestId", String.valueOf(request.id()))) {
            if (admitted.isFinished()) return true;

            if (request.isExpired()) {
                log.warn("Request {} expired before processing", request.id());
                return complete(admitted, Outcome.timedOut(request, "Deadline elapsed before processing"));
            }

            log.debug("Worker {} processing request {}", slot, request.id());
            try {
                O result = execute(request);
                return complete(admitted, Outcome.succeeded(request, result));
            } catch (TimeoutException e) {
                log.warn("Request {} timed out after {}", request.id(), request.deadline());
                return complete(admitted, Outcome.timedOut(request, "Deadline elapsed during processing"));
            } catch (InterruptedException e) {
                if (aborting) {
                    complete(admitted, Outcome.aborted(request));
                    Thread.currentThread().interrupt();
                    return false;
                }
                log.error("Request {} interrupted during processing", request.id());
                return complete(admitted, Outcome.failed(request, e));
            } catch (Exception e) {
                log.error("Request {} failed: {}", request.id(), e.getMessage());
                return complete(admitted, Outcome.failed(request, e));
            }
        }
    }

    private O execute(Request<P> request) throws Exception {
        Callable<O> attempt = () -> retry.executeCallable(() -> processor.process(request.payload()));

        Duration limit = timeLimit(request.remaining());
        if (limit == null) {
            Future<O> future = processing.submit(attempt);
            try {
                return future.get();
            } catch (ExecutionException e) {
                throw unwrap(e);
            } catch (InterruptedException e) {
                future.cancel(true);
                throw e;
            }
        }

        TimeLimiter timeLimiter = TimeLimiter.of("request-deadline", TimeLimiterConfig.custom()
                .timeoutDuration(limit)
                .cancelRunningFuture(true)
                .build());
        return timeLimiter.executeFutureSupplier(() -> processing.submit(attempt));
    }

    /**
     * Fit a remaining deadline into what the time limiter can wait for: sub-millisecond remainders round up
     * to one millisecond and deadlines past the millisecond range are treated as unbounded.
     *
     * @return The limit to race against, or null to run without one
     */
    static Duration timeLimit(Duration remaining) {
        if (remaining == null || remaining.compareTo(MAX_TIME_LIMIT) > 0) return null;
        return remaining.compareTo(MIN_TIME_LIMIT) < 0 ? MIN_TIME_LIMIT : remaining;
    }

    private boolean complete(AdmittedRequest<P, O> admitted, Outcome<O> outcome) {
        try {
            if (admitted.finish(outcome)) {
                log.debug("Request {} finished with {} in {}", outcome.requestId(), outcome.status(), outcome.latency());
            }
            return true;
        } catch (IllegalStateException e) {
            log.error("Fatal error finishing request {}, halting dispatcher", outcome.requestId(), e);
            onFatalError.run();
            return false;
        }
    }

    private static Exception unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof Error) throw (Error) cause;
        return cause instanceof Exception ? (Exception) cause : e;
    }

    static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
