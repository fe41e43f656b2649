package io.github.galkahana.dispatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;

import lombok.extern.slf4j.Slf4j;

/**
 * Owns the dispatcher statistics. Submission and completion events are queued by any thread and applied in
 * order by a single aggregator thread, which publishes an immutable {@link Stats} after every event.
 * Outcome events are acknowledged once applied, so a caller can hold back a reply until the statistics
 * include it.
 */
@Slf4j
public class StatsAggregator implements AutoCloseable {

    private enum Kind { SUBMITTED, COMPLETED, STOP }

    private record Event(Kind kind, Outcome<?> outcome, CompletableFuture<Void> applied) {
        static final Event SUBMITTED = new Event(Kind.SUBMITTED, null, null);
        static final Event STOP = new Event(Kind.STOP, null, null);

        void acknowledge() {
            if (applied != null) applied.complete(null);
        }
    }

    private static final CompletableFuture<Void> IGNORED = CompletableFuture.completedFuture(null);

    private final BlockingQueue<Event> events = new LinkedBlockingQueue<>();
    private final Thread aggregatorThread;

    private volatile Stats current = Stats.EMPTY;
    private boolean closed = false;

    public StatsAggregator() {
        aggregatorThread = new Thread(this::aggregatorLoop, "dispatcher-stats");
        aggregatorThread.setDaemon(true);
        aggregatorThread.start();
    }

    public void recordSubmitted() {
        enqueue(Event.SUBMITTED);
    }

    /**
     * @return Completes once the outcome is part of {@link #snapshot()}, or at once if the statistics are final
     */
    public CompletableFuture<Void> recordOutcome(Outcome<?> outcome) {
        Event event = new Event(Kind.COMPLETED, outcome, new CompletableFuture<>());
        return enqueue(event) ? event.applied() : IGNORED;
    }

    /**
     * Record the outcome and wait, uninterruptibly, until the snapshot includes it.
     */
    public void recordOutcomeAndWait(Outcome<?> outcome) {
        recordOutcome(outcome).join();
    }

    private synchronized boolean enqueue(Event event) {
        if (closed) {
            log.debug("Statistics are final, ignoring {} event", event.kind());
            return false;
        }
        events.add(event);
        return true;
    }

    /**
     * Latest published statistics. Never blocks.
     */
    public Stats snapshot() {
        return current;
    }

    /**
     * Apply all pending events and stop the aggregator thread. The snapshot is final afterwards.
     */
    @Override
    public void close() throws InterruptedException {
        synchronized (this) {
            if (closed) return;
            closed = true;
            events.add(Event.STOP);
        }
        aggregatorThread.join();
    }

    private void aggregatorLoop() {
        log.debug("Stats aggregator started");
        try {
            while (true) {
                Event event = events.take();
                if (event.kind() == Kind.STOP) break;
                current = event.kind() == Kind.SUBMITTED
                        ? current.withSubmission()
                        : current.withOutcome(event.outcome());
                event.acknowledge();
            }
        } catch (InterruptedException e) {
            log.warn("Stats aggregator interrupted with {} events pending", events.size());
            List<Event> pending = new ArrayList<>();
            events.drainTo(pending);
            pending.forEach(Event::acknowledge);
        }
        log.debug("Stats aggregator stopped: {}", current);
    }
}
