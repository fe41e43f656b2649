package io.github.galkahana.dispatcher;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single-use reply path from a worker back to the submitter. Only the first published outcome is kept.
 *
 * @param <O> Result type
 */
public class ReplyChannel<O> {

    private final CompletableFuture<Outcome<O>> slot = new CompletableFuture<>();

    /**
     * @return true if this call delivered the outcome, false if one was already published
     */
    public boolean publish(Outcome<O> outcome) {
        return slot.complete(outcome);
    }

    public boolean isPublished() {
        return slot.isDone();
    }

    /**
     * Wait for the outcome.
     */
    public Outcome<O> await() throws InterruptedException {
        try {
            return slot.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Reply channel completed exceptionally", e.getCause());
        }
    }

    /**
     * Wait for the outcome for at most {@code timeout}.
     *
     * @throws TimeoutException If no outcome was published in time. The request itself keeps running.
     */
    public Outcome<O> await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return slot.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Reply channel completed exceptionally", e.getCause());
        }
    }

    /**
     * Read-only view for asynchronous callers.
     */
    public CompletableFuture<Outcome<O>> future() {
        return slot.copy();
    }
}
