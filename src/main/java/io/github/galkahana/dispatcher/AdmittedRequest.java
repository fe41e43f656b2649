package io.github.galkahana.dispatcher;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * A request that holds an admission permit, travelling through the work queue together with its reply path.
 * <p>
 * Whoever finishes it first (a worker, or the shutdown path) records the outcome in the statistics, returns the
 * permit and publishes the reply. Every later attempt is a no-op, which keeps one outcome per request.
 */
class AdmittedRequest<P, O> {

    private final Request<P> request;
    private final ReplyChannel<O> reply;
    private final AdmissionGate.Permit permit;
    private final StatsAggregator stats;
    private final Consumer<AdmittedRequest<P, O>> onFinished;
    private final AtomicBoolean finished = new AtomicBoolean(false);

    AdmittedRequest(Request<P> request, AdmissionGate.Permit permit, StatsAggregator stats,
                    Consumer<AdmittedRequest<P, O>> onFinished) {
        this.request = request;
        this.reply = new ReplyChannel<>();
        this.permit = permit;
        this.stats = stats;
        this.onFinished = onFinished;
    }

    Request<P> request() {
        return request;
    }

    ReplyChannel<O> reply() {
        return reply;
    }

    boolean isFinished() {
        return finished.get();
    }

    /**
     * @return true if this call produced the request's outcome
     * @throws IllegalStateException If the permit had already been returned
     */
    boolean finish(Outcome<O> outcome) {
        if (!finished.compareAndSet(false, true)) return false;
        stats.recordOutcomeAndWait(outcome);
        try {
            onFinished.accept(this);
            permit.release();
        } finally {
            reply.publish(outcome);
        }
        return true;
    }
}
