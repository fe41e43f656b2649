package io.github.galkahana.dispatcher;

import java.time.Duration;

/**
 * Point-in-time dispatcher statistics.
 * <p>
 * {@link Outcome.Status#QUEUE_FULL} outcomes are counted as rejected, {@link Outcome.Status#ABORTED} outcomes
 * as timed out (and also in {@code aborted}), so that
 * {@code submitted == succeeded + failed + timedOut + rejected} once no request is in flight.
 *
 * @param submitted Total submit calls
 * @param succeeded Requests processed successfully
 * @param failed Requests whose processing raised an exception
 * @param timedOut Requests whose deadline elapsed, including aborted ones
 * @param rejected Requests refused at admission or by a full work queue
 * @param aborted Subset of timedOut that was force-abandoned during shutdown
 * @param cumulativeLatency Sum of latencies of succeeded requests
 */
public record Stats(long submitted, long succeeded, long failed, long timedOut, long rejected,
                    long aborted, Duration cumulativeLatency) {

    public static final Stats EMPTY = new Stats(0, 0, 0, 0, 0, 0, Duration.ZERO);

    public long completed() {
        return succeeded + failed + timedOut + rejected;
    }

    public Duration averageLatency() {
        return succeeded == 0 ? Duration.ZERO : cumulativeLatency.dividedBy(succeeded);
    }

    Stats withSubmission() {
        return new Stats(submitted + 1, succeeded, failed, timedOut, rejected, aborted, cumulativeLatency);
    }

    Stats withOutcome(Outcome<?> outcome) {
        return switch (outcome.status()) {
            case SUCCEEDED -> new Stats(submitted, succeeded + 1, failed, timedOut, rejected, aborted,
                    cumulativeLatency.plus(outcome.latency()));
            case FAILED -> new Stats(submitted, succeeded, failed + 1, timedOut, rejected, aborted, cumulativeLatency);
            case TIMED_OUT -> new Stats(submitted, succeeded, failed, timedOut + 1, rejected, aborted, cumulativeLatency);
            case ABORTED -> new Stats(submitted, succeeded, failed, timedOut + 1, rejected, aborted + 1, cumulativeLatency);
            case REJECTED, QUEUE_FULL -> new Stats(submitted, succeeded, failed, timedOut, rejected + 1, aborted, cumulativeLatency);
        };
    }
}
