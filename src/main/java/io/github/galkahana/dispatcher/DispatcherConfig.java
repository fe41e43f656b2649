package io.github.galkahana.dispatcher;

import java.time.Duration;
import java.util.Objects;

import lombok.Builder;

/**
 * Dispatcher configuration.
 *
 * @param workerCount Number of worker loops
 * @param queueCapacity Bound on requests waiting in the work queue
 * @param admissionLimit Maximum number of requests in flight (queued or processing)
 * @param perRequestTimeout Deadline applied when the caller does not give one, null for none
 * @param shutdownGracePeriod Time allowed for draining in-flight requests before they are aborted
 * @param admissionPolicy Behavior when the admission limit is reached
 * @param queueOfferTimeout How long a submitter waits for work queue space. Zero rejects immediately
 * @param maxRetries Retry attempts for a failed processing step, within the request deadline
 * @param retryWait Pause between retry attempts
 */
@Builder(toBuilder = true)
public record DispatcherConfig(
        int workerCount,
        int queueCapacity,
        int admissionLimit,
        Duration perRequestTimeout,
        Duration shutdownGracePeriod,
        AdmissionPolicy admissionPolicy,
        Duration queueOfferTimeout,
        int maxRetries,
        Duration retryWait) {

    public DispatcherConfig {
        if (workerCount < 1) throw new IllegalArgumentException("workerCount must be >= 1, got " + workerCount);
        if (queueCapacity < 1) throw new IllegalArgumentException("queueCapacity must be >= 1, got " + queueCapacity);
        if (admissionLimit < 1) throw new IllegalArgumentException("admissionLimit must be >= 1, got " + admissionLimit);
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        Objects.requireNonNull(admissionPolicy, "admissionPolicy");
        requireNonNegative(shutdownGracePeriod, "shutdownGracePeriod");
        requireNonNegative(queueOfferTimeout, "queueOfferTimeout");
        requireNonNegative(retryWait, "retryWait");
        if (perRequestTimeout != null && perRequestTimeout.isNegative()) {
            throw new IllegalArgumentException("perRequestTimeout must not be negative");
        }
    }

    private static void requireNonNegative(Duration duration, String name) {
        Objects.requireNonNull(duration, name);
        if (duration.isNegative()) throw new IllegalArgumentException(name + " must not be negative");
    }

    public static DispatcherConfig defaults() {
        return builder().build();
    }

    // Defaults picked up by the Lombok generated builder
    public static class DispatcherConfigBuilder {
        private int workerCount = 4;
        private int queueCapacity = 100;
        private int admissionLimit = 3;
        private Duration shutdownGracePeriod = Duration.ofSeconds(10);
        private AdmissionPolicy admissionPolicy = AdmissionPolicy.WAIT;
        private Duration queueOfferTimeout = Duration.ZERO;
        private int maxRetries = 0;
        private Duration retryWait = Duration.ofMillis(50);
    }
}
