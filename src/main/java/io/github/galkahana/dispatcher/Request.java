package io.github.galkahana.dispatcher;

import java.time.Duration;
import java.util.Objects;

/**
 * A unit of work submitted to the {@link Dispatcher}.
 *
 * @param id Unique, monotonically assigned request identifier
 * @param payload Opaque payload handed to the processing function
 * @param deadline Relative timeout measured from creation, or null for no deadline
 * @param createdNanos {@link System#nanoTime()} at creation
 * @param <P> Payload type
 */
public record Request<P>(long id, P payload, Duration deadline, long createdNanos) {

    public Request {
        Objects.requireNonNull(payload, "payload");
    }

    static <P> Request<P> create(long id, P payload, Duration deadline) {
        return new Request<>(id, payload, deadline, System.nanoTime());
    }

    public boolean hasDeadline() {
        return deadline != null;
    }

    /**
     * Time left before the deadline fires. Zero or negative once elapsed, null without a deadline.
     */
    public Duration remaining() {
        if (deadline == null) return null;
        return deadline.minusNanos(System.nanoTime() - createdNanos);
    }

    public boolean isExpired() {
        Duration remaining = remaining();
        return remaining != null && (remaining.isZero() || remaining.isNegative());
    }

    public Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - createdNanos);
    }
}
