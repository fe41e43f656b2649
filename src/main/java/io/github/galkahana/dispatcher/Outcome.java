package io.github.galkahana.dispatcher;

import java.time.Duration;

/**
 * The single result produced for a submitted {@link Request}.
 *
 * @param requestId Identifier of the originating request
 * @param status Terminal status
 * @param result Value returned by the processing function, only set on {@link Status#SUCCEEDED}
 * @param latency Time from request creation until this outcome was produced
 * @param error Human readable error detail, null on success
 * @param cause Underlying exception for failed processing, if any
 * @param <O> Result type
 */
public record Outcome<O>(long requestId, Status status, O result, Duration latency, String error, Throwable cause) {

    public enum Status {
        SUCCEEDED,
        FAILED,
        TIMED_OUT,
        /** Admission gate closed, dispatcher not running, or admission limit reached under the reject policy */
        REJECTED,
        /** Work queue stayed full for the whole offer timeout */
        QUEUE_FULL,
        /** Force-abandoned when the shutdown grace period elapsed */
        ABORTED
    }

    static <O> Outcome<O> succeeded(Request<?> request, O result) {
        return new Outcome<>(request.id(), Status.SUCCEEDED, result, request.elapsed(), null, null);
    }

    static <O> Outcome<O> failed(Request<?> request, Throwable cause) {
        return new Outcome<>(request.id(), Status.FAILED, null, request.elapsed(), String.valueOf(cause.getMessage()), cause);
    }

    static <O> Outcome<O> timedOut(Request<?> request, String error) {
        return new Outcome<>(request.id(), Status.TIMED_OUT, null, request.elapsed(), error, null);
    }

    static <O> Outcome<O> rejected(Request<?> request, String error) {
        return new Outcome<>(request.id(), Status.REJECTED, null, request.elapsed(), error, null);
    }

    static <O> Outcome<O> queueFull(Request<?> request) {
        return new Outcome<>(request.id(), Status.QUEUE_FULL, null, request.elapsed(), "Work queue is full", null);
    }

    static <O> Outcome<O> aborted(Request<?> request) {
        return new Outcome<>(request.id(), Status.ABORTED, null, request.elapsed(), "Aborted by shutdown", null);
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }
}
