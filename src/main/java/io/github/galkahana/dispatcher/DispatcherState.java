package io.github.galkahana.dispatcher;

/**
 * Dispatcher lifecycle. Transitions only move forward.
 */
public enum DispatcherState {
    NEW,
    RUNNING,
    /** Admission closed, already admitted requests still being processed */
    DRAINING,
    STOPPED
}
