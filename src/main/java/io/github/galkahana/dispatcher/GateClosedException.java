package io.github.galkahana.dispatcher;

import java.util.concurrent.RejectedExecutionException;

/**
 * Thrown by {@link AdmissionGate} once it has been closed for shutdown.
 */
public class GateClosedException extends RejectedExecutionException {
    public GateClosedException() {
        super("Admission gate is closed");
    }
}
