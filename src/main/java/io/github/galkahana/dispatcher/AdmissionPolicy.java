package io.github.galkahana.dispatcher;

/**
 * What a submitter does when the admission limit is reached.
 */
public enum AdmissionPolicy {
    /** Block until a permit frees up or the gate closes */
    WAIT,
    /** Return a {@link Outcome.Status#REJECTED} outcome immediately */
    REJECT
}
