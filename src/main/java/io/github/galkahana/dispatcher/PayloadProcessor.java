package io.github.galkahana.dispatcher;

/**
 * Processing step applied by a worker to each request payload.
 *
 * @param <P> Payload type
 * @param <O> Result type
 */
@FunctionalInterface
public interface PayloadProcessor<P, O> {
    O process(P payload) throws Exception;
}
