package io.github.galkahana.dispatcher.demo;

import java.time.Duration;

/**
 * A fake HTTP request for the demo server.
 *
 * @param sequence 1-based arrival number
 * @param path Requested path
 * @param processingTime How long handling the request takes
 */
public record SimulatedRequest(long sequence, String path, Duration processingTime) {

    static SimulatedRequest of(long sequence) {
        return new SimulatedRequest(sequence,
                "/api/endpoint" + (sequence % 5),
                Duration.ofMillis(100 + (sequence % 5) * 50));
    }

    /**
     * Every seventh request fails, like a server answering 500.
     */
    boolean failsOnPurpose() {
        return sequence % 7 == 0;
    }
}
