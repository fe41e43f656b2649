package io.github.galkahana.dispatcher.demo;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import io.github.galkahana.dispatcher.Dispatcher;
import io.github.galkahana.dispatcher.DispatcherConfig;
import io.github.galkahana.dispatcher.DispatcherConfigLoader;
import io.github.galkahana.dispatcher.Outcome;
import io.github.galkahana.dispatcher.Stats;
import lombok.extern.slf4j.Slf4j;

/**
 * Simulated request server: a generator submits fake HTTP requests at a steady rate, a collector waits for
 * their responses and a monitor reports free admission slots, until everything is answered and the dispatcher
 * shuts down.
 */
@Slf4j
public class DispatcherDemo {

    private static final Duration RESPONSE_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration MONITOR_INTERVAL = Duration.ofSeconds(2);

    private final DispatcherConfig config;
    private final int numRequests;
    private final Duration arrivalInterval;

    public DispatcherDemo(DispatcherConfig config, int numRequests, Duration arrivalInterval) {
        this.config = config;
        this.numRequests = numRequests;
        this.arrivalInterval = arrivalInterval;
    }

    public static void main(String[] args) throws InterruptedException {
        String location = args.length > 0 ? args[0] : "dispatcher.yaml";
        DispatcherConfig config = new DispatcherConfigLoader().load(location);
        DispatcherDemo demo = new DispatcherDemo(config, 20, Duration.ofMillis(50));

        Stats stats = demo.run();

        log.info("Server statistics: total={}, succeeded={} ({}%), failed={} ({}%), average latency={}ms",
                stats.submitted(),
                stats.succeeded(), percent(stats.succeeded(), stats.submitted()),
                stats.failed(), percent(stats.failed(), stats.submitted()),
                stats.averageLatency().toMillis());

        Stats drained = demo.runGracefulShutdown(
                List.of(Duration.ofMillis(300), Duration.ofSeconds(30), Duration.ofSeconds(30)), Duration.ofSeconds(1));
        log.info("Graceful shutdown: succeeded={}, aborted={}", drained.succeeded(), drained.aborted());
    }

    /**
     * Run the simulation to completion.
     *
     * @return Final dispatcher statistics
     */
    public Stats run() throws InterruptedException {
        Dispatcher<SimulatedRequest, String> dispatcher = new Dispatcher<>(config, DispatcherDemo::handle);
        ScheduledExecutorService monitor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "demo-monitor");
            thread.setDaemon(true);
            return thread;
        });

        dispatcher.start();
        monitor.scheduleAtFixedRate(
                () -> log.info("Monitor: {} admission slots available, {} requests queued",
                        dispatcher.availableSlots(), dispatcher.queuedRequests()),
                MONITOR_INTERVAL.toMillis(), MONITOR_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);

        try {
            List<CompletableFuture<Outcome<String>>> responses = generate(dispatcher);
            collect(responses);
        } finally {
            monitor.shutdownNow();
            dispatcher.shutdown();
        }
        return dispatcher.statsSnapshot();
    }

    /**
     * Submit long running requests, one per processing time, and shut down while they are still in flight.
     * Requests that finish within the grace period succeed and the rest are aborted.
     *
     * @return Final dispatcher statistics
     */
    public Stats runGracefulShutdown(List<Duration> processingTimes, Duration grace) throws InterruptedException {
        Dispatcher<SimulatedRequest, String> dispatcher = new Dispatcher<>(config, DispatcherDemo::handle);
        dispatcher.start();

        List<CompletableFuture<Outcome<String>>> responses = new ArrayList<>(processingTimes.size());
        long sequence = 1;
        for (Duration processingTime : processingTimes) {
            responses.add(dispatcher.submitAsync(new SimulatedRequest(sequence, "/api/long" + sequence, processingTime)));
            sequence++;
        }

        log.info("Shutting down with {} requests in flight, grace period {}", dispatcher.inFlightRequests(), grace);
        dispatcher.shutdown(grace);
        collect(responses);
        return dispatcher.statsSnapshot();
    }

    private List<CompletableFuture<Outcome<String>>> generate(Dispatcher<SimulatedRequest, String> dispatcher)
            throws InterruptedException {
        log.info("Generating {} requests", numRequests);
        List<CompletableFuture<Outcome<String>>> responses = new ArrayList<>(numRequests);
        for (long sequence = 1; sequence <= numRequests; sequence++) {
            SimulatedRequest request = SimulatedRequest.of(sequence);
            log.debug("Submitting request #{} ({})", sequence, request.path());
            responses.add(dispatcher.submitAsync(request));
            Thread.sleep(arrivalInterval.toMillis());
        }
        log.info("All requests submitted");
        return responses;
    }

    private void collect(List<CompletableFuture<Outcome<String>>> responses) throws InterruptedException {
        int received = 0;
        for (CompletableFuture<Outcome<String>> response : responses) {
            try {
                Outcome<String> outcome = response.get(RESPONSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                received++;
                if (outcome.isSuccess()) {
                    log.info("Response #{}: {}", outcome.requestId(), outcome.result());
                } else {
                    log.warn("Response #{}: {} ({})", outcome.requestId(), outcome.status(), outcome.error());
                }
            } catch (TimeoutException e) {
                log.warn("Gave up waiting for responses after {}", RESPONSE_TIMEOUT);
                break;
            } catch (ExecutionException e) {
                throw new IllegalStateException("Response future failed", e.getCause());
            }
        }
        log.info("Collector done, received {} responses", received);
    }

    static String handle(SimulatedRequest request) throws InterruptedException, SimulatedServerException {
        Thread.sleep(request.processingTime().toMillis());
        if (request.failsOnPurpose()) {
            throw new SimulatedServerException(request.path());
        }
        return "Response for " + request.path();
    }

    private static String percent(long part, long total) {
        return total == 0 ? "0.0" : String.format("%.1f", part * 100.0 / total);
    }

    /**
     * Stand-in for an HTTP 500 from the simulated backend.
     */
    static class SimulatedServerException extends Exception {
        SimulatedServerException(String path) {
            super("Internal server error for " + path);
        }
    }
}
