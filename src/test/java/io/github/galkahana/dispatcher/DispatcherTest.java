package io.github.galkahana.dispatcher;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class DispatcherTest {

    private Dispatcher<Integer, Integer> dispatcher;

    @AfterEach
    public void tearDown() throws Exception {
        if (dispatcher != null) dispatcher.shutdown(Duration.ZERO);
    }

    private Dispatcher<Integer, Integer> startDispatcher(DispatcherConfig config, PayloadProcessor<Integer, Integer> processor) {
        dispatcher = new Dispatcher<>(config, processor);
        dispatcher.start();
        return dispatcher;
    }

    @Test
    public void testAdmissionLimit_BoundsConcurrentProcessing() throws Exception {
        // Arrange
        AtomicInteger running = new AtomicInteger(0);
        AtomicInteger maxRunning = new AtomicInteger(0);

        startDispatcher(
            DispatcherConfig.builder().workerCount(2).admissionLimit(2).queueCapacity(10).build(),
            num -> {
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                Thread.sleep(100);
                running.decrementAndGet();
                return num * 2;
            }
        );

        // Act
        List<CompletableFuture<Outcome<Integer>>> futures = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            futures.add(dispatcher.submitAsync(i));
        }
        List<Outcome<Integer>> outcomes = futures.stream().map(CompletableFuture::join).toList();
        dispatcher.shutdown();

        // Assert
        for (int i = 0; i < 5; i++) {
            assertEquals(Outcome.Status.SUCCEEDED, outcomes.get(i).status(), "Request " + i + " should succeed");
            assertEquals(i * 2, outcomes.get(i).result());
        }
        assertTrue(maxRunning.get() <= 2, "At most 2 requests should run at once, saw " + maxRunning.get());
        Stats stats = dispatcher.statsSnapshot();
        assertEquals(5, stats.submitted());
        assertEquals(5, stats.succeeded());
    }

    @Test
    public void testRejectPolicy_RejectsBeyondAdmissionLimit() throws Exception {
        // Arrange
        CountDownLatch release = new CountDownLatch(1);
        startDispatcher(
            DispatcherConfig.builder().workerCount(1).admissionLimit(1).admissionPolicy(AdmissionPolicy.REJECT).build(),
            num -> {
                release.await();
                return num;
            }
        );

        // Act
        CompletableFuture<Outcome<Integer>> first = dispatcher.submitAsync(1);
        Outcome<Integer> second = dispatcher.submit(2);
        release.countDown();

        // Assert
        assertEquals(Outcome.Status.REJECTED, second.status());
        assertEquals(Outcome.Status.SUCCEEDED, first.join().status());
    }

    @Test
    public void testWaitPolicy_SuspendsUntilSlotFrees() throws Exception {
        // Arrange
        CountDownLatch release = new CountDownLatch(1);
        startDispatcher(
            DispatcherConfig.builder().workerCount(1).admissionLimit(1).build(),
            num -> {
                release.await();
                return num;
            }
        );
        CompletableFuture<Outcome<Integer>> first = dispatcher.submitAsync(1);

        // Act
        CompletableFuture<Outcome<Integer>> second = CompletableFuture.supplyAsync(() -> {
            try {
                return dispatcher.submit(2);
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(200);
        boolean secondDoneWhileBlocked = second.isDone();
        release.countDown();

        // Assert
        assertFalse(secondDoneWhileBlocked, "Second submitter should wait for a free slot");
        assertEquals(Outcome.Status.SUCCEEDED, first.join().status());
        assertEquals(Outcome.Status.SUCCEEDED, second.get(5, TimeUnit.SECONDS).status());
    }

    @Test
    public void testExpiredDeadline_TimesOutWithoutProcessing() throws Exception {
        // Arrange
        AtomicInteger invocations = new AtomicInteger(0);
        startDispatcher(DispatcherConfig.defaults(), num -> {
            invocations.incrementAndGet();
            return num;
        });

        // Act
        Outcome<Integer> outcome = dispatcher.submit(1, Duration.ZERO);

        // Assert
        assertEquals(Outcome.Status.TIMED_OUT, outcome.status());
        assertEquals(0, invocations.get(), "Processing should not be invoked for an expired request");
    }

    @Test
    public void testDeadlineDuringProcessing_TimesOutAndWorkerContinues() throws Exception {
        // Arrange - a single worker, so the second request proves the loop survived
        startDispatcher(DispatcherConfig.builder().workerCount(1).build(), num -> {
            if (num < 0) Thread.sleep(5_000);
            return num;
        });

        // Act
        Outcome<Integer> slow = dispatcher.submit(-1, Duration.ofMillis(100));
        Outcome<Integer> fast = dispatcher.submit(7, Duration.ofSeconds(5));

        // Assert
        assertEquals(Outcome.Status.TIMED_OUT, slow.status());
        assertTrue(slow.latency().compareTo(Duration.ofSeconds(5)) < 0, "Timed out request should not wait for processing");
        assertEquals(Outcome.Status.SUCCEEDED, fast.status());
        assertEquals(7, fast.result());
    }

    @Test
    public void testDefaultDeadline_AppliedWhenCallerGivesNone() throws Exception {
        // Arrange
        startDispatcher(DispatcherConfig.builder().perRequestTimeout(Duration.ofMillis(100)).build(), num -> {
            Thread.sleep(5_000);
            return num;
        });

        // Act
        Outcome<Integer> outcome = dispatcher.submit(1);

        // Assert
        assertEquals(Outcome.Status.TIMED_OUT, outcome.status());
    }

    @Test
    public void testProcessingFailures_ReportedAndPoolSurvives() throws Exception {
        // Arrange
        startDispatcher(DispatcherConfig.builder().workerCount(1).build(), num -> {
            if (num % 2 == 1) throw new RuntimeException("Simulated failure for " + num);
            return num;
        });

        // Act
        List<Outcome<Integer>> outcomes = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            outcomes.add(dispatcher.submit(i));
        }

        // Assert
        for (int i = 0; i < 6; i++) {
            Outcome<Integer> outcome = outcomes.get(i);
            if (i % 2 == 1) {
                assertEquals(Outcome.Status.FAILED, outcome.status());
                assertEquals("Simulated failure for " + i, outcome.error());
                assertInstanceOf(RuntimeException.class, outcome.cause());
            } else {
                assertEquals(Outcome.Status.SUCCEEDED, outcome.status());
            }
        }
    }

    @Test
    public void testTransientFailures_RecoverWithRetries() throws Exception {
        // Arrange
        ConcurrentHashMap<Integer, AtomicInteger> attemptCounts = new ConcurrentHashMap<>();
        startDispatcher(DispatcherConfig.builder().maxRetries(3).retryWait(Duration.ofMillis(1)).build(), num -> {
            int attemptNumber = attemptCounts.computeIfAbsent(num, k -> new AtomicInteger(0)).incrementAndGet();

            // Fail on first two attempts
            if (attemptNumber <= 2) {
                throw new RuntimeException("Simulated failure on attempt " + attemptNumber);
            }
            return num;
        });

        // Act
        List<Outcome<Integer>> outcomes = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            outcomes.add(dispatcher.submit(i));
        }

        // Assert
        for (int i = 0; i < 5; i++) {
            assertEquals(Outcome.Status.SUCCEEDED, outcomes.get(i).status());
            assertEquals(3, attemptCounts.get(i).get(), "Request " + i + " should take 3 attempts");
        }
    }

    @Test
    public void testPersistentFailures_FailAfterRetries() throws Exception {
        // Arrange
        AtomicInteger attempts = new AtomicInteger(0);
        startDispatcher(DispatcherConfig.builder().maxRetries(2).retryWait(Duration.ofMillis(1)).build(), num -> {
            attempts.incrementAndGet();
            throw new IllegalArgumentException("Persistent failure");
        });

        // Act
        Outcome<Integer> outcome = dispatcher.submit(1);

        // Assert
        assertEquals(Outcome.Status.FAILED, outcome.status());
        assertInstanceOf(IllegalArgumentException.class, outcome.cause());
        assertEquals(3, attempts.get());
    }

    @Test
    public void testFullQueue_RejectsFast() throws Exception {
        // Arrange
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        startDispatcher(
            DispatcherConfig.builder().workerCount(1).admissionLimit(3).queueCapacity(1).build(),
            num -> {
                started.countDown();
                release.await();
                return num;
            }
        );
        CompletableFuture<Outcome<Integer>> processing = dispatcher.submitAsync(1);
        assertTrue(started.await(5, TimeUnit.SECONDS));
        CompletableFuture<Outcome<Integer>> queued = dispatcher.submitAsync(2);

        // Act
        Outcome<Integer> overflow = dispatcher.submit(3);
        release.countDown();

        // Assert
        assertEquals(Outcome.Status.QUEUE_FULL, overflow.status());
        assertEquals(Outcome.Status.SUCCEEDED, processing.join().status());
        assertEquals(Outcome.Status.SUCCEEDED, queued.join().status());

        dispatcher.shutdown();
        assertEquals(1, dispatcher.statsSnapshot().rejected());
    }

    @Test
    public void testStats_AccountForEveryOutcome() throws Exception {
        // Arrange
        startDispatcher(DispatcherConfig.builder().workerCount(2).build(), num -> {
            if (num < 0) throw new RuntimeException("negative");
            return num;
        });

        // Act
        dispatcher.submit(1);
        dispatcher.submit(2);
        dispatcher.submit(-1);
        dispatcher.submit(3, Duration.ZERO);
        dispatcher.shutdown();
        Outcome<Integer> afterShutdown = dispatcher.submit(4);

        // Assert
        assertEquals(Outcome.Status.REJECTED, afterShutdown.status());
        Stats stats = dispatcher.statsSnapshot();
        assertEquals(4, stats.submitted(), "Submissions after stop are not counted in the final stats");
        assertEquals(2, stats.succeeded());
        assertEquals(1, stats.failed());
        assertEquals(1, stats.timedOut());
        assertEquals(0, stats.rejected());
        assertEquals(stats.submitted(), stats.succeeded() + stats.failed() + stats.timedOut() + stats.rejected());
        assertTrue(stats.averageLatency().compareTo(Duration.ZERO) > 0);
    }

    @Test
    public void testRequestIds_AreUniqueAndIncreasing() throws Exception {
        // Arrange
        startDispatcher(DispatcherConfig.defaults(), num -> num);

        // Act
        long previous = 0;
        for (int i = 0; i < 10; i++) {
            long id = dispatcher.submit(i).requestId();

            // Assert
            assertTrue(id > previous, "Request ids should increase");
            previous = id;
        }
    }

    @Test
    public void testStats_IncludeOutcomeOnceSubmitReturns() throws Exception {
        // Arrange
        startDispatcher(DispatcherConfig.builder().workerCount(2).build(), num -> {
            if (num % 5 == 0) throw new RuntimeException("Simulated failure for " + num);
            return num;
        });

        // Act
        int lagging = 0;
        for (int i = 0; i < 2000; i++) {
            dispatcher.submit(i);
            Stats stats = dispatcher.statsSnapshot();
            if (stats.submitted() != stats.completed() || stats.completed() != i + 1) lagging++;
        }

        // Assert
        assertEquals(0, lagging, "Snapshots taken after submit returned should include its outcome");
        assertEquals(400, dispatcher.statsSnapshot().failed());
    }

    @Test
    public void testRejectedSubmit_CountedBeforeOutcomeReturned() throws Exception {
        // Arrange
        CountDownLatch release = new CountDownLatch(1);
        startDispatcher(DispatcherConfig.builder().admissionLimit(1).admissionPolicy(AdmissionPolicy.REJECT).build(), num -> {
            release.await();
            return num;
        });
        CompletableFuture<Outcome<Integer>> blocking = dispatcher.submitAsync(1);

        // Act
        Outcome<Integer> rejected = dispatcher.submit(2);
        Stats stats = dispatcher.statsSnapshot();
        release.countDown();
        blocking.join();

        // Assert
        assertEquals(Outcome.Status.REJECTED, rejected.status());
        assertEquals(2, stats.submitted());
        assertEquals(1, stats.rejected());
    }

    @Test
    public void testHugeDeadline_ProcessesWithoutLimit() throws Exception {
        // Arrange
        startDispatcher(DispatcherConfig.defaults(), num -> num + 1);

        // Act
        Outcome<Integer> outcome = dispatcher.submit(41, Duration.ofSeconds(Long.MAX_VALUE));

        // Assert
        assertEquals(Outcome.Status.SUCCEEDED, outcome.status());
        assertEquals(42, outcome.result());
    }

    @Test
    public void testSubmitBeforeStart_Throws() {
        // Arrange
        Dispatcher<Integer, Integer> notStarted = new Dispatcher<>(DispatcherConfig.defaults(), num -> num);

        // Act & Assert
        assertThrows(IllegalStateException.class, () -> notStarted.submit(1));
    }

    @Test
    public void testStartTwice_Throws() {
        // Arrange
        startDispatcher(DispatcherConfig.defaults(), num -> num);

        // Act & Assert
        assertThrows(IllegalStateException.class, () -> dispatcher.start());
    }

    @Test
    public void testAvailableSlots_TrackInFlightRequests() throws Exception {
        // Arrange
        CountDownLatch release = new CountDownLatch(1);
        startDispatcher(DispatcherConfig.builder().admissionLimit(3).build(), num -> {
            release.await();
            return num;
        });

        // Act
        CompletableFuture<Outcome<Integer>> first = dispatcher.submitAsync(1);
        CompletableFuture<Outcome<Integer>> second = dispatcher.submitAsync(2);
        int slotsWhileBusy = dispatcher.availableSlots();
        release.countDown();
        first.join();
        second.join();

        // Assert
        assertEquals(1, slotsWhileBusy);
        assertEquals(3, dispatcher.availableSlots());
        assertEquals(0, dispatcher.inFlightRequests());
    }
}
