package com.cajunsystems.camel.activation;

import com.cajunsystems.camel.RouteCreationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(10)
class ActivationTrackerTest {

    private ActivationTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new ActivationTracker();
    }

    @Test
    void unknownActorIsUnregistered() {
        assertEquals(ActivationState.UNREGISTERED, tracker.stateOf("a"));
        assertEquals(0, tracker.routeCount());
    }

    @Test
    void fullLifecycle() throws Exception {
        tracker.activating("a");
        assertEquals(ActivationState.ACTIVATING, tracker.stateOf("a"));

        tracker.activated("a");
        tracker.awaitActivation("a", Duration.ofMillis(10));
        assertEquals(1, tracker.routeCount());

        tracker.deactivating("a");
        assertEquals(0, tracker.routeCount());
        tracker.deactivated("a");
        tracker.awaitDeactivation("a", Duration.ofMillis(10));
        assertEquals(ActivationState.INACTIVE, tracker.stateOf("a"));
    }

    @Test
    void awaitActivationWakesUpOnTransition() throws Exception {
        tracker.activating("a");
        CountDownLatch waiting = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> waiter = executor.submit(() -> {
                waiting.countDown();
                tracker.awaitActivation("a", Duration.ofSeconds(5));
                return null;
            });
            assertTrue(waiting.await(1, TimeUnit.SECONDS));

            tracker.activated("a");

            waiter.get(2, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void awaitActivationFailsWithRouteCreationException() {
        IllegalArgumentException cause = new IllegalArgumentException("bad uri");
        tracker.activating("a");
        tracker.failed("a", cause);

        RouteCreationException e = assertThrows(RouteCreationException.class,
                () -> tracker.awaitActivation("a", Duration.ofSeconds(1)));
        assertSame(cause, e.getCause());
        assertEquals("a", e.getActorId());
        assertEquals(0, tracker.routeCount());
    }

    @Test
    void awaitActivationTimesOut() {
        tracker.activating("a");

        assertThrows(TimeoutException.class, () -> tracker.awaitActivation("a", Duration.ofMillis(20)));
    }

    @Test
    void awaitDeactivationTimesOutWhileActive() {
        tracker.activating("a");
        tracker.activated("a");

        assertThrows(TimeoutException.class, () -> tracker.awaitDeactivation("a", Duration.ofMillis(20)));
    }

    @Test
    void illegalTransitionsAreRejected() {
        assertThrows(IllegalStateException.class, () -> tracker.activated("a"));
        assertThrows(IllegalStateException.class, () -> tracker.deactivating("a"));

        tracker.activating("a");
        assertThrows(IllegalStateException.class, () -> tracker.activating("a"));
        assertThrows(IllegalStateException.class, () -> tracker.deactivated("a"));

        tracker.activated("a");
        assertThrows(IllegalStateException.class, () -> tracker.failed("a", new RuntimeException()));
        assertEquals(ActivationState.ACTIVE, tracker.stateOf("a"));
    }

    @Test
    void failedConsumerBecomesInactiveWhenStopped() throws Exception {
        tracker.activating("a");
        tracker.failed("a", new RuntimeException("x"));

        tracker.deactivated("a");

        tracker.awaitDeactivation("a", Duration.ofMillis(10));
    }

    @Test
    void inactiveIdCanBeActivatedAgain() throws Exception {
        tracker.activating("a");
        tracker.activated("a");
        tracker.deactivating("a");
        tracker.deactivated("a");

        tracker.activating("a");
        tracker.activated("a");

        assertEquals(ActivationState.ACTIVE, tracker.stateOf("a"));
        assertEquals(1, tracker.routeCount());
    }

    @Test
    void futuresCompleteOnTransitions() throws Exception {
        CompletableFuture<String> activation = tracker.activationFuture("a");
        CompletableFuture<String> deactivation = tracker.deactivationFuture("a");
        assertFalse(activation.isDone());

        tracker.activating("a");
        tracker.activated("a");
        assertEquals("a", activation.get(1, TimeUnit.SECONDS));
        assertFalse(deactivation.isDone());

        tracker.deactivating("a");
        tracker.deactivated("a");
        assertEquals("a", deactivation.get(1, TimeUnit.SECONDS));
    }

    @Test
    void activationFutureFailsOnRouteFailure() {
        tracker.activating("a");
        tracker.failed("a", new IllegalStateException("nope"));

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> tracker.activationFuture("a").get(1, TimeUnit.SECONDS));
        assertInstanceOf(RouteCreationException.class, e.getCause());
    }

    @Test
    void routeCountIsConsistentUnderConcurrentTransitions() throws Exception {
        int consumers = 50;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < consumers; i++) {
                String id = "c" + i;
                futures.add(executor.submit(() -> {
                    tracker.activating(id);
                    tracker.activated(id);
                    if (id.hashCode() % 2 == 0) {
                        tracker.deactivating(id);
                        tracker.deactivated(id);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        long expected = 0;
        for (int i = 0; i < consumers; i++) {
            if (tracker.stateOf("c" + i) == ActivationState.ACTIVE) {
                expected++;
            }
        }
        assertEquals(expected, tracker.routeCount());
    }
}
