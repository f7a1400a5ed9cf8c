package com.cajunsystems.camel.activation;

import com.cajunsystems.camel.RouteCreationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Records the activation state of every consumer actor's route and lets callers wait for transitions.
 * <p>
 * State is only changed by the bridge through {@link #activating}, {@link #activated}, {@link #failed},
 * {@link #deactivating} and {@link #deactivated}; the tracker never moves a route on its own.
 * All state lives under one lock and waiters are woken through a condition.
 */
public class ActivationTracker {
    private static final Logger logger = LoggerFactory.getLogger(ActivationTracker.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition stateChanged = lock.newCondition();

    private final Map<String, ActivationState> states = new HashMap<>();
    private final Map<String, Throwable> failures = new HashMap<>();
    private final Map<String, CompletableFuture<String>> activationFutures = new HashMap<>();
    private final Map<String, CompletableFuture<String>> deactivationFutures = new HashMap<>();
    private int activeCount;

    /**
     * Marks the start of a route build. Allowed for new actor IDs and for IDs whose previous route is INACTIVE.
     */
    public void activating(String actorId) {
        lock.lock();
        try {
            transition(actorId, ActivationState.ACTIVATING);
            failures.remove(actorId);
            activationFutures.computeIfPresent(actorId, (id, future) -> future.isDone() ? null : future);
            deactivationFutures.computeIfPresent(actorId, (id, future) -> future.isDone() ? null : future);
        } finally {
            lock.unlock();
        }
    }

    public void activated(String actorId) {
        CompletableFuture<String> future;
        lock.lock();
        try {
            transition(actorId, ActivationState.ACTIVE);
            activeCount++;
            future = activationFutures.get(actorId);
        } finally {
            lock.unlock();
        }
        logger.info("Route of consumer {} activated", actorId);
        if (future != null) {
            future.complete(actorId);
        }
    }

    public void failed(String actorId, Throwable cause) {
        CompletableFuture<String> future;
        lock.lock();
        try {
            transition(actorId, ActivationState.FAILED);
            failures.put(actorId, cause);
            future = activationFutures.get(actorId);
        } finally {
            lock.unlock();
        }
        logger.warn("Route of consumer {} failed to activate", actorId, cause);
        if (future != null) {
            future.completeExceptionally(new RouteCreationException(actorId, cause));
        }
    }

    public void deactivating(String actorId) {
        lock.lock();
        try {
            transition(actorId, ActivationState.DEACTIVATING);
            activeCount--;
        } finally {
            lock.unlock();
        }
    }

    public void deactivated(String actorId) {
        CompletableFuture<String> future;
        lock.lock();
        try {
            transition(actorId, ActivationState.INACTIVE);
            future = deactivationFutures.get(actorId);
        } finally {
            lock.unlock();
        }
        logger.info("Route of consumer {} deactivated", actorId);
        if (future != null) {
            future.complete(actorId);
        }
    }

    /**
     * Blocks until the route of the actor is ACTIVE.
     *
     * @throws RouteCreationException if the route failed to build
     * @throws TimeoutException if the route is not active when the timeout elapses
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public void awaitActivation(String actorId, Duration timeout) throws TimeoutException, InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (true) {
                ActivationState state = stateOf(actorId);
                if (state == ActivationState.ACTIVE) {
                    return;
                }
                if (state == ActivationState.FAILED) {
                    throw new RouteCreationException(actorId, failures.get(actorId));
                }
                if (remaining <= 0) {
                    throw new TimeoutException("Consumer " + actorId + " was not activated within "
                            + timeout.toMillis() + " ms (state " + state + ")");
                }
                remaining = stateChanged.awaitNanos(remaining);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until the route of the actor is INACTIVE.
     *
     * @throws TimeoutException if the route is not inactive when the timeout elapses
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public void awaitDeactivation(String actorId, Duration timeout) throws TimeoutException, InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (stateOf(actorId) != ActivationState.INACTIVE) {
                if (remaining <= 0) {
                    throw new TimeoutException("Consumer " + actorId + " was not deactivated within "
                            + timeout.toMillis() + " ms (state " + stateOf(actorId) + ")");
                }
                remaining = stateChanged.awaitNanos(remaining);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a future completed with the actor ID once the route is ACTIVE,
     * or exceptionally with a {@link RouteCreationException} if it fails.
     */
    public CompletableFuture<String> activationFuture(String actorId) {
        lock.lock();
        try {
            CompletableFuture<String> future = activationFutures.computeIfAbsent(actorId, id -> new CompletableFuture<>());
            ActivationState state = stateOf(actorId);
            if (state == ActivationState.ACTIVE) {
                future.complete(actorId);
            } else if (state == ActivationState.FAILED) {
                future.completeExceptionally(new RouteCreationException(actorId, failures.get(actorId)));
            }
            return future;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a future completed with the actor ID once the route is INACTIVE.
     */
    public CompletableFuture<String> deactivationFuture(String actorId) {
        lock.lock();
        try {
            CompletableFuture<String> future = deactivationFutures.computeIfAbsent(actorId, id -> new CompletableFuture<>());
            if (stateOf(actorId) == ActivationState.INACTIVE) {
                future.complete(actorId);
            }
            return future;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of routes currently ACTIVE.
     */
    public int routeCount() {
        lock.lock();
        try {
            return activeCount;
        } finally {
            lock.unlock();
        }
    }

    public ActivationState stateOf(String actorId) {
        lock.lock();
        try {
            return states.getOrDefault(actorId, ActivationState.UNREGISTERED);
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock
    private void transition(String actorId, ActivationState target) {
        ActivationState current = states.getOrDefault(actorId, ActivationState.UNREGISTERED);
        if (!current.canMoveTo(target)) {
            throw new IllegalStateException("Illegal activation transition for " + actorId + ": "
                    + current + " -> " + target);
        }
        states.put(actorId, target);
        logger.debug("Consumer {} moved from {} to {}", actorId, current, target);
        stateChanged.signalAll();
    }
}
