package com.cajunsystems.camel.actor.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates every thread the actor system and the Camel bridge run on, so that they share naming and daemon settings.
 * <p>
 * All threads are daemon threads. The actor system holds the JVM open on its own until it is shut down.
 * <pre>{@code
 * ActorSystem system = new ActorSystem(new ThreadPoolFactory()
 *         .setSchedulerThreads(4)
 *         .setActorBatchSize(32));
 * }</pre>
 */
public class ThreadPoolFactory {

    private int schedulerThreads = Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
    private int schedulerShutdownTimeoutSeconds = 5;
    private int actorShutdownTimeoutSeconds = 10;
    private int actorBatchSize = 10;
    private boolean useNamedThreads = true;

    /**
     * Timer pool, used for delayed messages, ask timeouts and exchange deadlines.
     */
    public ScheduledExecutorService createScheduledExecutorService(String poolName) {
        return Executors.newScheduledThreadPool(schedulerThreads, threadsNamed(poolName + "-scheduler"));
    }

    /**
     * Growing pool for short hand-offs, such as completing Camel exchanges off the actor threads.
     */
    public ExecutorService createExecutorService(String poolName) {
        return Executors.newCachedThreadPool(threadsNamed(poolName));
    }

    /**
     * Runs tasks one at a time in submission order.
     */
    public ExecutorService createSingleThreadExecutor(String poolName) {
        return Executors.newSingleThreadExecutor(threadsNamed(poolName));
    }

    /**
     * Factory for the mailbox thread of one actor.
     */
    public ThreadFactory createThreadFactory(String actorId) {
        return threadsNamed("actor-" + actorId);
    }

    private ThreadFactory threadsNamed(String prefix) {
        AtomicInteger sequence = new AtomicInteger();
        return task -> {
            Thread thread = new Thread(task);
            if (useNamedThreads) {
                thread.setName(prefix + "-" + sequence.incrementAndGet());
            }
            thread.setDaemon(true);
            return thread;
        };
    }

    public int getSchedulerThreads() {
        return schedulerThreads;
    }

    public ThreadPoolFactory setSchedulerThreads(int schedulerThreads) {
        this.schedulerThreads = requirePositive(schedulerThreads, "schedulerThreads");
        return this;
    }

    public int getSchedulerShutdownTimeoutSeconds() {
        return schedulerShutdownTimeoutSeconds;
    }

    public ThreadPoolFactory setSchedulerShutdownTimeoutSeconds(int seconds) {
        this.schedulerShutdownTimeoutSeconds = seconds;
        return this;
    }

    /**
     * How long stopping an actor waits for its mailbox thread to finish the current message.
     */
    public int getActorShutdownTimeoutSeconds() {
        return actorShutdownTimeoutSeconds;
    }

    public ThreadPoolFactory setActorShutdownTimeoutSeconds(int seconds) {
        this.actorShutdownTimeoutSeconds = seconds;
        return this;
    }

    /**
     * Maximum number of messages a mailbox thread takes per wake-up.
     */
    public int getActorBatchSize() {
        return actorBatchSize;
    }

    public ThreadPoolFactory setActorBatchSize(int actorBatchSize) {
        this.actorBatchSize = requirePositive(actorBatchSize, "actorBatchSize");
        return this;
    }

    public boolean isUseNamedThreads() {
        return useNamedThreads;
    }

    public ThreadPoolFactory setUseNamedThreads(boolean useNamedThreads) {
        this.useNamedThreads = useNamedThreads;
        return this;
    }

    private static int requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return "ThreadPoolFactory{schedulerThreads=" + schedulerThreads + ", actorBatchSize=" + actorBatchSize + '}';
    }
}
