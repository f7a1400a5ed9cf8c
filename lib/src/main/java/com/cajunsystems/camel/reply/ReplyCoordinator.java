package com.cajunsystems.camel.reply;

import com.cajunsystems.camel.CamelBridgeException;
import com.cajunsystems.camel.ResponseProtocol;
import com.cajunsystems.camel.actor.ActorException;
import com.cajunsystems.camel.actor.ActorSystem;
import com.cajunsystems.camel.actor.Pid;
import com.cajunsystems.camel.actor.ReplyHandler;
import com.cajunsystems.camel.actor.config.ThreadPoolFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Dispatches exchanges to actors and correlates their replies.
 * <p>
 * Every dispatch gets its own reply address, registered with the actor system as the sender of the message,
 * and an absolute deadline enforced by a scheduler. The address is removed and the deadline cancelled
 * as soon as the waiter resolves, so replies are matched by correlation and never by arrival order.
 */
public class ReplyCoordinator implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ReplyCoordinator.class);

    static final String ADDRESS_PREFIX = "camel-exchange";

    private final ActorSystem system;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService completionExecutor;
    private final Map<String, ExchangeWaiter> pending = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public ReplyCoordinator(ActorSystem system) {
        this.system = system;
        ThreadPoolFactory threadPoolFactory = system.getThreadPoolFactory();
        this.scheduler = threadPoolFactory.createScheduledExecutorService("camel-reply");
        this.completionExecutor = threadPoolFactory.createExecutorService("camel-completion");
    }

    /**
     * Sends a message to an actor and returns the waiter for its outcome.
     * Delivery failures resolve the waiter immediately with the {@link ActorException}.
     *
     * @param target The actor to deliver to
     * @param message The message, usually a {@link com.cajunsystems.camel.CamelMessage}
     * @param timeout How long the actor has to answer
     * @param protocol The response protocol the actor follows
     * @return The waiter, already registered
     */
    public ExchangeWaiter dispatch(Pid target, Object message, Duration timeout, ResponseProtocol protocol) {
        String correlationId = system.newReplyAddress(ADDRESS_PREFIX);
        ExchangeWaiter waiter = new ExchangeWaiter(correlationId, target.actorId(), protocol, timeout);
        if (closed) {
            waiter.fail(new CamelBridgeException("Reply coordinator is closed"));
            return waiter;
        }

        pending.put(correlationId, waiter);
        system.registerReplyAddress(correlationId, new ReplyHandler() {
            @Override
            public void onReply(Object reply) {
                waiter.offer(reply);
            }

            @Override
            public void onShutdown() {
                waiter.fail(new ActorException("Actor system shut down before actor replied", target.actorId()));
            }
        });

        ScheduledFuture<?> deadline;
        try {
            deadline = scheduler.schedule(waiter::expire, timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            deadline = null;
            waiter.fail(new CamelBridgeException("Reply coordinator is closed", e));
        }
        ScheduledFuture<?> scheduledDeadline = deadline;
        waiter.outcome().whenComplete((outcome, error) -> {
            system.unregisterReplyAddress(correlationId);
            pending.remove(correlationId);
            if (scheduledDeadline != null) {
                scheduledDeadline.cancel(false);
            }
        });

        if (!waiter.isResolved()) {
            try {
                system.tellWithSender(target, message, correlationId);
                logger.debug("Dispatched exchange {} to actor {}", correlationId, target.actorId());
            } catch (ActorException e) {
                logger.debug("Could not deliver exchange {} to actor {}", correlationId, target.actorId(), e);
                waiter.fail(e);
            }
        }
        return waiter;
    }

    /**
     * Executor on which exchange completions are handed back to Camel, keeping actor and timer threads free.
     */
    public ExecutorService getCompletionExecutor() {
        return completionExecutor;
    }

    /**
     * Returns the number of waiters that are still pending.
     */
    public int pendingCount() {
        return pending.size();
    }

    /**
     * Fails every pending waiter and stops the scheduler.
     */
    @Override
    public void close() {
        closed = true;
        for (ExchangeWaiter waiter : new ArrayList<>(pending.values())) {
            waiter.fail(new CamelBridgeException("Reply coordinator closed before actor " + waiter.getActorId() + " replied"));
        }
        scheduler.shutdownNow();
        completionExecutor.shutdown();
        try {
            if (!completionExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                completionExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            completionExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
