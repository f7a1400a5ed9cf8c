package com.cajunsystems.camel.actor;

import com.cajunsystems.camel.actor.builder.ActorBuilder;
import com.cajunsystems.camel.actor.config.MailboxConfig;
import com.cajunsystems.camel.actor.config.ThreadPoolFactory;
import com.cajunsystems.camel.actor.handler.Handler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Registry and message router for actors.
 * <p>
 * Besides actor IDs, a {@link Pid} can name a reply address: a temporary name registered by a caller
 * that is not an actor, such as {@link #ask} or the Camel reply coordinator. Messages sent to a reply
 * address go to its {@link ReplyHandler} instead of a mailbox. Once removed, late messages to an
 * address are dropped at debug level.
 * <p>
 * The system owns a scheduler for delayed messages and ask timeouts, and a non-daemon thread that keeps
 * the JVM running until {@link #shutdown()}.
 */
public class ActorSystem {
    private static final Logger logger = LoggerFactory.getLogger(ActorSystem.class);

    private static final String ASK_PREFIX = "ask-promise";

    /**
     * Mailbox entry for a message whose receiver must see a sender.
     */
    record MessageWithSender<T>(T message, String sender) {}

    private final ThreadPoolFactory threadPoolFactory;
    private final MailboxConfig mailboxConfig;
    private final Map<String, Actor<?>> actors = new ConcurrentHashMap<>();
    private final Map<String, ReplyHandler> replyAddresses = new ConcurrentHashMap<>();
    private final Set<String> replyAddressPrefixes = ConcurrentHashMap.newKeySet();
    private final Map<String, List<TerminationWatch>> watchers = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> delayedMessages = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean terminated = new AtomicBoolean();
    private final CountDownLatch terminationLatch = new CountDownLatch(1);
    private final Thread keepAlive;

    public ActorSystem() {
        this(null, null);
    }

    public ActorSystem(ThreadPoolFactory threadPoolFactory) {
        this(threadPoolFactory, null);
    }

    /**
     * @param threadPoolFactory Thread settings, or null for the defaults
     * @param mailboxConfig     Mailbox used by actors that do not choose their own, or null for the default
     */
    public ActorSystem(ThreadPoolFactory threadPoolFactory, MailboxConfig mailboxConfig) {
        this.threadPoolFactory = threadPoolFactory != null ? threadPoolFactory : new ThreadPoolFactory();
        this.mailboxConfig = mailboxConfig != null ? mailboxConfig : new MailboxConfig();
        this.scheduler = this.threadPoolFactory.createScheduledExecutorService("actor-system");
        this.keepAlive = new Thread(this::awaitTermination, "actor-system-keepalive");
        this.keepAlive.setDaemon(false);
        this.keepAlive.start();
        logger.debug("Actor system started with {} and {}", this.threadPoolFactory, this.mailboxConfig);
    }

    private void awaitTermination() {
        try {
            terminationLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.debug("Keep-alive thread exiting");
    }

    // ---- actors ----

    /**
     * @return the registered actor, or null
     */
    public Actor<?> getActor(Pid pid) {
        return actors.get(pid.actorId());
    }

    public boolean isAlive(Pid pid) {
        return actors.containsKey(pid.actorId());
    }

    /**
     * Instantiates, registers and starts an actor class through its public {@code (ActorSystem, String)} constructor.
     *
     * @throws ActorException if the class cannot be instantiated or the ID is taken
     */
    public <T extends Actor<?>> Pid register(Class<T> actorClass, String actorId) {
        T actor;
        try {
            actor = actorClass.getConstructor(ActorSystem.class, String.class).newInstance(this, actorId);
        } catch (ReflectiveOperationException e) {
            throw new ActorException("Cannot instantiate actor " + actorClass.getName(), e, actorId);
        }
        registerActor(actor);
        actor.start();
        return actor.self();
    }

    public <T extends Actor<?>> Pid register(Class<T> actorClass) {
        return register(actorClass, generateActorId());
    }

    /**
     * Builder for an actor running instances of the handler class. Each restart gets a fresh instance.
     */
    public <Message> ActorBuilder<Message> actorOf(Class<? extends Handler<Message>> handlerClass) {
        Supplier<Handler<Message>> factory = handlerFactory(handlerClass);
        return new ActorBuilder<>(this, factory.get(), factory);
    }

    /**
     * Builder for an actor running the given handler. The same instance survives restarts.
     */
    public <Message> ActorBuilder<Message> actorOf(Handler<Message> handler) {
        return new ActorBuilder<>(this, handler);
    }

    /**
     * Supplier of new handler instances, created through the class's no-argument constructor.
     *
     * @throws ActorException if there is no such constructor, or later if instantiation fails
     */
    public static <Message> Supplier<Handler<Message>> handlerFactory(Class<? extends Handler<Message>> handlerClass) {
        Constructor<? extends Handler<Message>> constructor;
        try {
            constructor = handlerClass.getDeclaredConstructor();
        } catch (NoSuchMethodException e) {
            throw new ActorException(handlerClass.getName() + " needs a no-argument constructor", e);
        }
        return () -> {
            try {
                return constructor.newInstance();
            } catch (ReflectiveOperationException e) {
                throw new ActorException("Cannot instantiate handler " + handlerClass.getName(), e);
            }
        };
    }

    /**
     * Adds a created, not yet started actor to the registry.
     *
     * @throws ActorException if the ID is already taken
     */
    public void registerActor(Actor<?> actor) {
        if (actors.putIfAbsent(actor.getActorId(), actor) != null) {
            throw new ActorException("Actor ID already in use: " + actor.getActorId(), actor.getActorId());
        }
    }

    /**
     * Removes the actor, stops it if it is still running and fires its termination watches.
     * Unknown IDs are ignored.
     */
    public void shutdown(String actorId) {
        Actor<?> actor = actors.remove(actorId);
        if (actor == null) {
            return;
        }
        if (actor.isRunning()) {
            actor.stop();
        }
        logger.debug("Actor {} terminated", actorId);
        List<TerminationWatch> watches = watchers.remove(actorId);
        if (watches != null) {
            watches.forEach(watch -> watch.fire(actor.self()));
        }
    }

    public void stopActor(Pid pid) {
        Actor<?> actor = getActor(pid);
        if (actor != null) {
            actor.stop();
        }
    }

    /**
     * Calls {@code onTerminated} once, on the stopping thread, when the actor stops.
     * Restarts are not terminations. For an actor that is not registered the callback runs right away.
     */
    public void watch(Pid pid, Consumer<Pid> onTerminated) {
        TerminationWatch watch = new TerminationWatch(onTerminated);
        watchers.computeIfAbsent(pid.actorId(), id -> new CopyOnWriteArrayList<>()).add(watch);
        if (!actors.containsKey(pid.actorId())) {
            // raced with shutdown(actorId): nobody else will fire these
            List<TerminationWatch> orphaned = watchers.remove(pid.actorId());
            if (orphaned != null) {
                orphaned.forEach(w -> w.fire(pid));
            }
            watch.fire(pid);
        }
    }

    public String generateActorId() {
        return UUID.randomUUID().toString();
    }

    public ThreadPoolFactory getThreadPoolFactory() {
        return threadPoolFactory;
    }

    public MailboxConfig getMailboxConfig() {
        return mailboxConfig;
    }

    // ---- reply addresses ----

    /**
     * @throws IllegalStateException if the address is already registered
     */
    public void registerReplyAddress(String address, ReplyHandler handler) {
        if (replyAddresses.putIfAbsent(address, handler) != null) {
            throw new IllegalStateException("Reply address already registered: " + address);
        }
    }

    /**
     * @return true if the address was registered
     */
    public boolean unregisterReplyAddress(String address) {
        return replyAddresses.remove(address) != null;
    }

    /**
     * Returns a new unique address {@code prefix-<uuid>}. Late messages to a removed address with a
     * known prefix are treated as late replies rather than undeliverable messages.
     */
    public String newReplyAddress(String prefix) {
        replyAddressPrefixes.add(prefix + "-");
        return prefix + "-" + generateActorId();
    }

    // ---- messaging ----

    public <T> void tell(Pid pid, T message) {
        routeMessage(pid.actorId(), message);
    }

    public <T> void tell(Pid pid, T message, long delay, TimeUnit timeUnit) {
        routeMessage(pid.actorId(), message, delay, timeUnit);
    }

    /**
     * Delivers a message that the receiving actor sees with {@code replyTo} as its sender.
     *
     * @throws ActorException if the actor is not registered or its mailbox rejects the message
     */
    public void tellWithSender(Pid target, Object message, String replyTo) {
        Actor<?> actor = actors.get(target.actorId());
        if (actor == null) {
            throw new ActorException("Actor not found: " + target.actorId(), target.actorId());
        }
        if (!actor.enqueue(new MessageWithSender<>(message, replyTo))) {
            throw new ActorException("Mailbox of actor " + target.actorId() + " rejected the message", target.actorId());
        }
    }

    /**
     * Request-response with an actor. The reply is correlated through a one-off reply address.
     *
     * @return a future completed with the first reply, or exceptionally with a {@link TimeoutException},
     *         an {@link ActorException} when the message cannot be delivered, or an
     *         {@link IllegalStateException} when the system shuts down first
     */
    @SuppressWarnings("unchecked")
    public <RequestMessage, ResponseMessage> CompletableFuture<ResponseMessage> ask(
            Pid target, RequestMessage message, Duration timeout) {
        CompletableFuture<ResponseMessage> result = new CompletableFuture<>();
        String address = newReplyAddress(ASK_PREFIX);
        registerReplyAddress(address, new ReplyHandler() {
            @Override
            public void onReply(Object reply) {
                if (unregisterReplyAddress(address)) {
                    result.complete((ResponseMessage) reply);
                }
            }

            @Override
            public void onShutdown() {
                result.completeExceptionally(new IllegalStateException("Actor system shut down before "
                        + target.actorId() + " replied"));
            }
        });

        ScheduledFuture<?> deadline = scheduler.schedule(() -> {
            if (unregisterReplyAddress(address)) {
                result.completeExceptionally(new TimeoutException("No reply from " + target.actorId()
                        + " within " + timeout.toMillis() + " ms"));
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        result.whenComplete((reply, error) -> deadline.cancel(false));

        try {
            tellWithSender(target, message, address);
        } catch (ActorException e) {
            unregisterReplyAddress(address);
            result.completeExceptionally(e);
        }
        return result;
    }

    /**
     * Reply addresses win over actor IDs. Messages for unknown targets are logged and dropped.
     */
    <Message> void routeMessage(String target, Message message) {
        ReplyHandler replyHandler = replyAddresses.get(target);
        if (replyHandler != null) {
            try {
                replyHandler.onReply(message);
            } catch (RuntimeException e) {
                logger.warn("Reply handler of {} failed on {}", target, message, e);
            }
            return;
        }
        Actor<?> actor = actors.get(target);
        if (actor != null) {
            actor.enqueue(message);
        } else if (isRetiredReplyAddress(target)) {
            logger.debug("Late message for retired reply address {} dropped: {}", target, message);
        } else {
            logger.warn("No actor {} to deliver {} to", target, message);
        }
    }

    <Message> void routeMessage(String target, Message message, long delay, TimeUnit timeUnit) {
        String key = generateActorId();
        delayedMessages.put(key, scheduler.schedule(() -> {
            delayedMessages.remove(key);
            routeMessage(target, message);
        }, delay, timeUnit));
    }

    private boolean isRetiredReplyAddress(String target) {
        return replyAddressPrefixes.stream().anyMatch(target::startsWith);
    }

    // ---- shutdown ----

    /**
     * Stops all actors, fails every open reply address, cancels delayed messages and releases the
     * keep-alive thread. Later calls do nothing.
     */
    public void shutdown() {
        if (!terminated.compareAndSet(false, true)) {
            return;
        }
        logger.info("Shutting down actor system with {} actors", actors.size());

        for (String actorId : new ArrayList<>(actors.keySet())) {
            Actor<?> actor = actors.get(actorId);
            if (actor == null) {
                continue;
            }
            try {
                actor.stop();
            } catch (RuntimeException e) {
                logger.warn("Actor {} failed to stop cleanly", actorId, e);
            }
        }
        actors.clear();

        for (String address : new ArrayList<>(replyAddresses.keySet())) {
            ReplyHandler handler = replyAddresses.remove(address);
            if (handler != null) {
                handler.onShutdown();
            }
        }

        delayedMessages.values().forEach(future -> future.cancel(false));
        delayedMessages.clear();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(threadPoolFactory.getSchedulerShutdownTimeoutSeconds(), TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }

        terminationLatch.countDown();
        try {
            keepAlive.join(2000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (keepAlive.isAlive()) {
            logger.warn("Keep-alive thread still running after shutdown");
            keepAlive.interrupt();
        }
        logger.info("Actor system shut down");
    }

    /**
     * Termination callback that fires at most once.
     */
    private static final class TerminationWatch {
        private final Consumer<Pid> callback;
        private final AtomicBoolean fired = new AtomicBoolean();

        TerminationWatch(Consumer<Pid> callback) {
            this.callback = callback;
        }

        void fire(Pid pid) {
            if (!fired.compareAndSet(false, true)) {
                return;
            }
            try {
                callback.accept(pid);
            } catch (RuntimeException e) {
                logger.warn("Termination callback of actor {} failed", pid.actorId(), e);
            }
        }
    }
}
