package com.cajunsystems.camel.actor;

import com.cajunsystems.camel.actor.config.MailboxConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Base class of all actors. Messages are processed one at a time on the actor's own mailbox thread.
 * <p>
 * An entry may carry a sender (a reply address or another actor); while that entry is processed,
 * {@link #getSender()} returns it. When {@link #receive} throws, the actor's {@link SupervisionStrategy}
 * decides through {@link Supervisor} whether it resumes, restarts in place or stops.
 *
 * @param <Message> The type of messages this actor processes
 */
public abstract class Actor<Message> {
    private static final Logger logger = LoggerFactory.getLogger(Actor.class);

    private final ActorSystem system;
    private final String actorId;
    private final Pid self;
    private final Logger actorLogger;
    private final MailboxProcessor<Object> mailboxProcessor;
    private final ThreadLocal<String> currentSender = new ThreadLocal<>();
    private volatile SupervisionStrategy supervisionStrategy = SupervisionStrategy.RESUME;

    /**
     * Creates an actor with the system's default mailbox. Classes passed to
     * {@link ActorSystem#register(Class, String)} need a public constructor with this signature.
     *
     * @param actorId The actor ID, or null for a random one
     */
    public Actor(ActorSystem system, String actorId) {
        this(system, actorId, null);
    }

    /**
     * @param actorId       The actor ID, or null for a random one
     * @param mailboxConfig The mailbox to use, or null for the system's default
     */
    protected Actor(ActorSystem system, String actorId, MailboxConfig mailboxConfig) {
        this.system = system;
        this.actorId = actorId != null ? actorId : UUID.randomUUID().toString();
        this.self = new Pid(this.actorId, system);
        this.actorLogger = LoggerFactory.getLogger(getClass().getName() + "." + this.actorId);
        MailboxConfig mailbox = mailboxConfig != null ? mailboxConfig : system.getMailboxConfig();
        this.mailboxProcessor = new MailboxProcessor<>(
                this.actorId,
                mailbox.createMailbox(),
                this::handleException,
                new EnvelopeDispatcher(),
                system.getThreadPoolFactory());
        logger.debug("Actor {} created with {}", this.actorId, mailbox);
    }

    protected abstract void receive(Message message);

    /**
     * Runs before the first message, on the thread that starts the actor.
     */
    protected void preStart() {
    }

    /**
     * Runs once when the actor stops. Pending messages have been discarded by then.
     */
    protected void postStop() {
        logger.debug("Actor {} stopped", actorId);
    }

    /**
     * Runs on the mailbox thread before a restart, with the error that caused it.
     */
    protected void preRestart(Throwable reason) {
    }

    /**
     * Runs on the mailbox thread after a restart, before the next message. Defaults to {@link #preStart()}.
     */
    protected void postRestart(Throwable reason) {
        preStart();
    }

    /**
     * Runs after {@link #receive} threw, before supervision applies.
     *
     * @return true to have the failed message processed again
     */
    protected boolean onError(Message message, Throwable exception) {
        return false;
    }

    /**
     * Starts the mailbox thread. Actors created through builders are started for you.
     */
    public void start() {
        mailboxProcessor.start();
    }

    /**
     * Stops the actor: pending messages are dropped, the actor leaves the system and its watchers fire.
     * Calling it again has no effect.
     */
    public void stop() {
        if (!mailboxProcessor.isRunning()) {
            return;
        }
        mailboxProcessor.stop();
        system.shutdown(actorId);
    }

    public Pid self() {
        return self;
    }

    public String getActorId() {
        return actorId;
    }

    public ActorSystem getSystem() {
        return system;
    }

    /**
     * The sender of the message being processed. Empty outside {@link #receive} and for plain tells.
     */
    public Optional<Pid> getSender() {
        return Optional.ofNullable(currentSender.get()).map(sender -> new Pid(sender, system));
    }

    /**
     * Logger named {@code <actor class>.<actor id>}.
     */
    public Logger getLogger() {
        return actorLogger;
    }

    public boolean isRunning() {
        return mailboxProcessor.isRunning();
    }

    public Actor<Message> withSupervisionStrategy(SupervisionStrategy strategy) {
        this.supervisionStrategy = strategy;
        return this;
    }

    public SupervisionStrategy getSupervisionStrategy() {
        return supervisionStrategy;
    }

    /**
     * Called on the mailbox thread when an entry failed. Delegates to {@link Supervisor}.
     */
    protected void handleException(Object envelope, Throwable exception) {
        Supervisor.handleException(this, envelope, exception);
    }

    boolean enqueue(Object envelope) {
        return mailboxProcessor.tell(envelope);
    }

    /**
     * Calls {@link #onError} with the sender of the failed entry in scope.
     */
    boolean reportError(Object envelope, Throwable exception) {
        return withSenderOf(envelope, message -> onError(message, exception));
    }

    /**
     * Restarts in place on the mailbox thread: same Pid, same mailbox, no termination.
     * If a restart hook throws, the actor is stopped instead.
     */
    void restart(Throwable reason) {
        try {
            preRestart(reason);
            postRestart(reason);
            logger.debug("Actor {} restarted after {}", actorId, reason.toString());
        } catch (RuntimeException e) {
            logger.error("Actor {} failed to restart, stopping it", actorId, e);
            stop();
        }
    }

    @SuppressWarnings("unchecked")
    private <R> R withSenderOf(Object envelope, Function<Message, R> action) {
        if (!(envelope instanceof ActorSystem.MessageWithSender<?> withSender)) {
            return action.apply((Message) envelope);
        }
        currentSender.set(withSender.sender());
        try {
            return action.apply((Message) withSender.message());
        } finally {
            currentSender.remove();
        }
    }

    private final class EnvelopeDispatcher implements ActorLifecycle<Object> {
        @Override
        public void preStart() {
            Actor.this.preStart();
        }

        @Override
        public void receive(Object envelope) {
            withSenderOf(envelope, message -> {
                Actor.this.receive(message);
                return null;
            });
        }

        @Override
        public void postStop() {
            Actor.this.postStop();
        }
    }
}
