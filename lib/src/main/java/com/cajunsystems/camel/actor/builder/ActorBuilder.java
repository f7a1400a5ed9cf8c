package com.cajunsystems.camel.actor.builder;

import com.cajunsystems.camel.actor.ActorSystem;
import com.cajunsystems.camel.actor.Pid;
import com.cajunsystems.camel.actor.SupervisionStrategy;
import com.cajunsystems.camel.actor.config.MailboxConfig;
import com.cajunsystems.camel.actor.handler.Handler;
import com.cajunsystems.camel.actor.internal.HandlerActor;

import java.util.function.Supplier;

/**
 * Fluent setup of a handler-based actor, obtained from {@link ActorSystem#actorOf}.
 * <pre>{@code
 * Pid counter = system.actorOf(CounterHandler.class)
 *         .withId("counter")
 *         .withSupervisionStrategy(SupervisionStrategy.RESTART)
 *         .spawn();
 * }</pre>
 *
 * @param <Message> The type of messages the actor processes
 */
public class ActorBuilder<Message> {

    private final ActorSystem system;
    private final Handler<Message> initialHandler;
    private final Supplier<? extends Handler<Message>> handlerFactory;
    private String id;
    private MailboxConfig mailboxConfig;
    private SupervisionStrategy strategy;

    public ActorBuilder(ActorSystem system, Handler<Message> handler) {
        this(system, handler, null);
    }

    /**
     * @param handlerFactory Supplies the handler that takes over after each restart, or null to keep {@code handler}
     */
    public ActorBuilder(ActorSystem system, Handler<Message> handler, Supplier<? extends Handler<Message>> handlerFactory) {
        this.system = system;
        this.initialHandler = handler;
        this.handlerFactory = handlerFactory;
    }

    /**
     * Uses a fixed ID instead of a random one.
     */
    public ActorBuilder<Message> withId(String id) {
        this.id = id;
        return this;
    }

    public ActorBuilder<Message> withMailboxConfig(MailboxConfig mailboxConfig) {
        this.mailboxConfig = mailboxConfig;
        return this;
    }

    /**
     * Defaults to {@link SupervisionStrategy#RESUME}.
     */
    public ActorBuilder<Message> withSupervisionStrategy(SupervisionStrategy strategy) {
        this.strategy = strategy;
        return this;
    }

    /**
     * Registers and starts the actor.
     *
     * @throws com.cajunsystems.camel.actor.ActorException if the ID is already in use
     */
    public Pid spawn() {
        HandlerActor<Message> actor = new HandlerActor<>(
                system, id != null ? id : system.generateActorId(), initialHandler, handlerFactory, mailboxConfig);
        if (strategy != null) {
            actor.withSupervisionStrategy(strategy);
        }
        system.registerActor(actor);
        actor.start();
        return actor.self();
    }
}
