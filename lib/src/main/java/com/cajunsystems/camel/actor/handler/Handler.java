package com.cajunsystems.camel.actor.handler;

import com.cajunsystems.camel.actor.ActorContext;

/**
 * Message handling logic of an actor, kept apart from the actor machinery.
 * All callbacks run on the actor's mailbox thread, one at a time.
 * <p>
 * A consumer handler receives {@link com.cajunsystems.camel.CamelMessage}s and answers them through
 * {@link ActorContext#reply(Object)}.
 *
 * @param <Message> The type of messages handled
 */
public interface Handler<Message> {

    void receive(Message message, ActorContext context);

    default void preStart(ActorContext context) {
    }

    default void postStop(ActorContext context) {
    }

    /**
     * Runs on the failed handler before a restart. Defaults to {@link #postStop}.
     */
    default void preRestart(Throwable reason, ActorContext context) {
        postStop(context);
    }

    /**
     * Runs on the handler that takes over after a restart, which is a new instance when the actor
     * was built from a handler class. Defaults to {@link #preStart}.
     */
    default void postRestart(Throwable reason, ActorContext context) {
        preStart(context);
    }

    /**
     * Runs after {@link #receive} threw, before the supervision strategy is applied.
     *
     * @return true to process the same message again
     */
    default boolean onError(Message message, Throwable exception, ActorContext context) {
        return false;
    }
}
