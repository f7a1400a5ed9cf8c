package com.cajunsystems.camel.actor.internal;

import com.cajunsystems.camel.actor.Actor;
import com.cajunsystems.camel.actor.ActorContext;
import com.cajunsystems.camel.actor.ActorContextImpl;
import com.cajunsystems.camel.actor.ActorSystem;
import com.cajunsystems.camel.actor.config.MailboxConfig;
import com.cajunsystems.camel.actor.handler.Handler;

import java.util.function.Supplier;

/**
 * Actor that forwards every callback to a {@link Handler}.
 * <p>
 * With a handler factory, each restart swaps the failed handler for a new instance, so handler state
 * starts over. Without one the same instance carries on.
 *
 * @param <Message> The type of messages processed
 */
public class HandlerActor<Message> extends Actor<Message> {

    private final Supplier<? extends Handler<Message>> handlerFactory;
    private final ActorContext context;
    private volatile Handler<Message> handler;

    public HandlerActor(ActorSystem system, String actorId, Handler<Message> handler, MailboxConfig mailboxConfig) {
        this(system, actorId, handler, null, mailboxConfig);
    }

    /**
     * @param handlerFactory Supplies the replacement handler on restart, or null
     * @param mailboxConfig  The mailbox, or null for the system default
     */
    public HandlerActor(
            ActorSystem system,
            String actorId,
            Handler<Message> handler,
            Supplier<? extends Handler<Message>> handlerFactory,
            MailboxConfig mailboxConfig) {
        super(system, actorId, mailboxConfig);
        this.handler = handler;
        this.handlerFactory = handlerFactory;
        this.context = new ActorContextImpl(this);
    }

    protected ActorContext getContext() {
        return context;
    }

    public Handler<Message> getHandler() {
        return handler;
    }

    @Override
    protected void receive(Message message) {
        handler.receive(message, context);
    }

    @Override
    protected void preStart() {
        handler.preStart(context);
    }

    @Override
    protected void postStop() {
        try {
            handler.postStop(context);
        } finally {
            super.postStop();
        }
    }

    @Override
    protected void preRestart(Throwable reason) {
        handler.preRestart(reason, context);
        if (handlerFactory != null) {
            handler = handlerFactory.get();
        }
    }

    @Override
    protected void postRestart(Throwable reason) {
        handler.postRestart(reason, context);
    }

    @Override
    protected boolean onError(Message message, Throwable exception) {
        return handler.onError(message, exception, context);
    }
}
