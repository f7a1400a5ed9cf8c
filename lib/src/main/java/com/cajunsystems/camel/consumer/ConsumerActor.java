package com.cajunsystems.camel.consumer;

import com.cajunsystems.camel.CamelMessage;
import com.cajunsystems.camel.Failure;
import com.cajunsystems.camel.actor.ActorSystem;
import com.cajunsystems.camel.actor.Pid;
import com.cajunsystems.camel.actor.config.MailboxConfig;
import com.cajunsystems.camel.actor.handler.Handler;
import com.cajunsystems.camel.actor.internal.HandlerActor;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Actor behind a Camel consumer route. Messages from the route arrive as {@link CamelMessage}s whose sender
 * is the reply address of the waiting exchange; the handler answers through {@code context.reply(...)}.
 * Other messages can be told to the actor directly, as to any actor.
 */
public class ConsumerActor extends HandlerActor<Object> {

    private final ConsumerConfig config;

    public ConsumerActor(
            ActorSystem system,
            String actorId,
            Handler<Object> handler,
            Supplier<? extends Handler<Object>> handlerFactory,
            MailboxConfig mailboxConfig,
            ConsumerConfig config) {
        super(system, actorId, handler, handlerFactory, mailboxConfig);
        this.config = config;
    }

    public ConsumerConfig getConfig() {
        return config;
    }

    @Override
    protected void receive(Object message) {
        try {
            super.receive(message);
        } catch (Throwable e) {
            if (config.isErrorPassing() && message instanceof CamelMessage) {
                Optional<Pid> sender = getSender();
                if (sender.isPresent()) {
                    getLogger().debug("Passing error to exchange {}", sender.get().actorId());
                    getSystem().tell(sender.get(), new Failure(e));
                }
            }
            throw e;
        }
    }
}
