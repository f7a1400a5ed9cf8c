package com.cajunsystems.camel.actor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link ActorContext} backed by the actor running the handler.
 */
public class ActorContextImpl implements ActorContext {
    private static final Logger logger = LoggerFactory.getLogger(ActorContextImpl.class);

    private final Actor<?> owner;

    public ActorContextImpl(Actor<?> owner) {
        this.owner = owner;
    }

    @Override
    public Pid self() {
        return owner.self();
    }

    @Override
    public String getActorId() {
        return owner.getActorId();
    }

    @Override
    public ActorSystem getSystem() {
        return owner.getSystem();
    }

    @Override
    public Optional<Pid> getSender() {
        return owner.getSender();
    }

    @Override
    public <T> void reply(T response) {
        Optional<Pid> sender = owner.getSender();
        if (sender.isEmpty()) {
            logger.debug("Actor {} replied {} without a sender, dropped", owner.getActorId(), response);
            return;
        }
        owner.getSystem().tell(sender.get(), response);
    }

    @Override
    public <T> void tell(Pid target, T message) {
        owner.getSystem().tell(target, message);
    }

    @Override
    public <T> void tellSelf(T message) {
        owner.getSystem().tell(owner.self(), message);
    }

    @Override
    public <T> void tellSelf(T message, long delay, TimeUnit timeUnit) {
        owner.getSystem().tell(owner.self(), message, delay, timeUnit);
    }

    @Override
    public void stop() {
        owner.stop();
    }

    @Override
    public Logger getLogger() {
        return owner.getLogger();
    }
}
