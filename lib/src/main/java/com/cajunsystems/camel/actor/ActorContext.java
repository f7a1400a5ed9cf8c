package com.cajunsystems.camel.actor;

import org.slf4j.Logger;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * What a {@link com.cajunsystems.camel.actor.handler.Handler} sees of the actor running it.
 * <p>
 * Consumer handlers answer an exchange with {@link #reply(Object)}: the sender of a message coming
 * from a Camel route is the reply address of the waiting exchange.
 */
public interface ActorContext {

    Pid self();

    String getActorId();

    ActorSystem getSystem();

    /**
     * The sender of the message being handled, empty for plain {@code tell}s.
     */
    Optional<Pid> getSender();

    /**
     * Sends to the sender of the message being handled. Without a sender the response is dropped and logged at debug.
     */
    <T> void reply(T response);

    /**
     * Sends to an actor or a reply address.
     */
    <T> void tell(Pid target, T message);

    <T> void tellSelf(T message);

    <T> void tellSelf(T message, long delay, TimeUnit timeUnit);

    /**
     * Stops the actor. Watchers are notified and, for consumers, the route is removed.
     */
    void stop();

    /**
     * Logger named after the actor class and ID.
     */
    Logger getLogger();
}
