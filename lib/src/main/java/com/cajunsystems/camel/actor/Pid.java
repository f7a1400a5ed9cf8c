package com.cajunsystems.camel.actor;

import java.util.concurrent.TimeUnit;

/**
 * Address of an actor or of a reply address within an {@link ActorSystem}.
 * The same Pid keeps reaching an actor across restarts; it goes stale only once the actor stops.
 *
 * @param actorId The actor ID or reply address name
 * @param system  The system that routes messages sent to it
 */
public record Pid(String actorId, ActorSystem system) {

    public <Message> void tell(Message message) {
        system.routeMessage(actorId, message);
    }

    /**
     * Delivers the message once the delay has passed. Pending deliveries are cancelled on system shutdown.
     */
    public <Message> void tell(Message message, long delay, TimeUnit timeUnit) {
        system.routeMessage(actorId, message, delay, timeUnit);
    }

    @Override
    public String toString() {
        return actorId + "@local";
    }
}
