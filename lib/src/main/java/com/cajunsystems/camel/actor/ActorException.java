package com.cajunsystems.camel.actor;

/**
 * Raised when an actor cannot be created, found or reached.
 * Delivery failures of Camel exchanges surface as this exception on the failed exchange.
 */
public class ActorException extends RuntimeException {

    private final String actorId;

    public ActorException(String message) {
        this(message, null, null);
    }

    public ActorException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public ActorException(String message, String actorId) {
        this(message, null, actorId);
    }

    public ActorException(String message, Throwable cause, String actorId) {
        super(message, cause);
        this.actorId = actorId;
    }

    /**
     * @return the ID of the actor involved, or null when unknown
     */
    public String getActorId() {
        return actorId;
    }
}
