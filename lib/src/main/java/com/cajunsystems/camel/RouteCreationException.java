package com.cajunsystems.camel;

/**
 * Thrown when the route of a consumer actor could not be created, typically because the endpoint URI is invalid.
 * The cause is the exception Camel raised while building or starting the route.
 */
public class RouteCreationException extends CamelBridgeException {

    private final String actorId;

    public RouteCreationException(String actorId, Throwable cause) {
        super("Failed to create route for consumer actor " + actorId
                + (cause == null ? "" : ": " + cause.getMessage()), cause);
        this.actorId = actorId;
    }

    /**
     * Returns the ID of the consumer actor whose route failed.
     */
    public String getActorId() {
        return actorId;
    }
}
