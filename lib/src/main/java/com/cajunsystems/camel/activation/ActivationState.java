package com.cajunsystems.camel.activation;

/**
 * Lifecycle of the route that belongs to a consumer actor.
 */
public enum ActivationState {
    /** Never registered with the tracker. */
    UNREGISTERED,
    /** The actor started and its route is being built. */
    ACTIVATING,
    /** The route is running. */
    ACTIVE,
    /** The actor stopped and its route is being removed. */
    DEACTIVATING,
    /** The route was removed, or never came up and the actor stopped. */
    INACTIVE,
    /** The route could not be built. */
    FAILED;

    /**
     * Returns true if the tracker accepts a move from this state to the target state.
     */
    public boolean canMoveTo(ActivationState target) {
        switch (this) {
            case UNREGISTERED:
            case INACTIVE:
                return target == ACTIVATING;
            case ACTIVATING:
                return target == ACTIVE || target == FAILED;
            case ACTIVE:
                return target == DEACTIVATING;
            case DEACTIVATING:
            case FAILED:
                return target == INACTIVE;
            default:
                return false;
        }
    }
}
