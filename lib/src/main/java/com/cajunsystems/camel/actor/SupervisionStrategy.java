package com.cajunsystems.camel.actor;

/**
 * Supervision strategies for handling actor failures.
 */
public enum SupervisionStrategy {
    /**
     * Resume processing the next message, ignoring the failure.
     */
    RESUME,

    /**
     * Restart the actor in place, then continue with the next message.
     * The actor keeps its {@link Pid}, its mailbox and its registration; no termination is signalled.
     */
    RESTART,

    /**
     * Stop the actor. Termination watchers are notified.
     */
    STOP
}
