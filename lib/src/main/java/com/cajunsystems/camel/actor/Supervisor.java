package com.cajunsystems.camel.actor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies an actor's {@link SupervisionStrategy} after {@code receive} threw.
 * Runs on the failing actor's mailbox thread, so the outcome is settled before the next message is taken.
 */
public final class Supervisor {
    private static final Logger logger = LoggerFactory.getLogger(Supervisor.class);

    private Supervisor() {
    }

    /**
     * @param envelope The mailbox entry that failed, with its sender if it had one
     */
    public static void handleException(Actor<?> actor, Object envelope, Throwable exception) {
        boolean retry = actor.reportError(envelope, exception);
        SupervisionStrategy strategy = actor.getSupervisionStrategy();
        switch (strategy) {
            case RESUME -> logger.debug("Actor {} resumes after {}", actor.getActorId(), exception.toString());
            case RESTART -> {
                logger.info("Actor {} restarts after {}", actor.getActorId(), exception.toString());
                actor.restart(exception);
            }
            case STOP -> {
                logger.info("Actor {} stops after {}", actor.getActorId(), exception.toString());
                actor.stop();
                return;
            }
        }
        if (retry && actor.isRunning()) {
            actor.enqueue(envelope);
        }
    }
}
