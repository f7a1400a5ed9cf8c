package com.cajunsystems.camel.actor;

/**
 * Hooks a {@link MailboxProcessor} calls into its actor.
 *
 * @param <T> The type of mailbox entries
 */
public interface ActorLifecycle<T> {

    /** Runs on the starting thread, before the mailbox thread exists. */
    void preStart();

    /** Runs on the mailbox thread for every entry taken from the mailbox. */
    void receive(T envelope);

    /** Runs once when the processor stops, after pending entries were discarded. */
    void postStop();
}
