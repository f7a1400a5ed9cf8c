package com.cajunsystems.camel.mailbox;

import java.util.Collection;
import java.util.concurrent.TimeUnit;

/**
 * Queue of pending entries of one actor. Many threads enqueue, only the actor's mailbox thread dequeues.
 *
 * @param <T> The type of entries
 */
public interface Mailbox<T> {

    /**
     * Enqueues without blocking.
     *
     * @return false if a bounded mailbox is full
     * @throws NullPointerException for a null entry
     */
    boolean offer(T entry);

    /**
     * Takes the next entry, parking the caller for at most the timeout while the mailbox is empty.
     *
     * @return the entry, or null on timeout
     */
    T poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Moves up to {@code limit} further entries into {@code batch}, without waiting.
     *
     * @return how many entries were moved
     */
    int drainTo(Collection<? super T> batch, int limit);

    int size();

    /** Discards every pending entry. Used when the actor stops. */
    void clear();

    int capacity();
}
