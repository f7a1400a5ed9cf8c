package com.cajunsystems.camel.mailbox;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded mailbox on a {@link LinkedBlockingQueue}. When full, offers fail and the sender sees the rejection.
 *
 * @param <T> The type of entries
 */
public class LinkedMailbox<T> implements Mailbox<T> {

    private final LinkedBlockingQueue<T> entries;

    public LinkedMailbox(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Mailbox capacity must be positive: " + capacity);
        }
        this.entries = new LinkedBlockingQueue<>(capacity);
    }

    @Override
    public boolean offer(T entry) {
        return entries.offer(Objects.requireNonNull(entry, "entry"));
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        return entries.poll(timeout, unit);
    }

    @Override
    public int drainTo(Collection<? super T> batch, int limit) {
        return entries.drainTo(batch, limit);
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public void clear() {
        entries.clear();
    }

    @Override
    public int capacity() {
        return entries.size() + entries.remainingCapacity();
    }

    @Override
    public String toString() {
        return "LinkedMailbox{size=" + size() + ", capacity=" + capacity() + '}';
    }
}
