package com.cajunsystems.camel.mailbox;

import org.jctools.queues.MpscUnboundedArrayQueue;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded mailbox on a JCTools {@link MpscUnboundedArrayQueue}.
 * <p>
 * Producers never lock unless the consumer is parked on an empty mailbox. The consumer publishes
 * {@code parked} before its last emptiness check, so a producer either sees the flag and signals,
 * or its entry is found by that check.
 *
 * @param <T> The type of entries
 */
public class MpscMailbox<T> implements Mailbox<T> {

    static final int DEFAULT_CHUNK_SIZE = 128;

    private final MpscUnboundedArrayQueue<T> entries;
    private final ReentrantLock parkLock = new ReentrantLock();
    private final Condition arrived = parkLock.newCondition();
    private volatile boolean parked;

    public MpscMailbox() {
        this(DEFAULT_CHUNK_SIZE);
    }

    /**
     * @param chunkSize growth step of the queue, rounded up to a power of two by JCTools
     */
    public MpscMailbox(int chunkSize) {
        this.entries = new MpscUnboundedArrayQueue<>(Math.max(2, chunkSize));
    }

    @Override
    public boolean offer(T entry) {
        entries.offer(Objects.requireNonNull(entry, "entry"));
        if (parked) {
            parkLock.lock();
            try {
                arrived.signal();
            } finally {
                parkLock.unlock();
            }
        }
        return true;
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        T entry = entries.poll();
        if (entry != null) {
            return entry;
        }
        long remaining = unit.toNanos(timeout);
        parkLock.lockInterruptibly();
        try {
            parked = true;
            while ((entry = entries.poll()) == null && remaining > 0) {
                remaining = arrived.awaitNanos(remaining);
            }
            return entry;
        } finally {
            parked = false;
            parkLock.unlock();
        }
    }

    @Override
    public int drainTo(Collection<? super T> batch, int limit) {
        Objects.requireNonNull(batch, "batch");
        return limit <= 0 ? 0 : entries.drain(batch::add, limit);
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
        return Integer.MAX_VALUE;
    }

    @Override
    public String toString() {
        return "MpscMailbox{size=" + size() + '}';
    }
}
