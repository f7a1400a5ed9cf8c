package com.cajunsystems.camel.actor;

import com.cajunsystems.camel.actor.config.ThreadPoolFactory;
import com.cajunsystems.camel.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

/**
 * Runs one actor: a dedicated thread takes entries from the mailbox in batches and hands each to the
 * actor's {@code receive}. A failing entry goes to the failure handler, which applies supervision
 * on this same thread before the next entry is taken.
 *
 * @param <T> The type of mailbox entries
 */
public class MailboxProcessor<T> {
    private static final Logger logger = LoggerFactory.getLogger(MailboxProcessor.class);

    // Short so that a stop request is noticed promptly
    private static final long IDLE_WAIT_MS = 1;

    private final String actorId;
    private final Mailbox<T> mailbox;
    private final BiConsumer<T, Throwable> onFailure;
    private final ActorLifecycle<T> lifecycle;
    private final ThreadPoolFactory threads;
    private final int batchSize;
    private final List<T> batch;

    private volatile boolean running;
    private volatile Thread worker;

    /**
     * @param actorId   Used for the thread name and logging
     * @param mailbox   The actor's mailbox
     * @param onFailure Called on the mailbox thread with the entry and the error when {@code receive} throws
     * @param lifecycle The actor's hooks
     * @param threads   Supplies the mailbox thread, the batch size and the stop timeout
     */
    public MailboxProcessor(
            String actorId,
            Mailbox<T> mailbox,
            BiConsumer<T, Throwable> onFailure,
            ActorLifecycle<T> lifecycle,
            ThreadPoolFactory threads) {
        this.actorId = actorId;
        this.mailbox = mailbox;
        this.onFailure = onFailure;
        this.lifecycle = lifecycle;
        this.threads = threads;
        this.batchSize = Math.max(1, threads.getActorBatchSize());
        this.batch = new ArrayList<>(batchSize);
    }

    /**
     * Runs {@code preStart} on the calling thread, then starts the mailbox thread and waits until it runs.
     */
    public void start() {
        if (running) {
            logger.debug("Actor {} already started", actorId);
            return;
        }
        running = true;
        lifecycle.preStart();

        CountDownLatch started = new CountDownLatch(1);
        worker = threads.createThreadFactory(actorId).newThread(() -> {
            started.countDown();
            runLoop();
        });
        worker.start();
        try {
            if (!started.await(5, TimeUnit.SECONDS)) {
                logger.warn("Mailbox thread of actor {} did not come up within 5 s", actorId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while starting actor {}", actorId);
        }
        logger.debug("Actor {} started", actorId);
    }

    /**
     * Discards pending entries, stops the mailbox thread and runs {@code postStop}.
     * From the mailbox thread itself this returns without waiting for the thread to end.
     */
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        mailbox.clear();
        Thread current = worker;
        worker = null;
        if (current != null && current != Thread.currentThread()) {
            current.interrupt();
            try {
                current.join(TimeUnit.SECONDS.toMillis(threads.getActorShutdownTimeoutSeconds()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (current.isAlive()) {
                logger.warn("Mailbox thread of actor {} still busy after stop", actorId);
            }
        }
        lifecycle.postStop();
        logger.debug("Actor {} stopped", actorId);
    }

    /**
     * @return false if the mailbox rejected the entry
     */
    public boolean tell(T entry) {
        if (mailbox.offer(entry)) {
            return true;
        }
        logger.warn("Mailbox of actor {} is full, dropping {}", actorId, entry);
        return false;
    }

    public boolean isRunning() {
        return running;
    }

    private void runLoop() {
        try {
            while (running) {
                T head = mailbox.poll(IDLE_WAIT_MS, TimeUnit.MILLISECONDS);
                if (head == null) {
                    continue;
                }
                batch.add(head);
                mailbox.drainTo(batch, batchSize - 1);
                for (int i = 0; i < batch.size() && running; i++) {
                    dispatch(batch.get(i));
                }
                batch.clear();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Mailbox thread of actor {} interrupted", actorId);
        }
    }

    private void dispatch(T entry) {
        try {
            lifecycle.receive(entry);
        } catch (Throwable e) {
            logger.error("Actor {} failed to process {}", actorId, entry, e);
            onFailure.accept(entry, e);
        }
    }
}
