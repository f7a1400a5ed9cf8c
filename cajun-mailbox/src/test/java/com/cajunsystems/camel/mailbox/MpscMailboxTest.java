package com.cajunsystems.camel.mailbox;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(10)
class MpscMailboxTest {

    private final MpscMailbox<String> mailbox = new MpscMailbox<>();

    @Test
    void nullEntriesAreRejected() {
        assertThrows(NullPointerException.class, () -> mailbox.offer(null));
    }

    @Test
    void entriesComeOutInOfferOrder() throws InterruptedException {
        mailbox.offer("exchange-1");
        mailbox.offer("exchange-2");

        assertEquals("exchange-1", mailbox.poll(0, TimeUnit.MILLISECONDS));
        assertEquals("exchange-2", mailbox.poll(0, TimeUnit.MILLISECONDS));
        assertNull(mailbox.poll(0, TimeUnit.MILLISECONDS));
    }

    @Test
    void emptyPollWaitsForTheTimeout() throws InterruptedException {
        long start = System.nanoTime();

        assertNull(mailbox.poll(50, TimeUnit.MILLISECONDS));

        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(50));
    }

    @Test
    void offerWakesParkedConsumer() throws Exception {
        ExecutorService consumer = Executors.newSingleThreadExecutor();
        try {
            Future<String> taken = consumer.submit(() -> mailbox.poll(5, TimeUnit.SECONDS));
            Thread.sleep(50);

            mailbox.offer("reply");

            assertEquals("reply", taken.get(1, TimeUnit.SECONDS));
        } finally {
            consumer.shutdownNow();
        }
    }

    @Test
    void parkedConsumerCanBeInterrupted() throws Exception {
        CompletableFuture<Throwable> outcome = new CompletableFuture<>();
        Thread consumer = new Thread(() -> {
            try {
                mailbox.poll(5, TimeUnit.SECONDS);
                outcome.complete(null);
            } catch (InterruptedException e) {
                outcome.complete(e);
            }
        });
        consumer.start();
        Thread.sleep(50);

        consumer.interrupt();

        assertInstanceOf(InterruptedException.class, outcome.get(1, TimeUnit.SECONDS));
    }

    @Test
    void drainToStopsAtLimit() {
        for (int i = 0; i < 5; i++) {
            mailbox.offer("m" + i);
        }
        List<String> batch = new ArrayList<>();

        assertEquals(3, mailbox.drainTo(batch, 3));

        assertEquals(List.of("m0", "m1", "m2"), batch);
        assertEquals(2, mailbox.size());
    }

    @Test
    void clearDiscardsPendingEntries() {
        mailbox.offer("a");
        mailbox.offer("b");

        mailbox.clear();

        assertEquals(0, mailbox.size());
        assertEquals(Integer.MAX_VALUE, mailbox.capacity());
    }

    @Test
    void concurrentProducersLoseNothingAndKeepPerProducerOrder() throws Exception {
        MpscMailbox<int[]> shared = new MpscMailbox<>(16);
        int producers = 4;
        int perProducer = 2_000;
        ExecutorService pool = Executors.newFixedThreadPool(producers);
        try {
            for (int p = 0; p < producers; p++) {
                int producer = p;
                pool.execute(() -> {
                    for (int i = 0; i < perProducer; i++) {
                        shared.offer(new int[]{producer, i});
                    }
                });
            }

            int[] lastSeen = {-1, -1, -1, -1};
            int received = 0;
            while (received < producers * perProducer) {
                int[] entry = shared.poll(1, TimeUnit.SECONDS);
                assertNotNull(entry, "mailbox ran dry after " + received + " entries");
                assertEquals(lastSeen[entry[0]] + 1, entry[1]);
                lastSeen[entry[0]] = entry[1];
                received++;
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
