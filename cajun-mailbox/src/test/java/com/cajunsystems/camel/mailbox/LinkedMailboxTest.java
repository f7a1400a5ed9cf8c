package com.cajunsystems.camel.mailbox;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LinkedMailboxTest {

    @Test
    void fullMailboxRejectsOffers() {
        LinkedMailbox<String> mailbox = new LinkedMailbox<>(2);

        assertTrue(mailbox.offer("a"));
        assertTrue(mailbox.offer("b"));

        assertFalse(mailbox.offer("c"));
        assertEquals(2, mailbox.size());
        assertEquals(2, mailbox.capacity());
    }

    @Test
    void capacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new LinkedMailbox<String>(0));
    }

    @Test
    void pollThenDrainKeepsOrder() throws InterruptedException {
        LinkedMailbox<String> mailbox = new LinkedMailbox<>(10);
        mailbox.offer("first");
        mailbox.offer("second");
        mailbox.offer("third");

        assertEquals("first", mailbox.poll(10, TimeUnit.MILLISECONDS));
        List<String> batch = new ArrayList<>();
        assertEquals(2, mailbox.drainTo(batch, 10));

        assertEquals(List.of("second", "third"), batch);
        assertNull(mailbox.poll(10, TimeUnit.MILLISECONDS));
    }

    @Test
    void clearFreesCapacity() {
        LinkedMailbox<String> mailbox = new LinkedMailbox<>(1);
        mailbox.offer("x");

        mailbox.clear();

        assertTrue(mailbox.offer("y"));
    }

    @Test
    void mailboxTypeCreatesMatchingImplementation() {
        assertInstanceOf(MpscMailbox.class, MailboxType.MPSC.create(8));
        Mailbox<String> linked = MailboxType.LINKED.create(8);
        assertInstanceOf(LinkedMailbox.class, linked);
        assertEquals(8, linked.capacity());
    }
}
