package com.cajunsystems.camel.actor.config;

import com.cajunsystems.camel.mailbox.Mailbox;
import com.cajunsystems.camel.mailbox.MailboxType;

/**
 * Which mailbox an actor gets. Defaults to an unbounded {@link MailboxType#MPSC} mailbox;
 * {@link MailboxType#LINKED} bounds it to {@link #getCapacity()} entries, after which deliveries are rejected.
 */
public class MailboxConfig {
    public static final int DEFAULT_CAPACITY = 10_000;

    private MailboxType mailboxType = MailboxType.MPSC;
    private int capacity = DEFAULT_CAPACITY;

    public MailboxType getMailboxType() {
        return mailboxType;
    }

    public MailboxConfig setMailboxType(MailboxType mailboxType) {
        if (mailboxType == null) {
            throw new IllegalArgumentException("mailboxType must not be null");
        }
        this.mailboxType = mailboxType;
        return this;
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * Ignored by unbounded mailbox types.
     */
    public MailboxConfig setCapacity(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Mailbox capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        return this;
    }

    /**
     * A new, empty mailbox for one actor.
     */
    public <T> Mailbox<T> createMailbox() {
        return mailboxType.create(capacity);
    }

    @Override
    public String toString() {
        return "MailboxConfig{" + mailboxType + ", capacity=" + capacity + '}';
    }
}
