package com.cajunsystems.camel.mailbox;

/**
 * The mailbox implementations an actor can be configured with.
 */
public enum MailboxType {

    /**
     * Lock-free unbounded mailbox; the default for actors fed by many concurrent senders,
     * such as consumers receiving exchanges from several Camel threads.
     */
    MPSC {
        @Override
        public <T> Mailbox<T> create(int capacity) {
            return new MpscMailbox<>();
        }
    },

    /**
     * Bounded blocking mailbox; offers fail once {@code capacity} messages are queued.
     */
    LINKED {
        @Override
        public <T> Mailbox<T> create(int capacity) {
            return new LinkedMailbox<>(capacity);
        }
    };

    /**
     * Creates a new, empty mailbox of this type.
     *
     * @param capacity the capacity for bounded types, ignored by unbounded ones
     */
    public abstract <T> Mailbox<T> create(int capacity);
}
