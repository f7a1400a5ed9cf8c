package com.cajunsystems.camel.actor;

/**
 * Receives the messages sent to a temporary reply address registered with
 * {@link ActorSystem#registerReplyAddress(String, ReplyHandler)}.
 * Reply addresses are how the ask pattern and other request/reply callers that are not actors
 * correlate replies with their requests.
 */
@FunctionalInterface
public interface ReplyHandler {

    /**
     * Called with every message sent to the reply address, on the sender's thread.
     *
     * @param reply the message that was sent
     */
    void onReply(Object reply);

    /**
     * Called when the actor system shuts down while the address is still registered.
     */
    default void onShutdown() {
    }
}
