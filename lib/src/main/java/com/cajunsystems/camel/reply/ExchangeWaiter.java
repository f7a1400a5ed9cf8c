package com.cajunsystems.camel.reply;

import com.cajunsystems.camel.Ack;
import com.cajunsystems.camel.CamelMessage;
import com.cajunsystems.camel.Failure;
import com.cajunsystems.camel.ResponseProtocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Waits for the outcome of one exchange dispatched to an actor.
 * The first reply, acknowledgement, failure or timeout resolves the waiter; everything after that is discarded.
 */
public class ExchangeWaiter {
    private static final Logger logger = LoggerFactory.getLogger(ExchangeWaiter.class);

    private final String correlationId;
    private final String actorId;
    private final ResponseProtocol protocol;
    private final Duration timeout;
    private final CompletableFuture<ExchangeOutcome> outcome = new CompletableFuture<>();

    public ExchangeWaiter(String correlationId, String actorId, ResponseProtocol protocol, Duration timeout) {
        this.correlationId = correlationId;
        this.actorId = actorId;
        this.protocol = protocol;
        this.timeout = timeout;
    }

    /**
     * Resolves the waiter with a message the actor sent back.
     *
     * @param reply {@link Ack}, {@link Failure}, a {@link CamelMessage} or any other value
     * @return true if this reply resolved the waiter, false if it was late
     */
    public boolean offer(Object reply) {
        return resolve(toOutcome(reply), reply);
    }

    /**
     * Resolves the waiter with a {@link TimeoutException} whose message depends on the response protocol.
     *
     * @return true if the waiter was still pending
     */
    public boolean expire() {
        String message = protocol == ResponseProtocol.MANUAL_ACK
                ? "Failed to get Ack or Failure response from actor " + actorId + " within " + timeout.toMillis() + " ms"
                : "Failed to get a reply from actor " + actorId + " within " + timeout.toMillis() + " ms";
        return resolve(new ExchangeOutcome.TimedOut(new TimeoutException(message)), "timeout");
    }

    /**
     * Resolves the waiter with an error raised by the bridge itself, such as a failed delivery.
     *
     * @return true if the waiter was still pending
     */
    public boolean fail(Throwable cause) {
        return resolve(new ExchangeOutcome.Failed(cause), cause);
    }

    /**
     * Blocks until the waiter is resolved. The coordinator guarantees resolution by the deadline.
     *
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public ExchangeOutcome await() throws InterruptedException {
        try {
            return outcome.get();
        } catch (ExecutionException e) {
            // outcome is only ever completed normally
            throw new IllegalStateException("Waiter " + correlationId + " completed exceptionally", e.getCause());
        }
    }

    /**
     * Returns a stage that completes with the outcome once the waiter is resolved.
     */
    public CompletionStage<ExchangeOutcome> outcome() {
        return outcome.minimalCompletionStage();
    }

    public WaiterState getState() {
        return outcome.isDone() ? outcome.join().state() : WaiterState.PENDING;
    }

    public boolean isResolved() {
        return outcome.isDone();
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public String getActorId() {
        return actorId;
    }

    public ResponseProtocol getProtocol() {
        return protocol;
    }

    public Duration getTimeout() {
        return timeout;
    }

    private ExchangeOutcome toOutcome(Object reply) {
        if (reply instanceof Ack) {
            return new ExchangeOutcome.Acknowledged();
        }
        if (reply instanceof Failure failure) {
            return new ExchangeOutcome.Failed(failure.cause());
        }
        if (protocol == ResponseProtocol.MANUAL_ACK) {
            return new ExchangeOutcome.Failed(new IllegalStateException("Actor " + actorId
                    + " must answer with Ack or Failure under manual acknowledgement but replied: " + reply));
        }
        if (reply instanceof CamelMessage message) {
            return new ExchangeOutcome.Replied(message.getBody(), message.getHeaders());
        }
        return new ExchangeOutcome.Replied(reply, Collections.emptyMap());
    }

    private boolean resolve(ExchangeOutcome result, Object cause) {
        if (outcome.complete(result)) {
            logger.debug("Exchange {} of actor {} resolved as {}", correlationId, actorId, result.state());
            return true;
        }
        logger.debug("Exchange {} of actor {} already {}, discarding {}", correlationId, actorId, getState(), cause);
        return false;
    }

    @Override
    public String toString() {
        return "ExchangeWaiter{" + correlationId + ", actor=" + actorId + ", state=" + getState() + '}';
    }
}
