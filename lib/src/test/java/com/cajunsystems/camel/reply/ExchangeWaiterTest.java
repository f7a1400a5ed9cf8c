package com.cajunsystems.camel.reply;

import com.cajunsystems.camel.Ack;
import com.cajunsystems.camel.CamelMessage;
import com.cajunsystems.camel.Failure;
import com.cajunsystems.camel.ResponseProtocol;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ExchangeWaiterTest {

    private static ExchangeWaiter waiter(ResponseProtocol protocol) {
        return new ExchangeWaiter("camel-exchange-1", "consumer", protocol, Duration.ofMillis(250));
    }

    @Test
    void newWaiterIsPending() {
        ExchangeWaiter waiter = waiter(ResponseProtocol.AUTO_REPLY);

        assertEquals(WaiterState.PENDING, waiter.getState());
        assertFalse(waiter.isResolved());
    }

    @Test
    void plainReplyBecomesBodyWithoutHeaders() throws Exception {
        ExchangeWaiter waiter = waiter(ResponseProtocol.AUTO_REPLY);

        assertTrue(waiter.offer("hello"));

        ExchangeOutcome.Replied replied = assertInstanceOf(ExchangeOutcome.Replied.class, waiter.await());
        assertEquals("hello", replied.body());
        assertTrue(replied.headers().isEmpty());
        assertEquals(WaiterState.REPLIED, waiter.getState());
    }

    @Test
    void camelMessageReplyKeepsHeaders() throws Exception {
        ExchangeWaiter waiter = waiter(ResponseProtocol.AUTO_REPLY);

        waiter.offer(new CamelMessage("body", Map.of("answer", 42)));

        ExchangeOutcome.Replied replied = assertInstanceOf(ExchangeOutcome.Replied.class, waiter.await());
        assertEquals("body", replied.body());
        assertEquals(42, replied.headers().get("answer"));
    }

    @Test
    void ackAcknowledgesUnderBothProtocols() throws Exception {
        for (ResponseProtocol protocol : ResponseProtocol.values()) {
            ExchangeWaiter waiter = waiter(protocol);

            waiter.offer(Ack.INSTANCE);

            assertInstanceOf(ExchangeOutcome.Acknowledged.class, waiter.await());
            assertEquals(WaiterState.ACKNOWLEDGED, waiter.getState());
        }
    }

    @Test
    void failureCarriesOriginalCause() throws Exception {
        Exception cause = new Exception("e1");
        ExchangeWaiter waiter = waiter(ResponseProtocol.MANUAL_ACK);

        waiter.offer(new Failure(cause));

        ExchangeOutcome.Failed failed = assertInstanceOf(ExchangeOutcome.Failed.class, waiter.await());
        assertSame(cause, failed.cause());
    }

    @Test
    void plainReplyUnderManualAckIsProtocolViolation() throws Exception {
        ExchangeWaiter waiter = waiter(ResponseProtocol.MANUAL_ACK);

        waiter.offer("not an ack");

        ExchangeOutcome.Failed failed = assertInstanceOf(ExchangeOutcome.Failed.class, waiter.await());
        assertInstanceOf(IllegalStateException.class, failed.cause());
        assertTrue(failed.cause().getMessage().contains("not an ack"));
    }

    @Test
    void expireUsesReplyMessageForAutoReply() throws Exception {
        ExchangeWaiter waiter = waiter(ResponseProtocol.AUTO_REPLY);

        assertTrue(waiter.expire());

        ExchangeOutcome.TimedOut timedOut = assertInstanceOf(ExchangeOutcome.TimedOut.class, waiter.await());
        assertEquals("Failed to get a reply from actor consumer within 250 ms", timedOut.cause().getMessage());
        assertEquals(WaiterState.TIMED_OUT, waiter.getState());
    }

    @Test
    void expireUsesAckMessageForManualAck() throws Exception {
        ExchangeWaiter waiter = waiter(ResponseProtocol.MANUAL_ACK);

        waiter.expire();

        ExchangeOutcome.TimedOut timedOut = assertInstanceOf(ExchangeOutcome.TimedOut.class, waiter.await());
        assertTrue(timedOut.cause().getMessage().startsWith("Failed to get Ack or Failure response from actor consumer"));
    }

    @Test
    void firstResolutionWins() throws Exception {
        ExchangeWaiter waiter = waiter(ResponseProtocol.AUTO_REPLY);

        assertTrue(waiter.offer("first"));
        assertFalse(waiter.offer("second"));
        assertFalse(waiter.expire());
        assertFalse(waiter.fail(new RuntimeException("late")));

        ExchangeOutcome.Replied replied = assertInstanceOf(ExchangeOutcome.Replied.class, waiter.await());
        assertEquals("first", replied.body());
    }

    @Test
    void lateReplyAfterTimeoutIsDiscarded() throws Exception {
        ExchangeWaiter waiter = waiter(ResponseProtocol.AUTO_REPLY);

        waiter.expire();

        assertFalse(waiter.offer("too late"));
        assertEquals(WaiterState.TIMED_OUT, waiter.getState());
    }

    @Test
    void outcomeStageCompletesOnResolution() throws Exception {
        ExchangeWaiter waiter = waiter(ResponseProtocol.AUTO_REPLY);
        CompletableFuture<WaiterState> observed = new CompletableFuture<>();
        waiter.outcome().thenAccept(outcome -> observed.complete(outcome.state()));
        assertFalse(observed.isDone());

        waiter.fail(new IllegalArgumentException("boom"));

        assertEquals(WaiterState.FAILED, observed.get(1, TimeUnit.SECONDS));
    }
}
