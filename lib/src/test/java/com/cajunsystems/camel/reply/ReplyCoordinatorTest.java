package com.cajunsystems.camel.reply;

import com.cajunsystems.camel.Ack;
import com.cajunsystems.camel.CamelBridgeException;
import com.cajunsystems.camel.CamelMessage;
import com.cajunsystems.camel.ResponseProtocol;
import com.cajunsystems.camel.actor.ActorContext;
import com.cajunsystems.camel.actor.ActorException;
import com.cajunsystems.camel.actor.ActorSystem;
import com.cajunsystems.camel.actor.Pid;
import com.cajunsystems.camel.actor.handler.Handler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(10)
class ReplyCoordinatorTest {

    private ActorSystem system;
    private ReplyCoordinator coordinator;

    @BeforeEach
    void setUp() {
        system = new ActorSystem();
        coordinator = new ReplyCoordinator(system);
    }

    @AfterEach
    void tearDown() {
        coordinator.close();
        system.shutdown();
    }

    static class UpperCaseHandler implements Handler<Object> {
        @Override
        public void receive(Object message, ActorContext context) {
            if (message instanceof CamelMessage camelMessage) {
                context.reply(camelMessage.getBodyAs(String.class).toUpperCase());
            }
        }
    }

    @Test
    void dispatchResolvesWithActorReply() throws Exception {
        Pid actor = system.actorOf(new UpperCaseHandler()).withId("upper").spawn();

        ExchangeWaiter waiter = coordinator.dispatch(
                actor, CamelMessage.of("abc"), Duration.ofSeconds(2), ResponseProtocol.AUTO_REPLY);

        ExchangeOutcome.Replied replied = assertInstanceOf(ExchangeOutcome.Replied.class, waiter.await());
        assertEquals("ABC", replied.body());
        assertTrue(waiter.getCorrelationId().startsWith("camel-exchange-"));
        assertEquals("upper", waiter.getActorId());
    }

    @Test
    void replyAddressIsRetiredAfterResolution() throws Exception {
        Pid actor = system.actorOf(new UpperCaseHandler()).withId("upper").spawn();

        ExchangeWaiter waiter = coordinator.dispatch(
                actor, CamelMessage.of("abc"), Duration.ofSeconds(2), ResponseProtocol.AUTO_REPLY);
        waiter.await();

        // cleanup runs on the completing thread right after resolution
        long deadline = System.currentTimeMillis() + 1000;
        while (coordinator.pendingCount() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertEquals(0, coordinator.pendingCount());
        assertFalse(system.unregisterReplyAddress(waiter.getCorrelationId()));
    }

    @Test
    void dispatchToUnknownActorFailsImmediately() throws Exception {
        ExchangeWaiter waiter = coordinator.dispatch(
                new Pid("missing", system), CamelMessage.of("abc"), Duration.ofSeconds(5), ResponseProtocol.AUTO_REPLY);

        ExchangeOutcome.Failed failed = assertInstanceOf(ExchangeOutcome.Failed.class, waiter.await());
        assertInstanceOf(ActorException.class, failed.cause());
    }

    @Test
    void silentActorTimesOut() throws Exception {
        Pid actor = system.actorOf((Handler<Object>) (message, context) -> { }).withId("silent").spawn();

        ExchangeWaiter waiter = coordinator.dispatch(
                actor, CamelMessage.of("abc"), Duration.ofMillis(20), ResponseProtocol.MANUAL_ACK);

        ExchangeOutcome.TimedOut timedOut = assertInstanceOf(ExchangeOutcome.TimedOut.class, waiter.await());
        assertTrue(timedOut.cause().getMessage().contains("Failed to get Ack"));
    }

    @Test
    void concurrentExchangesAreCorrelatedIndependently() throws Exception {
        // replies in reverse order of arrival
        List<ActorContextReply> held = new CopyOnWriteArrayList<>();
        CountDownLatch bothArrived = new CountDownLatch(2);
        Pid actor = system.actorOf((Handler<Object>) (message, context) -> {
            held.add(new ActorContextReply(context.getSender().orElseThrow(), (CamelMessage) message));
            bothArrived.countDown();
        }).withId("holder").spawn();

        ExchangeWaiter first = coordinator.dispatch(
                actor, CamelMessage.of("one"), Duration.ofSeconds(2), ResponseProtocol.AUTO_REPLY);
        ExchangeWaiter second = coordinator.dispatch(
                actor, CamelMessage.of("two"), Duration.ofSeconds(2), ResponseProtocol.AUTO_REPLY);
        assertTrue(bothArrived.await(2, TimeUnit.SECONDS));

        for (int i = held.size() - 1; i >= 0; i--) {
            ActorContextReply reply = held.get(i);
            system.tell(reply.sender(), "reply to " + reply.message().getBody());
        }

        assertEquals("reply to one", ((ExchangeOutcome.Replied) first.await()).body());
        assertEquals("reply to two", ((ExchangeOutcome.Replied) second.await()).body());
    }

    @Test
    void manualAckResolvesAsAcknowledged() throws Exception {
        Pid actor = system.actorOf((Handler<Object>) (message, context) -> context.reply(Ack.INSTANCE))
                .withId("acker").spawn();

        ExchangeWaiter waiter = coordinator.dispatch(
                actor, CamelMessage.of("abc"), Duration.ofSeconds(2), ResponseProtocol.MANUAL_ACK);

        assertInstanceOf(ExchangeOutcome.Acknowledged.class, waiter.await());
    }

    @Test
    void closeFailsPendingWaiters() throws Exception {
        Pid actor = system.actorOf((Handler<Object>) (message, context) -> { }).withId("silent").spawn();
        ExchangeWaiter waiter = coordinator.dispatch(
                actor, CamelMessage.of("abc"), Duration.ofSeconds(30), ResponseProtocol.AUTO_REPLY);
        CompletableFuture<ExchangeOutcome> observed = waiter.outcome().toCompletableFuture();

        coordinator.close();

        ExchangeOutcome.Failed failed = assertInstanceOf(ExchangeOutcome.Failed.class, observed.get(1, TimeUnit.SECONDS));
        assertInstanceOf(CamelBridgeException.class, failed.cause());
    }

    @Test
    void dispatchAfterCloseFails() throws Exception {
        Pid actor = system.actorOf(new UpperCaseHandler()).withId("upper").spawn();
        coordinator.close();

        ExchangeWaiter waiter = coordinator.dispatch(
                actor, CamelMessage.of("abc"), Duration.ofSeconds(1), ResponseProtocol.AUTO_REPLY);

        assertEquals(WaiterState.FAILED, waiter.getState());
    }

    private record ActorContextReply(Pid sender, CamelMessage message) {
    }
}
