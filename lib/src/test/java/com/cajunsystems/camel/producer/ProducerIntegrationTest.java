package com.cajunsystems.camel.producer;

import com.cajunsystems.camel.Ack;
import com.cajunsystems.camel.CamelExtension;
import com.cajunsystems.camel.CamelMessage;
import com.cajunsystems.camel.Failure;
import com.cajunsystems.camel.actor.ActorSystem;
import com.cajunsystems.camel.actor.Pid;
import org.apache.camel.builder.RouteBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(10)
class ProducerIntegrationTest {

    private ActorSystem system;
    private CamelExtension camel;
    private final BlockingQueue<Object> sink = new LinkedBlockingQueue<>();

    @BeforeEach
    void setUp() throws Exception {
        system = new ActorSystem();
        camel = CamelExtension.create(system);
        camel.context().addRoutes(new RouteBuilder() {
            @Override
            public void configure() {
                from("direct:upper")
                        .process(exchange -> {
                            exchange.getMessage().setBody(exchange.getIn().getBody(String.class).toUpperCase());
                            exchange.getMessage().setHeader("seen", exchange.getIn().getHeader("tag"));
                        });
                from("direct:sink")
                        .process(exchange -> sink.add(exchange.getIn().getBody()));
                from("direct:broken")
                        .throwException(new IllegalArgumentException("broken endpoint"));
            }
        });
    }

    @AfterEach
    void tearDown() {
        camel.close();
        system.shutdown();
    }

    @Test
    void inOutProducerRepliesWithResultMessage() throws Exception {
        Pid producer = camel.producerOf("direct:upper").spawn();

        Object reply = system.ask(producer, new CamelMessage("abc", Map.of("tag", "t1")), Duration.ofSeconds(2))
                .get(2, TimeUnit.SECONDS);

        CamelMessage result = assertInstanceOf(CamelMessage.class, reply);
        assertEquals("ABC", result.getBody());
        assertEquals("t1", result.getHeaderAs("seen", String.class).orElseThrow());
    }

    @Test
    void plainMessageIsSentAsBody() throws Exception {
        Pid producer = camel.producerOf("direct:upper").spawn();

        Object reply = system.ask(producer, "xyz", Duration.ofSeconds(2)).get(2, TimeUnit.SECONDS);

        assertEquals("XYZ", ((CamelMessage) reply).getBody());
    }

    @Test
    void onewayProducerRepliesWithAck() throws Exception {
        Pid producer = camel.producerOf("direct:sink").oneway(true).withId("sink-producer").spawn();

        Object reply = system.ask(producer, "event", Duration.ofSeconds(2)).get(2, TimeUnit.SECONDS);

        assertSame(Ack.INSTANCE, reply);
        assertEquals("event", sink.poll(1, TimeUnit.SECONDS));
    }

    @Test
    void onewayProducerWithoutSenderStillSends() throws Exception {
        Pid producer = camel.producerOf("direct:sink").oneway(true).spawn();

        producer.tell("fire and forget");

        assertEquals("fire and forget", sink.poll(1, TimeUnit.SECONDS));
    }

    @Test
    void failedExchangeRepliesWithFailure() throws Exception {
        Pid producer = camel.producerOf("direct:broken").spawn();

        Object reply = system.ask(producer, "anything", Duration.ofSeconds(2)).get(2, TimeUnit.SECONDS);

        Failure failure = assertInstanceOf(Failure.class, reply);
        assertInstanceOf(IllegalArgumentException.class, failure.cause());
        assertEquals("broken endpoint", failure.cause().getMessage());
    }

    @Test
    void extensionSendsDirectlyToEndpoints() throws Exception {
        assertEquals("SYNC", camel.sendTo("direct:upper", "sync"));
        assertEquals("ASYNC", camel.requestAsync("direct:upper", "async").get(2, TimeUnit.SECONDS));

        assertNull(camel.sendToAsync("direct:sink", "in-only").get(2, TimeUnit.SECONDS));
        assertEquals("in-only", sink.poll(1, TimeUnit.SECONDS));
    }

    @Test
    void asyncSendCarriesOriginalError() {
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> camel.sendToAsync("direct:broken", "x").get(2, TimeUnit.SECONDS));

        Throwable cause = e.getCause();
        while (cause != null && !(cause instanceof IllegalArgumentException)) {
            cause = cause.getCause();
        }
        assertNotNull(cause);
        assertEquals("broken endpoint", cause.getMessage());
    }

    @Test
    void producerRequiresEndpoint() {
        assertThrows(IllegalArgumentException.class, () -> camel.producerOf(" "));
    }
}
