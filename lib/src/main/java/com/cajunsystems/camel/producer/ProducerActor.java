package com.cajunsystems.camel.producer;

import com.cajunsystems.camel.Ack;
import com.cajunsystems.camel.CamelMessage;
import com.cajunsystems.camel.Failure;
import com.cajunsystems.camel.actor.Actor;
import com.cajunsystems.camel.actor.ActorSystem;
import com.cajunsystems.camel.actor.Pid;
import org.apache.camel.Exchange;
import org.apache.camel.ExchangePattern;
import org.apache.camel.ProducerTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Actor that forwards every message it receives to a Camel endpoint.
 * <p>
 * In-out producers reply the result to the sender as a {@link CamelMessage}; oneway producers send in-only
 * and reply {@link Ack}. A failed exchange is replied as {@link Failure}. Sends are asynchronous, so the
 * actor keeps processing while earlier exchanges are in flight.
 */
public class ProducerActor extends Actor<Object> {
    private static final Logger logger = LoggerFactory.getLogger(ProducerActor.class);

    private final ProducerTemplate template;
    private final String endpointUri;
    private final boolean oneway;

    public ProducerActor(ActorSystem system, String actorId, ProducerTemplate template, String endpointUri, boolean oneway) {
        super(system, actorId);
        this.template = template;
        this.endpointUri = endpointUri;
        this.oneway = oneway;
    }

    @Override
    protected void receive(Object message) {
        Optional<Pid> sender = getSender();
        CamelMessage request = message instanceof CamelMessage ? (CamelMessage) message : CamelMessage.of(message);
        ExchangePattern pattern = oneway ? ExchangePattern.InOnly : ExchangePattern.InOut;

        template.asyncSend(endpointUri, exchange -> {
            exchange.setPattern(pattern);
            exchange.getIn().setBody(request.getBody());
            exchange.getIn().getHeaders().putAll(request.getHeaders());
        }).whenComplete((exchange, error) -> {
            Object reply = toReply(exchange, error);
            logger.debug("Producer {} completed exchange to {}: {}", getActorId(), endpointUri, reply);
            sender.ifPresent(pid -> getSystem().tell(pid, reply));
        });
    }

    private Object toReply(Exchange exchange, Throwable error) {
        if (error != null) {
            return new Failure(error);
        }
        if (exchange.getException() != null) {
            return new Failure(exchange.getException());
        }
        return oneway ? Ack.INSTANCE : CamelMessage.from(exchange);
    }

    public String getEndpointUri() {
        return endpointUri;
    }

    public boolean isOneway() {
        return oneway;
    }
}
