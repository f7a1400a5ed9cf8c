package com.cajunsystems.camel.consumer;

import com.cajunsystems.camel.CamelMessage;
import com.cajunsystems.camel.actor.Pid;
import com.cajunsystems.camel.reply.ExchangeOutcome;
import com.cajunsystems.camel.reply.ExchangeWaiter;
import com.cajunsystems.camel.reply.ReplyCoordinator;
import org.apache.camel.AsyncCallback;
import org.apache.camel.Exchange;
import org.apache.camel.support.AsyncProcessorSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.RejectedExecutionException;

/**
 * Camel processor at the end of a consumer route. Turns every exchange into a {@link CamelMessage},
 * hands it to the consumer actor and completes the exchange from the actor's answer.
 * <p>
 * The processor is bound to the actor's {@link Pid}, which survives restarts, so it is created once per route.
 */
public class ConsumerAdapter extends AsyncProcessorSupport {
    private static final Logger logger = LoggerFactory.getLogger(ConsumerAdapter.class);

    private final Pid consumer;
    private final ConsumerConfig config;
    private final ReplyCoordinator coordinator;

    public ConsumerAdapter(Pid consumer, ConsumerConfig config, ReplyCoordinator coordinator) {
        this.consumer = consumer;
        this.config = config;
        this.coordinator = coordinator;
    }

    @Override
    public boolean process(Exchange exchange, AsyncCallback callback) {
        CamelMessage message = CamelMessage.from(exchange);
        ExchangeWaiter waiter = coordinator.dispatch(
                consumer, message, config.getReplyTimeout(), config.getResponseProtocol());

        if (config.isBlocking()) {
            try {
                complete(exchange, waiter.await());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                waiter.fail(e);
                exchange.setException(e);
            }
            callback.done(true);
            return true;
        }

        waiter.outcome().whenComplete((outcome, error) -> {
            try {
                coordinator.getCompletionExecutor().execute(() -> finish(exchange, outcome, error, callback));
            } catch (RejectedExecutionException e) {
                logger.debug("Completion executor is shut down, completing exchange {} inline", exchange.getExchangeId());
                finish(exchange, outcome, error, callback);
            }
        });
        return false;
    }

    private static void finish(Exchange exchange, ExchangeOutcome outcome, Throwable error, AsyncCallback callback) {
        try {
            if (error != null) {
                exchange.setException(error);
            } else {
                complete(exchange, outcome);
            }
        } finally {
            callback.done(false);
        }
    }

    /**
     * Writes an outcome onto the exchange: a result body and headers, an empty body, or an exception.
     */
    static void complete(Exchange exchange, ExchangeOutcome outcome) {
        if (outcome instanceof ExchangeOutcome.Replied replied) {
            exchange.getMessage().setBody(replied.body());
            exchange.getMessage().getHeaders().putAll(replied.headers());
        } else if (outcome instanceof ExchangeOutcome.Acknowledged) {
            exchange.getMessage().setBody(null);
        } else if (outcome instanceof ExchangeOutcome.Failed failed) {
            exchange.setException(failed.cause());
        } else if (outcome instanceof ExchangeOutcome.TimedOut timedOut) {
            exchange.setException(timedOut.cause());
        }
        logger.debug("Exchange {} completed as {}", exchange.getExchangeId(), outcome.state());
    }

    public Pid getConsumer() {
        return consumer;
    }

    @Override
    public String toString() {
        return "ConsumerAdapter[" + consumer.actorId() + "]";
    }
}
