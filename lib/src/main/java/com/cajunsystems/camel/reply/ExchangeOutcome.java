package com.cajunsystems.camel.reply;

import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Terminal result of an {@link ExchangeWaiter}.
 */
public sealed interface ExchangeOutcome
        permits ExchangeOutcome.Replied, ExchangeOutcome.Acknowledged, ExchangeOutcome.Failed, ExchangeOutcome.TimedOut {

    WaiterState state();

    /**
     * The actor replied with data. Headers are copied onto the result message.
     */
    record Replied(Object body, Map<String, Object> headers) implements ExchangeOutcome {
        @Override
        public WaiterState state() {
            return WaiterState.REPLIED;
        }
    }

    /**
     * The actor acknowledged the exchange; the result body is empty.
     */
    record Acknowledged() implements ExchangeOutcome {
        @Override
        public WaiterState state() {
            return WaiterState.ACKNOWLEDGED;
        }
    }

    record Failed(Throwable cause) implements ExchangeOutcome {
        @Override
        public WaiterState state() {
            return WaiterState.FAILED;
        }
    }

    record TimedOut(TimeoutException cause) implements ExchangeOutcome {
        @Override
        public WaiterState state() {
            return WaiterState.TIMED_OUT;
        }
    }
}
