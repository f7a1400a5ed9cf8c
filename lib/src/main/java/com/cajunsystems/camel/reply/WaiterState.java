package com.cajunsystems.camel.reply;

/**
 * State of an {@link ExchangeWaiter}. Every state except PENDING is terminal.
 */
public enum WaiterState {
    PENDING,
    REPLIED,
    ACKNOWLEDGED,
    FAILED,
    TIMED_OUT
}
