package com.cajunsystems.camel;

/**
 * How a consumer actor completes the exchanges it receives.
 */
public enum ResponseProtocol {
    /**
     * Any reply completes the exchange: data becomes the result, {@link Ack} an empty result,
     * {@link Failure} an error.
     */
    AUTO_REPLY,

    /**
     * Only {@link Ack} or {@link Failure} complete the exchange; a data reply is a protocol violation.
     */
    MANUAL_ACK
}
