package com.cajunsystems.camel;

/**
 * Positive acknowledgement a consumer actor sends to complete an exchange without a result body.
 * Required under {@link ResponseProtocol#MANUAL_ACK}.
 */
public enum Ack {
    INSTANCE;

    @Override
    public String toString() {
        return "Ack";
    }
}
