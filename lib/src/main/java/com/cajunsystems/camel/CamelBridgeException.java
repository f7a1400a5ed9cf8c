package com.cajunsystems.camel;

/**
 * Base class of the exceptions raised by the actor/Camel bridge.
 */
public class CamelBridgeException extends RuntimeException {

    public CamelBridgeException(String message) {
        super(message);
    }

    public CamelBridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
