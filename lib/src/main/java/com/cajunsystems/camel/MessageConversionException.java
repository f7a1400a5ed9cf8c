package com.cajunsystems.camel;

/**
 * Thrown when a message body or header cannot be converted to the requested type.
 */
public class MessageConversionException extends CamelBridgeException {

    public MessageConversionException(String message) {
        super(message);
    }

    public MessageConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
