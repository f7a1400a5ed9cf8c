package com.cajunsystems.camel;

import org.apache.camel.Exchange;
import org.apache.camel.NoTypeConversionAvailableException;
import org.apache.camel.TypeConversionException;
import org.apache.camel.TypeConverter;
import org.apache.camel.util.CaseInsensitiveMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Immutable message exchanged between Camel endpoints and actors: a body and a set of headers.
 * Header names are looked up case-insensitively, as Camel does.
 * Conversions use the type converter of the Camel context the message came from.
 */
public final class CamelMessage {
    private static final Logger logger = LoggerFactory.getLogger(CamelMessage.class);

    private final Object body;
    private final Map<String, Object> headers;
    private final TypeConverter typeConverter;

    /**
     * Creates a message without a type converter. Only conversions to a supertype of the value succeed.
     */
    public CamelMessage(Object body, Map<String, Object> headers) {
        this(body, headers, null);
    }

    public CamelMessage(Object body, Map<String, Object> headers, TypeConverter typeConverter) {
        this.body = body;
        this.headers = headers == null || headers.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new CaseInsensitiveMap(headers));
        this.typeConverter = typeConverter;
    }

    /**
     * Creates a message with a body and no headers.
     */
    public static CamelMessage of(Object body) {
        return new CamelMessage(body, Collections.emptyMap());
    }

    /**
     * Copies body and headers of the current message of an exchange.
     */
    public static CamelMessage from(Exchange exchange) {
        org.apache.camel.Message message = exchange.getMessage();
        return new CamelMessage(message.getBody(), message.getHeaders(), exchange.getContext().getTypeConverter());
    }

    public Object getBody() {
        return body;
    }

    /**
     * Returns the body converted to the given type, or null if the body is null.
     *
     * @throws MessageConversionException if the body cannot be converted
     */
    public <T> T getBodyAs(Class<T> type) {
        return convert(body, type, "body");
    }

    public Map<String, Object> getHeaders() {
        return headers;
    }

    public Optional<Object> getHeader(String name) {
        return Optional.ofNullable(headers.get(name));
    }

    /**
     * Returns the header converted to the given type, or empty if the header is absent.
     *
     * @throws MessageConversionException if the header is present but cannot be converted
     */
    public <T> Optional<T> getHeaderAs(String name, Class<T> type) {
        return Optional.ofNullable(convert(headers.get(name), type, "header '" + name + "'"));
    }

    /**
     * Returns true if Camel marked this message as a redelivery.
     * An absent or false {@code CamelRedelivered} header means a first delivery, and so does a value
     * that does not convert to a boolean.
     */
    public boolean isRedelivered() {
        try {
            return getHeaderAs(Exchange.REDELIVERED, Boolean.class).orElse(Boolean.FALSE);
        } catch (MessageConversionException e) {
            logger.debug("Ignoring unreadable {} header: {}", Exchange.REDELIVERED, e.getMessage());
            return false;
        }
    }

    /**
     * Returns the number of redelivery attempts so far, 0 for a first delivery.
     */
    public int getRedeliveryCounter() {
        return getHeaderAs(Exchange.REDELIVERY_COUNTER, Integer.class).orElse(0);
    }

    public CamelMessage withBody(Object newBody) {
        return new CamelMessage(newBody, headers, typeConverter);
    }

    /**
     * Returns a copy whose headers are these headers plus the given ones, the given ones winning.
     */
    public CamelMessage withHeaders(Map<String, Object> extraHeaders) {
        Map<String, Object> merged = new CaseInsensitiveMap(headers);
        merged.putAll(extraHeaders);
        return new CamelMessage(body, merged, typeConverter);
    }

    public CamelMessage mapBody(Function<Object, ?> transform) {
        return withBody(transform.apply(body));
    }

    /**
     * Converts the body to the given type, then transforms it.
     */
    public <A, B> CamelMessage mapBody(Class<A> type, Function<A, B> transform) {
        return withBody(transform.apply(getBodyAs(type)));
    }

    private <T> T convert(Object value, Class<T> type, String what) {
        if (value == null) {
            return null;
        }
        if (type.isInstance(value)) {
            return type.cast(value);
        }
        if (typeConverter == null) {
            throw new MessageConversionException("Cannot convert " + what + " of type "
                    + value.getClass().getName() + " to " + type.getName() + ": no type converter available");
        }
        try {
            return typeConverter.mandatoryConvertTo(type, value);
        } catch (NoTypeConversionAvailableException | TypeConversionException e) {
            throw new MessageConversionException("Cannot convert " + what + " of type "
                    + value.getClass().getName() + " to " + type.getName(), e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CamelMessage)) {
            return false;
        }
        CamelMessage that = (CamelMessage) o;
        return Objects.equals(body, that.body) && Objects.equals(headers, that.headers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(body, headers);
    }

    @Override
    public String toString() {
        return "CamelMessage{body=" + body + ", headers=" + headers + '}';
    }
}
