package com.cajunsystems.camel.consumer;

import org.apache.camel.Exchange;
import org.apache.camel.model.OnExceptionDefinition;
import org.apache.camel.model.RouteDefinition;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Exception handling and redelivery settings for a consumer route, rendered as a route-scoped
 * {@code onException} clause. Camel does the redelivering; consumers see it through
 * {@link com.cajunsystems.camel.CamelMessage#isRedelivered()}.
 * <pre>{@code
 * ExceptionPolicy.on(IllegalStateException.class)
 *         .maximumRedeliveries(1)
 *         .redeliveryDelay(Duration.ofMillis(10));
 * }</pre>
 */
public class ExceptionPolicy implements RouteCustomizer {

    private final List<Class<? extends Throwable>> exceptionTypes;
    private Predicate<Throwable> condition;
    private boolean handled;
    private Function<Throwable, Object> transform;
    private Integer maximumRedeliveries;
    private Duration redeliveryDelay;

    private ExceptionPolicy(List<Class<? extends Throwable>> exceptionTypes) {
        this.exceptionTypes = exceptionTypes;
    }

    /**
     * Creates a policy for the given exception types and their subclasses.
     */
    @SafeVarargs
    public static ExceptionPolicy on(Class<? extends Throwable>... exceptionTypes) {
        if (exceptionTypes.length == 0) {
            throw new IllegalArgumentException("At least one exception type is required");
        }
        return new ExceptionPolicy(new ArrayList<>(Arrays.asList(exceptionTypes)));
    }

    /**
     * Restricts the policy to exceptions matching the predicate.
     */
    public ExceptionPolicy when(Predicate<Throwable> condition) {
        this.condition = condition;
        return this;
    }

    /**
     * Marks matching exceptions as handled, so the caller gets a normal result instead of an error.
     */
    public ExceptionPolicy handled(boolean handled) {
        this.handled = handled;
        return this;
    }

    /**
     * Sets the result body from the caught exception once redeliveries are exhausted.
     */
    public ExceptionPolicy transform(Function<Throwable, Object> transform) {
        this.transform = transform;
        return this;
    }

    public ExceptionPolicy maximumRedeliveries(int maximumRedeliveries) {
        if (maximumRedeliveries < -1) {
            throw new IllegalArgumentException("maximumRedeliveries must be -1 (forever) or more: " + maximumRedeliveries);
        }
        this.maximumRedeliveries = maximumRedeliveries;
        return this;
    }

    public ExceptionPolicy redeliveryDelay(Duration redeliveryDelay) {
        if (redeliveryDelay.isNegative()) {
            throw new IllegalArgumentException("redeliveryDelay must not be negative: " + redeliveryDelay);
        }
        this.redeliveryDelay = redeliveryDelay;
        return this;
    }

    public List<Class<? extends Throwable>> getExceptionTypes() {
        return Collections.unmodifiableList(exceptionTypes);
    }

    public boolean isHandled() {
        return handled;
    }

    public Integer getMaximumRedeliveries() {
        return maximumRedeliveries;
    }

    public Duration getRedeliveryDelay() {
        return redeliveryDelay;
    }

    @Override
    @SuppressWarnings("unchecked")
    public void customize(RouteDefinition route) {
        OnExceptionDefinition clause = route.onException(exceptionTypes.toArray(new Class[0]));
        if (condition != null) {
            Predicate<Throwable> test = condition;
            clause.onWhen(exchange -> test.test(caughtException(exchange)));
        }
        clause.handled(handled);
        if (maximumRedeliveries != null) {
            clause.maximumRedeliveries(maximumRedeliveries);
        }
        if (redeliveryDelay != null) {
            clause.redeliveryDelay(redeliveryDelay.toMillis());
        }
        if (transform != null) {
            Function<Throwable, Object> bodyOf = transform;
            clause.process(exchange -> exchange.getMessage().setBody(bodyOf.apply(caughtException(exchange))));
        }
        clause.end();
    }

    private static Throwable caughtException(Exchange exchange) {
        Throwable current = exchange.getException();
        return current != null ? current : exchange.getProperty(Exchange.EXCEPTION_CAUGHT, Throwable.class);
    }

    @Override
    public String toString() {
        return "ExceptionPolicy{exceptionTypes=" + exceptionTypes
                + ", handled=" + handled
                + ", maximumRedeliveries=" + maximumRedeliveries
                + ", redeliveryDelay=" + redeliveryDelay + '}';
    }
}
