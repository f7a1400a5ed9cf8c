package com.cajunsystems.camel.consumer;

import com.cajunsystems.camel.ResponseProtocol;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Configuration of a consumer actor: the endpoint it consumes from and how its exchanges are completed.
 */
public class ConsumerConfig {

    private String endpointUri;
    private Duration replyTimeout;
    private boolean blocking = false;
    private ResponseProtocol responseProtocol = ResponseProtocol.AUTO_REPLY;
    private boolean errorPassing = false;
    private final List<RouteCustomizer> routeCustomizers = new ArrayList<>();

    /**
     * Creates a configuration that uses the given reply timeout until another is set.
     */
    public ConsumerConfig(Duration defaultReplyTimeout) {
        this.replyTimeout = defaultReplyTimeout;
    }

    public String getEndpointUri() {
        return endpointUri;
    }

    public ConsumerConfig setEndpointUri(String endpointUri) {
        this.endpointUri = endpointUri;
        return this;
    }

    public Duration getReplyTimeout() {
        return replyTimeout;
    }

    public ConsumerConfig setReplyTimeout(Duration replyTimeout) {
        if (replyTimeout == null || replyTimeout.isNegative() || replyTimeout.isZero()) {
            throw new IllegalArgumentException("replyTimeout must be positive: " + replyTimeout);
        }
        this.replyTimeout = replyTimeout;
        return this;
    }

    /**
     * Returns true if the Camel thread blocks until the actor answers; false for asynchronous completion.
     */
    public boolean isBlocking() {
        return blocking;
    }

    public ConsumerConfig setBlocking(boolean blocking) {
        this.blocking = blocking;
        return this;
    }

    public ResponseProtocol getResponseProtocol() {
        return responseProtocol;
    }

    public ConsumerConfig setResponseProtocol(ResponseProtocol responseProtocol) {
        this.responseProtocol = responseProtocol;
        return this;
    }

    /**
     * Returns true if handler exceptions are replied to the waiting exchange as a failure before supervision runs.
     */
    public boolean isErrorPassing() {
        return errorPassing;
    }

    public ConsumerConfig setErrorPassing(boolean errorPassing) {
        this.errorPassing = errorPassing;
        return this;
    }

    public List<RouteCustomizer> getRouteCustomizers() {
        return Collections.unmodifiableList(routeCustomizers);
    }

    public ConsumerConfig addRouteCustomizer(RouteCustomizer customizer) {
        routeCustomizers.add(customizer);
        return this;
    }

    /**
     * Checks that the configuration is complete.
     *
     * @throws IllegalStateException if no endpoint URI was set
     */
    public void validate() {
        if (endpointUri == null || endpointUri.isBlank()) {
            throw new IllegalStateException("A consumer needs an endpoint URI");
        }
    }

    @Override
    public String toString() {
        return "ConsumerConfig{endpointUri='" + endpointUri + '\''
                + ", replyTimeout=" + replyTimeout
                + ", blocking=" + blocking
                + ", responseProtocol=" + responseProtocol
                + ", errorPassing=" + errorPassing
                + ", routeCustomizers=" + routeCustomizers.size() + '}';
    }
}
