package com.cajunsystems.camel.consumer;

import org.apache.camel.model.RouteDefinition;

/**
 * Hook that adjusts the route of a consumer actor, typically to add a route-scoped {@code onException} clause.
 * Invoked once, when the route is built, after {@code from(endpoint)} and before the actor's processor.
 */
@FunctionalInterface
public interface RouteCustomizer {

    /**
     * @param route the route under construction
     */
    void customize(RouteDefinition route);
}
