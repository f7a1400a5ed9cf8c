package com.cajunsystems.camel.consumer;

import org.apache.camel.builder.RouteBuilder;
import org.apache.camel.model.RouteDefinition;

/**
 * Builds the route of one consumer actor: {@code from(endpoint)}, the actor's route customizers, then the adapter.
 * The route ID is the actor ID.
 */
public class ConsumerRouteBuilder extends RouteBuilder {

    private final String routeId;
    private final ConsumerConfig config;
    private final ConsumerAdapter adapter;

    public ConsumerRouteBuilder(String routeId, ConsumerConfig config, ConsumerAdapter adapter) {
        this.routeId = routeId;
        this.config = config;
        this.adapter = adapter;
    }

    @Override
    public void configure() {
        RouteDefinition route = from(config.getEndpointUri()).routeId(routeId);
        for (RouteCustomizer customizer : config.getRouteCustomizers()) {
            customizer.customize(route);
        }
        route.process(adapter);
    }
}
