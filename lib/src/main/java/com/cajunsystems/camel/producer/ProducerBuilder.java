package com.cajunsystems.camel.producer;

import com.cajunsystems.camel.actor.ActorSystem;
import com.cajunsystems.camel.actor.Pid;
import com.cajunsystems.camel.actor.SupervisionStrategy;
import org.apache.camel.ProducerTemplate;

/**
 * Builder for producer actors with a fluent API.
 */
public class ProducerBuilder {

    private final ActorSystem system;
    private final ProducerTemplate template;
    private final String endpointUri;
    private boolean oneway = false;
    private String id;
    private SupervisionStrategy supervisionStrategy;

    public ProducerBuilder(ActorSystem system, ProducerTemplate template, String endpointUri) {
        if (endpointUri == null || endpointUri.isBlank()) {
            throw new IllegalArgumentException("A producer needs an endpoint URI");
        }
        this.system = system;
        this.template = template;
        this.endpointUri = endpointUri;
    }

    /**
     * Sends in-only and replies {@link com.cajunsystems.camel.Ack} instead of the result.
     */
    public ProducerBuilder oneway(boolean oneway) {
        this.oneway = oneway;
        return this;
    }

    public ProducerBuilder withId(String id) {
        this.id = id;
        return this;
    }

    public ProducerBuilder withSupervisionStrategy(SupervisionStrategy supervisionStrategy) {
        this.supervisionStrategy = supervisionStrategy;
        return this;
    }

    /**
     * Creates and starts the producer actor.
     *
     * @return The PID of the producer actor
     */
    public Pid spawn() {
        String finalId = id != null ? id : system.generateActorId();
        ProducerActor actor = new ProducerActor(system, finalId, template, endpointUri, oneway);
        if (supervisionStrategy != null) {
            actor.withSupervisionStrategy(supervisionStrategy);
        }
        system.registerActor(actor);
        actor.start();
        return actor.self();
    }
}
