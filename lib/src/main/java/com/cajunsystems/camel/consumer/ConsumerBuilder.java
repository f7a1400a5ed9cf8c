package com.cajunsystems.camel.consumer;

import com.cajunsystems.camel.ResponseProtocol;
import com.cajunsystems.camel.actor.ActorSystem;
import com.cajunsystems.camel.actor.Pid;
import com.cajunsystems.camel.actor.SupervisionStrategy;
import com.cajunsystems.camel.actor.config.MailboxConfig;
import com.cajunsystems.camel.actor.handler.Handler;

import java.time.Duration;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Builder for consumer actors with a fluent API.
 * <pre>{@code
 * Pid pid = camel.consumerOf(new EchoHandler())
 *         .endpoint("direct:echo")
 *         .replyTimeout(Duration.ofSeconds(5))
 *         .spawn();
 * camel.awaitActivation(pid, Duration.ofSeconds(1));
 * }</pre>
 * Consumers restart on failure unless another supervision strategy is set.
 */
public class ConsumerBuilder {

    private final ActorSystem system;
    private final Handler<Object> handler;
    private final Supplier<? extends Handler<Object>> handlerFactory;
    private final ConsumerConfig config;
    private final Consumer<ConsumerActor> launcher;
    private String id;
    private MailboxConfig mailboxConfig;
    private SupervisionStrategy supervisionStrategy = SupervisionStrategy.RESTART;

    /**
     * @param system The actor system the consumer lives in
     * @param handler The initial handler
     * @param handlerFactory Supplies replacement handlers on restart, or null to keep the initial one
     * @param defaultReplyTimeout The reply timeout used unless {@link #replyTimeout} is called
     * @param launcher Starts the actor and its route
     */
    public ConsumerBuilder(
            ActorSystem system,
            Handler<Object> handler,
            Supplier<? extends Handler<Object>> handlerFactory,
            Duration defaultReplyTimeout,
            Consumer<ConsumerActor> launcher) {
        this.system = system;
        this.handler = handler;
        this.handlerFactory = handlerFactory;
        this.config = new ConsumerConfig(defaultReplyTimeout);
        this.launcher = launcher;
    }

    /**
     * Sets the URI of the endpoint to consume from. Required.
     */
    public ConsumerBuilder endpoint(String endpointUri) {
        config.setEndpointUri(endpointUri);
        return this;
    }

    public ConsumerBuilder replyTimeout(Duration replyTimeout) {
        config.setReplyTimeout(replyTimeout);
        return this;
    }

    /**
     * Makes the Camel thread block until the actor answers. The default is asynchronous completion.
     */
    public ConsumerBuilder blocking(boolean blocking) {
        config.setBlocking(blocking);
        return this;
    }

    public ConsumerBuilder responseProtocol(ResponseProtocol responseProtocol) {
        config.setResponseProtocol(responseProtocol);
        return this;
    }

    /**
     * Shortcut for {@code responseProtocol(ResponseProtocol.MANUAL_ACK)}.
     */
    public ConsumerBuilder manualAck() {
        return responseProtocol(ResponseProtocol.MANUAL_ACK);
    }

    /**
     * Replies handler exceptions to the waiting exchange as a failure, so that the route's exception
     * handling and redelivery apply to them.
     */
    public ConsumerBuilder errorPassing() {
        config.setErrorPassing(true);
        return this;
    }

    public ConsumerBuilder customizeRoute(RouteCustomizer customizer) {
        config.addRouteCustomizer(customizer);
        return this;
    }

    public ConsumerBuilder onException(ExceptionPolicy policy) {
        config.addRouteCustomizer(policy);
        return this;
    }

    public ConsumerBuilder withId(String id) {
        this.id = id;
        return this;
    }

    public ConsumerBuilder withMailboxConfig(MailboxConfig mailboxConfig) {
        this.mailboxConfig = mailboxConfig;
        return this;
    }

    public ConsumerBuilder withSupervisionStrategy(SupervisionStrategy supervisionStrategy) {
        this.supervisionStrategy = supervisionStrategy;
        return this;
    }

    /**
     * Creates and starts the consumer actor and starts building its route.
     * Route failures are reported through the extension's activation methods, not thrown here.
     *
     * @return The PID of the consumer actor
     * @throws IllegalStateException if no endpoint was set
     */
    public Pid spawn() {
        config.validate();
        String finalId = id != null ? id : system.generateActorId();
        ConsumerActor actor = new ConsumerActor(system, finalId, handler, handlerFactory, mailboxConfig, config);
        actor.withSupervisionStrategy(supervisionStrategy);
        launcher.accept(actor);
        return actor.self();
    }
}
