package com.cajunsystems.camel;

import com.cajunsystems.camel.activation.ActivationState;
import com.cajunsystems.camel.activation.ActivationTracker;
import com.cajunsystems.camel.actor.ActorSystem;
import com.cajunsystems.camel.actor.Pid;
import com.cajunsystems.camel.actor.handler.Handler;
import com.cajunsystems.camel.consumer.ConsumerActor;
import com.cajunsystems.camel.consumer.ConsumerAdapter;
import com.cajunsystems.camel.consumer.ConsumerBuilder;
import com.cajunsystems.camel.consumer.ConsumerRouteBuilder;
import com.cajunsystems.camel.producer.ProducerBuilder;
import com.cajunsystems.camel.reply.ReplyCoordinator;
import org.apache.camel.CamelContext;
import org.apache.camel.ProducerTemplate;
import org.apache.camel.impl.DefaultCamelContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Entry point of the bridge between an {@link ActorSystem} and Apache Camel.
 * <p>
 * Owns a started {@link CamelContext} and {@link ProducerTemplate}, the activation tracker and the reply
 * coordinator. Routes are added and removed one at a time on a dedicated lifecycle thread, in the order
 * consumers start and stop. The actor system stays owned by the caller.
 */
public final class CamelExtension implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(CamelExtension.class);

    private final ActorSystem system;
    private final CamelSettings settings;
    private final DefaultCamelContext context;
    private final ProducerTemplate template;
    private final ActivationTracker tracker;
    private final ReplyCoordinator coordinator;
    private final ExecutorService lifecycleExecutor;
    private volatile boolean closed;

    private CamelExtension(ActorSystem system, CamelSettings settings) {
        this.system = system;
        this.settings = settings;
        this.context = new DefaultCamelContext();
        context.setName(settings.getContextName());
        if (!settings.isJmxEnabled()) {
            context.disableJMX();
        }
        context.setStreamCaching(settings.isStreamCaching());
        context.start();
        this.template = context.createProducerTemplate();
        this.tracker = new ActivationTracker();
        this.coordinator = new ReplyCoordinator(system);
        this.lifecycleExecutor = system.getThreadPoolFactory().createSingleThreadExecutor("camel-lifecycle");
        logger.info("Camel extension started with context {} and {}", context.getName(), settings);
    }

    /**
     * Creates and starts an extension with default settings.
     */
    public static CamelExtension create(ActorSystem system) {
        return create(system, new CamelSettings());
    }

    public static CamelExtension create(ActorSystem system, CamelSettings settings) {
        return new CamelExtension(system, settings);
    }

    /**
     * Creates a builder for a consumer actor around the handler instance.
     * The same instance keeps handling messages after a restart.
     */
    public ConsumerBuilder consumerOf(Handler<Object> handler) {
        return new ConsumerBuilder(system, handler, null, settings.getReplyTimeout(), this::startConsumer);
    }

    /**
     * Creates a builder for a consumer actor whose handler is instantiated from the class,
     * with a fresh instance after every restart.
     */
    public ConsumerBuilder consumerOf(Class<? extends Handler<Object>> handlerClass) {
        Supplier<Handler<Object>> factory = ActorSystem.handlerFactory(handlerClass);
        return new ConsumerBuilder(system, factory.get(), factory, settings.getReplyTimeout(), this::startConsumer);
    }

    /**
     * Creates a builder for an actor that forwards its messages to the endpoint.
     */
    public ProducerBuilder producerOf(String endpointUri) {
        return new ProducerBuilder(system, template, endpointUri);
    }

    /**
     * Sends a body in-out and returns the result body.
     *
     * @throws org.apache.camel.CamelExecutionException carrying the original error as its cause
     */
    public Object sendTo(String endpointUri, Object body) {
        return template.requestBody(endpointUri, body);
    }

    /**
     * Sends a body in-only. The future completes with null, or exceptionally with a
     * {@link org.apache.camel.CamelExecutionException} whose cause is the original error.
     */
    public CompletableFuture<Object> sendToAsync(String endpointUri, Object body) {
        return template.asyncSendBody(endpointUri, body).thenApply(result -> null);
    }

    /**
     * Sends a body in-out. The future completes with the result body, or exceptionally with a
     * {@link org.apache.camel.CamelExecutionException} whose cause is the original error.
     */
    public CompletableFuture<Object> requestAsync(String endpointUri, Object body) {
        return template.asyncRequestBody(endpointUri, body);
    }

    /**
     * Blocks until the consumer's route is active.
     *
     * @throws RouteCreationException if the route could not be created
     * @throws TimeoutException if the route is not active in time
     */
    public void awaitActivation(Pid consumer, Duration timeout) throws TimeoutException, InterruptedException {
        tracker.awaitActivation(consumer.actorId(), timeout);
    }

    /**
     * Blocks for at most the configured activation timeout until the consumer's route is active.
     */
    public void awaitActivation(Pid consumer) throws TimeoutException, InterruptedException {
        awaitActivation(consumer, settings.getActivationTimeout());
    }

    /**
     * Blocks until the consumer's route has been removed after the actor stopped.
     *
     * @throws TimeoutException if the route is not removed in time
     */
    public void awaitDeactivation(Pid consumer, Duration timeout) throws TimeoutException, InterruptedException {
        tracker.awaitDeactivation(consumer.actorId(), timeout);
    }

    public void awaitDeactivation(Pid consumer) throws TimeoutException, InterruptedException {
        awaitDeactivation(consumer, settings.getActivationTimeout());
    }

    public CompletableFuture<String> activationFuture(Pid consumer) {
        return tracker.activationFuture(consumer.actorId());
    }

    public CompletableFuture<String> deactivationFuture(Pid consumer) {
        return tracker.deactivationFuture(consumer.actorId());
    }

    /**
     * Returns the number of consumer routes currently active.
     */
    public int routeCount() {
        return tracker.routeCount();
    }

    public ActivationState activationState(Pid consumer) {
        return tracker.stateOf(consumer.actorId());
    }

    public CamelContext context() {
        return context;
    }

    public ProducerTemplate template() {
        return template;
    }

    public ActorSystem system() {
        return system;
    }

    public CamelSettings settings() {
        return settings;
    }

    /**
     * Registers and starts a consumer actor, then queues the creation of its route.
     * Used by {@link ConsumerBuilder}.
     */
    private void startConsumer(ConsumerActor actor) {
        if (closed) {
            throw new IllegalStateException("Camel extension is closed");
        }
        Pid pid = actor.self();
        system.registerActor(actor);
        try {
            tracker.activating(pid.actorId());
        } catch (IllegalStateException e) {
            system.shutdown(pid.actorId());
            throw e;
        }
        actor.start();
        ConsumerAdapter adapter = new ConsumerAdapter(pid, actor.getConfig(), coordinator);
        submitLifecycle(() -> createRoute(pid, actor, adapter), pid, "create route");
        system.watch(pid, this::onConsumerTerminated);
    }

    private void createRoute(Pid pid, ConsumerActor actor, ConsumerAdapter adapter) {
        String routeId = pid.actorId();
        try {
            context.addRoutes(new ConsumerRouteBuilder(routeId, actor.getConfig(), adapter));
            tracker.activated(routeId);
        } catch (Exception e) {
            removeRouteAfterFailure(routeId);
            tracker.failed(routeId, e);
        }
    }

    private void onConsumerTerminated(Pid pid) {
        submitLifecycle(() -> removeRoute(pid), pid, "remove route");
    }

    private void removeRoute(Pid pid) {
        String routeId = pid.actorId();
        ActivationState state = tracker.stateOf(routeId);
        if (state == ActivationState.FAILED) {
            tracker.deactivated(routeId);
            return;
        }
        if (state != ActivationState.ACTIVE) {
            logger.warn("Consumer {} stopped while its route was {}", routeId, state);
            return;
        }
        tracker.deactivating(routeId);
        try {
            context.getRouteController().stopRoute(routeId);
            if (!context.removeRoute(routeId)) {
                logger.warn("Route {} could not be removed after stopping", routeId);
            }
        } catch (Exception e) {
            logger.error("Failed to remove route of consumer {}", routeId, e);
        }
        tracker.deactivated(routeId);
    }

    private void removeRouteAfterFailure(String routeId) {
        try {
            if (context.getRoute(routeId) != null) {
                context.getRouteController().stopRoute(routeId);
                context.removeRoute(routeId);
            }
        } catch (Exception cleanupError) {
            logger.warn("Could not clean up failed route {}", routeId, cleanupError);
        }
    }

    private void submitLifecycle(Runnable task, Pid pid, String what) {
        try {
            lifecycleExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            logger.debug("Camel extension closed, cannot {} for consumer {}", what, pid.actorId());
        }
    }

    /**
     * Stops Camel and the bridge's threads. Routes stop before the reply coordinator closes, so no exchange
     * enters once waiters can no longer be completed. Pending exchanges fail; the actor system keeps running.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        logger.info("Stopping Camel extension {}", context.getName());
        lifecycleExecutor.shutdown();
        try {
            if (!lifecycleExecutor.awaitTermination(settings.getShutdownTimeoutSeconds(), TimeUnit.SECONDS)) {
                lifecycleExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            lifecycleExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        try {
            context.getRouteController().stopAllRoutes();
        } catch (Exception e) {
            logger.warn("Failed to stop routes of Camel context {}", context.getName(), e);
        }
        coordinator.close();
        try {
            template.stop();
        } finally {
            context.stop();
        }
    }
}
