/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.aegis.messaging;

import dev.mars.aegis.core.CallError;
import dev.mars.aegis.core.CallResult;
import dev.mars.aegis.core.exceptions.CallException;
import dev.mars.aegis.envelope.CallEnvelope;
import dev.mars.aegis.event.EventPublisher;
import dev.mars.aegis.resilience.EndpointResilience;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;

/**
 * Call envelope for publishing to peer agents, plus the agent's inbound side of the hub.
 *
 * <p>Publishing is fire-and-forget: the response is a {@link DeliveryReceipt}, never a
 * body from the recipient. Inbound messages are validated, expired ones are dropped, and
 * the rest are dispatched first by topic subscription and then by message type.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 */
public class PeerMessagingClient extends CallEnvelope<PeerMessage, DeliveryReceipt, DeliveryReceipt> {

    private static final Logger logger = LoggerFactory.getLogger(PeerMessagingClient.class);

    private final String agentId;
    private final EndpointResilience resilience;
    private final PeerTransport transport;
    private final PeerMessageValidator validator;
    private final Clock clock;

    private final Map<String, TopicBinding> topicHandlers = new ConcurrentHashMap<>();
    private final Map<String, PeerMessageHandler> typeHandlers = new ConcurrentHashMap<>();
    private final AtomicBoolean connected = new AtomicBoolean(false);

    private final LongAdder received = new LongAdder();
    private final LongAdder rejected = new LongAdder();
    private final LongAdder expired = new LongAdder();
    private final LongAdder unhandled = new LongAdder();

    public PeerMessagingClient(String agentId, EndpointResilience resilience, PeerTransport transport,
                               EventPublisher events) {
        this(agentId, resilience, transport, events, Clock.systemUTC());
    }

    public PeerMessagingClient(String agentId, EndpointResilience resilience, PeerTransport transport,
                               EventPublisher events, Clock clock) {
        super("peer-messaging", events);
        this.agentId = Objects.requireNonNull(agentId, "Agent id cannot be null");
        this.resilience = Objects.requireNonNull(resilience, "Endpoint resilience cannot be null");
        this.transport = Objects.requireNonNull(transport, "Transport cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.validator = new PeerMessageValidator(clock);
    }

    // ==================== Connection ====================

    public Future<Void> connect() {
        if (connected.get()) {
            return Future.succeededFuture();
        }
        return transport.connect(agentId, this::onInbound).onSuccess(v -> {
            connected.set(true);
            logger.info("Agent {} connected to peer hub", agentId);
        });
    }

    public Future<Void> disconnect() {
        if (!connected.compareAndSet(true, false)) {
            return Future.succeededFuture();
        }
        return transport.disconnect().onSuccess(v -> logger.info("Agent {} disconnected from peer hub", agentId));
    }

    public boolean isConnected() {
        return connected.get();
    }

    public Future<Void> register(AgentRegistration registration) {
        Objects.requireNonNull(registration, "Registration cannot be null");
        return transport.register(registration)
                .onSuccess(v -> logger.info("Agent {} registered as {} with {} subscription(s)",
                        registration.agentId(), registration.agentType(), registration.subscriptions().size()));
    }

    // ==================== Subscriptions ====================

    public Future<Void> subscribe(String topic, PeerMessageHandler handler) {
        return subscribe(Subscription.to(topic), handler);
    }

    /**
     * Binds {@code handler} to the subscription's topic locally, then registers the
     * subscription with the hub. The local binding is removed if the hub refuses.
     */
    public Future<Void> subscribe(Subscription subscription, PeerMessageHandler handler) {
        Objects.requireNonNull(subscription, "Subscription cannot be null");
        Objects.requireNonNull(handler, "Handler cannot be null");
        TopicBinding binding = new TopicBinding(subscription, handler);
        topicHandlers.put(subscription.topic(), binding);
        return transport.subscribe(agentId, subscription)
                .onSuccess(v -> logger.debug("Agent {} subscribed to {}", agentId, subscription.topic()))
                .onFailure(failure -> {
                    topicHandlers.remove(subscription.topic(), binding);
                    logger.warn("Subscription of {} to {} failed: {}", agentId, subscription.topic(), failure.getMessage());
                });
    }

    public Future<Void> unsubscribe(String topic) {
        topicHandlers.remove(topic);
        return transport.unsubscribe(agentId, topic);
    }

    /**
     * Registers a handler for direct messages of a type, regardless of topic.
     */
    public void onMessageType(String messageType, PeerMessageHandler handler) {
        typeHandlers.put(Objects.requireNonNull(messageType, "Message type cannot be null"),
                Objects.requireNonNull(handler, "Handler cannot be null"));
    }

    public boolean isSubscribed(String topic) {
        return topicHandlers.containsKey(topic);
    }

    // ==================== Publishing ====================

    public Future<DeliveryReceipt> publish(PeerMessage message) {
        if (message != null && (message.sourceAgent() == null || message.sourceAgent().isBlank())) {
            message = message.withSourceAgent(agentId);
        }
        return invoke(message);
    }

    public Future<DeliveryReceipt> publish(String topic, String messageType, JsonObject payload, String targetAgent) {
        return invoke(PeerMessage.of(agentId, topic, messageType, payload).withTargetAgent(targetAgent));
    }

    public Future<Boolean> healthCheck() {
        return transport.healthCheck()
                .map(hubHealthy -> hubHealthy && connected.get())
                .recover(failure -> {
                    logger.debug("Peer hub health check failed: {}", failure.getMessage());
                    return Future.succeededFuture(false);
                });
    }

    public Map<String, Object> statistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("agentId", agentId);
        stats.put("connected", connected.get());
        stats.put("subscriptions", List.copyOf(topicHandlers.keySet()));
        stats.put("received", received.sum());
        stats.put("rejected", rejected.sum());
        stats.put("expired", expired.sum());
        stats.put("unhandled", unhandled.sum());
        return stats;
    }

    public String agentId() {
        return agentId;
    }

    @Override
    public Future<Void> stop() {
        return super.stop().compose(v -> disconnect()).compose(v -> transport.close());
    }

    // ==================== Inbound ====================

    void onInbound(PeerMessage message) {
        received.increment();
        List<String> problems = validator.validate(message);
        if (!problems.isEmpty()) {
            rejected.increment();
            logger.warn("Dropping invalid inbound message: {}", problems);
            return;
        }
        if (message.isExpired(Instant.now(clock))) {
            expired.increment();
            logger.debug("Dropping expired message {} on {}", message.id(), message.topic());
            return;
        }

        PeerMessageHandler handler = handlerFor(message);
        if (handler == null) {
            unhandled.increment();
            logger.warn("No handler for message type {} on topic {}", message.messageType(), message.topic());
            return;
        }

        Future<JsonObject> outcome;
        try {
            outcome = handler.handle(message);
        } catch (RuntimeException e) {
            outcome = Future.failedFuture(e);
        }
        outcome.onComplete(ar -> {
            if (ar.failed()) {
                logger.error("Handler for {} failed on message {}", message.messageType(), message.id(), ar.cause());
                return;
            }
            JsonObject reply = ar.result();
            String replyTo = message.metadata().replyTo();
            if (reply != null && replyTo != null) {
                publishReply(message, reply);
            }
        });
    }

    private PeerMessageHandler handlerFor(PeerMessage message) {
        TopicBinding binding = topicHandlers.get(message.topic());
        if (binding != null && binding.subscription().accepts(message.messageType())) {
            return binding.handler();
        }
        return typeHandlers.get(message.messageType());
    }

    private void publishReply(PeerMessage request, JsonObject reply) {
        MessageMetadata metadata = new MessageMetadata(request.metadata().correlationId(),
                MessageMetadata.DEFAULT_TTL_MS, 0, 0, null, request.metadata().replyTo());
        PeerMessage response = PeerMessage.of(agentId, request.topic(), request.messageType() + "_response", reply)
                .withTargetAgent(request.sourceAgent())
                .withPriority(request.priority())
                .withMetadata(metadata);
        publish(response).onSuccess(receipt -> logger.debug("Reply {} to {}: {}",
                response.id(), request.sourceAgent(), receipt.status()));
    }

    // ==================== Envelope Hooks ====================

    @Override
    protected void validate(PeerMessage message) {
        List<String> problems = validator.validate(message);
        if (!problems.isEmpty()) {
            throw CallException.validation(String.join("; ", problems));
        }
    }

    @Override
    protected EndpointResilience resolve(PeerMessage message) {
        return resilience;
    }

    @Override
    protected Future<DeliveryReceipt> transport(PeerMessage message, int attempt) {
        return transport.publish(message);
    }

    @Override
    protected DeliveryReceipt toSuccess(PeerMessage message, DeliveryReceipt raw, CallResult result) {
        return raw;
    }

    @Override
    protected DeliveryReceipt toFailure(PeerMessage message, CallError error, CallResult result) {
        String messageId = message != null ? message.id() : null;
        String target = message != null && message.targetAgent() != null ? message.targetAgent() : "unknown";
        return DeliveryReceipt.failed(messageId, target, error);
    }

    @Override
    protected String correlationIdOf(PeerMessage message) {
        return message.metadata() != null ? message.metadata().correlationId() : null;
    }

    @Override
    public Collection<EndpointResilience> endpoints() {
        return List.of(resilience);
    }

    private record TopicBinding(Subscription subscription, PeerMessageHandler handler) {
    }
}
