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

import io.vertx.core.json.EncodeException;
import io.vertx.core.json.JsonObject;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Structural validation of peer messages, applied both before publishing and on receipt.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 */
public class PeerMessageValidator {

    public static final int MAX_ID_LENGTH = 100;
    public static final int MAX_AGENT_LENGTH = 50;
    public static final int MAX_TOPIC_LENGTH = 100;
    public static final int MAX_ROUTING_KEY_LENGTH = 200;
    public static final long MAX_TTL_MS = Duration.ofHours(24).toMillis();
    public static final int MAX_RETRY_COUNT = 10;
    public static final int MAX_DELIVERY_ATTEMPTS = 20;
    public static final int MAX_PAYLOAD_BYTES = 1024 * 1024;
    public static final Duration MAX_CLOCK_SKEW = Duration.ofMinutes(5);

    private final Clock clock;

    public PeerMessageValidator() {
        this(Clock.systemUTC());
    }

    public PeerMessageValidator(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return the problems found, empty for a valid message
     */
    public List<String> validate(PeerMessage message) {
        List<String> errors = new ArrayList<>();
        if (message == null) {
            errors.add("message is required");
            return errors;
        }
        requireText(errors, message.id(), "message id", MAX_ID_LENGTH);
        requireText(errors, message.sourceAgent(), "source agent", MAX_AGENT_LENGTH);
        requireText(errors, message.topic(), "topic", MAX_TOPIC_LENGTH);
        requireText(errors, message.messageType(), "message type", MAX_TOPIC_LENGTH);
        if (message.targetAgent() != null && message.targetAgent().length() > MAX_AGENT_LENGTH) {
            errors.add("target agent must be " + MAX_AGENT_LENGTH + " characters or less");
        }

        if (message.timestamp() == null) {
            errors.add("timestamp is required");
        } else if (message.timestamp().isAfter(Instant.now(clock).plus(MAX_CLOCK_SKEW))) {
            errors.add("timestamp is too far in the future");
        }

        JsonObject payload = message.payload();
        if (payload == null) {
            errors.add("payload is required");
        } else {
            int size = encodedSize(payload);
            if (size < 0) {
                errors.add("payload is not JSON-encodable");
            } else if (size > MAX_PAYLOAD_BYTES) {
                errors.add("payload must be smaller than 1MB");
            }
        }

        if (message.metadata() == null) {
            errors.add("metadata is required");
        } else {
            validateMetadata(errors, message.metadata());
        }
        return errors;
    }

    /**
     * @return the encoded size in bytes, or -1 when the payload holds values JSON cannot represent
     */
    private static int encodedSize(JsonObject payload) {
        try {
            return payload.toBuffer().length();
        } catch (EncodeException | IllegalStateException e) {
            return -1;
        }
    }

    public boolean isValid(PeerMessage message) {
        return validate(message).isEmpty();
    }

    private static void validateMetadata(List<String> errors, MessageMetadata metadata) {
        requireText(errors, metadata.correlationId(), "correlation id", MAX_ID_LENGTH);
        if (metadata.ttlMs() <= 0) {
            errors.add("ttl must be positive");
        } else if (metadata.ttlMs() > MAX_TTL_MS) {
            errors.add("ttl must be at most 24 hours");
        }
        if (metadata.retryCount() < 0 || metadata.retryCount() > MAX_RETRY_COUNT) {
            errors.add("retry count must be between 0 and " + MAX_RETRY_COUNT);
        }
        if (metadata.deliveryAttempts() < 0 || metadata.deliveryAttempts() > MAX_DELIVERY_ATTEMPTS) {
            errors.add("delivery attempts must be between 0 and " + MAX_DELIVERY_ATTEMPTS);
        }
        if (metadata.routingKey() != null && metadata.routingKey().length() > MAX_ROUTING_KEY_LENGTH) {
            errors.add("routing key must be " + MAX_ROUTING_KEY_LENGTH + " characters or less");
        }
        if (metadata.replyTo() != null && metadata.replyTo().length() > MAX_ID_LENGTH) {
            errors.add("reply-to must be " + MAX_ID_LENGTH + " characters or less");
        }
    }

    private static void requireText(List<String> errors, String value, String field, int maxLength) {
        if (value == null || value.isBlank()) {
            errors.add(field + " is required");
        } else if (value.length() > maxLength) {
            errors.add(field + " must be " + maxLength + " characters or less");
        }
    }
}
