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

import io.vertx.core.json.JsonObject;

/**
 * Delivery metadata of a peer message.
 *
 * @param correlationId    links the message to the exchange it belongs to
 * @param ttlMs            lifetime from the message timestamp; expired messages are dropped
 * @param retryCount       publish retries already made by the sender
 * @param deliveryAttempts delivery attempts already made by the hub
 * @param routingKey       optional routing hint for the hub
 * @param replyTo          where a handler's reply should go, null for no reply
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 */
public record MessageMetadata(
        String correlationId,
        long ttlMs,
        int retryCount,
        int deliveryAttempts,
        String routingKey,
        String replyTo
) {

    public static final long DEFAULT_TTL_MS = 300_000;

    public static MessageMetadata of(String correlationId) {
        return new MessageMetadata(correlationId, DEFAULT_TTL_MS, 0, 0, null, null);
    }

    public MessageMetadata withReplyTo(String newReplyTo) {
        return new MessageMetadata(correlationId, ttlMs, retryCount, deliveryAttempts, routingKey, newReplyTo);
    }

    public MessageMetadata withTtl(long newTtlMs) {
        return new MessageMetadata(correlationId, newTtlMs, retryCount, deliveryAttempts, routingKey, replyTo);
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
                .put("correlationId", correlationId)
                .put("ttl", ttlMs)
                .put("retryCount", retryCount)
                .put("deliveryAttempts", deliveryAttempts);
        if (routingKey != null) {
            json.put("routingKey", routingKey);
        }
        if (replyTo != null) {
            json.put("replyTo", replyTo);
        }
        return json;
    }

    public static MessageMetadata fromJson(JsonObject json) {
        return new MessageMetadata(
                json.getString("correlationId"),
                json.getLong("ttl", 0L),
                json.getInteger("retryCount", 0),
                json.getInteger("deliveryAttempts", 0),
                json.getString("routingKey"),
                json.getString("replyTo"));
    }
}
