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

import dev.mars.aegis.core.Priority;
import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.UUID;

/**
 * A message exchanged between agents through the hub. Without a target agent the
 * message goes to every subscriber of its topic.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 */
public record PeerMessage(
        String id,
        Instant timestamp,
        String sourceAgent,
        String targetAgent,
        String topic,
        String messageType,
        Priority priority,
        JsonObject payload,
        MessageMetadata metadata
) {

    public PeerMessage {
        priority = priority != null ? priority : Priority.NORMAL;
        payload = copyOf(payload);
    }

    /**
     * A payload holding values JSON cannot represent is kept as given so that validation can reject it.
     */
    private static JsonObject copyOf(JsonObject payload) {
        if (payload == null) {
            return null;
        }
        try {
            return payload.copy();
        } catch (IllegalStateException e) {
            return payload;
        }
    }

    public static PeerMessage of(String sourceAgent, String topic, String messageType, JsonObject payload) {
        return new PeerMessage("msg_" + shortId(), Instant.now(), sourceAgent, null, topic, messageType,
                Priority.NORMAL, payload, MessageMetadata.of("corr_" + shortId()));
    }

    public PeerMessage withTargetAgent(String agent) {
        return new PeerMessage(id, timestamp, sourceAgent, agent, topic, messageType, priority, payload, metadata);
    }

    public PeerMessage withSourceAgent(String agent) {
        return new PeerMessage(id, timestamp, agent, targetAgent, topic, messageType, priority, payload, metadata);
    }

    public PeerMessage withPriority(Priority newPriority) {
        return new PeerMessage(id, timestamp, sourceAgent, targetAgent, topic, messageType, newPriority, payload, metadata);
    }

    public PeerMessage withMetadata(MessageMetadata newMetadata) {
        return new PeerMessage(id, timestamp, sourceAgent, targetAgent, topic, messageType, priority, payload, newMetadata);
    }

    /**
     * A message expires once its ttl has elapsed since its timestamp.
     */
    public boolean isExpired(Instant now) {
        if (timestamp == null || metadata == null) {
            return false;
        }
        return timestamp.plusMillis(metadata.ttlMs()).isBefore(now);
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
                .put("id", id)
                .put("timestamp", timestamp != null ? timestamp.toString() : null)
                .put("sourceAgent", sourceAgent)
                .put("topic", topic)
                .put("messageType", messageType)
                .put("priority", priority.getValue())
                .put("payload", payload)
                .put("metadata", metadata != null ? metadata.toJson() : null);
        if (targetAgent != null) {
            json.put("targetAgent", targetAgent);
        }
        return json;
    }

    /**
     * @throws ClassCastException if a field has the wrong JSON type
     * @throws java.time.format.DateTimeParseException if the timestamp is not ISO-8601
     * @throws IllegalArgumentException if the priority is unknown
     */
    public static PeerMessage fromJson(JsonObject json) {
        String timestamp = json.getString("timestamp");
        JsonObject metadata = json.getJsonObject("metadata");
        return new PeerMessage(
                json.getString("id"),
                timestamp != null ? Instant.parse(timestamp) : null,
                json.getString("sourceAgent"),
                json.getString("targetAgent"),
                json.getString("topic"),
                json.getString("messageType"),
                Priority.fromValue(json.getString("priority")),
                json.getJsonObject("payload"),
                metadata != null ? MessageMetadata.fromJson(metadata) : null);
    }

    private static String shortId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
