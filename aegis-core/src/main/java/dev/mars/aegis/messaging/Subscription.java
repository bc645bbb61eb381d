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
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;
import java.util.Objects;

/**
 * Interest of an agent in a topic. An empty {@code messageTypes} list accepts every type.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 */
public record Subscription(String topic, List<String> messageTypes, Priority priority) {

    public Subscription {
        Objects.requireNonNull(topic, "Topic cannot be null");
        messageTypes = messageTypes != null ? List.copyOf(messageTypes) : List.of();
        priority = priority != null ? priority : Priority.NORMAL;
    }

    public static Subscription to(String topic, String... messageTypes) {
        return new Subscription(topic, List.of(messageTypes), Priority.NORMAL);
    }

    public boolean accepts(String messageType) {
        return messageTypes.isEmpty() || messageTypes.contains(messageType);
    }

    public JsonObject toJson() {
        return new JsonObject()
                .put("topic", topic)
                .put("messageTypes", new JsonArray(messageTypes))
                .put("priority", priority.getValue());
    }

    public static Subscription fromJson(JsonObject json) {
        return new Subscription(
                json.getString("topic"),
                json.getJsonArray("messageTypes", new JsonArray()).stream().map(String::valueOf).toList(),
                Priority.fromValue(json.getString("priority")));
    }
}
