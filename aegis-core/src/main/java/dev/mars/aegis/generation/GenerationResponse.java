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


package dev.mars.aegis.generation;

import dev.mars.aegis.core.CallError;
import io.vertx.core.json.JsonObject;

import java.time.Instant;

/**
 * Normalized outcome of a generation call. Exactly one of {@code content} and
 * {@code error} is meaningful, as indicated by {@code success}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 */
public record GenerationResponse(
        String id,
        String requestId,
        Instant timestamp,
        boolean success,
        String content,
        TokenUsage usage,
        CallError error,
        long processingTimeMs,
        String finishReason
) {

    public static GenerationResponse succeeded(String requestId, GenerationResult result, long processingTimeMs) {
        return new GenerationResponse(newId(), requestId, Instant.now(), true, result.content(),
                result.usage(), null, processingTimeMs, result.finishReason());
    }

    public static GenerationResponse failed(String requestId, CallError error, long processingTimeMs) {
        return new GenerationResponse(newId(), requestId, Instant.now(), false, null,
                null, error, processingTimeMs, null);
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
                .put("id", id)
                .put("requestId", requestId)
                .put("timestamp", timestamp.toString())
                .put("success", success)
                .put("processingTime", processingTimeMs);
        if (content != null) {
            json.put("content", content);
        }
        if (usage != null) {
            json.put("usage", usage.toJson());
        }
        if (error != null) {
            json.put("error", error.toJson());
        }
        if (finishReason != null) {
            json.put("finishReason", finishReason);
        }
        return json;
    }

    private static String newId() {
        return "resp_" + GenerationRequest.newId().substring(4);
    }
}
