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


package dev.mars.aegis.gateway;

import io.vertx.core.json.JsonObject;

/**
 * Delivery metadata attached to every {@link RpcResponse}.
 *
 * @param processingTimeMs wall time spent in the envelope, retries and waits included
 * @param serviceEndpoint  the configured endpoint of the target service, null if unresolved
 * @param retryCount       attempts made minus one
 * @param cacheHit         always false; responses are not cached
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 */
public record RpcResponseMetadata(long processingTimeMs, String serviceEndpoint, int retryCount, boolean cacheHit) {

    public JsonObject toJson() {
        return new JsonObject()
                .put("processingTime", processingTimeMs)
                .put("serviceEndpoint", serviceEndpoint)
                .put("retryCount", retryCount)
                .put("cacheHit", cacheHit);
    }
}
