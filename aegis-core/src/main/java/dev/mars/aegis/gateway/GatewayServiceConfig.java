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

import dev.mars.aegis.config.AegisConfiguration;
import dev.mars.aegis.config.ResilienceConfig;

import java.util.Objects;

/**
 * A backend service reachable through the data gateway.
 *
 * <p>Configuration keys, for a service named {@code orders}:</p>
 * <pre>
 * aegis.gateway.services=orders,customers
 * aegis.gateway.service.orders.endpoint=http://orders.internal:8080
 * aegis.gateway.service.orders.timeout-ms=10000
 * aegis.endpoint.orders.rate-limit-per-minute=120
 * </pre>
 *
 * @param name       service name used for routing
 * @param endpoint   the service endpoint reported in response metadata
 * @param timeoutMs  default transport timeout of one attempt
 * @param resilience resilience settings of this service
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 */
public record GatewayServiceConfig(String name, String endpoint, long timeoutMs, ResilienceConfig resilience) {

    public static final String SERVICE_PREFIX = "aegis.gateway.service.";
    public static final long DEFAULT_TIMEOUT_MS = 30000;

    public GatewayServiceConfig {
        Objects.requireNonNull(name, "Service name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Service name cannot be blank");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("Service timeout must be positive: " + timeoutMs);
        }
        endpoint = endpoint != null ? endpoint : "";
        resilience = resilience != null ? resilience : ResilienceConfig.defaults();
    }

    public static GatewayServiceConfig of(String name, String endpoint) {
        return new GatewayServiceConfig(name, endpoint, DEFAULT_TIMEOUT_MS, ResilienceConfig.defaults());
    }

    public static GatewayServiceConfig from(AegisConfiguration config, String name) {
        String prefix = SERVICE_PREFIX + name + ".";
        return new GatewayServiceConfig(
                name,
                config.getString(prefix + "endpoint", ""),
                config.getLong(prefix + "timeout-ms", DEFAULT_TIMEOUT_MS),
                ResilienceConfig.forEndpoint(config, name));
    }

    /**
     * Endpoint name under which this service's resilience state is tracked.
     */
    public String resilienceEndpoint() {
        return "gateway:" + name;
    }
}
