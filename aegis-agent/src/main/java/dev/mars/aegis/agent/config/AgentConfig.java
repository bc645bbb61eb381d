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


package dev.mars.aegis.agent.config;

import dev.mars.aegis.config.AegisConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Agent settings resolved from {@code aegis.agent.*}, {@code aegis.gateway.*} and
 * {@code aegis.generation.*} keys.
 *
 * <p>Every value goes through {@link AegisConfiguration}, so each key can be overridden by an
 * environment variable (for example {@code AEGIS_AGENT_ID}) or a system property.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 */
public record AgentConfig(
        String agentId,
        String name,
        String agentType,
        String version,
        String environment,
        List<String> capabilities,
        long heartbeatIntervalMs,
        long metricsIntervalMs,
        boolean backgroundTasksEnabled,
        String hubUrl,
        String agentEndpoint,
        String gatewayUrl,
        List<String> gatewayServices,
        String generationBaseUrl,
        String generationModel,
        String generationApiKey,
        int generationMaxTokens,
        double generationTemperature,
        int connectTimeoutMs,
        long requestTimeoutMs,
        int healthPort,
        boolean telemetryEnabled,
        int prometheusPort
) {

    private static final Logger logger = LoggerFactory.getLogger(AgentConfig.class);

    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 30000;
    public static final long DEFAULT_METRICS_INTERVAL_MS = 60000;
    public static final int DEFAULT_HEALTH_PORT = 8090;
    public static final int DEFAULT_PROMETHEUS_PORT = 9466;

    public AgentConfig {
        Objects.requireNonNull(agentId, "Agent id cannot be null");
        capabilities = capabilities != null ? List.copyOf(capabilities) : List.of();
        gatewayServices = gatewayServices != null ? List.copyOf(gatewayServices) : List.of();
        hubUrl = hubUrl != null ? hubUrl : "";
        gatewayUrl = gatewayUrl != null ? gatewayUrl : "";
        generationApiKey = generationApiKey != null ? generationApiKey : "";
    }

    public static AgentConfig from(AegisConfiguration config) {
        String agentId = config.getString("aegis.agent.id", "aegis-agent");
        return new AgentConfig(
                agentId,
                config.getString("aegis.agent.name", agentId),
                config.getString("aegis.agent.type", "assistant"),
                config.getString("aegis.agent.version", "1.0.0"),
                config.getString("aegis.agent.environment", "development"),
                config.getList("aegis.agent.capabilities", List.of()),
                config.getLong("aegis.agent.heartbeat.interval-ms", DEFAULT_HEARTBEAT_INTERVAL_MS),
                config.getLong("aegis.agent.metrics.interval-ms", DEFAULT_METRICS_INTERVAL_MS),
                config.getBoolean("aegis.agent.background-tasks.enabled", true),
                config.getString("aegis.agent.hub.url", ""),
                config.getString("aegis.agent.endpoint", ""),
                config.getString("aegis.gateway.url", ""),
                config.getList("aegis.gateway.services", List.of()),
                config.getString("aegis.generation.base-url", "https://generativelanguage.googleapis.com/v1beta"),
                config.getString("aegis.generation.model", "gemini-pro"),
                config.getString("aegis.generation.api-key", ""),
                config.getInt("aegis.generation.max-tokens", 2048),
                config.getDouble("aegis.generation.temperature", 0.7),
                config.getInt("aegis.agent.connect-timeout-ms", 5000),
                config.getLong("aegis.agent.request-timeout-ms", 30000),
                config.getInt("aegis.agent.health.port", DEFAULT_HEALTH_PORT),
                config.getBoolean("aegis.agent.telemetry.enabled", false),
                config.getInt("aegis.agent.telemetry.prometheus.port", DEFAULT_PROMETHEUS_PORT));
    }

    /**
     * Settings suitable for a single-process agent: no hub, no gateway, no background timers.
     */
    public static AgentConfig forTesting(String agentId) {
        return new AgentConfig(agentId, agentId, "test", "1.0.0", "test", List.of(),
                DEFAULT_HEARTBEAT_INTERVAL_MS, DEFAULT_METRICS_INTERVAL_MS, false, "", "", "", List.of(),
                "http://localhost", "gemini-pro", "test-key", 2048, 0.7, 5000, 30000, 0, false,
                DEFAULT_PROMETHEUS_PORT);
    }

    public AgentConfig withBackgroundTasks(boolean enabled, long heartbeatMs, long metricsMs) {
        return new AgentConfig(agentId, name, agentType, version, environment, capabilities, heartbeatMs,
                metricsMs, enabled, hubUrl, agentEndpoint, gatewayUrl, gatewayServices, generationBaseUrl,
                generationModel, generationApiKey, generationMaxTokens, generationTemperature, connectTimeoutMs,
                requestTimeoutMs, healthPort, telemetryEnabled, prometheusPort);
    }

    public boolean usesRemoteHub() {
        return !hubUrl.isBlank();
    }

    /**
     * @return the problems found; empty when the configuration is usable
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (agentId.isBlank()) {
            problems.add("Agent id is required");
        }
        if (heartbeatIntervalMs <= 0) {
            problems.add("Heartbeat interval must be positive, got: " + heartbeatIntervalMs);
        }
        if (metricsIntervalMs <= 0) {
            problems.add("Metrics interval must be positive, got: " + metricsIntervalMs);
        }
        if (usesRemoteHub() && !isHttpUrl(hubUrl)) {
            problems.add("Hub URL must start with http:// or https://, got: " + hubUrl);
        }
        if (!gatewayServices.isEmpty() && !isHttpUrl(gatewayUrl)) {
            problems.add("Gateway URL must start with http:// or https:// when services are configured, got: "
                    + gatewayUrl);
        }
        if (!isHttpUrl(generationBaseUrl)) {
            problems.add("Generation base URL must start with http:// or https://, got: " + generationBaseUrl);
        }
        if (generationApiKey.isBlank()) {
            problems.add("Generation API key is required (aegis.generation.api-key)");
        }
        if (generationMaxTokens <= 0) {
            problems.add("Generation max tokens must be positive, got: " + generationMaxTokens);
        }
        if (generationTemperature < 0.0 || generationTemperature > 2.0) {
            problems.add("Generation temperature must be between 0 and 2, got: " + generationTemperature);
        }
        if (healthPort < 0 || healthPort > 65535) {
            problems.add("Health port must be between 0 and 65535, got: " + healthPort);
        }
        if (telemetryEnabled && (prometheusPort < 1 || prometheusPort > 65535)) {
            problems.add("Prometheus port must be between 1 and 65535, got: " + prometheusPort);
        }
        return problems;
    }

    public void logConfiguration() {
        logger.info("Aegis Agent Configuration:");
        logger.info("  Agent ID: {} ({} v{}, {})", agentId, agentType, version, environment);
        logger.info("  Capabilities: {}", capabilities);
        logger.info("  Heartbeat Interval: {}ms, Metrics Interval: {}ms, Background Tasks: {}",
                heartbeatIntervalMs, metricsIntervalMs, backgroundTasksEnabled);
        logger.info("  Peer Hub: {}", usesRemoteHub() ? hubUrl : "in-process");
        logger.info("  Gateway: {} services {}", gatewayUrl.isBlank() ? "-" : gatewayUrl, gatewayServices);
        logger.info("  Generation: {} model {}", generationBaseUrl, generationModel);
        logger.info("  Health Port: {}", healthPort);
        logger.info("  Telemetry Enabled: {}, Prometheus Port: {}", telemetryEnabled, prometheusPort);
    }

    private static boolean isHttpUrl(String url) {
        return url != null && (url.startsWith("http://") || url.startsWith("https://"));
    }

    @Override
    public String toString() {
        return "AgentConfig{agentId='" + agentId + "', type='" + agentType + "', hubUrl='" + hubUrl
                + "', gatewayServices=" + gatewayServices + ", apiKey=" + (generationApiKey.isBlank() ? "unset" : "***")
                + '}';
    }
}
