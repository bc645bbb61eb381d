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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AgentConfig")
class AgentConfigTest {

    private static AgentConfig load(Map<String, String> fileValues, Map<String, String> environment) {
        Properties properties = new Properties();
        properties.putAll(fileValues);
        return AgentConfig.from(new AegisConfiguration(properties, environment::get));
    }

    @Test
    @DisplayName("Should fall back to defaults when nothing is configured")
    void defaults() {
        AgentConfig config = load(Map.of(), Map.of());

        assertEquals("aegis-agent", config.agentId());
        assertEquals("aegis-agent", config.name());
        assertEquals("assistant", config.agentType());
        assertEquals(AgentConfig.DEFAULT_HEARTBEAT_INTERVAL_MS, config.heartbeatIntervalMs());
        assertEquals(AgentConfig.DEFAULT_METRICS_INTERVAL_MS, config.metricsIntervalMs());
        assertTrue(config.backgroundTasksEnabled());
        assertFalse(config.usesRemoteHub());
        assertEquals("gemini-pro", config.generationModel());
        assertEquals(AgentConfig.DEFAULT_HEALTH_PORT, config.healthPort());
        assertFalse(config.telemetryEnabled());
        assertTrue(config.gatewayServices().isEmpty());
    }

    @Test
    @DisplayName("Should read file values and let the environment override them")
    void fileAndEnvironment() {
        AgentConfig config = load(
                Map.of("aegis.agent.id", "planner-7",
                        "aegis.agent.capabilities", "planning, summarizing",
                        "aegis.gateway.url", "http://gateway:8080",
                        "aegis.gateway.services", "inventory,pricing",
                        "aegis.generation.api-key", "from-file"),
                Map.of("AEGIS_GENERATION_API_KEY", "from-env",
                        "AEGIS_AGENT_HEARTBEAT_INTERVAL_MS", "5000"));

        assertEquals("planner-7", config.agentId());
        assertEquals(List.of("planning", "summarizing"), config.capabilities());
        assertEquals(List.of("inventory", "pricing"), config.gatewayServices());
        assertEquals("from-env", config.generationApiKey());
        assertEquals(5000, config.heartbeatIntervalMs());
        assertTrue(config.validate().isEmpty(), () -> "unexpected problems " + config.validate());
    }

    @Test
    @DisplayName("Should report every problem in an unusable configuration")
    void validationProblems() {
        AgentConfig config = load(
                Map.of("aegis.agent.heartbeat.interval-ms", "0",
                        "aegis.agent.hub.url", "ws://hub",
                        "aegis.gateway.services", "inventory",
                        "aegis.generation.temperature", "3.5",
                        "aegis.agent.health.port", "70000"),
                Map.of());

        List<String> problems = config.validate();

        assertTrue(problems.contains("Heartbeat interval must be positive, got: 0"));
        assertTrue(problems.contains("Hub URL must start with http:// or https://, got: ws://hub"));
        assertTrue(problems.stream().anyMatch(p -> p.startsWith("Gateway URL must start with")));
        assertTrue(problems.contains("Generation API key is required (aegis.generation.api-key)"));
        assertTrue(problems.contains("Generation temperature must be between 0 and 2, got: 3.5"));
        assertTrue(problems.contains("Health port must be between 0 and 65535, got: 70000"));
        assertEquals(6, problems.size());
    }

    @Test
    @DisplayName("toString should never reveal the API key")
    void masksApiKey() {
        AgentConfig config = load(Map.of("aegis.generation.api-key", "secret-value"), Map.of());

        assertFalse(config.toString().contains("secret-value"));
        assertTrue(config.toString().contains("apiKey=***"));
        assertTrue(load(Map.of(), Map.of()).toString().contains("apiKey=unset"));
    }

    @Test
    @DisplayName("Test configuration should be valid and keep timers off")
    void forTesting() {
        AgentConfig config = AgentConfig.forTesting("unit");

        assertTrue(config.validate().isEmpty());
        assertFalse(config.backgroundTasksEnabled());

        AgentConfig timed = config.withBackgroundTasks(true, 100, 200);
        assertTrue(timed.backgroundTasksEnabled());
        assertEquals(100, timed.heartbeatIntervalMs());
        assertEquals(200, timed.metricsIntervalMs());
        assertEquals("unit", timed.agentId());
    }
}
