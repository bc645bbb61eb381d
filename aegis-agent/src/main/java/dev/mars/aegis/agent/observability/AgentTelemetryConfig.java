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


package dev.mars.aegis.agent.observability;

import dev.mars.aegis.agent.config.AgentConfig;
import io.opentelemetry.exporter.prometheus.PrometheusHttpServer;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.resources.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenTelemetry configuration for an agent process.
 *
 * Provides:
 * - Prometheus metrics export (configurable port, default 9466)
 * - Registration of the SDK as the global instance, so every {@code GlobalOpenTelemetry} meter
 *   in the process (resilience and agent metrics) is exported
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 */
public final class AgentTelemetryConfig {

    private static final Logger logger = LoggerFactory.getLogger(AgentTelemetryConfig.class);

    private AgentTelemetryConfig() {
    }

    /**
     * Installs the SDK when telemetry is enabled.
     *
     * @return the installed SDK, or {@code null} when telemetry is disabled
     */
    public static OpenTelemetrySdk install(AgentConfig config) {
        if (!config.telemetryEnabled()) {
            logger.info("Telemetry disabled, metrics are recorded against the no-op meter provider");
            return null;
        }

        // 1. Configure Resource with agent-specific attributes
        Resource resource = Resource.getDefault().toBuilder()
                .put("service.name", "aegis-agent")
                .put("service.instance.id", config.agentId())
                .put("service.version", config.version())
                .put("deployment.environment", config.environment())
                .build();

        // 2. Configure Metrics (Prometheus)
        PrometheusHttpServer prometheusReader = PrometheusHttpServer.builder()
                .setPort(config.prometheusPort())
                .build();

        SdkMeterProvider meterProvider = SdkMeterProvider.builder()
                .setResource(resource)
                .registerMetricReader(prometheusReader)
                .build();

        // 3. Initialize OpenTelemetry SDK
        OpenTelemetrySdk openTelemetry = OpenTelemetrySdk.builder()
                .setMeterProvider(meterProvider)
                .buildAndRegisterGlobal();

        logger.info("Prometheus metrics exposed on port {}", config.prometheusPort());
        return openTelemetry;
    }
}
