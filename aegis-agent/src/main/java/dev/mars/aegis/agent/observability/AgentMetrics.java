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

import dev.mars.aegis.agent.AgentStatus;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * OpenTelemetry metrics for an agent.
 *
 * Provides:
 * - aegis.agent.status (gauge) - Agent status (0=stopped, 1=running, 2=error, 3=initializing)
 * - aegis.agent.requests.total (counter) - Requests processed
 * - aegis.agent.requests.failed (counter) - Requests that ended in a failed response
 * - aegis.agent.response.time.ms.total (counter) - Accumulated processing time
 * - aegis.agent.heartbeats.total (counter) - Heartbeats recorded
 * - aegis.agent.uptime.seconds (gauge) - Agent uptime in seconds
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 */
public class AgentMetrics {

    private static final Logger logger = LoggerFactory.getLogger(AgentMetrics.class);
    private static final String METER_NAME = "aegis-agent";

    private static final AttributeKey<String> AGENT_ID_KEY = AttributeKey.stringKey("agent.id");
    private static final AttributeKey<String> ERROR_CODE_KEY = AttributeKey.stringKey("error.code");

    private final LongCounter requestsTotal;
    private final LongCounter requestsFailed;
    private final LongCounter responseTimeTotal;
    private final LongCounter heartbeatsTotal;

    private final AtomicLong agentStatus = new AtomicLong(AgentStatus.INITIALIZING.getGaugeValue());
    private final Attributes agentAttributes;
    private final String agentId;

    public AgentMetrics(String agentId, LongSupplier uptimeMs) {
        this.agentId = agentId;
        this.agentAttributes = Attributes.of(AGENT_ID_KEY, agentId);

        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        requestsTotal = meter.counterBuilder("aegis.agent.requests.total")
                .setDescription("Total number of requests processed")
                .setUnit("1")
                .build();

        requestsFailed = meter.counterBuilder("aegis.agent.requests.failed")
                .setDescription("Number of requests that ended in a failed response")
                .setUnit("1")
                .build();

        responseTimeTotal = meter.counterBuilder("aegis.agent.response.time.ms.total")
                .setDescription("Accumulated request processing time")
                .setUnit("ms")
                .build();

        heartbeatsTotal = meter.counterBuilder("aegis.agent.heartbeats.total")
                .setDescription("Total number of heartbeats recorded")
                .setUnit("1")
                .build();

        meter.gaugeBuilder("aegis.agent.status")
                .setDescription("Agent status (0=stopped, 1=running, 2=error, 3=initializing)")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(agentStatus.get(), agentAttributes));

        meter.gaugeBuilder("aegis.agent.uptime.seconds")
                .setDescription("Agent uptime in seconds")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(uptimeMs.getAsLong() / 1000, agentAttributes));

        logger.info("AgentMetrics initialized for agent: {}", agentId);
    }

    public void setStatus(AgentStatus status) {
        agentStatus.set(status.getGaugeValue());
    }

    public long getStatusValue() {
        return agentStatus.get();
    }

    public void recordRequest(long processingTimeMs, String errorCode) {
        requestsTotal.add(1, agentAttributes);
        responseTimeTotal.add(Math.max(0, processingTimeMs), agentAttributes);
        if (errorCode != null) {
            requestsFailed.add(1, Attributes.of(AGENT_ID_KEY, agentId, ERROR_CODE_KEY, errorCode));
        }
    }

    public void recordHeartbeat() {
        heartbeatsTotal.add(1, agentAttributes);
    }
}
