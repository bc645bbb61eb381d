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


package dev.mars.aegis.agent;

import dev.mars.aegis.agent.config.AgentClientFactory;
import dev.mars.aegis.agent.config.AgentConfig;
import dev.mars.aegis.agent.handler.AssistantHandler;
import dev.mars.aegis.agent.observability.AgentTelemetryConfig;
import dev.mars.aegis.agent.service.HealthEndpoint;
import dev.mars.aegis.config.AegisConfiguration;
import dev.mars.aegis.event.EventPublisher;
import dev.mars.aegis.monitoring.ResilienceMetrics;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for a standalone assistant agent.
 *
 * <p>Loads and validates configuration, installs telemetry, builds the call envelopes, starts
 * the agent with an {@link AssistantHandler}, exposes the health endpoint and shuts everything
 * down on JVM exit.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 */
public final class AegisAgentApplication {

    private static final Logger logger = LoggerFactory.getLogger(AegisAgentApplication.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private AegisAgentApplication() {
    }

    public static void main(String[] args) {
        logger.info("Starting Aegis Agent...");

        AegisConfiguration configuration = AegisConfiguration.load();
        AgentConfig config = AgentConfig.from(configuration);
        config.logConfiguration();

        List<String> problems = config.validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> logger.error("Configuration problem: {}", problem));
            logger.error("Aegis Agent not started: {} configuration problem(s)", problems.size());
            System.exit(1);
            return;
        }

        AgentTelemetryConfig.install(config);

        Vertx vertx = Vertx.vertx();
        logger.info("Created Vert.x instance: {}", System.identityHashCode(vertx));

        EventPublisher events = new EventPublisher();
        new ResilienceMetrics().attach(events);

        AgentClients clients = new AgentClientFactory(vertx, configuration, events).create(config);
        AgentLifecycleManager agent = new AgentLifecycleManager(vertx, config, clients, new AssistantHandler(), events);
        HealthEndpoint healthEndpoint = new HealthEndpoint(vertx, agent);

        CountDownLatch shutdownLatch = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received");
            CountDownLatch stopped = new CountDownLatch(1);
            healthEndpoint.stop()
                    .compose(v -> agent.shutdown())
                    .compose(v -> vertx.close())
                    .onComplete(ar -> {
                        if (ar.succeeded()) {
                            logger.info("Vert.x instance closed successfully");
                        } else {
                            logger.error("Error during shutdown", ar.cause());
                        }
                        stopped.countDown();
                    });
            try {
                if (!stopped.await(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    logger.warn("Shutdown did not complete within {}s", SHUTDOWN_TIMEOUT_SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for shutdown");
            }
            shutdownLatch.countDown();
        }));

        agent.initialize()
                .compose(v -> healthEndpoint.start(config.healthPort()))
                .onSuccess(port -> logger.info("Aegis Agent {} started, health endpoint on port {}",
                        config.agentId(), port))
                .onFailure(err -> {
                    logger.error("Failed to start Aegis Agent", err);
                    System.exit(1);
                });

        try {
            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Main thread interrupted");
        }

        logger.info("Aegis Agent stopped");
    }
}
