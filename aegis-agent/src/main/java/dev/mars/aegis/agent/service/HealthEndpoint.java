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


package dev.mars.aegis.agent.service;

import dev.mars.aegis.agent.AgentLifecycleManager;
import dev.mars.aegis.monitoring.health.HealthReport;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * HTTP health service for the agent.
 *
 * <ul>
 *   <li>{@code GET /health} runs the health checks: 200 when healthy or degraded, 503 when unhealthy</li>
 *   <li>{@code GET /status} returns the agent's status, uptime, metrics and recent errors</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 */
public class HealthEndpoint {

    private static final Logger logger = LoggerFactory.getLogger(HealthEndpoint.class);

    private final Vertx vertx;
    private final AgentLifecycleManager agent;
    private HttpServer httpServer;

    public HealthEndpoint(Vertx vertx, AgentLifecycleManager agent) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.agent = Objects.requireNonNull(agent, "Agent cannot be null");
    }

    /**
     * @param port the port to bind, or 0 for any free port
     * @return the port actually bound
     */
    public Future<Integer> start(int port) {
        Router router = Router.router(vertx);

        router.get("/health").handler(this::handleHealth);
        router.get("/status").respond(ctx -> Future.succeededFuture(agent.healthStatus().toJson()));

        httpServer = vertx.createHttpServer()
                .requestHandler(router);

        return httpServer.listen(port)
                .onSuccess(server -> logger.info("Health endpoint listening on port {}", server.actualPort()))
                .onFailure(err -> logger.error("Failed to start health endpoint", err))
                .map(HttpServer::actualPort);
    }

    public Future<Void> stop() {
        if (httpServer != null) {
            return httpServer.close()
                    .onSuccess(v -> logger.info("Health endpoint stopped"));
        }
        return Future.succeededFuture();
    }

    private void handleHealth(RoutingContext ctx) {
        agent.runHealthChecks().onComplete(ar -> {
            if (ar.failed()) {
                logger.error("Health checks could not be run", ar.cause());
                ctx.fail(500, ar.cause());
                return;
            }
            HealthReport report = ar.result();
            int statusCode = report.status() == HealthReport.Status.UNHEALTHY ? 503 : 200;
            ctx.response()
                    .setStatusCode(statusCode)
                    .putHeader("Content-Type", "application/json")
                    .end(report.toJson().put("agentId", agent.agentId()).encode());
        });
    }
}
