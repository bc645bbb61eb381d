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


package dev.mars.aegis.monitoring.health;

import dev.mars.aegis.event.EventPublisher;
import dev.mars.aegis.resilience.CircuitBreaker;
import dev.mars.aegis.resilience.CircuitState;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
@DisplayName("HealthMonitor")
class HealthMonitorTest {

    private static HealthCheck fixed(String name, HealthCheckResult.Status status) {
        return new HealthCheck() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Future<HealthCheckResult> check() {
                return Future.succeededFuture(HealthCheckResult.builder(name).status(status).message(name).build());
            }
        };
    }

    private static HealthCheck of(String name, Function<String, Future<HealthCheckResult>> body) {
        return new HealthCheck() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Future<HealthCheckResult> check() {
                return body.apply(name);
            }
        };
    }

    private static Map<String, HealthCheckResult> byName(HealthReport report) {
        return report.checks().stream().collect(Collectors.toMap(HealthCheckResult::getName, Function.identity()));
    }

    @Nested
    @DisplayName("Roll-up")
    class RollUp {

        @Test
        @DisplayName("All passing checks should be healthy")
        void healthy(Vertx vertx, VertxTestContext ctx) {
            HealthMonitor monitor = new HealthMonitor(vertx)
                    .register(fixed("a", HealthCheckResult.Status.PASS))
                    .register(fixed("b", HealthCheckResult.Status.PASS));

            monitor.runHealthChecks().onComplete(ctx.succeeding(report -> ctx.verify(() -> {
                assertEquals(HealthReport.Status.HEALTHY, report.status());
                assertEquals(2, report.checks().size());
                assertTrue(report.isHealthy());
                ctx.completeNow();
            })));
        }

        @Test
        @DisplayName("Any warning should be degraded")
        void degraded(Vertx vertx, VertxTestContext ctx) {
            HealthMonitor monitor = new HealthMonitor(vertx)
                    .register(fixed("a", HealthCheckResult.Status.PASS))
                    .register(fixed("b", HealthCheckResult.Status.WARN));

            monitor.runHealthChecks().onComplete(ctx.succeeding(report -> ctx.verify(() -> {
                assertEquals(HealthReport.Status.DEGRADED, report.status());
                ctx.completeNow();
            })));
        }

        @Test
        @DisplayName("Any failure should be unhealthy even alongside warnings")
        void unhealthy(Vertx vertx, VertxTestContext ctx) {
            HealthMonitor monitor = new HealthMonitor(vertx)
                    .register(fixed("a", HealthCheckResult.Status.WARN))
                    .register(fixed("b", HealthCheckResult.Status.FAIL));

            monitor.runHealthChecks().onComplete(ctx.succeeding(report -> ctx.verify(() -> {
                assertEquals(HealthReport.Status.UNHEALTHY, report.status());
                JsonObject json = report.toJson();
                assertEquals("unhealthy", json.getString("status"));
                assertEquals(2, json.getJsonArray("checks").size());
                ctx.completeNow();
            })));
        }
    }

    @Nested
    @DisplayName("Check failures")
    class CheckFailures {

        @Test
        @DisplayName("A check that never answers should fail on its timeout")
        void timesOut(Vertx vertx, VertxTestContext ctx) {
            HealthMonitor monitor = new HealthMonitor(vertx, 100)
                    .register(of("hung", name -> Promise.<HealthCheckResult>promise().future()))
                    .register(fixed("ok", HealthCheckResult.Status.PASS));

            monitor.runHealthChecks().onComplete(ctx.succeeding(report -> ctx.verify(() -> {
                HealthCheckResult hung = byName(report).get("hung");
                assertEquals(HealthCheckResult.Status.FAIL, hung.getStatus());
                assertTrue(hung.getMessage().contains("timed out"), hung.getMessage());
                assertEquals(HealthReport.Status.UNHEALTHY, report.status());
                ctx.completeNow();
            })));
        }

        @Test
        @DisplayName("A check that throws or fails should be reported as fail")
        void throwingCheck(Vertx vertx, VertxTestContext ctx) {
            HealthMonitor monitor = new HealthMonitor(vertx)
                    .register(of("throws", name -> {
                        throw new IllegalStateException("boom");
                    }))
                    .register(of("fails", name -> Future.failedFuture(new RuntimeException("down"))));

            monitor.runHealthChecks().onComplete(ctx.succeeding(report -> ctx.verify(() -> {
                Map<String, HealthCheckResult> results = byName(report);
                assertEquals(HealthCheckResult.Status.FAIL, results.get("throws").getStatus());
                assertEquals(HealthCheckResult.Status.FAIL, results.get("fails").getStatus());
                assertTrue(results.get("fails").getMessage().contains("down"));
                ctx.completeNow();
            })));
        }

        @Test
        @DisplayName("Checks can be unregistered by name")
        void unregister(Vertx vertx) {
            HealthMonitor monitor = new HealthMonitor(vertx)
                    .register(fixed("a", HealthCheckResult.Status.PASS));

            assertTrue(monitor.unregister("a"));
            assertFalse(monitor.unregister("a"));
            assertTrue(monitor.registeredChecks().isEmpty());
        }
    }

    @Nested
    @DisplayName("Default checks")
    class DefaultChecks {

        @Test
        @DisplayName("Heap usage thresholds")
        void heapThresholds(VertxTestContext ctx) {
            Future.all(
                    new HeapUsageHealthCheck(() -> 0.50, 0.90, 0.95).check(),
                    new HeapUsageHealthCheck(() -> 0.92, 0.90, 0.95).check(),
                    new HeapUsageHealthCheck(() -> 0.97, 0.90, 0.95).check()
            ).onComplete(ctx.succeeding(all -> ctx.verify(() -> {
                List<HealthCheckResult> results = all.list();
                assertEquals(HealthCheckResult.Status.PASS, results.get(0).getStatus());
                assertEquals(HealthCheckResult.Status.WARN, results.get(1).getStatus());
                assertEquals(HealthCheckResult.Status.FAIL, results.get(2).getStatus());
                ctx.completeNow();
            })));
        }

        @Test
        @DisplayName("Error rate thresholds")
        void errorRateThresholds(VertxTestContext ctx) {
            Future.all(
                    new ErrorRateHealthCheck(() -> 0.01).check(),
                    new ErrorRateHealthCheck(() -> 0.07).check(),
                    new ErrorRateHealthCheck(() -> 0.20).check()
            ).onComplete(ctx.succeeding(all -> ctx.verify(() -> {
                List<HealthCheckResult> results = all.list();
                assertEquals(HealthCheckResult.Status.PASS, results.get(0).getStatus());
                assertEquals(HealthCheckResult.Status.WARN, results.get(1).getStatus());
                assertEquals(HealthCheckResult.Status.FAIL, results.get(2).getStatus());
                ctx.completeNow();
            })));
        }

        @Test
        @DisplayName("Endpoint reachability counts open circuits")
        void reachability(VertxTestContext ctx) {
            EventPublisher events = new EventPublisher();
            CircuitBreaker open = new CircuitBreaker("down", 1, Duration.ofMinutes(1), events);
            open.tryAcquirePermission();
            open.onFailure();
            CircuitBreaker closed = new CircuitBreaker("up", 1, Duration.ofMinutes(1), events);
            assertEquals(CircuitState.OPEN, open.getState());

            new EndpointReachabilityHealthCheck(() -> List.of(open, closed)).check()
                    .onComplete(ctx.succeeding(result -> ctx.verify(() -> {
                        assertEquals(HealthCheckResult.Status.WARN, result.getStatus(),
                                "Half the endpoints reachable is below 0.8 but not below 0.5");
                        assertEquals("1/2 endpoints reachable", result.getMessage());
                        assertEquals(List.of("down"), result.getDetails().get("openCircuits"));
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("Endpoint reachability passes with no endpoints")
        void reachabilityWithoutEndpoints(VertxTestContext ctx) {
            new EndpointReachabilityHealthCheck(List::of).check()
                    .onComplete(ctx.succeeding(result -> ctx.verify(() -> {
                        assertEquals(HealthCheckResult.Status.PASS, result.getStatus());
                        ctx.completeNow();
                    })));
        }
    }
}
