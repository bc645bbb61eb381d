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

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs the registered health checks concurrently and rolls them up into a {@link HealthReport}.
 *
 * <p>Each check is bounded by a per-check timeout; a check that times out, throws or
 * returns a failed future is reported as {@code fail} with the reason in its message.
 * The returned future never fails.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public class HealthMonitor {

    private static final Logger logger = LoggerFactory.getLogger(HealthMonitor.class);

    public static final long DEFAULT_CHECK_TIMEOUT_MS = 5000;

    private final Vertx vertx;
    private final long checkTimeoutMs;
    private final Map<String, HealthCheck> checks = new LinkedHashMap<>();

    public HealthMonitor(Vertx vertx) {
        this(vertx, DEFAULT_CHECK_TIMEOUT_MS);
    }

    public HealthMonitor(Vertx vertx, long checkTimeoutMs) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        if (checkTimeoutMs <= 0) {
            throw new IllegalArgumentException("Check timeout must be positive, got: " + checkTimeoutMs);
        }
        this.checkTimeoutMs = checkTimeoutMs;
    }

    /**
     * Registers a check, replacing any check with the same name.
     */
    public synchronized HealthMonitor register(HealthCheck check) {
        Objects.requireNonNull(check, "Health check cannot be null");
        checks.put(check.name(), check);
        logger.debug("Registered health check '{}'", check.name());
        return this;
    }

    public synchronized boolean unregister(String name) {
        return checks.remove(name) != null;
    }

    public synchronized List<String> registeredChecks() {
        return List.copyOf(checks.keySet());
    }

    public long getCheckTimeoutMs() {
        return checkTimeoutMs;
    }

    public Future<HealthReport> runHealthChecks() {
        long startNanos = System.nanoTime();
        List<HealthCheck> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(checks.values());
        }

        List<Future<HealthCheckResult>> futures = new ArrayList<>();
        for (HealthCheck check : snapshot) {
            futures.add(runBounded(check));
        }

        return Future.all(futures).map(done -> {
            List<HealthCheckResult> results = new ArrayList<>();
            futures.forEach(future -> results.add(future.result()));
            HealthReport report = HealthReport.of(results, elapsedMs(startNanos));
            if (report.status() != HealthReport.Status.HEALTHY) {
                logger.warn("Health status {}: {}", report.status().getValue(), summarize(results));
            }
            return report;
        });
    }

    private Future<HealthCheckResult> runBounded(HealthCheck check) {
        String name = check.name();
        long startNanos = System.nanoTime();
        Promise<HealthCheckResult> promise = Promise.promise();
        long timerId = vertx.setTimer(checkTimeoutMs, id -> {
            if (promise.tryComplete(HealthCheckResult.fail(name, "Check timed out after " + checkTimeoutMs + "ms")
                    .withDuration(checkTimeoutMs))) {
                logger.warn("Health check '{}' timed out after {}ms", name, checkTimeoutMs);
            }
        });

        Future<HealthCheckResult> result;
        try {
            result = Objects.requireNonNull(check.check(), "Health check returned a null future");
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }

        result.onComplete(ar -> {
            vertx.cancelTimer(timerId);
            long duration = elapsedMs(startNanos);
            if (ar.succeeded()) {
                promise.tryComplete(ar.result().withDuration(duration));
            } else {
                logger.warn("Health check '{}' failed: {}", name, ar.cause().getMessage());
                promise.tryComplete(HealthCheckResult.fail(name, "Check failed: " + ar.cause().getMessage())
                        .withDuration(duration));
            }
        });
        return promise.future();
    }

    private static String summarize(List<HealthCheckResult> results) {
        StringBuilder sb = new StringBuilder();
        for (HealthCheckResult result : results) {
            if (result.getStatus() != HealthCheckResult.Status.PASS) {
                if (sb.length() > 0) {
                    sb.append("; ");
                }
                sb.append(result.getName()).append('=').append(result.getStatus().getValue())
                        .append(" (").append(result.getMessage()).append(')');
            }
        }
        return sb.toString();
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
