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

import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * Heap usage ratio (used / max) against warn and fail ceilings.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public class HeapUsageHealthCheck implements HealthCheck {

    public static final String NAME = "heap_usage";
    public static final double DEFAULT_WARN_RATIO = 0.90;
    public static final double DEFAULT_FAIL_RATIO = 0.95;

    private final DoubleSupplier usageRatio;
    private final double warnRatio;
    private final double failRatio;

    public HeapUsageHealthCheck() {
        this(HeapUsageHealthCheck::currentHeapRatio, DEFAULT_WARN_RATIO, DEFAULT_FAIL_RATIO);
    }

    public HeapUsageHealthCheck(DoubleSupplier usageRatio, double warnRatio, double failRatio) {
        this.usageRatio = Objects.requireNonNull(usageRatio, "Usage supplier cannot be null");
        this.warnRatio = warnRatio;
        this.failRatio = failRatio;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Future<HealthCheckResult> check() {
        double ratio = usageRatio.getAsDouble();
        String usage = String.format("Heap usage %.1f%%", ratio * 100);
        HealthCheckResult.Builder result = HealthCheckResult.builder(NAME).detail("ratio", ratio);
        if (ratio > failRatio) {
            result.fail().message(usage + " exceeds " + percent(failRatio));
        } else if (ratio > warnRatio) {
            result.warn().message(usage + " exceeds " + percent(warnRatio));
        } else {
            result.pass().message(usage);
        }
        return Future.succeededFuture(result.build());
    }

    /**
     * Used heap over the maximum the JVM may grow to.
     */
    public static double currentHeapRatio() {
        Runtime runtime = Runtime.getRuntime();
        long used = runtime.totalMemory() - runtime.freeMemory();
        return (double) used / runtime.maxMemory();
    }

    private static String percent(double ratio) {
        return String.format("%.0f%%", ratio * 100);
    }
}
