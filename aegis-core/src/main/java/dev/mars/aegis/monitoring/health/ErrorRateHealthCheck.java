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
 * Process-wide call error rate against warn and fail ceilings.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public class ErrorRateHealthCheck implements HealthCheck {

    public static final String NAME = "error_rate";
    public static final double DEFAULT_WARN_RATE = 0.05;
    public static final double DEFAULT_FAIL_RATE = 0.10;

    private final DoubleSupplier errorRate;
    private final double warnRate;
    private final double failRate;

    public ErrorRateHealthCheck(DoubleSupplier errorRate) {
        this(errorRate, DEFAULT_WARN_RATE, DEFAULT_FAIL_RATE);
    }

    public ErrorRateHealthCheck(DoubleSupplier errorRate, double warnRate, double failRate) {
        this.errorRate = Objects.requireNonNull(errorRate, "Error rate supplier cannot be null");
        this.warnRate = warnRate;
        this.failRate = failRate;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Future<HealthCheckResult> check() {
        double rate = errorRate.getAsDouble();
        String message = String.format("Error rate %.2f%%", rate * 100);
        HealthCheckResult.Builder result = HealthCheckResult.builder(NAME).detail("rate", rate).message(message);
        if (rate > failRate) {
            result.fail();
        } else if (rate > warnRate) {
            result.warn();
        } else {
            result.pass();
        }
        return Future.succeededFuture(result.build());
    }
}
