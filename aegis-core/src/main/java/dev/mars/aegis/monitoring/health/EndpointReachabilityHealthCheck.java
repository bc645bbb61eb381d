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

import dev.mars.aegis.resilience.CircuitBreaker;
import dev.mars.aegis.resilience.CircuitState;
import io.vertx.core.Future;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Fraction of configured endpoints whose circuit breaker is not open.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public class EndpointReachabilityHealthCheck implements HealthCheck {

    public static final String NAME = "endpoint_reachability";
    public static final double DEFAULT_WARN_BELOW = 0.8;
    public static final double DEFAULT_FAIL_BELOW = 0.5;

    private final Supplier<Collection<CircuitBreaker>> breakers;
    private final double warnBelow;
    private final double failBelow;

    public EndpointReachabilityHealthCheck(Supplier<Collection<CircuitBreaker>> breakers) {
        this(breakers, DEFAULT_WARN_BELOW, DEFAULT_FAIL_BELOW);
    }

    public EndpointReachabilityHealthCheck(Supplier<Collection<CircuitBreaker>> breakers,
                                           double warnBelow, double failBelow) {
        this.breakers = Objects.requireNonNull(breakers, "Breaker supplier cannot be null");
        this.warnBelow = warnBelow;
        this.failBelow = failBelow;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Future<HealthCheckResult> check() {
        Collection<CircuitBreaker> all = breakers.get();
        if (all.isEmpty()) {
            return Future.succeededFuture(HealthCheckResult.pass(NAME, "No endpoints configured"));
        }

        List<String> open = all.stream()
                .filter(breaker -> breaker.getState() == CircuitState.OPEN)
                .map(CircuitBreaker::getEndpoint)
                .sorted()
                .toList();
        int reachable = all.size() - open.size();
        double ratio = (double) reachable / all.size();
        String message = String.format("%d/%d endpoints reachable", reachable, all.size());

        HealthCheckResult.Builder result = HealthCheckResult.builder(NAME)
                .detail("ratio", ratio)
                .detail("openCircuits", open);
        if (ratio < failBelow) {
            result.fail().message(message);
        } else if (ratio < warnBelow) {
            result.warn().message(message);
        } else {
            result.pass().message(message);
        }
        return Future.succeededFuture(result.build());
    }
}
