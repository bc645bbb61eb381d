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


package dev.mars.aegis.resilience;

import java.time.Duration;
import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * Immutable retry settings for one endpoint.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public record RetryPolicy(
        int maxAttempts,
        BackoffStrategy backoffStrategy,
        Duration initialDelay,
        Duration maxDelay,
        boolean jitterEnabled
) {

    public static final double MIN_JITTER_FACTOR = 0.5;

    public RetryPolicy {
        Objects.requireNonNull(backoffStrategy, "Backoff strategy cannot be null");
        Objects.requireNonNull(initialDelay, "Initial delay cannot be null");
        Objects.requireNonNull(maxDelay, "Max delay cannot be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be at least 1, got: " + maxAttempts);
        }
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Retry delays cannot be negative");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("Max delay " + maxDelay + " is shorter than initial delay " + initialDelay);
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, BackoffStrategy.EXPONENTIAL, Duration.ofMillis(1000), Duration.ofMillis(10000), true);
    }

    /**
     * A policy that makes exactly one attempt.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, BackoffStrategy.LINEAR, Duration.ZERO, Duration.ZERO, false);
    }

    /**
     * Delay after the given attempt failed, clamped to {@link #maxDelay()}, without jitter.
     */
    public long computeDelayMs(int attempt) {
        double base = backoffStrategy.baseDelayMs(initialDelay.toMillis(), attempt);
        return (long) Math.min(base, maxDelay.toMillis());
    }

    /**
     * Delay after the given attempt failed, with jitter applied when enabled.
     *
     * @param random source of uniform values in [0, 1)
     */
    public long delayBeforeRetry(int attempt, DoubleSupplier random) {
        long delay = computeDelayMs(attempt);
        if (!jitterEnabled) {
            return delay;
        }
        double factor = MIN_JITTER_FACTOR + (1.0 - MIN_JITTER_FACTOR) * random.getAsDouble();
        return Math.round(delay * factor);
    }
}
