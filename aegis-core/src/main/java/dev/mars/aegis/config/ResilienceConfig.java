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


package dev.mars.aegis.config;

import dev.mars.aegis.resilience.BackoffStrategy;
import dev.mars.aegis.resilience.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Resilience settings applied to one endpoint: rate limit, circuit breaker and retry.
 *
 * <p>Global values live under {@code aegis.resilience.*}; an endpoint may override any of
 * them under {@code aegis.endpoint.<name>.*}, for example
 * {@code aegis.endpoint.generation.rate-limit-per-minute=30}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public record ResilienceConfig(
        int rateLimitPerMinute,
        int circuitBreakerThreshold,
        int retryMaxAttempts,
        BackoffStrategy retryBackoffStrategy,
        long retryInitialDelayMs,
        long retryMaxDelayMs,
        boolean retryJitter,
        long circuitOpenDurationMs,
        long rateLimitQueueTimeoutMs
) {

    private static final Logger logger = LoggerFactory.getLogger(ResilienceConfig.class);

    public static final String GLOBAL_PREFIX = "aegis.resilience.";
    public static final String ENDPOINT_PREFIX = "aegis.endpoint.";

    // Default configuration values
    public static final int DEFAULT_RATE_LIMIT_PER_MINUTE = 60;
    public static final int DEFAULT_CIRCUIT_BREAKER_THRESHOLD = 5;
    public static final int DEFAULT_RETRY_MAX_ATTEMPTS = 3;
    public static final BackoffStrategy DEFAULT_RETRY_BACKOFF_STRATEGY = BackoffStrategy.EXPONENTIAL;
    public static final long DEFAULT_RETRY_INITIAL_DELAY_MS = 1000;
    public static final long DEFAULT_RETRY_MAX_DELAY_MS = 10000;
    public static final boolean DEFAULT_RETRY_JITTER = true;
    public static final long DEFAULT_CIRCUIT_OPEN_DURATION_MS = 30000;
    public static final long DEFAULT_RATE_LIMIT_QUEUE_TIMEOUT_MS = 30000;

    public ResilienceConfig {
        Objects.requireNonNull(retryBackoffStrategy, "Backoff strategy cannot be null");
        requirePositive("rateLimitPerMinute", rateLimitPerMinute);
        requirePositive("circuitBreakerThreshold", circuitBreakerThreshold);
        requirePositive("retryMaxAttempts", retryMaxAttempts);
        requirePositive("circuitOpenDurationMs", circuitOpenDurationMs);
        requirePositive("rateLimitQueueTimeoutMs", rateLimitQueueTimeoutMs);
        if (retryInitialDelayMs < 0 || retryMaxDelayMs < retryInitialDelayMs) {
            throw new IllegalArgumentException(String.format(
                    "Retry delays must satisfy 0 <= initial (%d) <= max (%d)", retryInitialDelayMs, retryMaxDelayMs));
        }
    }

    public static ResilienceConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves the global settings.
     */
    public static ResilienceConfig from(AegisConfiguration config) {
        return resolve(config, defaults(), GLOBAL_PREFIX);
    }

    /**
     * Resolves settings for one endpoint, falling back to the global settings for each key.
     */
    public static ResilienceConfig forEndpoint(AegisConfiguration config, String endpoint) {
        Objects.requireNonNull(endpoint, "Endpoint name cannot be null");
        ResilienceConfig global = from(config);
        ResilienceConfig resolved = resolve(config, global, ENDPOINT_PREFIX + endpoint + ".");
        if (!resolved.equals(global)) {
            logger.debug("Endpoint '{}' overrides global resilience settings: {}", endpoint, resolved.toMap());
        }
        return resolved;
    }

    private static ResilienceConfig resolve(AegisConfiguration config, ResilienceConfig fallback, String prefix) {
        BackoffStrategy strategy = fallback.retryBackoffStrategy();
        String strategyValue = config.getString(prefix + "retry-backoff-strategy", null);
        if (strategyValue != null) {
            try {
                strategy = BackoffStrategy.fromValue(strategyValue);
            } catch (IllegalArgumentException e) {
                logger.warn("Invalid backoff strategy for {}: '{}', using {}",
                        prefix + "retry-backoff-strategy", strategyValue, strategy.getValue());
            }
        }
        return new ResilienceConfig(
                config.getInt(prefix + "rate-limit-per-minute", fallback.rateLimitPerMinute()),
                config.getInt(prefix + "circuit-breaker-threshold", fallback.circuitBreakerThreshold()),
                config.getInt(prefix + "retry-max-attempts", fallback.retryMaxAttempts()),
                strategy,
                config.getLong(prefix + "retry-initial-delay-ms", fallback.retryInitialDelayMs()),
                config.getLong(prefix + "retry-max-delay-ms", fallback.retryMaxDelayMs()),
                config.getBoolean(prefix + "retry-jitter", fallback.retryJitter()),
                config.getLong(prefix + "circuit-open-duration-ms", fallback.circuitOpenDurationMs()),
                config.getLong(prefix + "rate-limit-queue-timeout-ms", fallback.rateLimitQueueTimeoutMs()));
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(retryMaxAttempts, retryBackoffStrategy,
                Duration.ofMillis(retryInitialDelayMs), Duration.ofMillis(retryMaxDelayMs), retryJitter);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("rateLimitPerMinute", rateLimitPerMinute);
        map.put("circuitBreakerThreshold", circuitBreakerThreshold);
        map.put("retryMaxAttempts", retryMaxAttempts);
        map.put("retryBackoffStrategy", retryBackoffStrategy.getValue());
        map.put("retryInitialDelayMs", retryInitialDelayMs);
        map.put("retryMaxDelayMs", retryMaxDelayMs);
        map.put("retryJitter", retryJitter);
        map.put("circuitOpenDurationMs", circuitOpenDurationMs);
        map.put("rateLimitQueueTimeoutMs", rateLimitQueueTimeoutMs);
        return map;
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
    }

    /**
     * Builder starting from the documented defaults.
     */
    public static final class Builder {
        private int rateLimitPerMinute = DEFAULT_RATE_LIMIT_PER_MINUTE;
        private int circuitBreakerThreshold = DEFAULT_CIRCUIT_BREAKER_THRESHOLD;
        private int retryMaxAttempts = DEFAULT_RETRY_MAX_ATTEMPTS;
        private BackoffStrategy retryBackoffStrategy = DEFAULT_RETRY_BACKOFF_STRATEGY;
        private long retryInitialDelayMs = DEFAULT_RETRY_INITIAL_DELAY_MS;
        private long retryMaxDelayMs = DEFAULT_RETRY_MAX_DELAY_MS;
        private boolean retryJitter = DEFAULT_RETRY_JITTER;
        private long circuitOpenDurationMs = DEFAULT_CIRCUIT_OPEN_DURATION_MS;
        private long rateLimitQueueTimeoutMs = DEFAULT_RATE_LIMIT_QUEUE_TIMEOUT_MS;

        private Builder() {
        }

        public Builder rateLimitPerMinute(int rateLimitPerMinute) {
            this.rateLimitPerMinute = rateLimitPerMinute;
            return this;
        }

        public Builder circuitBreakerThreshold(int circuitBreakerThreshold) {
            this.circuitBreakerThreshold = circuitBreakerThreshold;
            return this;
        }

        public Builder retryMaxAttempts(int retryMaxAttempts) {
            this.retryMaxAttempts = retryMaxAttempts;
            return this;
        }

        public Builder retryBackoffStrategy(BackoffStrategy retryBackoffStrategy) {
            this.retryBackoffStrategy = retryBackoffStrategy;
            return this;
        }

        public Builder retryInitialDelayMs(long retryInitialDelayMs) {
            this.retryInitialDelayMs = retryInitialDelayMs;
            return this;
        }

        public Builder retryMaxDelayMs(long retryMaxDelayMs) {
            this.retryMaxDelayMs = retryMaxDelayMs;
            return this;
        }

        public Builder retryJitter(boolean retryJitter) {
            this.retryJitter = retryJitter;
            return this;
        }

        public Builder circuitOpenDurationMs(long circuitOpenDurationMs) {
            this.circuitOpenDurationMs = circuitOpenDurationMs;
            return this;
        }

        public Builder rateLimitQueueTimeoutMs(long rateLimitQueueTimeoutMs) {
            this.rateLimitQueueTimeoutMs = rateLimitQueueTimeoutMs;
            return this;
        }

        public ResilienceConfig build() {
            return new ResilienceConfig(rateLimitPerMinute, circuitBreakerThreshold, retryMaxAttempts,
                    retryBackoffStrategy, retryInitialDelayMs, retryMaxDelayMs, retryJitter,
                    circuitOpenDurationMs, rateLimitQueueTimeoutMs);
        }
    }
}
