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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RetryPolicy")
class RetryPolicyTest {

    private static RetryPolicy policy(BackoffStrategy strategy, long initialMs, long maxMs, boolean jitter) {
        return new RetryPolicy(5, strategy, Duration.ofMillis(initialMs), Duration.ofMillis(maxMs), jitter);
    }

    @ParameterizedTest(name = "exponential attempt {0} -> {1}ms")
    @CsvSource({"1, 1000", "2, 2000", "3, 4000", "4, 8000", "5, 10000", "8, 10000"})
    void exponentialDelays(int attempt, long expected) {
        assertEquals(expected, policy(BackoffStrategy.EXPONENTIAL, 1000, 10000, false).computeDelayMs(attempt));
    }

    @ParameterizedTest(name = "linear attempt {0} -> {1}ms")
    @CsvSource({"1, 500", "2, 1000", "3, 1500", "10, 3000"})
    void linearDelays(int attempt, long expected) {
        assertEquals(expected, policy(BackoffStrategy.LINEAR, 500, 3000, false).computeDelayMs(attempt));
    }

    @Test
    @DisplayName("Exponential attempt 3 without jitter should wait 4000ms")
    void exponentialThirdAttempt() {
        RetryPolicy defaults = new RetryPolicy(3, BackoffStrategy.EXPONENTIAL, Duration.ofMillis(1000),
                Duration.ofMillis(10000), false);

        assertEquals(4000, defaults.delayBeforeRetry(3, () -> 0.99));
    }

    @Test
    @DisplayName("Jitter should scale the delay into [0.5, 1.0]")
    void jitterBounds() {
        RetryPolicy jittered = policy(BackoffStrategy.EXPONENTIAL, 1000, 10000, true);

        assertEquals(1000, jittered.delayBeforeRetry(2, () -> 0.0));
        assertEquals(1500, jittered.delayBeforeRetry(2, () -> 0.5));
        long upper = jittered.delayBeforeRetry(2, () -> 0.999999);
        assertTrue(upper <= 2000 && upper >= 1999, "Upper bound should approach the full delay: " + upper);
    }

    @Test
    @DisplayName("Should reject inconsistent settings")
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, BackoffStrategy.LINEAR,
                Duration.ofMillis(10), Duration.ofMillis(10), false));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, BackoffStrategy.LINEAR,
                Duration.ofMillis(100), Duration.ofMillis(10), false));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, BackoffStrategy.LINEAR,
                Duration.ofMillis(-1), Duration.ofMillis(10), false));
    }

    @Test
    @DisplayName("Backoff strategy should parse its configuration value")
    void parsesStrategy() {
        assertEquals(BackoffStrategy.LINEAR, BackoffStrategy.fromValue("linear"));
        assertEquals(BackoffStrategy.EXPONENTIAL, BackoffStrategy.fromValue("EXPONENTIAL"));
        assertThrows(IllegalArgumentException.class, () -> BackoffStrategy.fromValue("fibonacci"));
    }
}
