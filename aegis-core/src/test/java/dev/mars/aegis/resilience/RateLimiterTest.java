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

import dev.mars.aegis.core.ErrorKind;
import dev.mars.aegis.core.exceptions.CallException;
import dev.mars.aegis.event.EventPublisher;
import dev.mars.aegis.event.RateLimitTimeoutEvent;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the token bucket and its FIFO wait queue.
 *
 * <p>The refill ticker is left stopped in most tests and {@link RateLimiter#refill(long)} is
 * driven directly so that token arithmetic is deterministic.</p>
 */
@ExtendWith(VertxExtension.class)
@DisplayName("RateLimiter")
class RateLimiterTest {

    private final EventPublisher events = new EventPublisher();
    private RateLimiter limiter;

    @AfterEach
    void tearDown() {
        if (limiter != null) {
            limiter.stop();
        }
    }

    private static void drain(RateLimiter limiter) {
        while (limiter.tokensAvailable() > 0) {
            assertTrue(limiter.acquire().succeeded());
        }
    }

    @Nested
    @DisplayName("Immediate grants")
    class ImmediateGrants {

        @Test
        @DisplayName("Should grant immediately while whole tokens remain")
        void grantsImmediately(Vertx vertx) {
            limiter = new RateLimiter(vertx, "test", 5, 30000, events);

            Future<Void> grant = limiter.acquire();

            assertTrue(grant.succeeded(), "Grant should already be complete");
            assertEquals(4, limiter.tokensAvailable());
            assertEquals(0, limiter.queueLength());
        }

        @Test
        @DisplayName("61 requests against capacity 60 should queue exactly one caller")
        void sixtyOneRequestsQueueOne(Vertx vertx) {
            limiter = new RateLimiter(vertx, "test", 60, 30000, events);

            int immediate = 0;
            for (int i = 0; i < 61; i++) {
                if (limiter.acquire().succeeded()) {
                    immediate++;
                }
            }

            assertEquals(60, immediate);
            assertEquals(1, limiter.queueLength());
            assertEquals(0, limiter.tokensAvailable());
        }

        @Test
        @DisplayName("Should queue a caller behind waiters even after tokens appear")
        void doesNotJumpTheQueue(Vertx vertx) {
            limiter = new RateLimiter(vertx, "test", 60, 30000, events);
            drain(limiter);
            Future<Void> first = limiter.acquire();

            limiter.refill(500);
            Future<Void> second = limiter.acquire();

            assertFalse(first.isComplete(), "Half a token should not release the first waiter");
            assertFalse(second.isComplete(), "A new caller must wait behind the queue");
            assertEquals(2, limiter.queueLength());
        }
    }

    @Nested
    @DisplayName("Refill")
    class Refill {

        @Test
        @DisplayName("Should add capacity/60 tokens per second")
        void refillsProportionally(Vertx vertx) {
            limiter = new RateLimiter(vertx, "test", 60, 30000, events);
            drain(limiter);

            limiter.refill(3000);

            assertEquals(3, limiter.tokensAvailable());
        }

        @Test
        @DisplayName("Should accumulate fractional tokens across refills")
        void accumulatesFractions(Vertx vertx) {
            limiter = new RateLimiter(vertx, "test", 30, 30000, events);
            drain(limiter);

            limiter.refill(1000);
            assertEquals(0, limiter.tokensAvailable(), "Half a token is not yet a whole token");

            limiter.refill(1000);
            assertEquals(1, limiter.tokensAvailable());
        }

        @Test
        @DisplayName("Should never exceed capacity")
        void cappedAtCapacity(Vertx vertx) {
            limiter = new RateLimiter(vertx, "test", 10, 30000, events);

            limiter.refill(600_000);

            assertEquals(10, limiter.tokensAvailable());
        }

        @Test
        @DisplayName("Should release queued callers in arrival order")
        void releasesFifo(Vertx vertx, VertxTestContext ctx) {
            limiter = new RateLimiter(vertx, "test", 60, 30000, events);
            drain(limiter);

            List<Integer> order = new CopyOnWriteArrayList<>();
            List<Future<Void>> waiters = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                int position = i;
                waiters.add(limiter.acquire().onSuccess(v -> order.add(position)));
            }

            limiter.refill(1000);
            assertEquals(List.of(0), order);
            assertEquals(2, limiter.queueLength());

            limiter.refill(2000);

            Future.all(waiters).onComplete(ctx.succeeding(v -> ctx.verify(() -> {
                assertEquals(List.of(0, 1, 2), order);
                assertEquals(0, limiter.queueLength());
                assertEquals(0, limiter.tokensAvailable(), "Every released token was consumed exactly once");
                ctx.completeNow();
            })));
        }

        @Test
        @DisplayName("Running ticker should release a queued caller within about a second")
        void tickerReleases(Vertx vertx, VertxTestContext ctx) {
            limiter = new RateLimiter(vertx, "test", 60, 5000, events);
            drain(limiter);
            limiter.start();

            long start = System.currentTimeMillis();
            limiter.acquire().onComplete(ctx.succeeding(v -> ctx.verify(() -> {
                long waited = System.currentTimeMillis() - start;
                assertTrue(waited < 3000, "Waited too long for a token: " + waited + "ms");
                ctx.completeNow();
            })));
        }
    }

    @Nested
    @DisplayName("Timeouts and stop")
    class TimeoutsAndStop {

        @Test
        @DisplayName("Queued caller should fail with RATE_LIMIT_TIMEOUT and leave the queue")
        void queuedCallerTimesOut(Vertx vertx, VertxTestContext ctx) {
            List<RateLimitTimeoutEvent> published = new CopyOnWriteArrayList<>();
            events.subscribe(RateLimitTimeoutEvent.class, published::add);
            limiter = new RateLimiter(vertx, "slow", 1, 100, events);
            drain(limiter);

            limiter.acquire().onComplete(ctx.failing(err -> ctx.verify(() -> {
                assertInstanceOf(CallException.class, err);
                assertEquals(ErrorKind.RATE_LIMIT_TIMEOUT, ((CallException) err).getKind());
                assertEquals(0, limiter.queueLength());
                assertEquals(1, limiter.getTimeoutCount());
                assertEquals(1, published.size());
                assertEquals("slow", published.get(0).endpoint());
                ctx.completeNow();
            })));
            assertEquals(1, limiter.queueLength());
        }

        @Test
        @DisplayName("Stopping should fail every queued caller")
        void stopFailsWaiters(Vertx vertx, VertxTestContext ctx) {
            limiter = new RateLimiter(vertx, "test", 1, 30000, events);
            drain(limiter);
            Future<Void> first = limiter.acquire();
            Future<Void> second = limiter.acquire();

            limiter.stop();

            Future.join(first, second).onComplete(ar -> ctx.verify(() -> {
                assertTrue(first.failed());
                assertTrue(second.failed());
                assertEquals(ErrorKind.RATE_LIMIT_TIMEOUT, ((CallException) first.cause()).getKind());
                assertEquals(0, limiter.queueLength());
                ctx.completeNow();
            }));
        }

        @Test
        @DisplayName("Should reject non-positive capacity")
        void rejectsInvalidCapacity(Vertx vertx) {
            assertThrows(IllegalArgumentException.class, () -> new RateLimiter(vertx, "bad", 0, 1000, events));
        }
    }
}
