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


package dev.mars.aegis.scheduling;

import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
@DisplayName("TaskScheduler")
class TaskSchedulerTest {

    private TaskScheduler scheduler;

    @BeforeEach
    void setUp(Vertx vertx) {
        scheduler = new TaskScheduler(vertx, "test");
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    @DisplayName("Should refuse to schedule before start")
    void refusesWhenStopped() {
        assertThrows(IllegalStateException.class, () -> scheduler.schedulePeriodic("x", 100, () -> { }));
    }

    @Test
    @DisplayName("Should reject non-positive intervals")
    void rejectsInvalidInterval() {
        scheduler.start();
        assertThrows(IllegalArgumentException.class, () -> scheduler.schedulePeriodic("x", 0, () -> { }));
    }

    @Test
    @DisplayName("Should run periodic tasks and survive a throwing task")
    void runsTasks(VertxTestContext ctx) {
        AtomicInteger runs = new AtomicInteger();
        AtomicInteger failures = new AtomicInteger();
        scheduler.start();
        scheduler.schedulePeriodic("counter", 20, runs::incrementAndGet);
        scheduler.schedulePeriodic("broken", 20, () -> {
            failures.incrementAndGet();
            throw new IllegalStateException("task failure");
        });

        await().atMost(Duration.ofSeconds(2)).until(() -> runs.get() >= 3 && failures.get() >= 3);
        assertEquals(Set.of("counter", "broken"), scheduler.scheduledTasks());
        ctx.completeNow();
    }

    @Test
    @DisplayName("Stop should cancel every task")
    void stopCancels() throws InterruptedException {
        AtomicInteger runs = new AtomicInteger();
        scheduler.start();
        scheduler.schedulePeriodic("counter", 10, runs::incrementAndGet);
        await().atMost(Duration.ofSeconds(2)).until(() -> runs.get() >= 1);

        scheduler.stop();
        int afterStop = runs.get();
        Thread.sleep(100);

        assertFalse(scheduler.isRunning());
        assertTrue(scheduler.scheduledTasks().isEmpty());
        assertTrue(runs.get() <= afterStop + 1);
    }

    @Test
    @DisplayName("Cancel should remove a single task")
    void cancelOne() {
        scheduler.start();
        scheduler.schedulePeriodic("a", 1000, () -> { });
        scheduler.schedulePeriodic("b", 1000, () -> { });

        assertTrue(scheduler.cancel("a"));
        assertFalse(scheduler.cancel("a"));
        assertFalse(scheduler.isScheduled("a"));
        assertTrue(scheduler.isScheduled("b"));
    }
}
