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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the named periodic Vert.x timers of one component.
 *
 * <p>Tasks can only be scheduled between {@link #start()} and {@link #stop()}; stopping
 * cancels every timer the scheduler created, so nothing keeps ticking after its owner
 * shut down.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 */
public class TaskScheduler {

    private static final Logger logger = LoggerFactory.getLogger(TaskScheduler.class);

    private final Vertx vertx;
    private final String owner;
    private final Map<String, Long> timers = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public TaskScheduler(Vertx vertx, String owner) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.owner = Objects.requireNonNull(owner, "Owner cannot be null");
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            logger.debug("Scheduler for {} started", owner);
        }
    }

    /**
     * Schedules a named task at a fixed period, replacing any task with the same name.
     *
     * @throws IllegalStateException if the scheduler is not running
     */
    public void schedulePeriodic(String name, long intervalMs, Runnable task) {
        Objects.requireNonNull(name, "Task name cannot be null");
        Objects.requireNonNull(task, "Task cannot be null");
        if (!running.get()) {
            throw new IllegalStateException("Scheduler for " + owner + " is not running");
        }
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("Interval must be positive, got: " + intervalMs);
        }
        long timerId = vertx.setPeriodic(intervalMs, id -> runSafely(name, task));
        Long previous = timers.put(name, timerId);
        if (previous != null) {
            vertx.cancelTimer(previous);
        }
        logger.debug("Scheduled {} task '{}' every {}ms", owner, name, intervalMs);
    }

    public boolean cancel(String name) {
        Long timerId = timers.remove(name);
        return timerId != null && vertx.cancelTimer(timerId);
    }

    /**
     * Cancels every task. Safe to call more than once.
     */
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }
        timers.forEach((name, timerId) -> vertx.cancelTimer(timerId));
        int cancelled = timers.size();
        timers.clear();
        logger.debug("Scheduler for {} stopped, {} task(s) cancelled", owner, cancelled);
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isScheduled(String name) {
        return timers.containsKey(name);
    }

    public Set<String> scheduledTasks() {
        return Set.copyOf(timers.keySet());
    }

    private void runSafely(String name, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            logger.error("Scheduled task '{}' of {} failed: {}", name, owner, e.getMessage(), e);
        }
    }
}
