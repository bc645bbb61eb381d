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


package dev.mars.aegis.agent;

import dev.mars.aegis.core.exceptions.InvalidTransitionException;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Mutable state of one agent, owned by its {@link AgentLifecycleManager}.
 *
 * <p>All access is synchronized on the instance. Readers receive copies.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 */
public class AgentState {

    public static final int RECENT_ERROR_CAPACITY = 50;

    private final String agentId;
    private AgentStatus status = AgentStatus.INITIALIZING;
    private Instant lastHeartbeat;
    private Instant startedAt;

    private long requestsProcessed;
    private long failedRequests;
    private double averageResponseTimeMs;
    private long memoryUsageMb;
    private double cpuUsage;

    private final Deque<AgentError> recentErrors = new ArrayDeque<>();

    public AgentState(String agentId) {
        this.agentId = Objects.requireNonNull(agentId, "Agent id cannot be null");
        this.lastHeartbeat = Instant.now();
        this.startedAt = lastHeartbeat;
    }

    /**
     * Clears metrics and errors at the start of initialization.
     */
    synchronized void reset(Instant now) {
        startedAt = now;
        lastHeartbeat = now;
        requestsProcessed = 0;
        failedRequests = 0;
        averageResponseTimeMs = 0.0;
        memoryUsageMb = 0;
        cpuUsage = 0.0;
        recentErrors.clear();
    }

    /**
     * @return the status before the transition
     * @throws InvalidTransitionException if the move is not in the transition table
     */
    synchronized AgentStatus transitionTo(AgentStatus target) throws InvalidTransitionException {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException(agentId, status, target, status.getValidTransitions());
        }
        AgentStatus previous = status;
        status = target;
        return previous;
    }

    synchronized void recordRequest(long processingTimeMs, boolean success) {
        requestsProcessed++;
        averageResponseTimeMs += (processingTimeMs - averageResponseTimeMs) / requestsProcessed;
        if (!success) {
            failedRequests++;
        }
    }

    synchronized void recordError(AgentError error) {
        recentErrors.addLast(error);
        while (recentErrors.size() > RECENT_ERROR_CAPACITY) {
            recentErrors.removeFirst();
        }
    }

    synchronized void heartbeat(Instant now) {
        lastHeartbeat = now;
    }

    synchronized void refreshSystemMetrics(long memoryMb, double cpu) {
        this.memoryUsageMb = memoryMb;
        this.cpuUsage = cpu;
    }

    // ==================== Readers ====================

    public String getAgentId() {
        return agentId;
    }

    public synchronized AgentStatus getStatus() {
        return status;
    }

    public synchronized Instant getLastHeartbeat() {
        return lastHeartbeat;
    }

    public synchronized Instant getStartedAt() {
        return startedAt;
    }

    public synchronized double getErrorRate() {
        return requestsProcessed == 0 ? 0.0 : (double) failedRequests / requestsProcessed;
    }

    public synchronized List<AgentError> getRecentErrors() {
        return List.copyOf(recentErrors);
    }

    public synchronized AgentError getLastError() {
        return recentErrors.peekLast();
    }

    public synchronized AgentMetricsSnapshot snapshot(Instant now) {
        long uptime = status == AgentStatus.RUNNING ? Math.max(0, now.toEpochMilli() - startedAt.toEpochMilli()) : 0;
        return new AgentMetricsSnapshot(requestsProcessed, averageResponseTimeMs, getErrorRate(), uptime,
                memoryUsageMb, cpuUsage);
    }
}
