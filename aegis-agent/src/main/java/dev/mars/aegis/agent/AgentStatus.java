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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle states of an agent process.
 *
 * <ul>
 *   <li>{@code INITIALIZING} until every call envelope has started and the agent has
 *   registered with the peer hub</li>
 *   <li>{@code RUNNING} while requests are accepted</li>
 *   <li>{@code ERROR} when initialization failed</li>
 *   <li>{@code STOPPED} after shutdown; terminal</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
public enum AgentStatus {

    INITIALIZING("initializing", 3),
    RUNNING("running", 1),
    ERROR("error", 2),
    STOPPED("stopped", 0);

    // ── Transition table (single source of truth) ──────────────────────

    private static final Map<AgentStatus, Set<AgentStatus>> TRANSITIONS;

    static {
        var map = new EnumMap<AgentStatus, Set<AgentStatus>>(AgentStatus.class);
        map.put(INITIALIZING, EnumSet.of(RUNNING, ERROR));
        map.put(RUNNING, EnumSet.of(STOPPED));
        map.put(ERROR, EnumSet.of(STOPPED));
        map.put(STOPPED, EnumSet.noneOf(AgentStatus.class));
        map.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        TRANSITIONS = Collections.unmodifiableMap(map);
    }

    private final String value;
    private final int gaugeValue;

    AgentStatus(String value, int gaugeValue) {
        this.value = value;
        this.gaugeValue = gaugeValue;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Numeric form exported by the status gauge: 0 stopped, 1 running, 2 error, 3 initializing.
     */
    public int getGaugeValue() {
        return gaugeValue;
    }

    public boolean canTransitionTo(AgentStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public AgentStatus[] getValidTransitions() {
        return TRANSITIONS.get(this).toArray(new AgentStatus[0]);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    @Override
    public String toString() {
        return value;
    }
}
