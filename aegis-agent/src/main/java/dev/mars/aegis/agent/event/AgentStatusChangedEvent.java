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


package dev.mars.aegis.agent.event;

import dev.mars.aegis.agent.AgentStatus;
import dev.mars.aegis.event.RuntimeEvent;

import java.time.Instant;

/**
 * Published on every lifecycle transition of an agent.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 */
public record AgentStatusChangedEvent(String agentId, AgentStatus previousStatus, AgentStatus newStatus,
                                      Instant timestamp) implements RuntimeEvent {
}
