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


package dev.mars.aegis.messaging;

import dev.mars.aegis.core.Priority;
import dev.mars.aegis.resilience.MutableClock;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PeerMessageValidator")
class PeerMessageValidatorTest {

    private MutableClock clock;
    private PeerMessageValidator validator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingNow();
        validator = new PeerMessageValidator(clock);
    }

    private PeerMessage message() {
        return new PeerMessage("msg-1", clock.instant(), "alice", null, "tasks", "task_assigned",
                Priority.HIGH, new JsonObject().put("task", "index"), MessageMetadata.of("corr-1"));
    }

    @Test
    @DisplayName("A well-formed message has no problems")
    void valid() {
        assertTrue(validator.isValid(message()));
    }

    @Test
    @DisplayName("Every missing field is reported")
    void missingFields() {
        PeerMessage empty = new PeerMessage(null, null, " ", null, null, null, null, null, null);

        List<String> problems = validator.validate(empty);

        assertTrue(problems.containsAll(List.of(
                "message id is required",
                "source agent is required",
                "topic is required",
                "message type is required",
                "timestamp is required",
                "payload is required",
                "metadata is required")), problems.toString());
    }

    @Test
    @DisplayName("Timestamps beyond the allowed clock skew are rejected")
    void futureTimestamp() {
        PeerMessage slightlyAhead = new PeerMessage("msg-1", clock.instant().plus(Duration.ofMinutes(4)), "alice",
                null, "tasks", "t", null, new JsonObject(), MessageMetadata.of("corr-1"));
        PeerMessage farAhead = new PeerMessage("msg-2", clock.instant().plus(Duration.ofMinutes(6)), "alice",
                null, "tasks", "t", null, new JsonObject(), MessageMetadata.of("corr-1"));

        assertTrue(validator.isValid(slightlyAhead));
        assertEquals(List.of("timestamp is too far in the future"), validator.validate(farAhead));
    }

    @Test
    @DisplayName("Metadata bounds are enforced")
    void metadataBounds() {
        MessageMetadata metadata = new MessageMetadata("corr-1", Duration.ofHours(25).toMillis(), 11, 21,
                "r".repeat(201), null);

        List<String> problems = validator.validate(message().withMetadata(metadata));

        assertEquals(4, problems.size(), problems.toString());
        assertTrue(problems.contains("ttl must be at most 24 hours"));
        assertTrue(problems.contains("retry count must be between 0 and 10"));
    }

    @Test
    @DisplayName("Oversized fields and payloads are rejected")
    void sizeLimits() {
        PeerMessage longSource = message().withSourceAgent("a".repeat(51));
        PeerMessage bigPayload = new PeerMessage("msg-1", clock.instant(), "alice", null, "tasks", "t", null,
                new JsonObject().put("blob", "x".repeat(PeerMessageValidator.MAX_PAYLOAD_BYTES)),
                MessageMetadata.of("corr-1"));

        assertEquals(List.of("source agent must be 50 characters or less"), validator.validate(longSource));
        assertEquals(List.of("payload must be smaller than 1MB"), validator.validate(bigPayload));
    }

    @Test
    @DisplayName("Payloads holding values JSON cannot represent are rejected")
    void unencodablePayload() {
        PeerMessage message = new PeerMessage("msg-1", clock.instant(), "alice", null, "tasks", "t", null,
                new JsonObject().put("handle", new Object()), MessageMetadata.of("corr-1"));

        assertEquals(List.of("payload is not JSON-encodable"), validator.validate(message));
    }

    @Test
    @DisplayName("Expiry is measured from the message timestamp")
    void expiry() {
        PeerMessage message = message().withMetadata(MessageMetadata.of("corr-1").withTtl(1000));
        Instant sent = message.timestamp();

        assertFalse(message.isExpired(sent.plusMillis(1000)));
        assertTrue(message.isExpired(sent.plusMillis(1001)));
    }

    @Test
    @DisplayName("A null message is reported rather than thrown")
    void nullMessage() {
        assertEquals(List.of("message is required"), validator.validate(null));
    }
}
