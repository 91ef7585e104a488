package me.golemcore.continuity.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.continuity.domain.model.Assertion;
import me.golemcore.continuity.domain.model.BoundaryInfo;
import me.golemcore.continuity.domain.model.BoundaryProximity;
import me.golemcore.continuity.domain.model.BoundaryRecordResult;
import me.golemcore.continuity.domain.model.BoundaryRequest;
import me.golemcore.continuity.domain.model.SessionBoundaryCreatedEvent;
import me.golemcore.continuity.domain.model.SessionBoundaryMarker;
import me.golemcore.continuity.domain.model.SessionState;
import me.golemcore.continuity.domain.model.TestSummary;
import me.golemcore.continuity.infrastructure.config.ContinuityProperties;
import me.golemcore.continuity.infrastructure.event.SpringEventBus;
import me.golemcore.continuity.infrastructure.lifecycle.InitializationGuard;
import me.golemcore.continuity.infrastructure.lifecycle.InitializationResult;
import me.golemcore.continuity.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Per-session key-value store with cross-session lookup.
 *
 * <p>
 * Each session owns one flat JSON object at
 * {@code sessions/data/<sessionId>.json}; keys are either plain or
 * {@code namespace:key}. The active session is taken from
 * {@link SessionBoundaryTracker#getCurrentSessionId()} on every call, so a
 * timeout rollover moves subsequent writes into the new session's file while
 * earlier values stay reachable through
 * {@link #retrieveAcrossSessions(String)}.
 *
 * <p>
 * Writes to one session file are serialized by a per-session lock and replace
 * the file atomically. Failures are logged and surface as {@code false},
 * {@code null} or empty results.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class SessionDataStore {

    static final String DATA_DIR = SessionBoundaryTracker.SESSIONS_DIR + "/data";
    static final String ASSERTIONS_KEY = "assertions";
    static final String TEST_SUMMARY_KEY = "testSummary";
    public static final String LAST_CONTEXT_INJECTION_KEY = "last_context_injection";
    private static final String TEST_RESULTS_DIR = "test-results";
    private static final String JSON_SUFFIX = ".json";
    private static final String BOUNDARY_KEY_PREFIX = "boundary-";
    private static final String SESSION_BOUNDARY_TYPE = "session_boundary";
    private static final String BOUNDARY_SOURCE = "session-data-store";
    private static final int LOCK_STRIPES = 64;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final SessionBoundaryTracker tracker;
    private final SpringEventBus eventBus;
    private final Clock clock;
    private final InitializationGuard initGuard;

    private final Object[] sessionLocks = newLockStripes();

    public SessionDataStore(StoragePort storagePort, ObjectMapper objectMapper, SessionBoundaryTracker tracker,
            SpringEventBus eventBus, Clock clock, ContinuityProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.tracker = tracker;
        this.eventBus = eventBus;
        this.clock = clock;
        this.initGuard = new InitializationGuard("session-data-store", properties.getInit().getMaxAttempts());
    }

    public InitializationResult initialize() {
        return initGuard.ensureInitialized(() -> {
            storagePort.ensureDirectory(DATA_DIR).join();
            InitializationResult trackerInit = tracker.initialize();
            if (!trackerInit.isSuccess()) {
                throw new IllegalStateException("Session tracker unavailable: " + trackerInit.getError());
            }
        });
    }

    // ==================== Key-value operations ====================

    public boolean store(String namespace, String key, Object value) {
        return store(fullKey(namespace, key), value);
    }

    /**
     * Stores {@code value} under {@code key} in the active session.
     */
    public boolean store(String key, Object value) {
        if (!ready("store")) {
            return false;
        }
        String sessionId = tracker.getCurrentSessionId();
        try {
            JsonNode node = objectMapper.valueToTree(value);
            updateSession(sessionId, data -> data.set(key, node));
            log.debug("[SessionData] Stored {} in session {}", key, sessionId);
            return true;
        } catch (RuntimeException e) {
            log.error("[SessionData] Failed to store {} in session {}: {}", key, sessionId, e.getMessage(), e);
            return false;
        }
    }

    public JsonNode get(String namespace, String key) {
        return get(fullKey(namespace, key));
    }

    /**
     * Reads a key from the active session only.
     *
     * @return the stored value, or {@code null} when absent
     */
    public JsonNode get(String key) {
        if (!ready("get")) {
            return null;
        }
        String sessionId = tracker.getCurrentSessionId();
        try {
            ObjectNode data = readSession(sessionId);
            return data.get(key);
        } catch (RuntimeException e) {
            log.error("[SessionData] Failed to read {} from session {}: {}", key, sessionId, e.getMessage(), e);
            return null;
        }
    }

    /**
     * Reads a key from the active session converted to {@code type}.
     */
    public <T> T get(String key, Class<T> type) {
        JsonNode node = get(key);
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            log.warn("[SessionData] Value of {} is not a {}: {}", key, type.getSimpleName(), e.getMessage());
            return null;
        }
    }

    public boolean has(String key) {
        return get(key) != null;
    }

    public boolean delete(String key) {
        if (!ready("delete")) {
            return false;
        }
        String sessionId = tracker.getCurrentSessionId();
        try {
            boolean[] removed = new boolean[1];
            updateSession(sessionId, data -> removed[0] = data.remove(key) != null);
            return removed[0];
        } catch (RuntimeException e) {
            log.error("[SessionData] Failed to delete {} from session {}: {}", key, sessionId, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Removes every key of the active session.
     */
    public boolean clear() {
        if (!ready("clear")) {
            return false;
        }
        String sessionId = tracker.getCurrentSessionId();
        try {
            updateSession(sessionId, ObjectNode::removeAll);
            log.info("[SessionData] Cleared data of session {}", sessionId);
            return true;
        } catch (RuntimeException e) {
            log.error("[SessionData] Failed to clear session {}: {}", sessionId, e.getMessage(), e);
            return false;
        }
    }

    // ==================== Cross-session lookup ====================

    /**
     * Ids of every session that has a data file, in directory order.
     */
    public List<String> listSessions() {
        if (!ready("listSessions")) {
            return List.of();
        }
        try {
            List<String> files = storagePort.listObjects(DATA_DIR, "").join();
            List<String> sessionIds = new ArrayList<>();
            for (String file : files) {
                String name = file.replace('\\', '/');
                if (name.contains("/") || !name.endsWith(JSON_SUFFIX)) {
                    continue;
                }
                sessionIds.add(name.substring(0, name.length() - JSON_SUFFIX.length()));
            }
            log.debug("[SessionData] Found {} sessions with data", sessionIds.size());
            return sessionIds;
        } catch (RuntimeException e) {
            log.error("[SessionData] Failed to list sessions: {}", e.getMessage(), e);
            return List.of();
        }
    }

    public JsonNode retrieveAcrossSessions(String namespace, String key) {
        return retrieveAcrossSessions(fullKey(namespace, key));
    }

    /**
     * Looks up a key in the active session first, then in every other session
     * file. The first match wins; which one it is among several older sessions is
     * not defined.
     */
    public JsonNode retrieveAcrossSessions(String key) {
        if (!ready("retrieveAcrossSessions")) {
            return null;
        }
        String currentId = tracker.getCurrentSessionId();
        try {
            JsonNode current = readSession(currentId).get(key);
            if (current != null) {
                log.debug("[SessionData] Retrieved {} from current session", key);
                return current;
            }

            for (String sessionId : listSessions()) {
                if (sessionId.equals(currentId)) {
                    continue;
                }
                JsonNode value = readSessionQuietly(sessionId).get(key);
                if (value != null) {
                    log.info("[SessionData] Retrieved {} from session {}", key, sessionId);
                    return value;
                }
            }
            log.warn("[SessionData] Data not found in any session: {}", key);
            return null;
        } catch (RuntimeException e) {
            log.error("[SessionData] Failed to retrieve {} across sessions: {}", key, e.getMessage(), e);
            return null;
        }
    }

    /**
     * Reads a key from a specific session file.
     */
    public JsonNode getPreviousSessionData(String sessionId, String key) {
        if (!ready("getPreviousSessionData")) {
            return null;
        }
        return readSessionQuietly(sessionId).get(key);
    }

    // ==================== Assertions ====================

    /**
     * Appends a named check to the {@code assertions} list of the active session.
     */
    public Assertion addAssertion(String name, boolean condition, String message) {
        Assertion assertion = Assertion.builder()
                .name(name)
                .passed(condition)
                .message(message)
                .timestamp(clock.instant())
                .build();
        if (!ready("assert")) {
            return assertion;
        }

        String sessionId = tracker.getCurrentSessionId();
        try {
            JsonNode node = objectMapper.valueToTree(assertion);
            updateSession(sessionId, data -> {
                JsonNode existing = data.get(ASSERTIONS_KEY);
                ArrayNode list = existing instanceof ArrayNode array ? array : data.putArray(ASSERTIONS_KEY);
                list.add(node);
            });
            log.info("[SessionData] Assertion {}: {} - {}", condition ? "PASSED" : "FAILED", name, message);
        } catch (RuntimeException e) {
            log.error("[SessionData] Failed to record assertion {}: {}", name, e.getMessage(), e);
        }
        return assertion;
    }

    /**
     * Summarizes the assertions of the active session, stores the summary under
     * {@code testSummary} and writes {@code test-results/<testId>-report.json}.
     *
     * @return the summary, or {@code null} when it could not be produced
     */
    public TestSummary completeTest() {
        if (!ready("completeTest")) {
            return null;
        }
        String sessionId = tracker.getCurrentSessionId();
        try {
            ObjectNode data = readSession(sessionId);
            List<Assertion> assertions = new ArrayList<>();
            JsonNode stored = data.get(ASSERTIONS_KEY);
            if (stored != null && stored.isArray()) {
                for (JsonNode node : stored) {
                    assertions.add(objectMapper.treeToValue(node, Assertion.class));
                }
            }

            int total = assertions.size();
            int passed = (int) assertions.stream().filter(Assertion::isPassed).count();
            Instant end = clock.instant();
            String testId = data.path("testId").asText("unknown");

            TestSummary summary = TestSummary.builder()
                    .testId(testId)
                    .testName(data.path("testName").asText("Unnamed Test"))
                    .description(data.path("description").asText(""))
                    .sessionId(sessionId)
                    .startTime(data.hasNonNull("startTime") ? data.get("startTime").asText() : end.toString())
                    .endTime(end)
                    .totalAssertions(total)
                    .passedAssertions(passed)
                    .successRate(total > 0 ? (passed * 100.0) / total : 0.0)
                    .assertions(assertions)
                    .build();

            JsonNode summaryNode = objectMapper.valueToTree(summary);
            updateSession(sessionId, d -> d.set(TEST_SUMMARY_KEY, summaryNode));

            String report = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(summary);
            storagePort.putText(TEST_RESULTS_DIR, testId + "-report.json", report).join();
            log.info("[SessionData] Test {} completed, success rate {}%", testId,
                    String.format("%.2f", summary.getSuccessRate()));
            return summary;
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("[SessionData] Failed to complete test in session {}: {}", sessionId, e.getMessage(), e);
            return null;
        }
    }

    // ==================== Boundaries and state ====================

    /**
     * Writes a boundary marker into the active session and records it with the
     * tracker as a {@code session_boundary}. A tracker failure is logged and
     * does not fail the marker.
     */
    public SessionBoundaryMarker createSessionBoundary(Map<String, Object> boundaryData) {
        if (!ready("createSessionBoundary")) {
            return SessionBoundaryMarker.failure(tracker.getActiveSessionId(),
                    "Initialization failed: " + initGuard.getLastError());
        }
        Map<String, Object> data = boundaryData != null ? new HashMap<>(boundaryData) : new HashMap<>();
        String sessionId = tracker.getCurrentSessionId();
        Instant now = clock.instant();
        Object requestedType = data.get("type");
        String type = requestedType != null ? requestedType.toString() : SessionBoundaryMarker.DEFAULT_TYPE;

        SessionBoundaryMarker marker = SessionBoundaryMarker.builder()
                .id(ContinuityIds.boundaryId(now))
                .timestamp(now)
                .sessionId(sessionId)
                .type(type)
                .data(data)
                .success(true)
                .build();

        if (!store(BOUNDARY_KEY_PREFIX + marker.getId(), marker)) {
            return SessionBoundaryMarker.failure(sessionId, "Failed to store boundary marker");
        }

        Map<String, Object> metadata = new HashMap<>(data);
        metadata.put("boundaryType", type);
        BoundaryRecordResult recorded = tracker.recordTokenBoundary(BoundaryRequest.builder()
                .id(marker.getId())
                .type(SESSION_BOUNDARY_TYPE)
                .source(BOUNDARY_SOURCE)
                .metadata(metadata)
                .build());
        if (!recorded.isSuccess()) {
            log.warn("[SessionData] Could not record token boundary for marker {}: {}", marker.getId(),
                    recorded.getError());
        }

        eventBus.publish(new SessionBoundaryCreatedEvent(sessionId, marker.getId(), type, now));
        log.info("[SessionData] Created session boundary marker: {}", marker.getId());
        return marker;
    }

    /**
     * Tracker metrics for the active session combined with the keys stored in
     * it.
     */
    public SessionState getSessionState() {
        if (!ready("getSessionState")) {
            return SessionState.failure(ContinuityIds.fallbackSessionId(clock.instant()),
                    "Initialization failed: " + initGuard.getLastError());
        }
        String sessionId = tracker.getCurrentSessionId();
        try {
            BoundaryInfo info = tracker.getBoundaryInfo(sessionId);
            ObjectNode data = readSession(sessionId);
            List<String> keys = new ArrayList<>();
            Iterator<String> names = data.fieldNames();
            names.forEachRemaining(keys::add);

            Instant now = clock.instant();
            SessionState.SessionStateBuilder builder = SessionState.builder()
                    .success(true)
                    .sessionId(sessionId)
                    .dataKeys(keys)
                    .dataSize(keys.size());
            if (info.isSuccess()) {
                builder.previousSessionId(info.getPreviousSessionId())
                        .startTime(info.getStartTime())
                        .lastUpdateTime(info.getLastActivity())
                        .boundaryProximity(info.getProximity())
                        .continuityScore(info.getContinuityScore());
            } else {
                log.warn("[SessionData] Could not get boundary info: {}", info.getError());
                builder.startTime(now)
                        .lastUpdateTime(now)
                        .boundaryProximity(BoundaryProximity.UNKNOWN)
                        .continuityScore(1.0);
            }
            return builder.build();
        } catch (RuntimeException e) {
            log.error("[SessionData] Failed to get session state: {}", e.getMessage(), e);
            return SessionState.failure(sessionId, e.getMessage());
        }
    }

    // ==================== Internals ====================

    private boolean ready(String operation) {
        InitializationResult init = initialize();
        if (!init.isSuccess()) {
            log.error("[SessionData] {} failed: initialization failed - {}", operation, init.getError());
            return false;
        }
        return true;
    }

    private void updateSession(String sessionId, Consumer<ObjectNode> mutation) {
        synchronized (lockFor(sessionId)) {
            ObjectNode data = readSession(sessionId);
            mutation.accept(data);
            writeSession(sessionId, data);
        }
    }

    private ObjectNode readSession(String sessionId) {
        synchronized (lockFor(sessionId)) {
            String json = storagePort.getText(DATA_DIR, sessionId + JSON_SUFFIX).join();
            if (json == null || json.isBlank()) {
                return objectMapper.createObjectNode();
            }
            try {
                JsonNode node = objectMapper.readTree(json);
                if (node instanceof ObjectNode objectNode) {
                    return objectNode;
                }
                log.warn("[SessionData] Session file {} is not a JSON object, ignoring it", sessionId);
                return objectMapper.createObjectNode();
            } catch (JsonProcessingException e) {
                log.warn("[SessionData] Session file {} is corrupt: {}", sessionId, e.getMessage());
                return objectMapper.createObjectNode();
            }
        }
    }

    private ObjectNode readSessionQuietly(String sessionId) {
        try {
            return readSession(sessionId);
        } catch (RuntimeException e) {
            log.warn("[SessionData] Error reading session {}: {}", sessionId, e.getMessage());
            return objectMapper.createObjectNode();
        }
    }

    private void writeSession(String sessionId, ObjectNode data) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(data);
            storagePort.putTextAtomic(DATA_DIR, sessionId + JSON_SUFFIX, json, false).join();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session data for " + sessionId, e);
        }
    }

    Object lockFor(String sessionId) {
        return sessionLocks[Math.floorMod(Objects.hashCode(sessionId), LOCK_STRIPES)];
    }

    private static Object[] newLockStripes() {
        Object[] stripes = new Object[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            stripes[i] = new Object();
        }
        return stripes;
    }

    private static String fullKey(String namespace, String key) {
        if (namespace == null || namespace.isBlank()) {
            return key;
        }
        return namespace + ":" + key;
    }
}
