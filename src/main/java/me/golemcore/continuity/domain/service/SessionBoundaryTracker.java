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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.continuity.domain.model.BoundaryInfo;
import me.golemcore.continuity.domain.model.BoundaryProximity;
import me.golemcore.continuity.domain.model.BoundaryRecordResult;
import me.golemcore.continuity.domain.model.BoundaryRequest;
import me.golemcore.continuity.domain.model.ContinuityConfigurationException;
import me.golemcore.continuity.domain.model.SessionRecord;
import me.golemcore.continuity.domain.model.SessionRecoveredEvent;
import me.golemcore.continuity.domain.model.SessionStartedEvent;
import me.golemcore.continuity.domain.model.SessionStatus;
import me.golemcore.continuity.domain.model.SessionTimedOutEvent;
import me.golemcore.continuity.domain.model.TokenBoundary;
import me.golemcore.continuity.domain.model.TokenBoundaryRecordedEvent;
import me.golemcore.continuity.infrastructure.config.ContinuityProperties;
import me.golemcore.continuity.infrastructure.event.SpringEventBus;
import me.golemcore.continuity.infrastructure.lifecycle.InitializationGuard;
import me.golemcore.continuity.infrastructure.lifecycle.InitializationResult;
import me.golemcore.continuity.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;

/**
 * Owns the session lifecycle and detects token boundaries.
 *
 * <p>
 * A session stays active while calls keep arriving within the configured
 * inactivity timeout. The first call after the timeout completes the old
 * session and opens a new one linked to it through
 * {@code previousSessionId}. Every state change is written to
 * {@code sessions/index.json} with an atomic replace before the call returns.
 *
 * <p>
 * Public operations never throw: failures are logged and reported through
 * result objects or a {@code fallback-session-<millis>} id. All index
 * mutations are serialized through a single lock.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class SessionBoundaryTracker {

    static final String SESSIONS_DIR = "sessions";
    static final String INDEX_FILE = "index.json";
    private static final double BOUNDARY_PENALTY = 0.05;
    private static final double MAX_PENALTY = 0.5;
    private static final TypeReference<List<SessionRecord>> RECORD_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final SpringEventBus eventBus;
    private final Clock clock;
    private final Duration timeout;
    private final InitializationGuard initGuard;

    private final Object lock = new Object();
    private final List<SessionRecord> sessionRecords = new ArrayList<>();
    private volatile String currentSessionId;

    public SessionBoundaryTracker(StoragePort storagePort, ObjectMapper objectMapper, SpringEventBus eventBus,
            Clock clock, ContinuityProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.eventBus = eventBus;
        this.clock = clock;
        this.timeout = properties.getSession().getTimeout();
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new ContinuityConfigurationException("continuity.session.timeout must be positive: " + timeout);
        }
        this.initGuard = new InitializationGuard("session-boundary-tracker", properties.getInit().getMaxAttempts());
    }

    /**
     * Loads the session index and opens a fresh active session. Sessions left
     * active by a previous run are completed and the newest of them becomes the
     * predecessor of the new session.
     */
    public InitializationResult initialize() {
        return initGuard.ensureInitialized(this::doInitialize);
    }

    public boolean isInitialized() {
        return initGuard.isInitialized();
    }

    /**
     * Id of the active session as currently known, without checking the timeout
     * or touching activity.
     */
    public String getActiveSessionId() {
        return currentSessionId;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Returns the active session id, rolling over to a new session when the
     * inactivity timeout has passed. Never throws.
     */
    public String getCurrentSessionId() {
        InitializationResult init = initialize();
        if (!init.isSuccess()) {
            log.error("[Session] Cannot resolve current session, initialization failed: {}", init.getError());
            return ContinuityIds.fallbackSessionId(clock.instant());
        }

        Object event = null;
        String result;
        synchronized (lock) {
            try {
                Instant now = clock.instant();
                SessionRecord current = findLocked(currentSessionId);

                if (current == null) {
                    log.warn("[Session] Current session {} not found, creating a new session", currentSessionId);
                    result = openSessionLocked(null, now);
                    event = new SessionRecoveredEvent(result, now);
                } else {
                    Duration inactivity = elapsed(current, now);
                    if (inactivity.compareTo(timeout) > 0) {
                        log.info("[Session] Session {} timed out after {}s, creating a new session",
                                current.getId(), inactivity.toSeconds());
                        result = rollOverLocked(current, now);
                        event = new SessionTimedOutEvent(current.getId(), result, inactivity, now);
                    } else {
                        Instant previousActivity = current.getLastActivity();
                        current.setLastActivity(now);
                        try {
                            persistLocked();
                        } catch (RuntimeException e) {
                            current.setLastActivity(previousActivity);
                            throw e;
                        }
                        result = current.getId();
                    }
                }
            } catch (RuntimeException e) {
                log.error("[Session] Error getting current session id: {}", e.getMessage(), e);
                result = currentSessionId != null ? currentSessionId
                        : ContinuityIds.fallbackSessionId(clock.instant());
            }
        }

        if (event != null) {
            eventBus.publish(event);
        }
        return result;
    }

    /**
     * Appends a token boundary to the active session. A missing active session
     * is recreated first. Never throws.
     */
    public BoundaryRecordResult recordTokenBoundary(BoundaryRequest request) {
        InitializationResult init = initialize();
        if (!init.isSuccess()) {
            log.error("[Session] Failed to record token boundary: initialization failed - {}", init.getError());
            return BoundaryRecordResult.failure(null, "Initialization failed: " + init.getError());
        }
        BoundaryRequest effective = request != null ? request : BoundaryRequest.builder().build();

        TokenBoundary boundary;
        synchronized (lock) {
            try {
                Instant now = clock.instant();
                SessionRecord current = findLocked(currentSessionId);
                if (current == null) {
                    log.warn("[Session] Current session {} not found, creating a new session", currentSessionId);
                    openSessionLocked(null, now);
                    current = findLocked(currentSessionId);
                }

                String boundaryId = effective.getId() != null && !effective.getId().isBlank()
                        ? effective.getId()
                        : ContinuityIds.boundaryId(now);
                boundary = TokenBoundary.builder()
                        .id(boundaryId)
                        .timestamp(now)
                        .sessionId(current.getId())
                        .type(effective.getType() != null ? effective.getType() : BoundaryRequest.DEFAULT_TYPE)
                        .source(effective.getSource())
                        .metadata(effective.getMetadata() != null
                                ? new HashMap<>(effective.getMetadata())
                                : new HashMap<>())
                        .build();

                Instant previousActivity = current.getLastActivity();
                current.addTokenBoundary(boundary);
                current.setLastActivity(now);
                try {
                    persistLocked();
                } catch (RuntimeException e) {
                    current.getTokenBoundaries().remove(current.getTokenBoundaries().size() - 1);
                    current.setLastActivity(previousActivity);
                    throw e;
                }
            } catch (RuntimeException e) {
                log.error("[Session] Error recording token boundary: {}", e.getMessage(), e);
                return BoundaryRecordResult.failure(currentSessionId, e.getMessage());
            }
        }

        log.info("[Session] Recorded token boundary {} in session {}", boundary.getId(), boundary.getSessionId());
        eventBus.publish(new TokenBoundaryRecordedEvent(boundary.getSessionId(), boundary.getId(),
                boundary.getType(), boundary.getTimestamp()));
        return BoundaryRecordResult.builder()
                .success(true)
                .boundaryId(boundary.getId())
                .sessionId(boundary.getSessionId())
                .timestamp(boundary.getTimestamp())
                .build();
    }

    /**
     * Computes boundary proximity and continuity score for a session.
     *
     * <p>
     * {@code ratio = min(1, elapsed / timeout)} is bucketed into quartiles, and
     * {@code continuityScore = max(0, 1 - min(0.5, 0.05 * boundaries) - min(0.5, elapsed / timeout * 0.5))}.
     */
    public BoundaryInfo getBoundaryInfo(String sessionId) {
        InitializationResult init = initialize();
        if (!init.isSuccess()) {
            log.error("[Session] Failed to get boundary info: initialization failed - {}", init.getError());
            return BoundaryInfo.failure(sessionId, "Initialization failed: " + init.getError());
        }

        synchronized (lock) {
            SessionRecord record = findLocked(sessionId);
            if (record == null) {
                log.warn("[Session] Session record not found for session id: {}", sessionId);
                return BoundaryInfo.failure(sessionId, "Session record not found");
            }

            Duration elapsed = elapsed(record, clock.instant());
            double timeRatio = (double) elapsed.toMillis() / timeout.toMillis();
            double ratio = Math.min(1.0, timeRatio);

            double score = 1.0;
            score -= Math.min(MAX_PENALTY, record.getBoundaryCount() * BOUNDARY_PENALTY);
            score -= Math.min(MAX_PENALTY, timeRatio * MAX_PENALTY);
            score = Math.max(0.0, score);

            return BoundaryInfo.builder()
                    .success(true)
                    .sessionId(record.getId())
                    .startTime(record.getStartTime())
                    .lastActivity(record.getLastActivity())
                    .tokenBoundaries(List.copyOf(record.getTokenBoundaries()))
                    .proximity(BoundaryProximity.fromRatio(ratio))
                    .continuityScore(score)
                    .previousSessionId(record.getPreviousSessionId())
                    .build();
        }
    }

    /**
     * Completes the active session and opens its successor.
     *
     * @return false when there is no active session or persisting failed
     */
    public boolean completeCurrentSession() {
        if (!initialize().isSuccess()) {
            return false;
        }
        Object event;
        synchronized (lock) {
            SessionRecord current = findLocked(currentSessionId);
            if (current == null) {
                log.warn("[Session] Current session {} not found", currentSessionId);
                return false;
            }
            try {
                Instant now = clock.instant();
                String next = rollOverLocked(current, now);
                event = new SessionStartedEvent(next, current.getId(), now);
                log.info("[Session] Completed session {}", current.getId());
            } catch (RuntimeException e) {
                log.error("[Session] Error completing current session: {}", e.getMessage(), e);
                return false;
            }
        }
        eventBus.publish(event);
        return true;
    }

    /**
     * Token boundaries of a session, oldest first. {@code null} means the active
     * session.
     */
    public List<TokenBoundary> getTokenBoundaries(String sessionId) {
        if (!initialize().isSuccess()) {
            return List.of();
        }
        synchronized (lock) {
            String target = sessionId != null ? sessionId : currentSessionId;
            SessionRecord record = findLocked(target);
            if (record == null) {
                log.warn("[Session] Session {} not found", target);
                return List.of();
            }
            return List.copyOf(record.getTokenBoundaries());
        }
    }

    /**
     * Copy of a session record. {@code null} means the active session.
     */
    public Optional<SessionRecord> getSessionInfo(String sessionId) {
        if (!initialize().isSuccess()) {
            return Optional.empty();
        }
        synchronized (lock) {
            String target = sessionId != null ? sessionId : currentSessionId;
            return Optional.ofNullable(findLocked(target)).map(this::copyOf);
        }
    }

    /**
     * Most recently started sessions first.
     */
    public List<SessionRecord> getRecentSessions(int limit) {
        if (!initialize().isSuccess()) {
            return List.of();
        }
        synchronized (lock) {
            return sessionRecords.stream()
                    .sorted(Comparator.comparing(SessionRecord::getStartTime,
                            Comparator.nullsLast(Comparator.reverseOrder())))
                    .limit(Math.max(0, limit))
                    .map(this::copyOf)
                    .toList();
        }
    }

    /**
     * Looks up a boundary in a session. Without a boundary id the latest boundary
     * is returned.
     */
    public Optional<TokenBoundary> getBoundaryById(String sessionId, String boundaryId) {
        if (!initialize().isSuccess()) {
            return Optional.empty();
        }
        synchronized (lock) {
            String target = sessionId != null ? sessionId : currentSessionId;
            SessionRecord record = findLocked(target);
            if (record == null) {
                log.warn("[Session] Session {} not found", target);
                return Optional.empty();
            }
            List<TokenBoundary> boundaries = record.getTokenBoundaries();
            if (boundaryId == null || boundaryId.isBlank()) {
                return boundaries.isEmpty()
                        ? Optional.empty()
                        : Optional.of(boundaries.get(boundaries.size() - 1));
            }
            Optional<TokenBoundary> found = boundaries.stream()
                    .filter(b -> boundaryId.equals(b.getId()))
                    .findFirst();
            if (found.isEmpty()) {
                log.warn("[Session] Boundary {} not found in session {}", boundaryId, target);
            }
            return found;
        }
    }

    /**
     * Completes the active session without opening a successor. The next call to
     * {@link #getCurrentSessionId()} opens a new one.
     */
    public boolean clearSessionState() {
        if (!initialize().isSuccess()) {
            return false;
        }
        synchronized (lock) {
            try {
                SessionRecord current = findLocked(currentSessionId);
                if (current != null) {
                    current.complete(clock.instant());
                }
                currentSessionId = null;
                persistLocked();
                log.info("[Session] Session state cleared");
                return true;
            } catch (RuntimeException e) {
                log.error("[Session] Error clearing session state: {}", e.getMessage(), e);
                return false;
            }
        }
    }

    // ==================== Internals ====================

    private void doInitialize() {
        String previous = null;
        synchronized (lock) {
            sessionRecords.clear();
            sessionRecords.addAll(loadIndexLocked());
            log.debug("[Session] Loaded {} session records", sessionRecords.size());

            Instant now = clock.instant();
            for (SessionRecord record : sessionRecords) {
                if (record.getStatus() == SessionStatus.ACTIVE) {
                    record.complete(record.getLastActivity() != null ? record.getLastActivity() : now);
                    previous = record.getId();
                }
            }
            String sessionId = openSessionLocked(previous, now);
            log.info("[Session] Tracker initialized, session: {}", sessionId);
        }
        eventBus.publish(new SessionStartedEvent(currentSessionId, previous, clock.instant()));
    }

    private List<SessionRecord> loadIndexLocked() {
        String json = storagePort.getText(SESSIONS_DIR, INDEX_FILE).join();
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            List<SessionRecord> records = objectMapper.readValue(json, RECORD_LIST_TYPE_REF);
            return records != null ? new ArrayList<>(records) : new ArrayList<>();
        } catch (JsonProcessingException e) {
            log.warn("[Session] Session index is corrupt, starting with an empty index: {}", e.getMessage());
            return new ArrayList<>();
        }
    }

    /**
     * Completes {@code current} and opens its successor. When the successor
     * cannot be persisted, {@code current} is left active as before.
     */
    private String rollOverLocked(SessionRecord current, Instant now) {
        SessionStatus previousStatus = current.getStatus();
        Instant previousEndTime = current.getEndTime();
        current.complete(now);
        try {
            return openSessionLocked(current.getId(), now);
        } catch (RuntimeException e) {
            current.setStatus(previousStatus);
            current.setEndTime(previousEndTime);
            throw e;
        }
    }

    private String openSessionLocked(String previousSessionId, Instant now) {
        SessionRecord record = SessionRecord.builder()
                .id(ContinuityIds.sessionId(now))
                .startTime(now)
                .lastActivity(now)
                .status(SessionStatus.ACTIVE)
                .previousSessionId(previousSessionId)
                .build();

        String previousCurrent = currentSessionId;
        sessionRecords.add(record);
        currentSessionId = record.getId();
        try {
            persistLocked();
        } catch (RuntimeException e) {
            sessionRecords.remove(record);
            currentSessionId = previousCurrent;
            throw e;
        }
        log.info("[Session] Created new session: {}", record.getId());
        return record.getId();
    }

    private void persistLocked() {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(sessionRecords);
            storagePort.putTextAtomic(SESSIONS_DIR, INDEX_FILE, json, true).join();
            log.debug("[Session] Saved {} session records to index", sessionRecords.size());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session index", e);
        }
    }

    private SessionRecord findLocked(String sessionId) {
        if (sessionId == null) {
            return null;
        }
        for (SessionRecord record : sessionRecords) {
            if (sessionId.equals(record.getId())) {
                return record;
            }
        }
        return null;
    }

    private Duration elapsed(SessionRecord record, Instant now) {
        if (record.getLastActivity() == null) {
            return Duration.ZERO;
        }
        Duration elapsed = Duration.between(record.getLastActivity(), now);
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }

    private SessionRecord copyOf(SessionRecord record) {
        return record.toBuilder()
                .tokenBoundaries(new ArrayList<>(record.getTokenBoundaries()))
                .build();
    }
}
