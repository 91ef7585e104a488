package me.golemcore.continuity.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.continuity.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.continuity.domain.model.Assertion;
import me.golemcore.continuity.domain.model.BoundaryProximity;
import me.golemcore.continuity.domain.model.SessionBoundaryCreatedEvent;
import me.golemcore.continuity.domain.model.SessionBoundaryMarker;
import me.golemcore.continuity.domain.model.SessionState;
import me.golemcore.continuity.domain.model.TestSummary;
import me.golemcore.continuity.domain.model.TokenBoundary;
import me.golemcore.continuity.infrastructure.config.AutoConfiguration;
import me.golemcore.continuity.infrastructure.config.ContinuityProperties;
import me.golemcore.continuity.infrastructure.event.SpringEventBus;
import me.golemcore.continuity.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.context.ApplicationEventPublisher;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SessionDataStoreTest {

    private static final Instant START = Instant.parse("2026-03-01T09:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private ObjectMapper objectMapper;
    private ContinuityProperties properties;
    private LocalStorageAdapter storage;
    private ApplicationEventPublisher publisher;
    private SessionBoundaryTracker tracker;
    private SessionDataStore dataStore;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        objectMapper = AutoConfiguration.objectMapper();
        properties = new ContinuityProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        properties.getSession().setTimeout(Duration.ofMinutes(30));
        storage = new LocalStorageAdapter(properties);
        storage.init();
        publisher = mock(ApplicationEventPublisher.class);
        SpringEventBus eventBus = new SpringEventBus(publisher);
        tracker = new SessionBoundaryTracker(storage, objectMapper, eventBus, clock, properties);
        dataStore = new SessionDataStore(storage, objectMapper, tracker, eventBus, clock, properties);
    }

    // ==================== Key-value ====================

    @Test
    void storeAndGetRoundTrip() {
        assertTrue(dataStore.store("project", Map.of("name", "continuity", "version", 2)));

        JsonNode value = dataStore.get("project");

        assertEquals("continuity", value.get("name").asText());
        assertEquals(2, value.get("version").asInt());
        assertTrue(dataStore.has("project"));
    }

    @Test
    void namespacedKeysAreJoinedWithColon() {
        dataStore.store("decisions", "storage", "jsonl");

        assertEquals("jsonl", dataStore.get("decisions:storage").asText());
        assertEquals("jsonl", dataStore.get("decisions", "storage").asText());
    }

    @Test
    void typedGetConvertsStoredValue() {
        dataStore.store("count", 42);

        assertEquals(42, dataStore.get("count", Integer.class));
        assertNull(dataStore.get("missing", Integer.class));
    }

    @Test
    void valuesArePersistedInSessionFile() throws Exception {
        dataStore.store("note", "remember me");
        String sessionId = tracker.getCurrentSessionId();

        Path file = tempDir.resolve("sessions/data").resolve(sessionId + ".json");
        assertTrue(Files.exists(file));
        assertEquals("remember me", objectMapper.readTree(file.toFile()).get("note").asText());
    }

    @Test
    void deleteAndClearRemoveData() {
        dataStore.store("a", 1);
        dataStore.store("b", 2);

        assertTrue(dataStore.delete("a"));
        assertFalse(dataStore.has("a"));
        assertTrue(dataStore.has("b"));

        assertTrue(dataStore.clear());
        assertFalse(dataStore.has("b"));
    }

    // ==================== Cross-session ====================

    @Test
    void concurrentStoresInOneSessionKeepEveryKey() throws Exception {
        String sessionId = tracker.getCurrentSessionId();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                String key = "key-" + i;
                results.add(executor.submit(() -> dataStore.store(key, "value")));
            }
            for (Future<Boolean> result : results) {
                assertTrue(result.get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }

        for (int i = 0; i < 40; i++) {
            assertEquals("value", dataStore.getPreviousSessionData(sessionId, "key-" + i).asText());
        }
    }

    @Test
    void sessionLocksStayBoundedForArbitraryIds() {
        Set<Object> locks = Collections.newSetFromMap(new IdentityHashMap<>());
        for (int i = 0; i < 1000; i++) {
            dataStore.getPreviousSessionData("unknown-session-" + i, "k");
            locks.add(dataStore.lockFor("unknown-session-" + i));
        }

        assertTrue(locks.size() <= 64, "lock count: " + locks.size());
        assertSame(dataStore.lockFor("session-a"), dataStore.lockFor("session-a"));
    }

    @Test
    void retrieveAcrossSessionsFindsValueFromTimedOutSession() {
        dataStore.store("architecture", Map.of("pattern", "hexagonal"));
        String firstSession = tracker.getCurrentSessionId();

        clock.advance(Duration.ofMinutes(31));
        String secondSession = tracker.getCurrentSessionId();

        assertNotEquals(firstSession, secondSession);
        assertNull(dataStore.get("architecture"));
        JsonNode recovered = dataStore.retrieveAcrossSessions("architecture");
        assertNotNull(recovered);
        assertEquals("hexagonal", recovered.get("pattern").asText());
        assertEquals("hexagonal", dataStore.getPreviousSessionData(firstSession, "architecture")
                .get("pattern").asText());
    }

    @Test
    void retrieveAcrossSessionsPrefersCurrentSession() {
        dataStore.store("phase", "design");
        clock.advance(Duration.ofMinutes(31));
        dataStore.store("phase", "build");

        assertEquals("build", dataStore.retrieveAcrossSessions("phase").asText());
    }

    @Test
    void retrieveAcrossSessionsReturnsNullWhenAbsent() {
        dataStore.store("something", "else");

        assertNull(dataStore.retrieveAcrossSessions("never-stored"));
    }

    @Test
    void listSessionsReturnsSessionsWithData() {
        dataStore.store("k", "v1");
        String first = tracker.getCurrentSessionId();
        clock.advance(Duration.ofMinutes(31));
        dataStore.store("k", "v2");
        String second = tracker.getCurrentSessionId();

        List<String> sessions = dataStore.listSessions();

        assertEquals(2, sessions.size());
        assertTrue(sessions.containsAll(List.of(first, second)));
    }

    // ==================== Assertions ====================

    @Test
    void completeTestSummarizesAssertionsAndWritesReport() throws Exception {
        dataStore.store("testId", "boundary-recovery");
        dataStore.store("testName", "Boundary recovery");
        dataStore.addAssertion("index written", true, "index.json exists");
        dataStore.addAssertion("context restored", true, "vision present");
        dataStore.addAssertion("score", false, "score below threshold");
        dataStore.addAssertion("history", true, "history capped");

        TestSummary summary = dataStore.completeTest();

        assertNotNull(summary);
        assertEquals(4, summary.getTotalAssertions());
        assertEquals(3, summary.getPassedAssertions());
        assertEquals(75.0, summary.getSuccessRate(), 1e-9);
        assertEquals("Boundary recovery", summary.getTestName());
        Path report = tempDir.resolve("test-results/boundary-recovery-report.json");
        assertTrue(Files.exists(report));
        assertEquals(4, objectMapper.readTree(report.toFile()).get("assertions").size());
        assertTrue(dataStore.has(SessionDataStore.TEST_SUMMARY_KEY));
    }

    @Test
    void addAssertionReturnsRecordedCheck() {
        Assertion assertion = dataStore.addAssertion("ok", true, "fine");

        assertTrue(assertion.isPassed());
        assertEquals(START, assertion.getTimestamp());
        assertEquals(1, dataStore.get(SessionDataStore.ASSERTIONS_KEY).size());
    }

    // ==================== Boundaries and state ====================

    @Test
    void createSessionBoundaryStoresMarkerAndRecordsTokenBoundary() {
        SessionBoundaryMarker marker = dataStore.createSessionBoundary(Map.of("type", "checkpoint", "step", 7));

        assertTrue(marker.isSuccess());
        assertEquals("checkpoint", marker.getType());
        assertTrue(dataStore.has("boundary-" + marker.getId()));

        List<TokenBoundary> boundaries = tracker.getTokenBoundaries(null);
        assertEquals(1, boundaries.size());
        assertEquals("session_boundary", boundaries.get(0).getType());
        assertEquals(marker.getId(), boundaries.get(0).getId());
        assertEquals("checkpoint", boundaries.get(0).getMetadata().get("boundaryType"));
        verify(publisher).publishEvent(any(SessionBoundaryCreatedEvent.class));
    }

    @Test
    void sessionStateCombinesTrackerMetricsAndDataKeys() {
        dataStore.store("alpha", 1);
        dataStore.store("beta", 2);

        SessionState state = dataStore.getSessionState();

        assertTrue(state.isSuccess());
        assertEquals(tracker.getCurrentSessionId(), state.getSessionId());
        assertEquals(BoundaryProximity.FAR, state.getBoundaryProximity());
        assertEquals(1.0, state.getContinuityScore(), 1e-9);
        assertEquals(2, state.getDataSize());
        assertTrue(state.getDataKeys().containsAll(List.of("alpha", "beta")));
    }
}
