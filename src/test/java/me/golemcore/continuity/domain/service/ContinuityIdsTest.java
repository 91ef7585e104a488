package me.golemcore.continuity.domain.service;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ContinuityIdsTest {

    private static final Instant NOW = Instant.ofEpochMilli(1772355600000L);

    @Test
    void sessionIdEmbedsTimestampAndEightCharSuffix() {
        assertTrue(ContinuityIds.sessionId(NOW).matches("session-1772355600000-[0-9a-z]{8}"));
    }

    @Test
    void boundaryIdEmbedsTimestampAndFiveCharSuffix() {
        assertTrue(ContinuityIds.boundaryId(NOW).matches("boundary-1772355600000-[0-9a-z]{5}"));
    }

    @Test
    void fallbackSessionIdIsDeterministic() {
        assertEquals("fallback-session-1772355600000", ContinuityIds.fallbackSessionId(NOW));
    }

    @Test
    void recordIdIsThirtyTwoHexChars() {
        String id = ContinuityIds.recordId();

        assertTrue(id.matches("[0-9a-f]{32}"));
        assertNotEquals(id, ContinuityIds.recordId());
    }
}
