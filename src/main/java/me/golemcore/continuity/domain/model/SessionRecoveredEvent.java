package me.golemcore.continuity.domain.model;

import java.time.Instant;

/**
 * Event published when the active session record was missing from the index
 * and a fresh session was opened in its place.
 *
 * @since 1.0
 */
public record SessionRecoveredEvent(String newSessionId, Instant timestamp) {
}
