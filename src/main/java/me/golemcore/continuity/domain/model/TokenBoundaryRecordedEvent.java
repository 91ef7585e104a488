package me.golemcore.continuity.domain.model;

import java.time.Instant;

/**
 * Event published after a token boundary was appended to the active session.
 *
 * @since 1.0
 */
public record TokenBoundaryRecordedEvent(String sessionId, String boundaryId, String type, Instant timestamp) {
}
