package me.golemcore.continuity.domain.model;

import java.time.Instant;

/**
 * Event published when the tracker opens a new session.
 *
 * <p>
 * {@code previousSessionId} is set when the session replaces a completed or
 * timed-out one.
 *
 * @since 1.0
 */
public record SessionStartedEvent(String sessionId, String previousSessionId, Instant timestamp) {
}
