package me.golemcore.continuity.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Event published when the active session exceeded its inactivity timeout and
 * was rolled over to a new session.
 *
 * @since 1.0
 */
public record SessionTimedOutEvent(String previousSessionId, String newSessionId, Duration inactivity,
        Instant timestamp) {
}
