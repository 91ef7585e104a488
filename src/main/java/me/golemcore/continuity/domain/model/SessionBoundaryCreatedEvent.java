package me.golemcore.continuity.domain.model;

import java.time.Instant;

/**
 * Event published by the session data store when a boundary marker is written.
 *
 * @since 1.0
 */
public record SessionBoundaryCreatedEvent(String sessionId, String markerId, String type, Instant timestamp) {
}
