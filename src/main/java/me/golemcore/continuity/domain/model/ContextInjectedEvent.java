package me.golemcore.continuity.domain.model;

import java.time.Instant;

/**
 * Event published after assembled context was rendered and recorded.
 *
 * @since 1.0
 */
public record ContextInjectedEvent(String sessionId, String strategy, int contextCount, Instant timestamp) {
}
