package me.golemcore.continuity.domain.context;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of the context assembler configuration and cache.
 */
public record ContextAssemblerStatus(
        boolean initialized,
        boolean cacheEnabled,
        int cacheSize,
        Instant lastCacheSweep,
        boolean compressionEnabled,
        boolean validationEnabled,
        int providerCount,
        List<String> strategies,
        String defaultStrategy,
        String lastError,
        Instant timestamp) {
}
