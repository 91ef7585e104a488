package me.golemcore.continuity.domain.context;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.continuity.domain.model.ContextBundle;
import me.golemcore.continuity.domain.model.ContextItem;
import me.golemcore.continuity.domain.model.ContextOptions;
import me.golemcore.continuity.infrastructure.config.ContinuityProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * TTL cache for assembled context bundles.
 *
 * <p>
 * Entries are keyed by strategy, query and the options that change the result.
 * An expired entry is removed when read; a sweep of all expired entries runs on
 * insert at most once per half TTL. Items are copied on the way in and out, so
 * callers never share mutable items with the cache.
 */
@Component
@Slf4j
public class ContextCache {

    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final Duration ttl;
    private final boolean enabled;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private volatile Instant lastSweep;

    public ContextCache(Clock clock, ObjectMapper objectMapper, ContinuityProperties properties) {
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.ttl = properties.getContext().getCacheTtl();
        this.enabled = properties.getContext().isCacheEnabled() && ttl != null && !ttl.isZero()
                && !ttl.isNegative();
        this.lastSweep = clock.instant();
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Builds the cache key, or empty when the options cannot be serialized.
     */
    public Optional<String> key(String strategy, String query, ContextOptions options) {
        ContextOptions effective = options != null ? options : ContextOptions.defaults();
        Map<String, Object> significant = new LinkedHashMap<>();
        significant.put("limit", effective.getLimit());
        significant.put("minRelevance", effective.getMinRelevance());
        significant.put("boundaryId", effective.getBoundaryId());
        significant.put("sessionId", effective.getSessionId());
        try {
            return Optional.of(strategy + ":" + query + ":" + objectMapper.writeValueAsString(significant));
        } catch (JsonProcessingException e) {
            log.warn("[Context] Cannot build cache key: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    public Optional<ContextBundle> get(String key) {
        if (!enabled) {
            return Optional.empty();
        }
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry, clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(detached(entry.bundle()));
    }

    public void put(String key, ContextBundle bundle) {
        if (!enabled) {
            return;
        }
        Instant now = clock.instant();
        entries.put(key, new Entry(detached(bundle), now));
        if (Duration.between(lastSweep, now).compareTo(ttl.dividedBy(2)) >= 0) {
            sweep(now);
        }
    }

    public void clear() {
        entries.clear();
        log.debug("[Context] Context cache cleared");
    }

    public int size() {
        return entries.size();
    }

    public Instant getLastSweep() {
        return lastSweep;
    }

    public Duration getTtl() {
        return ttl;
    }

    private void sweep(Instant now) {
        lastSweep = now;
        int before = entries.size();
        entries.entrySet().removeIf(e -> isExpired(e.getValue(), now));
        int removed = before - entries.size();
        if (removed > 0) {
            log.debug("[Context] Swept {} expired cache entries", removed);
        }
    }

    private static ContextBundle detached(ContextBundle bundle) {
        if (bundle.getContextItems() == null) {
            return bundle;
        }
        List<ContextItem> items = bundle.getContextItems().stream()
                .map(ContextCache::detached)
                .toList();
        return bundle.toBuilder().contextItems(items).build();
    }

    private static ContextItem detached(ContextItem item) {
        if (item == null) {
            return null;
        }
        float[] embedding = item.getEmbedding();
        return item.toBuilder().embedding(embedding != null ? embedding.clone() : null).build();
    }

    private boolean isExpired(Entry entry, Instant now) {
        return Duration.between(entry.storedAt(), now).compareTo(ttl) > 0;
    }

    private record Entry(ContextBundle bundle, Instant storedAt) {
    }
}
