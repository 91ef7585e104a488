package me.golemcore.continuity.domain.context;

import me.golemcore.continuity.domain.model.ContextBundle;
import me.golemcore.continuity.domain.model.ContextItem;
import me.golemcore.continuity.domain.model.ContextOptions;
import me.golemcore.continuity.infrastructure.config.AutoConfiguration;
import me.golemcore.continuity.infrastructure.config.ContinuityProperties;
import me.golemcore.continuity.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContextCacheTest {

    private static final Instant START = Instant.parse("2026-03-01T09:00:00Z");

    private MutableClock clock;
    private ContinuityProperties properties;
    private ContextCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        properties = new ContinuityProperties();
        properties.getContext().setCacheTtl(Duration.ofMinutes(5));
        cache = new ContextCache(clock, AutoConfiguration.objectMapper(), properties);
    }

    private static ContextBundle bundle(String query) {
        return ContextBundle.builder()
                .timestamp(START)
                .query(query)
                .strategy("standard")
                .contextItems(List.of())
                .success(true)
                .build();
    }

    @Test
    void returnsStoredBundleWithinTtl() {
        String key = cache.key("standard", "q", ContextOptions.defaults()).orElseThrow();
        cache.put(key, bundle("q"));
        clock.advance(Duration.ofMinutes(5));

        assertEquals("q", cache.get(key).orElseThrow().getQuery());
    }

    @Test
    void expiredEntryIsRemovedOnRead() {
        String key = cache.key("standard", "q", ContextOptions.defaults()).orElseThrow();
        cache.put(key, bundle("q"));
        clock.advance(Duration.ofMinutes(5).plusMillis(1));

        assertTrue(cache.get(key).isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void insertSweepsExpiredEntriesAtMostOncePerHalfTtl() {
        cache.put("old", bundle("old"));
        clock.advance(Duration.ofMinutes(6));

        cache.put("new", bundle("new"));

        assertEquals(1, cache.size());
        assertEquals(clock.instant(), cache.getLastSweep());

        clock.advance(Duration.ofMinutes(1));
        cache.put("newer", bundle("newer"));
        assertEquals(clock.instant().minus(Duration.ofMinutes(1)), cache.getLastSweep());
    }

    @Test
    void keyDependsOnResultShapingOptions() {
        ContextOptions base = ContextOptions.defaults();
        String plain = cache.key("boundary", "q", base).orElseThrow();
        String limited = cache.key("boundary", "q", base.withLimit(3)).orElseThrow();
        String withBoundary = cache.key("boundary", "q", base.withBoundaryInfo(Map.of("id", "b-1"))).orElseThrow();
        String otherSession = cache.key("boundary", "q", base.withSessionId("session-2")).orElseThrow();

        assertEquals(4, List.of(plain, limited, withBoundary, otherSession).stream().distinct().count());
        assertTrue(plain.startsWith("boundary:q:"));
        assertEquals(plain, cache.key("boundary", "q", ContextOptions.defaults()).orElseThrow());
    }

    @Test
    void cachedItemsAreIsolatedFromCallerMutation() {
        ContextItem item = ContextItem.builder().type("session").id("s-1").content("original").priority(0.5).build();
        ContextBundle stored = bundle("q").toBuilder().contextItems(List.of(item)).build();
        cache.put("k", stored);

        item.setContent("changed by producer");
        cache.get("k").orElseThrow().getContextItems().get(0).setContent("changed by consumer");

        ContextItem cached = cache.get("k").orElseThrow().getContextItems().get(0);
        assertEquals("original", cached.getContent());
        assertEquals(0.5, cached.getPriority());
    }

    @Test
    void disabledCacheStoresNothing() {
        properties.getContext().setCacheEnabled(false);
        ContextCache disabled = new ContextCache(clock, AutoConfiguration.objectMapper(), properties);

        disabled.put("k", bundle("q"));

        assertFalse(disabled.isEnabled());
        assertTrue(disabled.get("k").isEmpty());
    }

    @Test
    void clearEmptiesCache() {
        cache.put("a", bundle("a"));
        cache.put("b", bundle("b"));

        cache.clear();

        assertEquals(0, cache.size());
    }
}
