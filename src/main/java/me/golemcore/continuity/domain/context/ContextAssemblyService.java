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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.continuity.domain.context.strategy.BoundaryContextStrategy;
import me.golemcore.continuity.domain.context.strategy.ContextStrategy;
import me.golemcore.continuity.domain.model.BoundaryProximity;
import me.golemcore.continuity.domain.model.ContextBundle;
import me.golemcore.continuity.domain.model.ContextFormat;
import me.golemcore.continuity.domain.model.ContextInjectedEvent;
import me.golemcore.continuity.domain.model.ContextInjectionResult;
import me.golemcore.continuity.domain.model.ContextItem;
import me.golemcore.continuity.domain.model.ContextOptions;
import me.golemcore.continuity.domain.model.ContinuityConfigurationException;
import me.golemcore.continuity.domain.model.ContinuityInvariantException;
import me.golemcore.continuity.domain.model.SessionBoundaryMarker;
import me.golemcore.continuity.domain.model.SessionState;
import me.golemcore.continuity.domain.model.SessionTimedOutEvent;
import me.golemcore.continuity.domain.service.SessionDataStore;
import me.golemcore.continuity.infrastructure.config.ContinuityProperties;
import me.golemcore.continuity.infrastructure.event.SpringEventBus;
import me.golemcore.continuity.infrastructure.lifecycle.InitializationGuard;
import me.golemcore.continuity.infrastructure.lifecycle.InitializationResult;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Assembles, renders and records the context injected into an LLM prompt.
 *
 * <p>
 * Flow for {@link #generateContext}:
 * <ol>
 * <li>Resolve the strategy, falling back to the default for unknown names</li>
 * <li>Serve from {@link ContextCache} when a fresh entry exists</li>
 * <li>Run the strategy against the {@link ContextProviderRegistry}</li>
 * <li>Stable sort by descending priority</li>
 * <li>With no items, synthesize a semantic item from the query embedding</li>
 * </ol>
 *
 * <p>
 * {@link #injectContext} adds session state, renders the bundle, writes the
 * interaction record and stores a summary in session data.
 * {@link #injectContextAtBoundary} first places a boundary marker in the
 * session.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class ContextAssemblyService {

    static final String UNKNOWN_SESSION = "unknown-session";
    static final double SEMANTIC_FALLBACK_PRIORITY = 0.85;
    private static final Comparator<ContextItem> BY_PRIORITY_DESC = Comparator
            .comparingDouble(ContextItem::getEffectivePriority).reversed();

    private final ContextProviderRegistry registry;
    private final Map<String, ContextStrategy> strategies = new LinkedHashMap<>();
    private final ContextCache cache;
    private final ContextRenderer renderer;
    private final ContextHistoryRecorder historyRecorder;
    private final QueryEmbedder queryEmbedder;
    private final SessionDataStore sessionDataStore;
    private final SpringEventBus eventBus;
    private final Clock clock;
    private final ContinuityProperties.ContextProperties config;
    private final String defaultStrategy;
    private final InitializationGuard initGuard;

    public ContextAssemblyService(ContextProviderRegistry registry, List<ContextStrategy> strategies,
            ContextCache cache, ContextRenderer renderer, ContextHistoryRecorder historyRecorder,
            QueryEmbedder queryEmbedder, SessionDataStore sessionDataStore, SpringEventBus eventBus, Clock clock,
            ContinuityProperties properties) {
        this.registry = registry;
        this.cache = cache;
        this.renderer = renderer;
        this.historyRecorder = historyRecorder;
        this.queryEmbedder = queryEmbedder;
        this.sessionDataStore = sessionDataStore;
        this.eventBus = eventBus;
        this.clock = clock;
        this.config = properties.getContext();
        this.initGuard = new InitializationGuard("context-assembler", properties.getInit().getMaxAttempts());

        if (strategies == null || strategies.isEmpty()) {
            throw new ContinuityConfigurationException("No context strategies registered");
        }
        for (ContextStrategy strategy : strategies) {
            if (this.strategies.putIfAbsent(strategy.getName(), strategy) != null) {
                throw new ContinuityConfigurationException("Duplicate context strategy: " + strategy.getName());
            }
        }
        this.defaultStrategy = config.getDefaultStrategy();
        if (!this.strategies.containsKey(defaultStrategy)) {
            throw new ContinuityConfigurationException("Default context strategy not registered: "
                    + defaultStrategy + ", available: " + this.strategies.keySet());
        }
        log.info("[Context] Context assembler ready with strategies {} (default: {})",
                this.strategies.keySet(), defaultStrategy);
    }

    public InitializationResult initialize() {
        return initGuard.ensureInitialized(() -> {
            InitializationResult storeInit = sessionDataStore.initialize();
            if (!storeInit.isSuccess()) {
                throw new IllegalStateException("Session data unavailable: " + storeInit.getError());
            }
        });
    }

    // ==================== Assembly ====================

    /**
     * Builds the context bundle for a query. Never throws: a bundle with no
     * items and {@code success=false} signals that nothing could be assembled.
     */
    public ContextBundle generateContext(String query, ContextOptions options) {
        ContextOptions effective = options != null ? options : ContextOptions.defaults();
        ContextStrategy strategy = resolveStrategy(effective.getStrategy());
        String text = query != null ? query : "";

        Optional<String> cacheKey = cacheKey(strategy.getName(), text, effective);
        if (cacheKey.isPresent()) {
            Optional<ContextBundle> cached = cache.get(cacheKey.get());
            if (cached.isPresent()) {
                log.debug("[Context] Using cached context for strategy {}", strategy.getName());
                return cached.get().toBuilder().cached(true).build();
            }
        }

        List<ContextItem> items;
        try {
            items = new ArrayList<>(strategy.assemble(text, effective, registry));
        } catch (RuntimeException e) {
            log.error("[Context] Strategy {} failed: {}", strategy.getName(), e.getMessage(), e);
            items = new ArrayList<>();
        }
        items.sort(BY_PRIORITY_DESC);

        Instant now = clock.instant();
        if (items.isEmpty()) {
            Optional<ContextItem> fallback = semanticFallback(text, now);
            if (fallback.isEmpty()) {
                log.warn("[Context] No context items for query, fallback unavailable");
                return ContextBundle.builder()
                        .timestamp(now)
                        .query(text)
                        .strategy(strategy.getName())
                        .contextItems(List.of())
                        .success(false)
                        .error("No context available")
                        .build();
            }
            items.add(fallback.get());
        }

        ContextBundle bundle = ContextBundle.builder()
                .timestamp(now)
                .query(text)
                .strategy(strategy.getName())
                .contextItems(List.copyOf(items))
                .success(true)
                .build();
        cacheKey.ifPresent(key -> cache.put(key, bundle));
        log.debug("[Context] Generated {} context items with strategy {}", bundle.size(), strategy.getName());
        return bundle;
    }

    public ContextBundle generateContext(String query) {
        return generateContext(query, ContextOptions.defaults());
    }

    // ==================== Injection ====================

    /**
     * Generates, renders and records context for a prompt.
     */
    public ContextInjectionResult injectContext(String query, ContextOptions options) {
        ContextOptions effective = options != null ? options : ContextOptions.defaults();
        String displayQuery = query != null && !query.isBlank() ? query : ContextInjectionResult.BOUNDARY_QUERY;
        ContextFormat format = effective.getFormatOrDefault();
        log.info("[Context] Injecting context for query: {}", displayQuery);

        InitializationResult init = initialize();
        if (!init.isSuccess()) {
            log.error("[Context] Failed to inject context: initialization failed - {}", init.getError());
            return ContextInjectionResult.builder()
                    .timestamp(clock.instant())
                    .query(displayQuery)
                    .sessionId(effective.getSessionId() != null ? effective.getSessionId() : UNKNOWN_SESSION)
                    .boundaryInfo(effective.getBoundaryInfo())
                    .strategy(resolveStrategy(effective.getStrategy()).getName())
                    .format(format)
                    .formattedContext("")
                    .success(false)
                    .error("Initialization failed: " + init.getError())
                    .build();
        }

        ContextOptions enriched = withSessionState(effective);
        ContextBundle bundle = generateContext(query, enriched);
        String formatted = renderer.render(bundle, format);

        ContextInjectionResult result = ContextInjectionResult.builder()
                .timestamp(clock.instant())
                .query(displayQuery)
                .sessionId(enriched.getSessionId())
                .boundaryInfo(enriched.getBoundaryInfo())
                .strategy(bundle.getStrategy())
                .format(format)
                .contextCount(bundle.size())
                .formattedContext(formatted)
                .success(bundle.isSuccess())
                .error(bundle.getError())
                .build();

        historyRecorder.record(result);
        storeInjectionSummary(result, query);
        eventBus.publish(new ContextInjectedEvent(result.getSessionId(), result.getStrategy(),
                result.getContextCount(), result.getTimestamp()));
        return result;
    }

    /**
     * Places a boundary marker in the active session, then injects context with
     * the {@code boundary} strategy unless the options name another one.
     */
    public ContextInjectionResult injectContextAtBoundary(Map<String, Object> boundaryInfo, ContextOptions options) {
        Map<String, Object> info = boundaryInfo != null ? boundaryInfo : Map.of();
        log.info("[Context] Injecting context at token boundary: {}", info);
        ContextOptions effective = options != null ? options : ContextOptions.defaults();

        InitializationResult init = initialize();
        if (init.isSuccess()) {
            Map<String, Object> markerData = new HashMap<>();
            markerData.put("type", "token_boundary");
            markerData.put("source", "context-assembler");
            markerData.put("boundaryId", info.get("id") != null ? info.get("id").toString()
                    : "boundary-" + clock.millis());
            markerData.put("boundaryData", info);
            SessionBoundaryMarker marker = sessionDataStore.createSessionBoundary(markerData);
            if (!marker.isSuccess()) {
                log.warn("[Context] Could not record boundary marker: {}", marker.getError());
            }
        }

        ContextOptions boundaryOptions = effective.toBuilder()
                .strategy(effective.getStrategy() != null ? effective.getStrategy() : BoundaryContextStrategy.NAME)
                .boundaryInfo(info)
                .build();
        return injectContext("", boundaryOptions);
    }

    public ContextInjectionResult injectContextAtBoundary(Map<String, Object> boundaryInfo) {
        return injectContextAtBoundary(boundaryInfo, ContextOptions.defaults());
    }

    public String formatContextForInjection(ContextBundle bundle, ContextFormat format) {
        return renderer.render(bundle, format);
    }

    // ==================== Status ====================

    public ContextAssemblerStatus getStatus() {
        return new ContextAssemblerStatus(
                initGuard.isInitialized(),
                cache.isEnabled(),
                cache.size(),
                cache.getLastSweep(),
                config.isCompressionEnabled(),
                config.isValidationEnabled(),
                registry.size(),
                new ArrayList<>(strategies.keySet()),
                defaultStrategy,
                initGuard.getLastError(),
                clock.instant());
    }

    public void clearCache() {
        cache.clear();
    }

    @EventListener
    public void onSessionTimedOut(SessionTimedOutEvent event) {
        log.debug("[Context] Session {} timed out, clearing context cache", event.previousSessionId());
        cache.clear();
    }

    // ==================== Internals ====================

    private ContextStrategy resolveStrategy(String name) {
        if (name != null) {
            ContextStrategy strategy = strategies.get(name);
            if (strategy != null) {
                return strategy;
            }
            log.warn("[Context] Unknown strategy: {}, using {}", name, defaultStrategy);
        }
        ContextStrategy fallback = strategies.get(defaultStrategy);
        if (fallback == null) {
            throw new ContinuityInvariantException("Default context strategy missing: " + defaultStrategy);
        }
        return fallback;
    }

    private Optional<String> cacheKey(String strategy, String query, ContextOptions options) {
        if (!cache.isEnabled()) {
            return Optional.empty();
        }
        try {
            return cache.key(strategy, query, options);
        } catch (RuntimeException e) {
            log.warn("[Context] Cache unavailable, assembling without it: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<ContextItem> semanticFallback(String query, Instant now) {
        Optional<float[]> embedding = queryEmbedder.embed(query);
        if (embedding.isEmpty()) {
            return Optional.empty();
        }
        float[] vector = embedding.get();
        log.info("[Context] Using semantic fallback context ({} dimensions)", vector.length);
        return Optional.of(ContextItem.builder()
                .type("semantic")
                .id("semantic-context-" + now.toEpochMilli())
                .title("Semantic Context")
                .content("Query embedding generated with " + vector.length
                        + " dimensions. No stored context matched this query.")
                .priority(SEMANTIC_FALLBACK_PRIORITY)
                .embedding(vector)
                .build());
    }

    private ContextOptions withSessionState(ContextOptions options) {
        SessionState state = sessionDataStore.getSessionState();
        if (!state.isSuccess()) {
            log.warn("[Context] Could not get session state: {}", state.getError());
            return options.getSessionId() != null ? options : options.withSessionId(UNKNOWN_SESSION);
        }
        ContextOptions.ContextOptionsBuilder builder = options.toBuilder();
        if (options.getSessionId() == null) {
            builder.sessionId(state.getSessionId());
        }
        if (options.getBoundaryProximity() == null) {
            builder.boundaryProximity(state.getBoundaryProximity() != null
                    ? state.getBoundaryProximity()
                    : BoundaryProximity.UNKNOWN);
        }
        if (options.getContinuityScore() == null) {
            builder.continuityScore(state.getContinuityScore());
        }
        return builder.build();
    }

    private void storeInjectionSummary(ContextInjectionResult result, String query) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("timestamp", result.getTimestamp());
        summary.put("query", query);
        summary.put("strategy", result.getStrategy());
        summary.put("contextCount", result.getContextCount());
        summary.put("format", result.getFormat());
        if (!sessionDataStore.store(SessionDataStore.LAST_CONTEXT_INJECTION_KEY, summary)) {
            log.warn("[Context] Failed to store context injection in session");
        }
    }
}
