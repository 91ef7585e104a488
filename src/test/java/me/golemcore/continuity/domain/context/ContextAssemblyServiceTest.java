package me.golemcore.continuity.domain.context;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.continuity.domain.component.ContextProviderComponent;
import me.golemcore.continuity.domain.context.strategy.BoundaryContextStrategy;
import me.golemcore.continuity.domain.context.strategy.ComprehensiveContextStrategy;
import me.golemcore.continuity.domain.context.strategy.ContextStrategy;
import me.golemcore.continuity.domain.context.strategy.DevelopmentFlowContextStrategy;
import me.golemcore.continuity.domain.context.strategy.MetaCognitiveFocusedContextStrategy;
import me.golemcore.continuity.domain.context.strategy.MinimalContextStrategy;
import me.golemcore.continuity.domain.context.strategy.StandardContextStrategy;
import me.golemcore.continuity.domain.context.strategy.VisionFocusedContextStrategy;
import me.golemcore.continuity.domain.model.BoundaryProximity;
import me.golemcore.continuity.domain.model.ContextBundle;
import me.golemcore.continuity.domain.model.ContextFormat;
import me.golemcore.continuity.domain.model.ContextInjectedEvent;
import me.golemcore.continuity.domain.model.ContextInjectionResult;
import me.golemcore.continuity.domain.model.ContextItem;
import me.golemcore.continuity.domain.model.ContextOptions;
import me.golemcore.continuity.domain.model.ContinuityConfigurationException;
import me.golemcore.continuity.domain.model.SessionBoundaryMarker;
import me.golemcore.continuity.domain.model.SessionState;
import me.golemcore.continuity.domain.model.SessionTimedOutEvent;
import me.golemcore.continuity.domain.service.SessionDataStore;
import me.golemcore.continuity.infrastructure.config.AutoConfiguration;
import me.golemcore.continuity.infrastructure.config.ContinuityProperties;
import me.golemcore.continuity.infrastructure.event.SpringEventBus;
import me.golemcore.continuity.infrastructure.lifecycle.InitializationResult;
import me.golemcore.continuity.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ContextAssemblyServiceTest {

    private static final Instant START = Instant.parse("2026-03-01T09:00:00Z");
    private static final String SESSION_ID = "session-1772355600000-abcdefgh";

    private MutableClock clock;
    private ObjectMapper objectMapper;
    private ContinuityProperties properties;
    private ContextCache cache;
    private ContextHistoryRecorder historyRecorder;
    private QueryEmbedder queryEmbedder;
    private SessionDataStore sessionDataStore;
    private ApplicationEventPublisher publisher;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        objectMapper = AutoConfiguration.objectMapper();
        properties = new ContinuityProperties();
        cache = new ContextCache(clock, objectMapper, properties);
        historyRecorder = mock(ContextHistoryRecorder.class);
        when(historyRecorder.record(any())).thenReturn(true);
        queryEmbedder = mock(QueryEmbedder.class);
        when(queryEmbedder.embed(anyString())).thenReturn(Optional.empty());
        sessionDataStore = mock(SessionDataStore.class);
        when(sessionDataStore.initialize()).thenReturn(InitializationResult.succeeded(1));
        when(sessionDataStore.store(anyString(), any())).thenReturn(true);
        when(sessionDataStore.getSessionState()).thenReturn(SessionState.builder()
                .success(true)
                .sessionId(SESSION_ID)
                .boundaryProximity(BoundaryProximity.MEDIUM)
                .continuityScore(0.8)
                .dataKeys(List.of())
                .build());
        publisher = mock(ApplicationEventPublisher.class);
    }

    private ContextAssemblyService service(ContextProviderComponent... providers) {
        ContextProviderRegistry registry = new ContextProviderRegistry(List.of(providers));
        List<ContextStrategy> strategies = List.of(
                new StandardContextStrategy(),
                new MinimalContextStrategy(),
                new BoundaryContextStrategy(objectMapper),
                new ComprehensiveContextStrategy(),
                new VisionFocusedContextStrategy(),
                new MetaCognitiveFocusedContextStrategy(),
                new DevelopmentFlowContextStrategy());
        ContextRenderer renderer = new ContextRenderer(new ContextItemValidator(properties),
                new ContextCompressor(properties), objectMapper);
        return new ContextAssemblyService(registry, strategies, cache, renderer, historyRecorder, queryEmbedder,
                sessionDataStore, new SpringEventBus(publisher), clock, properties);
    }

    private static ContextOptions strategy(String name) {
        return ContextOptions.builder().strategy(name).build();
    }

    // ==================== Ordering ====================

    @Test
    void itemsAreOrderedByDescendingPriority() {
        FixedContextProvider b = new FixedContextProvider("b", 1, FixedContextProvider.item("B", 0.5));
        FixedContextProvider a = new FixedContextProvider("a", 2, FixedContextProvider.item("A", 0.9));
        ContextAssemblyService service = service(b, a);

        ContextBundle bundle = service.generateContext("q", strategy(ComprehensiveContextStrategy.NAME));

        assertTrue(bundle.isSuccess());
        assertEquals(List.of("A", "B"), bundle.getContextItems().stream().map(ContextItem::getId).toList());
    }

    @Test
    void equalPrioritiesKeepProviderOrderAndMissingPriorityGoesLast() {
        FixedContextProvider first = new FixedContextProvider("first", 1,
                FixedContextProvider.item("no-priority", null), FixedContextProvider.item("x", 0.6));
        FixedContextProvider second = new FixedContextProvider("second", 2, FixedContextProvider.item("y", 0.6));
        ContextAssemblyService service = service(first, second);

        ContextBundle bundle = service.generateContext("q", strategy(ComprehensiveContextStrategy.NAME));

        assertEquals(List.of("x", "y", "no-priority"),
                bundle.getContextItems().stream().map(ContextItem::getId).toList());
    }

    @Test
    void standardStrategyCombinesNamedProviders() {
        ContextAssemblyService service = service(
                new FixedContextProvider(ProviderNames.VISION, 10, FixedContextProvider.item("vision", 0.9)),
                new FixedContextProvider(ProviderNames.SESSION, 40, FixedContextProvider.item("session", 0.7)),
                new FixedContextProvider("unrelated", 60, FixedContextProvider.item("other", 1.0)));

        ContextBundle bundle = service.generateContext("q", ContextOptions.defaults());

        assertEquals("standard", bundle.getStrategy());
        assertEquals(List.of("vision", "session"), bundle.getContextItems().stream().map(ContextItem::getId).toList());
    }

    @Test
    void unknownStrategyFallsBackToDefault() {
        ContextAssemblyService service = service(
                new FixedContextProvider(ProviderNames.VISION, 10, FixedContextProvider.item("vision", 0.9)));

        ContextBundle bundle = service.generateContext("q", strategy("does-not-exist"));

        assertEquals("standard", bundle.getStrategy());
        assertEquals(1, bundle.size());
    }

    // ==================== Cache ====================

    @Test
    void repeatedQueryIsServedFromCacheUntilTtlExpires() {
        FixedContextProvider vision = new FixedContextProvider(ProviderNames.VISION, 10,
                FixedContextProvider.item("vision", 0.9));
        ContextAssemblyService service = service(vision);

        ContextBundle first = service.generateContext("q", ContextOptions.defaults());
        ContextBundle second = service.generateContext("q", ContextOptions.defaults());

        assertFalse(first.isCached());
        assertTrue(second.isCached());
        assertEquals(1, vision.getCallCount());

        clock.advance(properties.getContext().getCacheTtl().plusSeconds(1));
        service.generateContext("q", ContextOptions.defaults());
        assertEquals(2, vision.getCallCount());
    }

    @Test
    void sessionTimeoutClearsCache() {
        FixedContextProvider vision = new FixedContextProvider(ProviderNames.VISION, 10,
                FixedContextProvider.item("vision", 0.9));
        ContextAssemblyService service = service(vision);
        service.generateContext("q", ContextOptions.defaults());

        service.onSessionTimedOut(new SessionTimedOutEvent("old", "new", Duration.ofMinutes(31), START));
        service.generateContext("q", ContextOptions.defaults());

        assertEquals(2, vision.getCallCount());
        assertEquals(1, service.getStatus().cacheSize());
    }

    // ==================== Fallback ====================

    @Test
    void emptyStrategyResultFallsBackToSemanticItem() {
        when(queryEmbedder.embed("what changed?")).thenReturn(Optional.of(new float[] { 0.1f, 0.2f, 0.3f }));
        ContextAssemblyService service = service();

        ContextBundle bundle = service.generateContext("what changed?", ContextOptions.defaults());

        assertTrue(bundle.isSuccess());
        assertEquals(1, bundle.size());
        ContextItem semantic = bundle.getContextItems().get(0);
        assertEquals("semantic", semantic.getType());
        assertEquals("Semantic Context", semantic.getTitle());
        assertEquals(0.85, semantic.getPriority(), 1e-9);
        assertEquals(3, semantic.getEmbedding().length);
    }

    @Test
    void emptyResultWithoutEmbeddingReportsFailure() {
        ContextAssemblyService service = service();

        ContextBundle bundle = service.generateContext("q", ContextOptions.defaults());

        assertFalse(bundle.isSuccess());
        assertTrue(bundle.isEmpty());
        assertNotNull(bundle.getError());
    }

    // ==================== Configuration ====================

    @Test
    void shouldRejectUnregisteredDefaultStrategy() {
        properties.getContext().setDefaultStrategy("missing");

        assertThrows(ContinuityConfigurationException.class, this::service);
    }

    @Test
    void shouldRejectEmptyStrategySet() {
        ContextProviderRegistry registry = new ContextProviderRegistry(List.of());
        ContextRenderer renderer = new ContextRenderer(new ContextItemValidator(properties),
                new ContextCompressor(properties), objectMapper);

        assertThrows(ContinuityConfigurationException.class, () -> new ContextAssemblyService(registry, List.of(),
                cache, renderer, historyRecorder, queryEmbedder, sessionDataStore, new SpringEventBus(publisher),
                clock, properties));
    }

    // ==================== Injection ====================

    @Test
    void injectContextRendersRecordsAndStoresSummary() {
        ContextAssemblyService service = service(
                new FixedContextProvider(ProviderNames.VISION, 10, FixedContextProvider.item("vision", 0.9)));

        ContextInjectionResult result = service.injectContext("next step?", ContextOptions.defaults());

        assertTrue(result.isSuccess());
        assertEquals(SESSION_ID, result.getSessionId());
        assertEquals(1, result.getContextCount());
        assertEquals(ContextFormat.MARKDOWN, result.getFormat());
        assertTrue(result.getFormattedContext().startsWith("## Context Awareness"));
        verify(historyRecorder).record(result);
        verify(sessionDataStore).store(eq(SessionDataStore.LAST_CONTEXT_INJECTION_KEY), any());
        verify(publisher).publishEvent(any(ContextInjectedEvent.class));
    }

    @Test
    void injectContextPassesSessionStateToProviders() {
        FixedContextProvider vision = new FixedContextProvider(ProviderNames.VISION, 10,
                FixedContextProvider.item("vision", 0.9));
        ContextAssemblyService service = service(vision);

        service.injectContext("q", ContextOptions.defaults());

        ContextOptions seen = vision.getLastOptions();
        assertEquals(SESSION_ID, seen.getSessionId());
        assertEquals(BoundaryProximity.MEDIUM, seen.getBoundaryProximity());
        assertEquals(0.8, seen.getContinuityScore(), 1e-9);
    }

    @Test
    void injectContextFailsCleanlyWhenSessionDataUnavailable() {
        when(sessionDataStore.initialize()).thenReturn(InitializationResult.failed("disk gone", false, 3));
        ContextAssemblyService service = service(
                new FixedContextProvider(ProviderNames.VISION, 10, FixedContextProvider.item("vision", 0.9)));

        ContextInjectionResult result = service.injectContext("q", ContextOptions.defaults());

        assertFalse(result.isSuccess());
        assertEquals("", result.getFormattedContext());
        assertTrue(result.getError().contains("disk gone"));
        verify(historyRecorder, never()).record(any());
    }

    @Test
    void injectContextAtBoundaryMarksSessionAndLeadsWithBoundaryItem() {
        when(sessionDataStore.createSessionBoundary(anyMap())).thenReturn(SessionBoundaryMarker.builder()
                .id("boundary-1")
                .success(true)
                .build());
        FixedContextProvider adaptive = new FixedContextProvider(ProviderNames.ADAPTIVE, 50);
        ContextAssemblyService service = service(
                new FixedContextProvider(ProviderNames.VISION, 10, FixedContextProvider.item("vision", 0.9)),
                adaptive);

        ContextInjectionResult result = service.injectContextAtBoundary(Map.of("id", "b-42", "tokens", 8000));

        assertEquals(ContextInjectionResult.BOUNDARY_QUERY, result.getQuery());
        assertEquals(BoundaryContextStrategy.NAME, result.getStrategy());
        assertEquals(2, result.getContextCount());
        assertTrue(result.getFormattedContext().indexOf("### Token Boundary")
                < result.getFormattedContext().indexOf("### Title vision"));
        assertEquals(5, adaptive.getLastOptions().getLimit());
        assertEquals(0.75, adaptive.getLastOptions().getMinRelevance(), 1e-9);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> marker = ArgumentCaptor.forClass(Map.class);
        verify(sessionDataStore).createSessionBoundary(marker.capture());
        assertEquals("token_boundary", marker.getValue().get("type"));
        assertEquals("b-42", marker.getValue().get("boundaryId"));
    }

    @Test
    void formatContextForInjectionUsesRequestedFormat() {
        ContextAssemblyService service = service(
                new FixedContextProvider(ProviderNames.VISION, 10, FixedContextProvider.item("vision", 0.9)));
        ContextBundle bundle = service.generateContext("q", ContextOptions.defaults());

        assertTrue(service.formatContextForInjection(bundle, ContextFormat.PLAIN).startsWith("CONTEXT AWARENESS"));
    }

    @Test
    void statusReportsConfiguration() {
        ContextAssemblyService service = service(new FixedContextProvider(ProviderNames.VISION, 10));

        ContextAssemblerStatus status = service.getStatus();

        assertEquals("standard", status.defaultStrategy());
        assertEquals(7, status.strategies().size());
        assertEquals(1, status.providerCount());
        assertTrue(status.cacheEnabled());
    }
}
