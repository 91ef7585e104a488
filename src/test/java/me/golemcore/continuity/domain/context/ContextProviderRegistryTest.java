package me.golemcore.continuity.domain.context;

import me.golemcore.continuity.domain.component.ContextProviderComponent;
import me.golemcore.continuity.domain.model.ContextItem;
import me.golemcore.continuity.domain.model.ContextOptions;
import me.golemcore.continuity.domain.model.ContinuityConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ContextProviderRegistryTest {

    @Test
    void registersEnabledProvidersByOrder() {
        FixedContextProvider late = new FixedContextProvider("late", 50);
        FixedContextProvider early = new FixedContextProvider("early", 10);
        ContextProviderComponent disabled = mock(ContextProviderComponent.class);
        when(disabled.isEnabled()).thenReturn(false);
        when(disabled.getProviderName()).thenReturn("disabled");

        ContextProviderRegistry registry = new ContextProviderRegistry(List.of(late, disabled, early));

        assertEquals(List.of("early", "late"), registry.getProviderNames());
        assertEquals(2, registry.size());
    }

    @Test
    void shouldRejectDuplicateProviderNames() {
        List<ContextProviderComponent> providers = List.of(
                new FixedContextProvider("vision", 1), new FixedContextProvider("vision", 2));

        assertThrows(ContinuityConfigurationException.class, () -> new ContextProviderRegistry(providers));
    }

    @Test
    void throwingProviderContributesNothing() {
        ContextProviderComponent failing = mock(ContextProviderComponent.class);
        when(failing.isEnabled()).thenReturn(true);
        when(failing.getProviderName()).thenReturn("failing");
        when(failing.provide(anyString(), any())).thenThrow(new IllegalStateException("backend down"));
        ContextProviderRegistry registry = new ContextProviderRegistry(List.of(failing));

        List<ContextItem> items = registry.fetch("failing", "query", ContextOptions.defaults());

        assertTrue(items.isEmpty());
    }

    @Test
    void unknownProviderContributesNothing() {
        ContextProviderRegistry registry = new ContextProviderRegistry(List.of());

        assertTrue(registry.fetch("metacognitive", "query", ContextOptions.defaults()).isEmpty());
    }

    @Test
    void fetchReturnsProviderItems() {
        FixedContextProvider provider = new FixedContextProvider("session", 1,
                FixedContextProvider.item("s", 0.7));
        ContextProviderRegistry registry = new ContextProviderRegistry(List.of(provider));

        List<ContextItem> items = registry.fetch("session", "query", ContextOptions.defaults());

        assertEquals(1, items.size());
        assertEquals("s", items.get(0).getId());
    }
}
