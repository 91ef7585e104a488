package me.golemcore.continuity.domain.context.provider;

import me.golemcore.continuity.domain.model.ContextItem;
import me.golemcore.continuity.domain.model.ContextOptions;
import me.golemcore.continuity.port.outbound.MetaCognitivePort;
import me.golemcore.continuity.port.outbound.RecentChangesPort;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class OptionalPortContextProviderTest {

    private static final ContextItem REFLECTION = ContextItem.builder()
            .type("metacognitive")
            .id("reflection-1")
            .title("Reflection")
            .content("Tests were skipped twice")
            .priority(0.6)
            .build();

    @SuppressWarnings("unchecked")
    private static <T> ObjectProvider<T> providerOf(T bean) {
        ObjectProvider<T> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(bean);
        return provider;
    }

    @Test
    void metaCognitiveProviderDelegatesToPort() {
        MetaCognitivePort port = mock(MetaCognitivePort.class);
        when(port.getMetaCognitiveContext("q")).thenReturn(List.of(REFLECTION));

        MetaCognitiveContextProvider provider = new MetaCognitiveContextProvider(providerOf(port));

        assertEquals(List.of(REFLECTION), provider.provide("q", ContextOptions.defaults()));
    }

    @Test
    void metaCognitiveProviderIsEmptyWithoutPort() {
        MetaCognitiveContextProvider provider = new MetaCognitiveContextProvider(providerOf(null));

        assertTrue(provider.provide("q", ContextOptions.defaults()).isEmpty());
    }

    @Test
    void recentChangesProviderTreatsNullAsEmpty() {
        RecentChangesPort port = mock(RecentChangesPort.class);
        when(port.getRecentChanges("q")).thenReturn(null);

        RecentChangesContextProvider provider = new RecentChangesContextProvider(providerOf(port));

        assertTrue(provider.provide("q", ContextOptions.defaults()).isEmpty());
    }

    @Test
    void recentChangesProviderIsEmptyWithoutPort() {
        RecentChangesContextProvider provider = new RecentChangesContextProvider(providerOf(null));

        assertTrue(provider.provide("q", ContextOptions.defaults()).isEmpty());
    }
}
