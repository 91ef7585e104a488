package me.golemcore.continuity.adapter.outbound.vision;

import me.golemcore.continuity.domain.model.ContextItem;
import me.golemcore.continuity.infrastructure.config.ContinuityProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PropertiesVisionAnchorAdapterTest {

    private ContinuityProperties properties;
    private PropertiesVisionAnchorAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new ContinuityProperties();
        adapter = new PropertiesVisionAnchorAdapter(properties);
    }

    @Test
    void emptyWhenNothingConfigured() {
        assertTrue(adapter.getVisionContext().isEmpty());
    }

    @Test
    void combinesStatementAndPrinciples() {
        properties.getVision().setStatement("  Keep the agent oriented across sessions. ");
        properties.getVision().setPrinciples(List.of("Small steps", "Tests first"));

        Optional<ContextItem> vision = adapter.getVisionContext();

        assertTrue(vision.isPresent());
        assertEquals("vision", vision.get().getType());
        assertEquals("project_vision", vision.get().getId());
        assertEquals("Project Vision", vision.get().getTitle());
        assertEquals(0.9, vision.get().getPriority(), 1e-9);
        assertEquals("Keep the agent oriented across sessions.\n\nPrinciples:\n- Small steps\n- Tests first",
                vision.get().getContent());
    }

    @Test
    void principlesAloneAreEnough() {
        properties.getVision().setPrinciples(List.of("Small steps"));

        assertEquals("Principles:\n- Small steps", adapter.getVisionContext().orElseThrow().getContent());
    }
}
