package me.golemcore.continuity.domain.context;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.continuity.domain.model.ContextBundle;
import me.golemcore.continuity.domain.model.ContextFormat;
import me.golemcore.continuity.domain.model.ContextItem;
import me.golemcore.continuity.infrastructure.config.AutoConfiguration;
import me.golemcore.continuity.infrastructure.config.ContinuityProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContextRendererTest {

    private ObjectMapper objectMapper;
    private ContextRenderer renderer;

    @BeforeEach
    void setUp() {
        ContinuityProperties properties = new ContinuityProperties();
        objectMapper = AutoConfiguration.objectMapper();
        renderer = new ContextRenderer(new ContextItemValidator(properties), new ContextCompressor(properties),
                objectMapper);
    }

    private static ContextBundle bundle(ContextItem... items) {
        return ContextBundle.builder()
                .timestamp(Instant.parse("2026-03-01T09:00:00Z"))
                .query("q")
                .strategy("standard")
                .contextItems(List.of(items))
                .success(true)
                .build();
    }

    private static ContextItem item(String title, String content) {
        return ContextItem.builder().type("test").id(title).title(title).content(content).priority(0.5).build();
    }

    @Test
    void rendersMarkdownSections() {
        String markdown = renderer.render(bundle(item("Vision", "Stay focused"), item("Session", "Active")),
                ContextFormat.MARKDOWN);

        assertEquals("## Context Awareness\n\n### Vision\n\nStay focused\n\n### Session\n\nActive\n\n", markdown);
    }

    @Test
    void rendersPlainTextWithUnderlinedTitles() {
        String plain = renderer.render(bundle(item("Vision", "Stay focused")), ContextFormat.PLAIN);

        assertEquals("CONTEXT AWARENESS\n\nVISION\n------\nStay focused\n\n", plain);
    }

    @Test
    void rendersJsonWithCompressedContent() throws Exception {
        String json = renderer.render(bundle(item("Long", "word ".repeat(400))), ContextFormat.JSON);

        JsonNode node = objectMapper.readTree(json);
        assertEquals("standard", node.get("strategy").asText());
        String content = node.get("contextItems").get(0).get("content").asText();
        assertTrue(content.endsWith(ContextCompressor.TRUNCATION_MARKER));
        assertEquals(800 + ContextCompressor.TRUNCATION_MARKER.length(), content.length());
    }

    @Test
    void skipsInvalidItems() {
        String markdown = renderer.render(bundle(item("Kept", "yes"), item("Dropped", null)), ContextFormat.MARKDOWN);

        assertTrue(markdown.contains("### Kept"));
        assertFalse(markdown.contains("Dropped"));
    }

    @Test
    void emptyBundleRendersEmptyString() {
        assertEquals("", renderer.render(bundle(), ContextFormat.MARKDOWN));
        assertEquals("", renderer.render(null, ContextFormat.JSON));
    }
}
