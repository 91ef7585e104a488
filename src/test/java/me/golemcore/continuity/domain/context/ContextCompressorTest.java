package me.golemcore.continuity.domain.context;

import me.golemcore.continuity.domain.model.ContextFormat;
import me.golemcore.continuity.infrastructure.config.ContinuityProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ContextCompressorTest {

    private final ContextCompressor compressor = new ContextCompressor(new ContinuityProperties());

    @Test
    void shortContentIsUntouched() {
        String content = "line one\n\n   line two";

        assertEquals(content, compressor.compress(content, ContextFormat.MARKDOWN));
    }

    @Test
    void longContentIsCollapsedAndTruncatedPerFormat() {
        String content = "word\n\t ".repeat(400);

        String markdown = compressor.compress(content, ContextFormat.MARKDOWN);
        String json = compressor.compress(content, ContextFormat.JSON);
        String plain = compressor.compress(content, ContextFormat.PLAIN);

        assertEquals(1000 + ContextCompressor.TRUNCATION_MARKER.length(), markdown.length());
        assertEquals(800 + ContextCompressor.TRUNCATION_MARKER.length(), json.length());
        assertEquals(500 + ContextCompressor.TRUNCATION_MARKER.length(), plain.length());
        assertTrue(plain.endsWith(ContextCompressor.TRUNCATION_MARKER));
        assertFalse(markdown.contains("\n"));
        assertTrue(markdown.startsWith("word word word"));
    }

    @Test
    void configuredSectionLengthOverridesFormatDefault() {
        ContinuityProperties properties = new ContinuityProperties();
        properties.getContext().getMaxSectionLength().setPlain(120);
        ContextCompressor configured = new ContextCompressor(properties);
        String content = "word ".repeat(400);

        String plain = configured.compress(content, ContextFormat.PLAIN);

        assertEquals(120 + ContextCompressor.TRUNCATION_MARKER.length(), plain.length());
        assertEquals(1000 + ContextCompressor.TRUNCATION_MARKER.length(),
                configured.compress(content, ContextFormat.MARKDOWN).length());
    }

    @Test
    void longContentThatFitsAfterCollapsingIsNotTruncated() {
        String content = "a" + " ".repeat(1200) + "b";

        assertEquals("a b", compressor.compress(content, ContextFormat.PLAIN));
    }

    @Test
    void disabledCompressionReturnsOriginal() {
        ContinuityProperties properties = new ContinuityProperties();
        properties.getContext().setCompressionEnabled(false);
        String content = "x".repeat(5000);

        assertSame(content, new ContextCompressor(properties).compress(content, ContextFormat.PLAIN));
    }
}
