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
import me.golemcore.continuity.domain.model.ContextFormat;
import me.golemcore.continuity.infrastructure.config.ContinuityProperties;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Shortens long item content before rendering.
 *
 * <p>
 * Content below {@code continuity.context.compression-threshold} passes
 * through. Longer content has whitespace runs collapsed and is cut to the
 * format's {@code continuity.context.max-section-length.*} limit with a
 * truncation marker.
 */
@Component
@Slf4j
public class ContextCompressor {

    public static final String TRUNCATION_MARKER = "... [content truncated]";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final boolean enabled;
    private final int threshold;
    private final ContinuityProperties.SectionLengthProperties maxLengths;

    public ContextCompressor(ContinuityProperties properties) {
        this.enabled = properties.getContext().isCompressionEnabled();
        this.threshold = properties.getContext().getCompressionThreshold();
        this.maxLengths = properties.getContext().getMaxSectionLength();
    }

    public String compress(String content, ContextFormat format) {
        if (!enabled || content == null || content.length() < threshold) {
            return content;
        }
        try {
            String collapsed = WHITESPACE.matcher(content).replaceAll(" ");
            int max = maxSectionLength(format != null ? format : ContextFormat.MARKDOWN);
            if (collapsed.length() <= max) {
                return collapsed;
            }
            return collapsed.substring(0, max) + TRUNCATION_MARKER;
        } catch (RuntimeException e) {
            log.warn("[Context] Compression failed, using original content: {}", e.getMessage());
            return content;
        }
    }

    int maxSectionLength(ContextFormat format) {
        return switch (format) {
            case JSON -> maxLengths.getJson();
            case PLAIN -> maxLengths.getPlain();
            case MARKDOWN -> maxLengths.getMarkdown();
        };
    }
}
