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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.continuity.domain.model.ContextBundle;
import me.golemcore.continuity.domain.model.ContextFormat;
import me.golemcore.continuity.domain.model.ContextItem;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Renders a context bundle as prompt text.
 *
 * <p>
 * Items are validated and their content compressed here, so a bundle keeps the
 * full provider output until it is formatted.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContextRenderer {

    static final String MARKDOWN_HEADER = "## Context Awareness\n\n";
    static final String PLAIN_HEADER = "CONTEXT AWARENESS\n\n";

    private final ContextItemValidator validator;
    private final ContextCompressor compressor;
    private final ObjectMapper objectMapper;

    public String render(ContextBundle bundle, ContextFormat format) {
        if (bundle == null || bundle.isEmpty()) {
            return "";
        }
        ContextFormat effective = format != null ? format : ContextFormat.MARKDOWN;
        List<ContextItem> items = validator.filterValid(bundle.getContextItems());
        return switch (effective) {
        case MARKDOWN -> renderMarkdown(items);
        case PLAIN -> renderPlain(items);
        case JSON -> renderJson(bundle, items);
        };
    }

    private String renderMarkdown(List<ContextItem> items) {
        StringBuilder markdown = new StringBuilder(MARKDOWN_HEADER);
        for (ContextItem item : items) {
            markdown.append("### ").append(item.getTitle()).append("\n\n");
            markdown.append(compressor.compress(item.getContent(), ContextFormat.MARKDOWN)).append("\n\n");
        }
        return markdown.toString();
    }

    private String renderPlain(List<ContextItem> items) {
        StringBuilder text = new StringBuilder(PLAIN_HEADER);
        for (ContextItem item : items) {
            text.append(item.getTitle().toUpperCase(Locale.ROOT)).append('\n');
            text.append("-".repeat(item.getTitle().length())).append('\n');
            text.append(compressor.compress(item.getContent(), ContextFormat.PLAIN)).append("\n\n");
        }
        return text.toString();
    }

    private String renderJson(ContextBundle bundle, List<ContextItem> items) {
        List<ContextItem> compressed = items.stream()
                .map(item -> item.toBuilder()
                        .content(compressor.compress(item.getContent(), ContextFormat.JSON))
                        .build())
                .toList();
        try {
            return objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(bundle.toBuilder().contextItems(compressed).build());
        } catch (JsonProcessingException e) {
            log.error("[Context] Failed to render context as JSON: {}", e.getOriginalMessage());
            return "";
        }
    }
}
