package me.golemcore.continuity.domain.context.strategy;

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
import me.golemcore.continuity.domain.context.ContextProviderRegistry;
import me.golemcore.continuity.domain.context.ProviderNames;
import me.golemcore.continuity.domain.model.ContextItem;
import me.golemcore.continuity.domain.model.ContextOptions;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Context for the moment a token boundary is crossed.
 *
 * <p>
 * When the options carry {@code boundaryInfo}, a synthesized boundary item
 * describing it leads the list, followed by vision, session state, reflection
 * and up to five strong semantic matches.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BoundaryContextStrategy implements ContextStrategy {

    public static final String NAME = "boundary";
    static final double BOUNDARY_PRIORITY = 0.95;

    private final ObjectMapper objectMapper;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<ContextItem> assemble(String query, ContextOptions options, ContextProviderRegistry registry) {
        List<ContextItem> items = new ArrayList<>();
        Map<String, Object> boundaryInfo = options != null ? options.getBoundaryInfo() : null;
        if (boundaryInfo != null) {
            String boundaryId = options.getBoundaryId() != null ? options.getBoundaryId() : "unknown";
            items.add(ContextItem.builder()
                    .type("boundary")
                    .id("boundary-" + boundaryId)
                    .title("Token Boundary")
                    .content("Crossing token boundary: " + describe(boundaryInfo))
                    .priority(BOUNDARY_PRIORITY)
                    .build());
        }
        items.addAll(registry.fetch(ProviderNames.VISION, query, options));
        items.addAll(registry.fetch(ProviderNames.SESSION, query, options));
        items.addAll(registry.fetch(ProviderNames.METACOGNITIVE, query, options));
        items.addAll(registry.fetch(ProviderNames.ADAPTIVE, query,
                ContextStrategy.adaptiveOptions(options, 5, 0.75)));
        return items;
    }

    private String describe(Map<String, Object> boundaryInfo) {
        try {
            return objectMapper.writeValueAsString(boundaryInfo);
        } catch (JsonProcessingException e) {
            log.warn("[Context] Cannot serialize boundary info: {}", e.getOriginalMessage());
            return boundaryInfo.toString();
        }
    }
}
