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

import me.golemcore.continuity.domain.context.ContextProviderRegistry;
import me.golemcore.continuity.domain.model.ContextItem;
import me.golemcore.continuity.domain.model.ContextOptions;

import java.util.List;

/**
 * A named recipe combining provider output into a list of context items.
 *
 * <p>
 * Strategies only collect items. Ordering by priority, validation and fallback
 * are applied by the assembler afterwards.
 */
public interface ContextStrategy {

    String getName();

    List<ContextItem> assemble(String query, ContextOptions options, ContextProviderRegistry registry);

    static List<ContextItem> first(List<ContextItem> items) {
        return items.isEmpty() ? List.of() : List.of(items.get(0));
    }

    static List<ContextItem> boost(List<ContextItem> items, double boost) {
        return items.stream().map(item -> item.boosted(boost)).toList();
    }

    static ContextOptions adaptiveOptions(ContextOptions options, Integer limit, Double minRelevance) {
        ContextOptions base = options != null ? options : ContextOptions.defaults();
        ContextOptions result = base.withLimit(limit);
        return minRelevance != null ? result.withMinRelevance(minRelevance) : result;
    }
}
