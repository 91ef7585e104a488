package me.golemcore.continuity.domain.context.provider;

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
import me.golemcore.continuity.domain.component.ContextProviderComponent;
import me.golemcore.continuity.domain.context.ProviderNames;
import me.golemcore.continuity.domain.context.QueryEmbedder;
import me.golemcore.continuity.domain.memorygraph.MemoryGraphWriter;
import me.golemcore.continuity.domain.memorygraph.StoredEmbedding;
import me.golemcore.continuity.domain.model.ContextItem;
import me.golemcore.continuity.domain.model.ContextOptions;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Semantic lookup over the memory graph.
 *
 * <p>
 * The query is embedded and compared against every written embedding by cosine
 * similarity. Matches at or above {@code minRelevance} are joined to their
 * chunk by {@code chunk_id} and the best {@code limit} are returned, with the
 * similarity as priority.
 */
@Component
@Slf4j
public class AdaptiveContextProvider implements ContextProviderComponent {

    static final int DEFAULT_LIMIT = 5;
    static final double DEFAULT_MIN_RELEVANCE = 0.6;

    private final QueryEmbedder queryEmbedder;
    private final MemoryGraphWriter memoryGraph;

    public AdaptiveContextProvider(QueryEmbedder queryEmbedder, MemoryGraphWriter memoryGraph) {
        this.queryEmbedder = queryEmbedder;
        this.memoryGraph = memoryGraph;
    }

    @Override
    public String getProviderName() {
        return ProviderNames.ADAPTIVE;
    }

    @Override
    public List<ContextItem> provide(String query, ContextOptions options) {
        int limit = options != null && options.getLimit() != null ? options.getLimit() : DEFAULT_LIMIT;
        double minRelevance = options != null && options.getMinRelevance() != null
                ? options.getMinRelevance()
                : DEFAULT_MIN_RELEVANCE;
        if (limit <= 0) {
            return List.of();
        }

        Optional<float[]> queryVector = queryEmbedder.embed(query);
        if (queryVector.isEmpty()) {
            return List.of();
        }

        List<StoredEmbedding> embeddings = memoryGraph.readEmbeddings();
        if (embeddings.isEmpty()) {
            return List.of();
        }
        Map<String, Map<String, Object>> chunksById = indexChunks(memoryGraph.readChunks());

        List<Scored> matches = new ArrayList<>();
        for (StoredEmbedding embedding : embeddings) {
            if (embedding.vector().length != queryVector.get().length) {
                continue;
            }
            double similarity = queryEmbedder.similarity(queryVector.get(), embedding.vector());
            if (similarity >= minRelevance) {
                matches.add(new Scored(embedding, similarity));
            }
        }
        matches.sort(Comparator.comparingDouble(Scored::similarity).reversed());

        List<ContextItem> items = new ArrayList<>();
        for (Scored match : matches) {
            if (items.size() >= limit) {
                break;
            }
            Map<String, Object> chunk = chunksById.get(match.embedding().chunkId());
            Map<String, Object> source = chunk != null ? chunk : match.embedding().record();
            String content = text(source, "content", "text");
            if (content == null || content.isBlank()) {
                continue;
            }
            String title = chunk != null ? text(chunk, "title", "source") : null;
            String id = match.embedding().chunkId() != null ? match.embedding().chunkId() : match.embedding().id();
            items.add(ContextItem.builder()
                    .type(ProviderNames.ADAPTIVE)
                    .id("adaptive-" + id)
                    .title(title != null ? title : "Related Memory")
                    .content(content)
                    .priority(Math.max(0.0, Math.min(1.0, match.similarity())))
                    .build());
        }
        log.debug("[Context] Adaptive lookup returned {} of {} candidates", items.size(), matches.size());
        return items;
    }

    @Override
    public int getOrder() {
        return 50;
    }

    private Map<String, Map<String, Object>> indexChunks(List<Map<String, Object>> chunks) {
        Map<String, Map<String, Object>> byId = new HashMap<>();
        for (Map<String, Object> chunk : chunks) {
            Object id = chunk.get("chunk_id");
            if (id != null) {
                byId.put(id.toString(), chunk);
            }
        }
        return byId;
    }

    private static String text(Map<String, Object> record, String... keys) {
        for (String key : keys) {
            Object value = record.get(key);
            if (value != null) {
                return value.toString();
            }
        }
        return null;
    }

    private record Scored(StoredEmbedding embedding, double similarity) {
    }
}
