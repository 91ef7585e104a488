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
import me.golemcore.continuity.infrastructure.config.ContinuityProperties;
import me.golemcore.continuity.port.outbound.EmbeddingPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Embeds query text through {@link EmbeddingPort}, bounded by
 * {@code continuity.embedding.timeout}. An unavailable, failing or slow
 * backend yields an empty result.
 */
@Component
@Slf4j
public class QueryEmbedder {

    private final EmbeddingPort embeddingPort;
    private final Duration timeout;

    public QueryEmbedder(EmbeddingPort embeddingPort, ContinuityProperties properties) {
        this.embeddingPort = embeddingPort;
        this.timeout = properties.getEmbedding().getTimeout();
    }

    public Optional<float[]> embed(String text) {
        if (text == null || text.isBlank() || !embeddingPort.isAvailable()) {
            return Optional.empty();
        }
        try {
            float[] vector = embeddingPort.embed(text).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (vector == null || vector.length == 0) {
                return Optional.empty();
            }
            return Optional.of(vector);
        } catch (TimeoutException e) {
            log.warn("[Context] Embedding timed out after {}ms", timeout.toMillis());
            return Optional.empty();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Context] Embedding failed: {}", cause.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    public double similarity(float[] a, float[] b) {
        return embeddingPort.cosineSimilarity(a, b);
    }
}
