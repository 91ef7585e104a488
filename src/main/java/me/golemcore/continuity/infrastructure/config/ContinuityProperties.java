package me.golemcore.continuity.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the continuity core, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code continuity.*} prefix. Every
 * value is optional and falls back to the defaults declared here:
 * <ul>
 * <li>{@link StorageProperties} - workspace location</li>
 * <li>{@link SessionProperties} - session boundary timeout</li>
 * <li>{@link MemoryGraphProperties} - append log files, buffering, binary
 * vectors</li>
 * <li>{@link ContextProperties} - strategy, cache, compression, validation</li>
 * <li>{@link EmbeddingProperties} - embedding backend</li>
 * <li>{@link VisionProperties} - project vision anchor</li>
 * <li>{@link InitProperties} - shared initialization retry policy</li>
 * </ul>
 *
 * <p>
 * Environment variables map through Spring relaxed binding, e.g.
 * {@code CONTINUITY_SESSION_TIMEOUT=45m}.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "continuity")
@Data
public class ContinuityProperties {

    private StorageProperties storage = new StorageProperties();
    private SessionProperties session = new SessionProperties();
    private MemoryGraphProperties memoryGraph = new MemoryGraphProperties();
    private ContextProperties context = new ContextProperties();
    private EmbeddingProperties embedding = new EmbeddingProperties();
    private VisionProperties vision = new VisionProperties();
    private InitProperties init = new InitProperties();

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/continuity";
    }

    @Data
    public static class SessionProperties {
        private Duration timeout = Duration.ofMinutes(30);
    }

    @Data
    public static class MemoryGraphProperties {
        private String embeddingsFile = "memory-graph/embeddings.jsonl";
        private String chunksFile = "memory-graph/chunks.jsonl";
        private String binaryEmbeddingsDir = "memory-graph/binary-embeddings";
        private boolean enableBinaryStorage = false;
        private int maxBatchSize = 100;
        private Duration flushInterval = Duration.ofSeconds(5);
        private int bufferMaxSize = 1000;
        private String scratchDir = "${java.io.tmpdir}/continuity-memory-graph";
    }

    @Data
    public static class ContextProperties {
        private String defaultStrategy = "standard";
        private boolean cacheEnabled = true;
        private Duration cacheTtl = Duration.ofMinutes(5);
        private boolean compressionEnabled = true;
        private int compressionThreshold = 1000;
        private boolean validationEnabled = true;
        private int maxHistoryItems = 20;
        private SectionLengthProperties maxSectionLength = new SectionLengthProperties();
    }

    /**
     * Longest item content, per render format, kept by compression.
     */
    @Data
    public static class SectionLengthProperties {
        private int markdown = 1000;
        private int json = 800;
        private int plain = 500;
    }

    @Data
    public static class EmbeddingProperties {
        private String apiKey;
        private String model = "text-embedding-3-small";
        private String baseUrl;
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class VisionProperties {
        private String title = "Project Vision";
        private String statement = "";
        private List<String> principles = new ArrayList<>();
    }

    @Data
    public static class InitProperties {
        private int maxAttempts = 3;
    }
}
