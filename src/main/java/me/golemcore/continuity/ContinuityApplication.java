package me.golemcore.continuity;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the session continuity service.
 *
 * <p>
 * Keeps an LLM agent's awareness intact across token boundaries: it tracks
 * sessions and the boundaries crossed inside them, persists per-session data,
 * assembles prompt context from pluggable providers and appends memory-graph
 * chunks and embeddings to a crash-safe JSONL log.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Domain Layer       → SessionBoundaryTracker, SessionDataStore,
 *                      ContextAssemblyService, MemoryGraphWriter
 * Ports              → StoragePort, JsonlLogPort, EmbeddingPort, VisionAnchorPort
 * Infrastructure     → Local storage, atomic JSONL, langchain4j embeddings
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code continuity.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ContinuityApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContinuityApplication.class, args);
    }

}
