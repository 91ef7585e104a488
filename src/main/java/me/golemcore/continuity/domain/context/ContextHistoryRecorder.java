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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.continuity.domain.model.ContextHistoryEntry;
import me.golemcore.continuity.domain.model.ContextInjectionResult;
import me.golemcore.continuity.infrastructure.config.ContinuityProperties;
import me.golemcore.continuity.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps a record of context injections under {@code context/}: the latest
 * result in {@code current-context.json} and a newest-first summary list in
 * {@code context-history.json}.
 */
@Component
@Slf4j
public class ContextHistoryRecorder {

    static final String CONTEXT_DIR = "context";
    static final String CURRENT_FILE = "current-context.json";
    static final String HISTORY_FILE = "context-history.json";
    private static final TypeReference<List<ContextHistoryEntry>> HISTORY_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final int maxHistoryItems;
    private final Object lock = new Object();

    public ContextHistoryRecorder(StoragePort storagePort, ObjectMapper objectMapper,
            ContinuityProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.maxHistoryItems = Math.max(1, properties.getContext().getMaxHistoryItems());
    }

    /**
     * Records an injection. Failures are logged and reported as {@code false}.
     */
    public boolean record(ContextInjectionResult result) {
        synchronized (lock) {
            try {
                storagePort.ensureDirectory(CONTEXT_DIR).join();
                storagePort.putTextAtomic(CONTEXT_DIR, CURRENT_FILE,
                        objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result), false).join();

                List<ContextHistoryEntry> history = new ArrayList<>();
                history.add(ContextHistoryEntry.builder()
                        .timestamp(result.getTimestamp())
                        .query(result.getQuery())
                        .strategy(result.getStrategy())
                        .contextCount(result.getContextCount())
                        .sessionId(result.getSessionId())
                        .build());
                history.addAll(readHistory());
                if (history.size() > maxHistoryItems) {
                    history = new ArrayList<>(history.subList(0, maxHistoryItems));
                }
                storagePort.putTextAtomic(CONTEXT_DIR, HISTORY_FILE,
                        objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(history), false).join();
                return true;
            } catch (Exception e) {
                log.error("[Context] Error recording context injection: {}", e.getMessage(), e);
                return false;
            }
        }
    }

    /**
     * Newest-first injection summaries; empty when none are recorded or the file
     * is unreadable.
     */
    public List<ContextHistoryEntry> readHistory() {
        try {
            String json = storagePort.getText(CONTEXT_DIR, HISTORY_FILE).join();
            if (json == null || json.isBlank()) {
                return List.of();
            }
            return objectMapper.readValue(json, HISTORY_TYPE_REF);
        } catch (Exception e) {
            log.warn("[Context] Context history unreadable, starting fresh: {}", e.getMessage());
            return List.of();
        }
    }
}
