package me.golemcore.continuity.domain.model;

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

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.Map;

/**
 * Per-request options for context assembly. Strategies derive narrowed copies
 * through the {@code with*} methods; instances are never mutated.
 */
@Value
@Builder(toBuilder = true)
@With
public class ContextOptions {

    String strategy;
    ContextFormat format;
    Integer limit;
    Double minRelevance;
    String sessionId;

    /**
     * Description of the boundary being crossed, used by the boundary strategy.
     */
    Map<String, Object> boundaryInfo;

    BoundaryProximity boundaryProximity;
    Double continuityScore;

    public static ContextOptions defaults() {
        return ContextOptions.builder().build();
    }

    /**
     * Identifier of the boundary in {@link #boundaryInfo}, or {@code null}.
     */
    public String getBoundaryId() {
        if (boundaryInfo == null) {
            return null;
        }
        Object id = boundaryInfo.get("id");
        return id != null ? id.toString() : null;
    }

    public ContextFormat getFormatOrDefault() {
        return format != null ? format : ContextFormat.MARKDOWN;
    }
}
