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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single unit of context contributed by a provider and rendered into the
 * injected prompt. Priority is in [0, 1]; a missing priority sorts as 0.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContextItem {

    private String type;
    private String id;
    private String title;
    private String content;
    private Double priority;

    /**
     * Query embedding, only carried by the synthesized semantic fallback item.
     */
    @JsonIgnore
    private float[] embedding;

    @JsonIgnore
    public double getEffectivePriority() {
        return priority != null ? priority : 0.0;
    }

    /**
     * Returns a copy with the priority raised by {@code boost}, capped at 1.0.
     */
    public ContextItem boosted(double boost) {
        return toBuilder().priority(Math.min(getEffectivePriority() + boost, 1.0)).build();
    }
}
