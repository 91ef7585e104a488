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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One entry of the session index. Tracks the lifetime of a single inference
 * session and the token boundaries recorded while it was active.
 *
 * <p>
 * The index of these records is the only source of truth for which sessions
 * exist. A record is created when the tracker starts or rolls over, and is
 * later marked {@link SessionStatus#COMPLETED}; it is never removed.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionRecord {

    private String id;
    private Instant startTime;
    private Instant lastActivity;
    private Instant endTime;

    @Builder.Default
    private SessionStatus status = SessionStatus.ACTIVE;

    @Builder.Default
    private List<TokenBoundary> tokenBoundaries = new ArrayList<>();

    private String previousSessionId;

    @JsonIgnore
    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    /**
     * Marks the record completed at {@code now}.
     */
    public void complete(Instant now) {
        this.status = SessionStatus.COMPLETED;
        this.endTime = now;
    }

    public void addTokenBoundary(TokenBoundary boundary) {
        if (tokenBoundaries == null) {
            tokenBoundaries = new ArrayList<>();
        }
        tokenBoundaries.add(boundary);
    }

    @JsonIgnore
    public int getBoundaryCount() {
        return tokenBoundaries != null ? tokenBoundaries.size() : 0;
    }
}
