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

import java.time.Instant;
import java.util.List;

/**
 * Summary of the active session as seen by the data store: tracker metrics plus
 * the keys stored for the session.
 */
@Value
@Builder
public class SessionState {

    boolean success;
    String error;
    String sessionId;
    String previousSessionId;
    Instant startTime;
    Instant lastUpdateTime;
    BoundaryProximity boundaryProximity;
    double continuityScore;
    List<String> dataKeys;
    int dataSize;

    public static SessionState failure(String sessionId, String error) {
        return SessionState.builder()
                .success(false)
                .sessionId(sessionId)
                .error(error)
                .boundaryProximity(BoundaryProximity.UNKNOWN)
                .dataKeys(List.of())
                .build();
    }
}
