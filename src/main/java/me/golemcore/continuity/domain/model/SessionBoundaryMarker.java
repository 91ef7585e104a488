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
import java.util.HashMap;
import java.util.Map;

/**
 * Boundary marker written into session data by the data store. Stored under
 * {@code boundary-<id>} and mirrored to the tracker as a token boundary.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionBoundaryMarker {

    public static final String DEFAULT_TYPE = "generic";

    private String id;
    private Instant timestamp;
    private String sessionId;

    @Builder.Default
    private String type = DEFAULT_TYPE;

    @Builder.Default
    private Map<String, Object> data = new HashMap<>();

    @JsonIgnore
    private boolean success;

    @JsonIgnore
    private String error;

    public static SessionBoundaryMarker failure(String sessionId, String error) {
        return SessionBoundaryMarker.builder()
                .sessionId(sessionId)
                .success(false)
                .error(error)
                .build();
    }
}
