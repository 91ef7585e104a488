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
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Caller-supplied description of a token boundary to record. The tracker fills
 * in the id when none is given.
 */
@Data
@Builder
public class BoundaryRequest {

    public static final String DEFAULT_TYPE = "token_boundary";

    private String id;

    @Builder.Default
    private String type = DEFAULT_TYPE;

    private String source;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    public static BoundaryRequest of(String type, String source) {
        return BoundaryRequest.builder().type(type).source(source).build();
    }
}
