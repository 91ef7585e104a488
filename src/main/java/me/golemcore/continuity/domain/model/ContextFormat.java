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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Rendering formats for an assembled context bundle.
 */
public enum ContextFormat {

    MARKDOWN("markdown"), JSON("json"), PLAIN("plain");

    private final String value;

    ContextFormat(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parses a format name, falling back to markdown for unknown or blank names.
     */
    public static ContextFormat fromValue(String value) {
        if (value != null) {
            for (ContextFormat format : values()) {
                if (format.value.equalsIgnoreCase(value.trim())) {
                    return format;
                }
            }
        }
        return MARKDOWN;
    }
}
