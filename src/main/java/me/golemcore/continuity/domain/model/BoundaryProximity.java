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
 * Coarse estimate of how close the active session is to timing out, bucketed
 * by quartiles of {@code elapsed / timeout}.
 */
public enum BoundaryProximity {

    FAR("far"), MEDIUM("medium"), CLOSE("close"), IMMINENT("imminent"), UNKNOWN("unknown");

    private final String value;

    BoundaryProximity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Buckets a ratio already clamped to [0, 1].
     */
    public static BoundaryProximity fromRatio(double ratio) {
        if (ratio < 0.25) {
            return FAR;
        } else if (ratio < 0.5) {
            return MEDIUM;
        } else if (ratio < 0.75) {
            return CLOSE;
        }
        return IMMINENT;
    }
}
