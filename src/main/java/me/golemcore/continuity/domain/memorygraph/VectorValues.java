package me.golemcore.continuity.domain.memorygraph;

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

import java.util.List;

/**
 * Converts loosely typed vector values (JSON arrays, primitive arrays) to
 * {@code float[]}.
 */
final class VectorValues {

    private VectorValues() {
    }

    /**
     * @return the vector, or {@code null} when {@code value} is not a non-empty
     *         numeric array
     */
    static float[] toFloatArray(Object value) {
        if (value instanceof float[] floats) {
            return floats.length > 0 ? floats : null;
        }
        if (value instanceof double[] doubles) {
            if (doubles.length == 0) {
                return null;
            }
            float[] result = new float[doubles.length];
            for (int i = 0; i < doubles.length; i++) {
                result[i] = (float) doubles[i];
            }
            return result;
        }
        if (value instanceof List<?> list) {
            if (list.isEmpty()) {
                return null;
            }
            float[] result = new float[list.size()];
            for (int i = 0; i < list.size(); i++) {
                if (!(list.get(i) instanceof Number number)) {
                    return null;
                }
                result[i] = number.floatValue();
            }
            return result;
        }
        return null;
    }
}
