package me.golemcore.continuity.port.outbound;

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

import java.io.IOException;
import java.nio.file.Path;

/**
 * Port for raw embedding vectors kept outside the JSONL log, one file per
 * vector.
 */
public interface VectorFilePort {

    /**
     * Write {@code vector} to {@code <directory>/<id>.bin}.
     *
     * @return the written file
     */
    Path write(Path directory, String id, float[] vector) throws IOException;

    /**
     * Read a vector previously written by {@link #write}.
     */
    float[] read(Path file) throws IOException;
}
