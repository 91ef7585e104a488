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

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for append-only JSON Lines files that must never be left half written.
 * Each record is one JSON object on its own line.
 */
public interface JsonlLogPort {

    /**
     * Append records to the target file atomically.
     *
     * <p>
     * Records that cannot be serialized are dropped. On failure the previous
     * content of the target is restored from its backup and the future completes
     * exceptionally.
     *
     * @param target
     *            JSONL file to append to
     * @param records
     *            records to append
     * @return number of records actually written
     */
    CompletableFuture<Integer> append(Path target, List<Map<String, Object>> records);

    /**
     * Read every parseable record of the target file in file order. Malformed
     * lines are skipped; a missing file yields an empty list.
     */
    CompletableFuture<List<Map<String, Object>>> readAll(Path target);
}
