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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.continuity.domain.service.ContinuityIds;
import me.golemcore.continuity.infrastructure.config.ContinuityProperties;
import me.golemcore.continuity.infrastructure.config.WorkspacePaths;
import me.golemcore.continuity.infrastructure.lifecycle.InitializationGuard;
import me.golemcore.continuity.infrastructure.lifecycle.InitializationResult;
import me.golemcore.continuity.port.outbound.JsonlLogPort;
import me.golemcore.continuity.port.outbound.VectorFilePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Buffered writer for the memory graph: content chunks and their embeddings,
 * each appended to its own JSONL file.
 *
 * <p>
 * Records accumulate in memory and are flushed on a fixed timer, when a buffer
 * reaches {@code buffer-max-size}, or on shutdown. Only one flush runs at a
 * time; a flush requested while another is running returns {@code false} and
 * the records wait for the next tick. With binary storage enabled each vector
 * goes to {@code <id>.bin} and the JSONL record carries {@code vector_ref}
 * instead of {@code vector}.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class MemoryGraphWriter {

    static final String CHUNK_ID = "chunk_id";
    static final String EMBEDDING_ID = "id";
    static final String TIMESTAMP = "timestamp";
    static final String VECTOR = "vector";
    static final String VECTOR_REF = "vector_ref";

    private final JsonlLogPort jsonlLogPort;
    private final VectorFilePort vectorFilePort;
    private final Clock clock;
    private final ContinuityProperties.MemoryGraphProperties config;
    private final Path chunksFile;
    private final Path embeddingsFile;
    private final Path binaryEmbeddingsDir;
    private final InitializationGuard initGuard;

    private final Object bufferLock = new Object();
    private List<Map<String, Object>> chunksBuffer = new ArrayList<>();
    private List<Map<String, Object>> embeddingsBuffer = new ArrayList<>();

    private final AtomicBoolean writing = new AtomicBoolean(false);
    private final AtomicLong flushCount = new AtomicLong();
    private final AtomicLong chunksWritten = new AtomicLong();
    private final AtomicLong embeddingsWritten = new AtomicLong();

    private ScheduledExecutorService flushExecutor;

    public MemoryGraphWriter(JsonlLogPort jsonlLogPort, VectorFilePort vectorFilePort, Clock clock,
            ContinuityProperties properties) {
        this.jsonlLogPort = jsonlLogPort;
        this.vectorFilePort = vectorFilePort;
        this.clock = clock;
        this.config = properties.getMemoryGraph();
        Path base = WorkspacePaths.resolve(properties.getStorage().getBasePath());
        this.chunksFile = WorkspacePaths.resolveAgainst(base, config.getChunksFile());
        this.embeddingsFile = WorkspacePaths.resolveAgainst(base, config.getEmbeddingsFile());
        this.binaryEmbeddingsDir = WorkspacePaths.resolveAgainst(base, config.getBinaryEmbeddingsDir());
        this.initGuard = new InitializationGuard("memory-graph-writer", properties.getInit().getMaxAttempts());
    }

    @PostConstruct
    public void start() {
        InitializationResult result = initialize();
        if (!result.isSuccess()) {
            log.warn("[MemoryGraph] Writer not started: {}", result.getError());
            return;
        }
        long intervalMillis = Math.max(1, config.getFlushInterval().toMillis());
        flushExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "memory-graph-flush");
            t.setDaemon(true);
            return t;
        });
        flushExecutor.scheduleAtFixedRate(this::flushOnTimer, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("[MemoryGraph] Flush timer started, interval {}", Duration.ofMillis(intervalMillis));
    }

    public InitializationResult initialize() {
        return initGuard.ensureInitialized(() -> {
            createParent(chunksFile);
            createParent(embeddingsFile);
            if (config.isEnableBinaryStorage()) {
                Files.createDirectories(binaryEmbeddingsDir);
            }
            log.info("[MemoryGraph] Writer initialized: chunks={}, embeddings={}", chunksFile, embeddingsFile);
        });
    }

    /**
     * Stops the timer and flushes whatever is still buffered.
     */
    @PreDestroy
    public void shutdown() {
        if (flushExecutor != null) {
            flushExecutor.shutdownNow();
            flushExecutor = null;
        }
        if (hasBufferedRecords()) {
            flushBuffers();
        }
        log.info("[MemoryGraph] Writer shut down after {} flushes", flushCount.get());
    }

    // ==================== Producers ====================

    /**
     * Buffers a chunk, assigning {@code chunk_id} and {@code timestamp} when
     * absent.
     */
    public boolean addChunk(Map<String, Object> chunk) {
        if (chunk == null) {
            return false;
        }
        Map<String, Object> record = withDefaults(chunk, CHUNK_ID);
        boolean full;
        synchronized (bufferLock) {
            chunksBuffer.add(record);
            full = chunksBuffer.size() >= config.getBufferMaxSize();
        }
        if (full) {
            flushBuffers();
        }
        return true;
    }

    /**
     * Buffers an embedding, assigning {@code id} and {@code timestamp} when
     * absent. Embeddings without a numeric {@code vector} are rejected.
     */
    public boolean addEmbedding(Map<String, Object> embedding) {
        if (embedding == null) {
            return false;
        }
        if (VectorValues.toFloatArray(embedding.get(VECTOR)) == null) {
            log.warn("[MemoryGraph] Embedding must have a vector array");
            return false;
        }
        Map<String, Object> record = withDefaults(embedding, EMBEDDING_ID);
        boolean full;
        synchronized (bufferLock) {
            embeddingsBuffer.add(record);
            full = embeddingsBuffer.size() >= config.getBufferMaxSize();
        }
        if (full) {
            flushBuffers();
        }
        return true;
    }

    /**
     * Buffers chunks and embeddings together; invalid embeddings are skipped
     * individually.
     */
    public boolean addBatch(List<Map<String, Object>> chunks, List<Map<String, Object>> embeddings) {
        List<Map<String, Object>> chunkRecords = new ArrayList<>();
        List<Map<String, Object>> embeddingRecords = new ArrayList<>();
        if (chunks != null) {
            for (Map<String, Object> chunk : chunks) {
                if (chunk != null) {
                    chunkRecords.add(withDefaults(chunk, CHUNK_ID));
                }
            }
        }
        if (embeddings != null) {
            for (Map<String, Object> embedding : embeddings) {
                if (embedding == null || VectorValues.toFloatArray(embedding.get(VECTOR)) == null) {
                    log.warn("[MemoryGraph] Skipping embedding without vector array");
                    continue;
                }
                embeddingRecords.add(withDefaults(embedding, EMBEDDING_ID));
            }
        }

        boolean full;
        synchronized (bufferLock) {
            chunksBuffer.addAll(chunkRecords);
            embeddingsBuffer.addAll(embeddingRecords);
            full = chunksBuffer.size() >= config.getBufferMaxSize()
                    || embeddingsBuffer.size() >= config.getBufferMaxSize();
        }
        if (full) {
            flushBuffers();
        }
        return true;
    }

    // ==================== Flushing ====================

    /**
     * Writes both buffers to disk.
     *
     * @return {@code false} when another flush is in progress or a write failed
     */
    public boolean flushBuffers() {
        if (!writing.compareAndSet(false, true)) {
            log.debug("[MemoryGraph] Flush already in progress, skipping");
            return false;
        }
        try {
            List<Map<String, Object>> chunksToWrite;
            List<Map<String, Object>> embeddingsToWrite;
            synchronized (bufferLock) {
                chunksToWrite = chunksBuffer;
                embeddingsToWrite = embeddingsBuffer;
                chunksBuffer = new ArrayList<>();
                embeddingsBuffer = new ArrayList<>();
            }
            if (chunksToWrite.isEmpty() && embeddingsToWrite.isEmpty()) {
                return true;
            }

            boolean ok = true;
            if (!chunksToWrite.isEmpty()) {
                int written = appendInBatches(chunksFile, chunksToWrite);
                ok = written >= 0;
                if (ok) {
                    chunksWritten.addAndGet(written);
                    log.info("[MemoryGraph] Wrote {} chunks to {}", written, chunksFile);
                }
            }
            if (!embeddingsToWrite.isEmpty()) {
                List<Map<String, Object>> records = config.isEnableBinaryStorage()
                        ? toBinaryReferences(embeddingsToWrite)
                        : embeddingsToWrite;
                int written = appendInBatches(embeddingsFile, records);
                if (written >= 0) {
                    embeddingsWritten.addAndGet(written);
                    log.info("[MemoryGraph] Wrote {} embeddings to {}", written,
                            config.isEnableBinaryStorage() ? "binary storage" : embeddingsFile);
                } else {
                    ok = false;
                }
            }
            flushCount.incrementAndGet();
            return ok;
        } finally {
            writing.set(false);
        }
    }

    private void flushOnTimer() {
        try {
            if (hasBufferedRecords()) {
                flushBuffers();
            }
        } catch (RuntimeException e) {
            log.error("[MemoryGraph] Scheduled flush failed: {}", e.getMessage(), e);
        }
    }

    /**
     * @return records written, or -1 when an append failed
     */
    private int appendInBatches(Path target, List<Map<String, Object>> records) {
        int batchSize = Math.max(1, config.getMaxBatchSize());
        int written = 0;
        for (int from = 0; from < records.size(); from += batchSize) {
            List<Map<String, Object>> batch = records.subList(from, Math.min(records.size(), from + batchSize));
            try {
                written += jsonlLogPort.append(target, batch).join();
            } catch (RuntimeException e) {
                log.error("[MemoryGraph] Error appending to {}: {}", target, e.getMessage());
                return -1;
            }
        }
        return written;
    }

    private List<Map<String, Object>> toBinaryReferences(List<Map<String, Object>> embeddings) {
        List<Map<String, Object>> references = new ArrayList<>(embeddings.size());
        for (Map<String, Object> embedding : embeddings) {
            float[] vector = VectorValues.toFloatArray(embedding.get(VECTOR));
            if (vector == null) {
                log.warn("[MemoryGraph] Skipping embedding without vector: {}", embedding.get(EMBEDDING_ID));
                continue;
            }
            try {
                Path file = vectorFilePort.write(binaryEmbeddingsDir, embedding.get(EMBEDDING_ID).toString(), vector);
                Map<String, Object> meta = new LinkedHashMap<>(embedding);
                meta.remove(VECTOR);
                meta.put(VECTOR_REF, file.toString());
                references.add(meta);
            } catch (IOException | IllegalArgumentException e) {
                log.error("[MemoryGraph] Failed to write binary vector {}: {}", embedding.get(EMBEDDING_ID),
                        e.getMessage());
            }
        }
        return references;
    }

    // ==================== Readers ====================

    /**
     * All chunks written so far, in file order.
     */
    public List<Map<String, Object>> readChunks() {
        return readQuietly(chunksFile);
    }

    /**
     * All written embeddings with their vectors loaded, resolving
     * {@code vector_ref} files. Records whose vector cannot be read are skipped.
     */
    public List<StoredEmbedding> readEmbeddings() {
        List<StoredEmbedding> result = new ArrayList<>();
        for (Map<String, Object> record : readQuietly(embeddingsFile)) {
            float[] vector = VectorValues.toFloatArray(record.get(VECTOR));
            if (vector == null && record.get(VECTOR_REF) != null) {
                try {
                    vector = vectorFilePort.read(Path.of(record.get(VECTOR_REF).toString()));
                } catch (IOException | RuntimeException e) {
                    log.warn("[MemoryGraph] Cannot read vector {}: {}", record.get(VECTOR_REF), e.getMessage());
                }
            }
            if (vector == null) {
                continue;
            }
            Object id = record.get(EMBEDDING_ID);
            Object chunkId = record.get(CHUNK_ID);
            result.add(new StoredEmbedding(id != null ? id.toString() : null,
                    chunkId != null ? chunkId.toString() : null, vector, record));
        }
        return result;
    }

    public MemoryGraphStatus getStatus() {
        synchronized (bufferLock) {
            return new MemoryGraphStatus(initGuard.isInitialized(), chunksBuffer.size(), embeddingsBuffer.size(),
                    flushCount.get(), chunksWritten.get(), embeddingsWritten.get(), writing.get(),
                    config.isEnableBinaryStorage(), chunksFile.toString(), embeddingsFile.toString());
        }
    }

    // ==================== Internals ====================

    private boolean hasBufferedRecords() {
        synchronized (bufferLock) {
            return !chunksBuffer.isEmpty() || !embeddingsBuffer.isEmpty();
        }
    }

    private List<Map<String, Object>> readQuietly(Path file) {
        try {
            return jsonlLogPort.readAll(file).join();
        } catch (RuntimeException e) {
            log.warn("[MemoryGraph] Failed to read {}: {}", file, e.getMessage());
            return List.of();
        }
    }

    private Map<String, Object> withDefaults(Map<String, Object> source, String idField) {
        Map<String, Object> record = new LinkedHashMap<>(source);
        if (record.get(idField) == null || record.get(idField).toString().isBlank()) {
            record.put(idField, ContinuityIds.recordId());
        }
        if (record.get(TIMESTAMP) == null) {
            record.put(TIMESTAMP, clock.millis());
        }
        return record;
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
