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

package me.golemcore.continuity.adapter.outbound.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.continuity.infrastructure.config.ContinuityProperties;
import me.golemcore.continuity.infrastructure.config.WorkspacePaths;
import me.golemcore.continuity.port.outbound.JsonlLogPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * JSONL appender that never leaves a torn file behind.
 *
 * <p>
 * Each append rewrites the whole file: the current content plus the new lines
 * go into a uniquely named file in the scratch directory, which is then moved
 * over the target. A timestamped {@code <target>.<millis>.bak} copy is taken
 * first and removed on success. A failure while the target is being replaced
 * restores that backup; an earlier failure leaves the target as it was.
 * Original POSIX permissions are restored after the move.
 */
@Component
@Slf4j
public class AtomicJsonlLogAdapter implements JsonlLogPort {

    private static final String BACKUP_SUFFIX = ".bak";
    private static final TypeReference<Map<String, Object>> RECORD_TYPE_REF = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Path scratchDir;
    private final SecureRandom random = new SecureRandom();
    private final Map<Path, Object> fileLocks = new ConcurrentHashMap<>();

    public AtomicJsonlLogAdapter(ContinuityProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.scratchDir = WorkspacePaths.resolve(properties.getMemoryGraph().getScratchDir());
    }

    @Override
    public CompletableFuture<Integer> append(Path target, List<Map<String, Object>> records) {
        return CompletableFuture.supplyAsync(() -> {
            Path normalized = target.toAbsolutePath().normalize();
            synchronized (fileLocks.computeIfAbsent(normalized, p -> new Object())) {
                AppendAttempt attempt = new AppendAttempt();
                try {
                    return appendLocked(normalized, records, attempt);
                } catch (IOException | RuntimeException e) {
                    log.error("[Storage] Error appending to JSONL file {}: {}", normalized, e.getMessage());
                    recover(normalized, attempt);
                    throw new UncheckedIOException("JSONL append failed: " + normalized,
                            e instanceof IOException io ? io : new IOException(e));
                }
            }
        });
    }

    /**
     * Reads every record in file order. Lines that are not valid UTF-8 or not a
     * JSON object are skipped.
     */
    @Override
    public CompletableFuture<List<Map<String, Object>>> readAll(Path target) {
        return CompletableFuture.supplyAsync(() -> {
            if (!Files.exists(target)) {
                return List.of();
            }
            byte[] content;
            try {
                content = Files.readAllBytes(target);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read JSONL file: " + target, e);
            }

            CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT);
            List<Map<String, Object>> records = new ArrayList<>();
            int start = 0;
            int lineNumber = 0;
            for (int i = 0; i <= content.length; i++) {
                if (i < content.length && content[i] != '\n') {
                    continue;
                }
                lineNumber++;
                if (i > start) {
                    parseLine(target, lineNumber, decoder, ByteBuffer.wrap(content, start, i - start))
                            .ifPresent(records::add);
                }
                start = i + 1;
            }
            return records;
        });
    }

    private Optional<Map<String, Object>> parseLine(Path target, int lineNumber, CharsetDecoder decoder,
            ByteBuffer bytes) {
        String line;
        try {
            line = decoder.reset().decode(bytes).toString();
        } catch (CharacterCodingException e) {
            log.warn("[Storage] Skipping line {} in {}: not valid UTF-8", lineNumber, target);
            return Optional.empty();
        }
        if (line.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(line, RECORD_TYPE_REF));
        } catch (JsonProcessingException e) {
            log.warn("[Storage] Skipping malformed line {} in {}: {}", lineNumber, target, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private int appendLocked(Path target, List<Map<String, Object>> records, AppendAttempt attempt)
            throws IOException {
        if (records == null || records.isEmpty()) {
            return 0;
        }

        StringBuilder jsonl = new StringBuilder();
        int written = 0;
        for (Map<String, Object> record : records) {
            try {
                String line = objectMapper.writeValueAsString(record);
                jsonl.append(line).append('\n');
                written++;
            } catch (JsonProcessingException e) {
                log.warn("[Storage] Invalid record skipped: {}", e.getOriginalMessage());
            }
        }
        if (written == 0) {
            return 0;
        }
        byte[] newContent = jsonl.toString().getBytes(StandardCharsets.UTF_8);

        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        boolean targetExists = Files.exists(target);
        attempt.targetExisted = targetExists;
        Set<PosixFilePermission> originalPermissions = targetExists ? readPermissions(target) : null;

        // 1. Backup the current file
        Path backup = target.resolveSibling(target.getFileName() + "." + clock.millis() + BACKUP_SUFFIX);
        if (targetExists) {
            attempt.backup = backup;
            Files.copy(target, backup, StandardCopyOption.REPLACE_EXISTING);
            attempt.backupComplete = true;
        }

        Files.createDirectories(scratchDir);
        Path temp = scratchDir.resolve(target.getFileName() + "." + randomHex());
        try {
            // 2. Existing content + new lines into the scratch file
            try (FileChannel channel = FileChannel.open(temp,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                if (targetExists) {
                    try (FileChannel source = FileChannel.open(target, StandardOpenOption.READ)) {
                        long size = source.size();
                        long position = 0;
                        while (position < size) {
                            position += source.transferTo(position, size - position, channel);
                        }
                    }
                }
                ByteBuffer buffer = ByteBuffer.wrap(newContent);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }

            // 3. Sanity check
            long tempSize = Files.size(temp);
            if (tempSize == 0 || tempSize < newContent.length) {
                throw new IOException("Temporary file write verification failed");
            }

            // 4. Replace the target
            attempt.targetTouched = true;
            moveIntoPlace(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }

        if (originalPermissions != null) {
            try {
                Files.setPosixFilePermissions(target, originalPermissions);
            } catch (IOException | UnsupportedOperationException e) {
                log.warn("[Storage] Could not restore original file permissions for {}: {}", target, e.getMessage());
            }
        }

        deleteQuietly(backup);
        log.debug("[Storage] Appended {} records to {}", written, target);
        return written;
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            // Scratch dir on another filesystem: stage beside the target, then rename.
            Path staged = target.resolveSibling(temp.getFileName() + ".tmp");
            try {
                Files.copy(temp, staged, StandardCopyOption.REPLACE_EXISTING);
                try (FileChannel channel = FileChannel.open(staged, StandardOpenOption.WRITE)) {
                    channel.force(true);
                }
                try {
                    Files.move(staged, target, StandardCopyOption.REPLACE_EXISTING,
                            StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException again) {
                    log.warn("[Storage] Atomic move not supported, using regular move");
                    Files.move(staged, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(staged);
            }
        }
    }

    /**
     * Undoes a failed append. The target is restored from the backup this
     * append took, and only when the failure happened while replacing it;
     * earlier failures leave the target untouched and just drop the backup.
     */
    private void recover(Path target, AppendAttempt attempt) {
        if (!attempt.targetTouched) {
            if (attempt.backup != null) {
                deleteQuietly(attempt.backup);
            }
            return;
        }
        if (!attempt.targetExisted) {
            log.info("[Storage] Removing partially written {}", target);
            deleteQuietly(target);
            return;
        }
        if (!attempt.backupComplete) {
            log.warn("[Storage] No backup available to restore {}", target);
            return;
        }
        log.info("[Storage] Attempting recovery from backup: {}", attempt.backup);
        try {
            Files.copy(attempt.backup, target, StandardCopyOption.REPLACE_EXISTING);
            log.info("[Storage] Recovery successful from {}", attempt.backup);
            deleteQuietly(attempt.backup);
        } catch (IOException e) {
            log.error("[Storage] Recovery failed for {}, backup kept at {}: {}", target, attempt.backup,
                    e.getMessage());
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("[Storage] Could not delete {}: {}", path, e.getMessage());
        }
    }

    private Set<PosixFilePermission> readPermissions(Path target) {
        try {
            return Files.getPosixFilePermissions(target);
        } catch (IOException | UnsupportedOperationException e) {
            return null;
        }
    }

    private String randomHex() {
        byte[] bytes = new byte[8];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    /**
     * What a single append has done so far, consulted when it fails.
     */
    private static final class AppendAttempt {
        private Path backup;
        private boolean backupComplete;
        private boolean targetExisted;
        private boolean targetTouched;
    }
}
