package me.golemcore.continuity.adapter.outbound.storage;

import me.golemcore.continuity.infrastructure.config.ContinuityProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String SESSIONS_DIR = "sessions";
    private static final String INDEX_FILE = "index.json";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        ContinuityProperties properties = new ContinuityProperties();
        properties.getStorage().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void initCreatesWorkspaceDirectories() {
        assertTrue(Files.isDirectory(tempDir.resolve("sessions")));
        assertTrue(Files.isDirectory(tempDir.resolve("context")));
        assertTrue(Files.isDirectory(tempDir.resolve("memory-graph")));
        assertTrue(Files.isDirectory(tempDir.resolve("test-results")));
    }

    @Test
    void putAndGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putText(SESSIONS_DIR, INDEX_FILE, "[]").get();

        assertEquals("[]", storageAdapter.getText(SESSIONS_DIR, INDEX_FILE).get());
    }

    @Test
    void getText_returnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(SESSIONS_DIR, "missing.json").get());
    }

    @Test
    void listObjects_returnsPathsRelativeToDirectory() throws ExecutionException, InterruptedException {
        storageAdapter.putText("sessions/data", "session-1.json", "{}").get();
        storageAdapter.putText("sessions/data", "archive/session-0.json", "{}").get();

        List<String> all = storageAdapter.listObjects("sessions/data", "").get();
        List<String> archived = storageAdapter.listObjects("sessions/data", "archive").get();

        assertEquals(2, all.size());
        assertTrue(all.contains("session-1.json"));
        assertEquals(List.of(Path.of("archive", "session-0.json").toString()), archived);
    }

    @Test
    void listObjects_returnsEmptyForMissingDirectory() throws ExecutionException, InterruptedException {
        assertTrue(storageAdapter.listObjects("no-such-dir", "").get().isEmpty());
    }

    @Test
    void shouldBlockPathTraversal() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.putText(SESSIONS_DIR, "../../etc/passwd", "hack").get());
        assertTrue(ex.getCause() instanceof IllegalArgumentException);
    }

    @Test
    void ensureDirectory_createsDirectory() throws ExecutionException, InterruptedException {
        storageAdapter.ensureDirectory("sessions/data").get();

        assertTrue(Files.isDirectory(tempDir.resolve("sessions/data")));
    }

    // ==================== Atomic write ====================

    @Test
    void putTextAtomic_overwritesWithoutLeavingTempFile() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(SESSIONS_DIR, INDEX_FILE, "[1]", false).get();
        storageAdapter.putTextAtomic(SESSIONS_DIR, INDEX_FILE, "[2]", false).get();

        assertEquals("[2]", storageAdapter.getText(SESSIONS_DIR, INDEX_FILE).get());
        assertEquals(List.of(INDEX_FILE), storageAdapter.listObjects(SESSIONS_DIR, "").get());
    }

    @Test
    void putTextAtomic_keepsPreviousVersionAsBackupWhenRequested()
            throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(SESSIONS_DIR, INDEX_FILE, "[\"v1\"]", false).get();
        storageAdapter.putTextAtomic(SESSIONS_DIR, INDEX_FILE, "[\"v2\"]", true).get();

        assertEquals("[\"v2\"]", storageAdapter.getText(SESSIONS_DIR, INDEX_FILE).get());
        assertEquals("[\"v1\"]", storageAdapter.getText(SESSIONS_DIR, INDEX_FILE + ".bak").get());
    }

    @Test
    void putTextAtomic_createsParentDirectories() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic("context", "nested/current-context.json", "{}", false).get();

        assertEquals("{}", storageAdapter.getText("context", "nested/current-context.json").get());
    }
}
