package me.golemcore.continuity.adapter.outbound.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class Float32VectorFileAdapterTest {

    @TempDir
    Path tempDir;

    private final Float32VectorFileAdapter adapter = new Float32VectorFileAdapter();

    @Test
    void writesLittleEndianFloat32() throws IOException {
        Path file = adapter.write(tempDir, "vec-1", new float[] { 1.5f, -2.0f });

        assertEquals(tempDir.resolve("vec-1.bin"), file);
        ByteBuffer buffer = ByteBuffer.wrap(Files.readAllBytes(file)).order(ByteOrder.LITTLE_ENDIAN);
        assertEquals(1.5f, buffer.getFloat());
        assertEquals(-2.0f, buffer.getFloat());
        assertFalse(buffer.hasRemaining());
    }

    @Test
    void readReturnsWrittenVector() throws IOException {
        float[] vector = { 0.1f, 0.2f, 0.3f };
        Path file = adapter.write(tempDir.resolve("nested"), "vec-2", vector);

        assertArrayEquals(vector, adapter.read(file));
    }

    @Test
    void shouldRejectIdsThatEscapeDirectory() {
        assertThrows(IllegalArgumentException.class, () -> adapter.write(tempDir, "../escape", new float[] { 1f }));
        assertThrows(IllegalArgumentException.class, () -> adapter.write(tempDir, " ", new float[] { 1f }));
    }

    @Test
    void shouldRejectTruncatedFile() throws IOException {
        Path file = tempDir.resolve("broken.bin");
        Files.write(file, new byte[] { 1, 2, 3 });

        assertThrows(IOException.class, () -> adapter.read(file));
    }
}
