package me.golemcore.continuity.domain.memorygraph;

/**
 * Point-in-time view of the memory graph writer.
 */
public record MemoryGraphStatus(
        boolean initialized,
        int bufferedChunks,
        int bufferedEmbeddings,
        long flushCount,
        long chunksWritten,
        long embeddingsWritten,
        boolean flushInProgress,
        boolean binaryStorage,
        String chunksFile,
        String embeddingsFile) {
}
