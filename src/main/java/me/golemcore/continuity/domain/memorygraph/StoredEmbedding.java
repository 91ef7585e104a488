package me.golemcore.continuity.domain.memorygraph;

import java.util.Map;

/**
 * An embedding read back from the memory graph with its vector resolved.
 *
 * @param id
 *            embedding id
 * @param chunkId
 *            id of the chunk the vector was computed from, if recorded
 * @param vector
 *            the vector values
 * @param record
 *            the raw JSONL record
 */
public record StoredEmbedding(String id, String chunkId, float[] vector, Map<String, Object> record) {
}
