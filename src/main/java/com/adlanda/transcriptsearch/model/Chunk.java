package com.adlanda.transcriptsearch.model;

import java.util.Map;

/**
 * A window of consecutive segments from the same group, merged into one piece of text.
 *
 * @param id        Id of the first segment in the window
 * @param groupKey  Group shared by every segment in the window
 * @param text      Segment texts joined with a single space
 * @param start     Start of the first segment
 * @param end       End of the last segment
 * @param metadata  Metadata of the first segment
 */
public record Chunk(
        String id,
        String groupKey,
        String text,
        double start,
        double end,
        Map<String, Object> metadata
) {
    public Chunk {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Pairs this chunk with its embedding vector.
     */
    public EmbeddedChunk withEmbedding(float[] embedding) {
        return new EmbeddedChunk(this, embedding);
    }
}
