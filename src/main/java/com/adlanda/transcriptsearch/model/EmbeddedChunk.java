package com.adlanda.transcriptsearch.model;

/**
 * A chunk together with the vector produced for its text.
 * Only lives for the duration of one batch.
 */
public record EmbeddedChunk(Chunk chunk, float[] embedding) {

    public String id() {
        return chunk.id();
    }

    public String text() {
        return chunk.text();
    }

    public int dimension() {
        return embedding == null ? 0 : embedding.length;
    }
}
