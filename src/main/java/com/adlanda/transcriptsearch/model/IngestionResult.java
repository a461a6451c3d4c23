package com.adlanda.transcriptsearch.model;

/**
 * Outcome of one pipeline run.
 *
 * @param storedCount  Entities confirmed by the vector store
 * @param batchCount   Batches embedded and inserted
 */
public record IngestionResult(long storedCount, int batchCount) {

    public static IngestionResult empty() {
        return new IngestionResult(0, 0);
    }
}
