package com.adlanda.transcriptsearch.exception;

/**
 * Base class for failures that abort an ingestion run.
 *
 * Carries enough context to resume by hand: the batch that failed, the chunk
 * involved and how many entities earlier batches already committed.
 */
public abstract class IngestionException extends RuntimeException {

    private final int batchIndex;
    private final String chunkId;
    private final long storedBeforeFailure;

    protected IngestionException(String message, int batchIndex, String chunkId,
                                 long storedBeforeFailure, Throwable cause) {
        super(message, cause);
        this.batchIndex = batchIndex;
        this.chunkId = chunkId;
        this.storedBeforeFailure = storedBeforeFailure;
    }

    /**
     * Zero-based index of the batch that was being processed.
     */
    public int getBatchIndex() {
        return batchIndex;
    }

    /**
     * Id of the offending chunk, or of the first chunk of the batch when no single chunk is at fault.
     */
    public String getChunkId() {
        return chunkId;
    }

    /**
     * Number of entities already committed by earlier batches.
     */
    public long getStoredBeforeFailure() {
        return storedBeforeFailure;
    }
}
