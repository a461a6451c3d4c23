package com.adlanda.transcriptsearch.exception;

/**
 * The embedding provider returned vectors that do not fit the collection,
 * either the wrong number of vectors or the wrong dimension.
 * Indicates misconfiguration, so it is never retried.
 */
public class DataIntegrityException extends IngestionException {

    public DataIntegrityException(String message, int batchIndex, String chunkId, long storedBeforeFailure) {
        super(message, batchIndex, chunkId, storedBeforeFailure, null);
    }
}
