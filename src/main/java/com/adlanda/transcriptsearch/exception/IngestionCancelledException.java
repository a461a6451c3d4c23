package com.adlanda.transcriptsearch.exception;

/**
 * Ingestion stopped because its {@link com.adlanda.transcriptsearch.service.CancellationToken} was cancelled
 * or the ingesting thread was interrupted. The batch named here was not submitted.
 */
public class IngestionCancelledException extends IngestionException {

    public IngestionCancelledException(int batchIndex, String chunkId, long storedBeforeFailure) {
        super("Ingestion cancelled before batch " + batchIndex, batchIndex, chunkId, storedBeforeFailure, null);
    }
}
