package com.adlanda.transcriptsearch.exception;

/**
 * The embedding provider rejected a batch with an error that retrying will not fix.
 * The provider's exception is kept as the cause.
 */
public class EmbeddingFailedException extends IngestionException {

    public EmbeddingFailedException(String message, int batchIndex, String chunkId,
                                    long storedBeforeFailure, Throwable cause) {
        super(message, batchIndex, chunkId, storedBeforeFailure, cause);
    }
}
