package com.adlanda.transcriptsearch.exception;

/**
 * The vector store rejected an operation.
 */
public class VectorStoreException extends IngestionException {

    public VectorStoreException(String message) {
        this(message, null);
    }

    public VectorStoreException(String message, Throwable cause) {
        super(message, -1, null, 0, cause);
    }

    public VectorStoreException(String message, int batchIndex, String chunkId,
                                long storedBeforeFailure, Throwable cause) {
        super(message, batchIndex, chunkId, storedBeforeFailure, cause);
    }
}
