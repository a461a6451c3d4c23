package com.adlanda.transcriptsearch.exception;

/**
 * The embedding provider failed in a way expected to clear up on its own:
 * rate limiting, server errors, network faults.
 */
public class TransientEmbeddingException extends EmbeddingProviderException {

    public TransientEmbeddingException(String message) {
        super(message, null);
    }

    public TransientEmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
