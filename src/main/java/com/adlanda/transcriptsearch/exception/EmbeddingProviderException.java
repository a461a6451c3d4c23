package com.adlanda.transcriptsearch.exception;

/**
 * The embedding provider failed in a way that retrying will not fix
 * (bad credentials, unknown model, malformed request).
 */
public class EmbeddingProviderException extends RuntimeException {

    public EmbeddingProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
