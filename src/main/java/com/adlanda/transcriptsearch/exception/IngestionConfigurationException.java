package com.adlanda.transcriptsearch.exception;

/**
 * Invalid window, stride, batch size or dimension, detected before any work starts.
 */
public class IngestionConfigurationException extends IllegalArgumentException {

    public IngestionConfigurationException(String message) {
        super(message);
    }
}
