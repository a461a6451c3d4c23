package com.adlanda.transcriptsearch.service;

import com.adlanda.transcriptsearch.exception.IngestionConfigurationException;

import java.time.Duration;

/**
 * Tuning for {@link IngestionPipeline}.
 *
 * @param batchSize           Chunks embedded and inserted per round trip
 * @param embeddingDimension  Length every returned vector must have
 * @param retryDelay          Fixed wait before re-sending a batch after a transient embedding failure
 */
public record PipelineSettings(int batchSize, int embeddingDimension, Duration retryDelay) {

    public PipelineSettings {
        if (batchSize <= 0) {
            throw new IngestionConfigurationException("batchSize must be positive, was " + batchSize);
        }
        if (embeddingDimension <= 0) {
            throw new IngestionConfigurationException(
                    "embeddingDimension must be positive, was " + embeddingDimension);
        }
        if (retryDelay == null || retryDelay.isNegative()) {
            throw new IngestionConfigurationException("retryDelay must be zero or positive, was " + retryDelay);
        }
    }
}
