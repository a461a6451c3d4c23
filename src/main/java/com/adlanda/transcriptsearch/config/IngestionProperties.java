package com.adlanda.transcriptsearch.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for transcript ingestion.
 *
 * Maps to properties prefixed with 'transcripts.ingestion' in application.properties.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "transcripts.ingestion")
public class IngestionProperties {

    /**
     * Whether ingestion runs at startup.
     * When false, the service only answers queries against the existing collection.
     */
    private boolean enabled = true;

    /**
     * JSON Lines file with one transcript segment per line.
     */
    private String source = "./data/transcripts.jsonl";

    /**
     * Segment field whose value groups segments (one video per group).
     */
    @NotBlank
    private String groupField = "title";

    /**
     * Number of consecutive segments merged into one chunk.
     */
    @Positive
    private int window = 20;

    /**
     * Step between the first segments of two consecutive windows.
     */
    @Positive
    private int stride = 4;

    /**
     * Chunks embedded and inserted per round trip.
     */
    @Positive
    private int batchSize = 64;

    /**
     * Wait before re-sending a batch after a transient embedding failure.
     */
    @NotNull
    private Duration retryDelay = Duration.ofSeconds(5);

    /**
     * Whether to drop and recreate the collection before ingesting.
     */
    private boolean recreateCollection = true;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getGroupField() {
        return groupField;
    }

    public void setGroupField(String groupField) {
        this.groupField = groupField;
    }

    public int getWindow() {
        return window;
    }

    public void setWindow(int window) {
        this.window = window;
    }

    public int getStride() {
        return stride;
    }

    public void setStride(int stride) {
        this.stride = stride;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public void setRetryDelay(Duration retryDelay) {
        this.retryDelay = retryDelay;
    }

    public boolean isRecreateCollection() {
        return recreateCollection;
    }

    public void setRecreateCollection(boolean recreateCollection) {
        this.recreateCollection = recreateCollection;
    }
}
