package com.adlanda.transcriptsearch;

import com.adlanda.transcriptsearch.config.IngestionProperties;
import com.adlanda.transcriptsearch.exception.IngestionException;
import com.adlanda.transcriptsearch.health.IngestionHealthIndicator;
import com.adlanda.transcriptsearch.model.Chunk;
import com.adlanda.transcriptsearch.model.IngestionResult;
import com.adlanda.transcriptsearch.model.IngestionSummary;
import com.adlanda.transcriptsearch.model.Segment;
import com.adlanda.transcriptsearch.repository.VectorCollection;
import com.adlanda.transcriptsearch.service.IngestionPipeline;
import com.adlanda.transcriptsearch.service.SegmentLoader;
import com.adlanda.transcriptsearch.service.WindowedAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs transcript ingestion on application startup.
 *
 * Loads segments, merges them into windows, embeds and stores them,
 * then builds the index and loads the collection for search.
 */
@Component
@Order(1) // Run before StartupInfoLogger
public class IngestionRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(IngestionRunner.class);

    private final IngestionProperties properties;
    private final SegmentLoader segmentLoader;
    private final WindowedAggregator aggregator;
    private final IngestionPipeline pipeline;
    private final VectorCollection collection;
    private final IngestionHealthIndicator healthIndicator;

    public IngestionRunner(IngestionProperties properties,
                           SegmentLoader segmentLoader,
                           WindowedAggregator aggregator,
                           IngestionPipeline pipeline,
                           VectorCollection collection,
                           IngestionHealthIndicator healthIndicator) {
        this.properties = properties;
        this.segmentLoader = segmentLoader;
        this.aggregator = aggregator;
        this.pipeline = pipeline;
        this.collection = collection;
        this.healthIndicator = healthIndicator;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isEnabled()) {
            log.info("Ingestion disabled (transcripts.ingestion.enabled=false)");
            return;
        }

        Path source = Path.of(properties.getSource());
        if (!Files.exists(source)) {
            log.warn("Segment source does not exist: {}", source);
            healthIndicator.markUnhealthy("Segment source not found: " + source);
            return;
        }

        log.info("Starting transcript ingestion from {}...", source);
        long startTime = System.currentTimeMillis();

        try {
            // 1. Read segments and merge them into windows
            List<Segment> segments = segmentLoader.load(source);
            List<Chunk> chunks = aggregator.aggregateAll(segments);

            // 2. Prepare an empty collection
            if (properties.isRecreateCollection()) {
                collection.recreate();
            }

            // 3. Embed and insert in batches
            IngestionResult result = pipeline.ingest(chunks);

            // 4. Make the collection searchable
            collection.createIndex();
            collection.load();

            IngestionSummary summary = new IngestionSummary(
                    segments.size(),
                    chunks.size(),
                    result.storedCount(),
                    result.batchCount(),
                    System.currentTimeMillis() - startTime
            );
            healthIndicator.markHealthy(summary);
            log.info("Ingestion complete: {} entities stored in {} batches", result.storedCount(), result.batchCount());

        } catch (IngestionException e) {
            log.error("Ingestion aborted at batch {} (chunk {}), {} entities already stored: {}",
                    e.getBatchIndex(), e.getChunkId(), e.getStoredBeforeFailure(), e.getMessage(), e);
            healthIndicator.markUnhealthy(e.getMessage());
        } catch (IOException | RuntimeException e) {
            log.error("Failed to ingest transcripts: {}", e.getMessage(), e);
            healthIndicator.markUnhealthy(e.getMessage());
        }
    }
}
