package com.adlanda.transcriptsearch;

import com.adlanda.transcriptsearch.config.IngestionProperties;
import com.adlanda.transcriptsearch.exception.VectorStoreException;
import com.adlanda.transcriptsearch.health.IngestionHealthIndicator;
import com.adlanda.transcriptsearch.model.Chunk;
import com.adlanda.transcriptsearch.model.IngestionResult;
import com.adlanda.transcriptsearch.model.Segment;
import com.adlanda.transcriptsearch.repository.VectorCollection;
import com.adlanda.transcriptsearch.service.IngestionPipeline;
import com.adlanda.transcriptsearch.service.SegmentLoader;
import com.adlanda.transcriptsearch.service.WindowedAggregator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.actuate.health.Status;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IngestionRunnerTest {

    @Mock
    private SegmentLoader segmentLoader;

    @Mock
    private IngestionPipeline pipeline;

    @Mock
    private VectorCollection collection;

    @TempDir
    Path tempDir;

    private IngestionProperties properties;
    private IngestionHealthIndicator healthIndicator;
    private IngestionRunner runner;

    @BeforeEach
    void setUp() {
        properties = new IngestionProperties();
        healthIndicator = new IngestionHealthIndicator();
        runner = new IngestionRunner(properties, segmentLoader, new WindowedAggregator(2, 1),
                pipeline, collection, healthIndicator);
    }

    @Test
    void run_disabled_doesNothing() {
        properties.setEnabled(false);

        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(segmentLoader, pipeline, collection);
    }

    @Test
    void run_missingSource_marksUnhealthy() {
        properties.setSource(tempDir.resolve("absent.jsonl").toString());

        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(segmentLoader, pipeline, collection);
        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.DOWN);
    }

    @Test
    void run_recreatesIngestsIndexesAndLoads() throws IOException {
        Path source = Files.createFile(tempDir.resolve("segments.jsonl"));
        properties.setSource(source.toString());
        when(segmentLoader.load(source)).thenReturn(List.of(
                Segment.of("a0", "A", "hi", 0, 1),
                Segment.of("a1", "A", "there", 1, 2),
                Segment.of("b0", "B", "bye", 2, 3)
        ));
        when(pipeline.ingest(anyList())).thenReturn(new IngestionResult(2, 1));

        runner.run(new DefaultApplicationArguments());

        InOrder inOrder = inOrder(collection, pipeline);
        inOrder.verify(collection).recreate();
        inOrder.verify(pipeline).ingest(List.of(
                new Chunk("a0", "A", "hi there", 0, 2, null),
                new Chunk("b0", "B", "bye", 2, 3, null)
        ));
        inOrder.verify(collection).createIndex();
        inOrder.verify(collection).load();

        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.UP);
        assertThat(healthIndicator.health().getDetails())
                .containsEntry("segmentsRead", 3)
                .containsEntry("chunksBuilt", 2)
                .containsEntry("entitiesStored", 2L);
    }

    @Test
    void run_keepsExistingCollectionWhenRecreateDisabled() throws IOException {
        Path source = Files.createFile(tempDir.resolve("segments.jsonl"));
        properties.setSource(source.toString());
        properties.setRecreateCollection(false);
        when(segmentLoader.load(source)).thenReturn(List.of(Segment.of("a0", "A", "hi", 0, 1)));
        when(pipeline.ingest(anyList())).thenReturn(new IngestionResult(1, 1));

        runner.run(new DefaultApplicationArguments());

        verify(collection, never()).recreate();
        verify(collection).createIndex();
    }

    @Test
    void run_pipelineFailure_marksUnhealthyAndSkipsIndex() throws IOException {
        Path source = Files.createFile(tempDir.resolve("segments.jsonl"));
        properties.setSource(source.toString());
        when(segmentLoader.load(any(Path.class))).thenReturn(List.of(Segment.of("a0", "A", "hi", 0, 1)));
        when(pipeline.ingest(anyList()))
                .thenThrow(new VectorStoreException("Batch 0: insert failed", 0, "a0", 0, null));

        runner.run(new DefaultApplicationArguments());

        verify(collection, never()).createIndex();
        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.DOWN);
        assertThat(healthIndicator.health().getDetails()).containsEntry("error", "Batch 0: insert failed");
    }
}
