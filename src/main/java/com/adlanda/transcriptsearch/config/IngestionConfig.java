package com.adlanda.transcriptsearch.config;

import com.adlanda.transcriptsearch.repository.VectorCollection;
import com.adlanda.transcriptsearch.service.EmbeddingProvider;
import com.adlanda.transcriptsearch.service.IngestionPipeline;
import com.adlanda.transcriptsearch.service.PipelineSettings;
import com.adlanda.transcriptsearch.service.WindowedAggregator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the aggregator and the ingestion pipeline from configuration.
 * Invalid values fail here, at startup.
 */
@Configuration
public class IngestionConfig {

    @Bean
    public WindowedAggregator windowedAggregator(IngestionProperties properties) {
        return new WindowedAggregator(properties.getWindow(), properties.getStride());
    }

    @Bean
    public IngestionPipeline ingestionPipeline(EmbeddingProvider embeddingProvider,
                                               VectorCollection vectorCollection,
                                               IngestionProperties ingestion,
                                               MilvusProperties milvus) {
        PipelineSettings settings = new PipelineSettings(
                ingestion.getBatchSize(),
                milvus.getDimension(),
                ingestion.getRetryDelay()
        );
        return new IngestionPipeline(embeddingProvider, vectorCollection, settings);
    }
}
