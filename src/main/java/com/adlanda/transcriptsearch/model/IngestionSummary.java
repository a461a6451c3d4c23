package com.adlanda.transcriptsearch.model;

/**
 * Summary of a full startup ingestion run, reported through the health endpoint.
 *
 * @param segmentsRead    Segments read from the source file
 * @param chunksBuilt     Chunks produced by the windowed aggregator
 * @param entitiesStored  Entities inserted into the collection
 * @param batches         Embedding/insert round trips
 * @param durationMs      Wall time of the run
 */
public record IngestionSummary(
        int segmentsRead,
        int chunksBuilt,
        long entitiesStored,
        int batches,
        long durationMs
) {}
