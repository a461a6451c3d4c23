package com.adlanda.transcriptsearch.model;

import java.util.List;

/**
 * Response from the query endpoint.
 *
 * @param results        Matched chunks, closest first
 * @param totalEntities  Number of entities in the collection
 * @param queryTimeMs    Time taken to process the query in milliseconds
 */
public record QueryResponse(
        List<QueryResult> results,
        long totalEntities,
        long queryTimeMs
) {}
