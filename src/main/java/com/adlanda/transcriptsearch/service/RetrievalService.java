package com.adlanda.transcriptsearch.service;

import com.adlanda.transcriptsearch.model.QueryResponse;
import com.adlanda.transcriptsearch.model.QueryResult;
import com.adlanda.transcriptsearch.model.SearchHit;
import com.adlanda.transcriptsearch.repository.VectorCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Answers questions by searching the transcript collection.
 *
 * Orchestrates the query flow:
 * 1. Embed the question
 * 2. Search the collection for the closest chunks
 * 3. Return ranked results
 */
@Service
public class RetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

    private final EmbeddingProvider embeddingProvider;
    private final VectorCollection collection;

    public RetrievalService(EmbeddingProvider embeddingProvider, VectorCollection collection) {
        this.embeddingProvider = embeddingProvider;
        this.collection = collection;
    }

    /**
     * Queries the collection for chunks relevant to a question.
     *
     * @param question   The question to search for
     * @param maxResults Maximum number of results to return
     * @return QueryResponse containing the matched chunks and metadata
     */
    public QueryResponse query(String question, int maxResults) {
        long startTime = System.currentTimeMillis();

        float[] queryEmbedding = embeddingProvider.embed(question);

        List<List<SearchHit>> hits = collection.search(List.of(queryEmbedding), maxResults);

        List<QueryResult> results = hits.isEmpty()
                ? List.of()
                : hits.get(0).stream().map(QueryResult::from).toList();

        long queryTimeMs = System.currentTimeMillis() - startTime;

        log.debug("Query '{}' returned {} results in {}ms",
                truncate(question, 50), results.size(), queryTimeMs);

        return new QueryResponse(results, collection.count(), queryTimeMs);
    }

    /**
     * Returns the number of entities in the collection.
     */
    public long getCollectionSize() {
        return collection.count();
    }

    private String truncate(String s, int maxLen) {
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + "...";
    }
}
