package com.adlanda.transcriptsearch.controller;

import com.adlanda.transcriptsearch.model.QueryRequest;
import com.adlanda.transcriptsearch.model.QueryResponse;
import com.adlanda.transcriptsearch.service.RetrievalService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for searching the transcript collection.
 */
@RestController
@RequestMapping("/api/v1")
public class QueryController {

    private final RetrievalService retrievalService;

    public QueryController(RetrievalService retrievalService) {
        this.retrievalService = retrievalService;
    }

    /**
     * Search for transcript chunks relevant to a question.
     *
     * @param request The query request containing the question
     * @return QueryResponse with matched chunks and metadata
     */
    @PostMapping("/query")
    public ResponseEntity<QueryResponse> query(@Valid @RequestBody QueryRequest request) {
        QueryResponse response = retrievalService.query(request.question(), request.maxResults());
        return ResponseEntity.ok(response);
    }

    /**
     * Get collection statistics.
     */
    @GetMapping("/collection")
    public ResponseEntity<Map<String, Object>> getCollection() {
        long size = retrievalService.getCollectionSize();
        return ResponseEntity.ok(Map.of(
                "totalEntities", size,
                "status", size > 0 ? "indexed" : "empty"
        ));
    }
}
