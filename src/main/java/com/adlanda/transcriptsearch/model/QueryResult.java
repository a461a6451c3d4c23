package com.adlanda.transcriptsearch.model;

/**
 * A single result from a query.
 *
 * @param id     Id of the matched chunk (the id of its first segment)
 * @param text   The text of the matched chunk
 * @param score  Distance to the query vector
 */
public record QueryResult(
        String id,
        String text,
        double score
) {
    public static QueryResult from(SearchHit hit) {
        return new QueryResult(hit.id(), hit.text(), hit.score());
    }
}
