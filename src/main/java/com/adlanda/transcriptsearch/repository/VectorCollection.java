package com.adlanda.transcriptsearch.repository;

import com.adlanda.transcriptsearch.model.SearchHit;

import java.util.List;

/**
 * A collection in an external vector database holding chunk id, vector and text.
 *
 * Failures surface as {@link com.adlanda.transcriptsearch.exception.VectorStoreException}.
 */
public interface VectorCollection {

    /**
     * Inserts entities given as three parallel lists of equal length.
     *
     * @return number of entities the store reports as inserted
     */
    long insert(List<String> ids, List<float[]> vectors, List<String> texts);

    /**
     * Builds the configured index on the vector field.
     */
    void createIndex();

    /**
     * Runs a similarity search for each query vector.
     *
     * @param vectors Query vectors
     * @param limit   Hits to return per query vector
     * @return one ranked hit list per query vector, closest first
     */
    List<List<SearchHit>> search(List<float[]> vectors, int limit);

    /**
     * Drops the collection if it exists and creates it again, empty, with the configured schema.
     */
    void recreate();

    /**
     * Loads the collection into memory so it can be searched.
     */
    void load();

    /**
     * Number of entities in the collection.
     */
    long count();
}
