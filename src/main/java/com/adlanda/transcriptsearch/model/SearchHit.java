package com.adlanda.transcriptsearch.model;

/**
 * One ranked entity returned by the vector store for a query vector.
 *
 * @param id     Identifier of the stored chunk
 * @param text   Stored chunk text
 * @param score  Distance reported by the store (lower is closer for L2)
 */
public record SearchHit(String id, String text, double score) {}
