package com.flamingo.ai.ephemeralrag.store;

/**
 * A row of the vector index together with its cosine similarity to a query.
 *
 * @param index insertion index of the row
 * @param score cosine similarity in [-1, 1]
 */
public record ScoredIndex(int index, double score) {}
