package com.flamingo.ai.ephemeralrag.store;

import com.flamingo.ai.ephemeralrag.domain.model.Chunk;

/**
 * A chunk returned by a similarity search.
 *
 * @param chunk the matching chunk
 * @param score cosine similarity to the query
 */
public record SearchHit(Chunk chunk, double score) {}
