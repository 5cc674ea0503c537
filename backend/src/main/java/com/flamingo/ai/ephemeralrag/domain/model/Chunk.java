package com.flamingo.ai.ephemeralrag.domain.model;

/**
 * An immutable, retrievable unit of content owned by exactly one session.
 *
 * <p>The {@code vector} array is the unit-normalized row held by the session's vector index. It is
 * shared, not copied, and must never be mutated; callers exposing it outside the store copy it
 * first.
 *
 * @param index insertion index within the session, stable for point lookups
 * @param sequence position within its source document
 * @param text the chunk text
 * @param metadata the chunk metadata
 * @param vector the unit-normalized embedding
 */
public record Chunk(int index, int sequence, String text, ChunkMetadata metadata, float[] vector) {

  /** Returns the embedding dimension of this chunk. */
  public int dimension() {
    return vector.length;
  }

  /** Returns a defensive copy of the embedding. */
  public float[] vectorCopy() {
    return vector.clone();
  }
}
