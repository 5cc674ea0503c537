package com.flamingo.ai.ephemeralrag.service.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.ephemeralrag.domain.model.Chunk;
import com.flamingo.ai.ephemeralrag.domain.model.ChunkMetadata;

/** A stored chunk as exposed for browsing and export. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChunkView(
    String sessionId,
    int chunkIndex,
    int sequence,
    String text,
    ChunkMetadata metadata,
    int vectorDim,
    String embeddingModel,
    float[] vector) {

  static ChunkView of(String sessionId, Chunk chunk, String embeddingModel, boolean withVector) {
    return new ChunkView(
        sessionId,
        chunk.index(),
        chunk.sequence(),
        chunk.text(),
        chunk.metadata(),
        chunk.dimension(),
        embeddingModel,
        withVector ? chunk.vectorCopy() : null);
  }
}
