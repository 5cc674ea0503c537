package com.flamingo.ai.ephemeralrag.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.ephemeralrag.domain.model.ChunkMetadata;
import com.flamingo.ai.ephemeralrag.service.retrieval.RetrievedChunk;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one ranked chunk. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RetrievedChunkResponse {

  private int rank;
  private int chunkIndex;
  private int sequence;
  private String text;
  private ChunkMetadata metadata;
  private double score;
  private float[] vector;

  public static RetrievedChunkResponse fromResult(RetrievedChunk chunk, int rank) {
    return RetrievedChunkResponse.builder()
        .rank(rank)
        .chunkIndex(chunk.chunkIndex())
        .sequence(chunk.sequence())
        .text(chunk.text())
        .metadata(chunk.metadata())
        .score(chunk.score())
        .vector(chunk.vector())
        .build();
  }
}
