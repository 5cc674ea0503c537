package com.flamingo.ai.ephemeralrag.api.dto.response;

import com.flamingo.ai.ephemeralrag.service.retrieval.RetrievalResult;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for ranked retrieval results. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrievalResponse {

  private String sessionId;
  private String query;
  private int k;
  private int totalChunks;
  private int resultCount;
  private List<RetrievedChunkResponse> results;
  private long tookMilliseconds;

  public static RetrievalResponse fromResult(RetrievalResult result) {
    List<RetrievedChunkResponse> ranked = new ArrayList<>(result.results().size());
    for (int i = 0; i < result.results().size(); i++) {
      ranked.add(RetrievedChunkResponse.fromResult(result.results().get(i), i + 1));
    }
    return RetrievalResponse.builder()
        .sessionId(result.sessionId())
        .query(result.query())
        .k(result.k())
        .totalChunks(result.totalChunks())
        .resultCount(ranked.size())
        .results(ranked)
        .tookMilliseconds(result.tookMilliseconds())
        .build();
  }
}
