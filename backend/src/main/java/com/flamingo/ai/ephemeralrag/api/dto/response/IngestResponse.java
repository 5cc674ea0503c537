package com.flamingo.ai.ephemeralrag.api.dto.response;

import com.flamingo.ai.ephemeralrag.service.ingest.IngestionResult;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a successful ingestion. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestResponse {

  private String sessionId;
  private boolean newSession;
  private int chunksStored;
  private int totalChunks;
  private int quotaRemaining;
  private Instant quotaResetAt;
  private Instant expiresAt;

  public static IngestResponse fromResult(IngestionResult result) {
    return IngestResponse.builder()
        .sessionId(result.sessionId())
        .newSession(result.newSession())
        .chunksStored(result.chunksStored())
        .totalChunks(result.totalChunks())
        .quotaRemaining(result.quotaRemaining())
        .quotaResetAt(result.quotaResetAt())
        .expiresAt(result.expiresAt())
        .build();
  }
}
