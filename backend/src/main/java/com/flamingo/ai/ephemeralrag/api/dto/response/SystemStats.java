package com.flamingo.ai.ephemeralrag.api.dto.response;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for store-wide statistics. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemStats {
  private int activeSessions;
  private long totalChunks;
  private int dimension;
  private String embeddingModel;
  private String embeddingCircuitState;
  private Instant timestamp;
}
