package com.flamingo.ai.ephemeralrag.api.dto.response;

import com.flamingo.ai.ephemeralrag.store.SessionInfo;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for session data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionResponse {

  private String sessionId;
  private String ownerId;
  private int chunkCount;
  private int dimension;
  private Instant createdAt;
  private Instant lastAccessedAt;
  private Instant expiresAt;

  public static SessionResponse fromInfo(SessionInfo info) {
    return SessionResponse.builder()
        .sessionId(info.sessionId())
        .ownerId(info.ownerId())
        .chunkCount(info.chunkCount())
        .dimension(info.dimension())
        .createdAt(info.createdAt())
        .lastAccessedAt(info.lastAccessedAt())
        .expiresAt(info.expiresAt())
        .build();
  }
}
