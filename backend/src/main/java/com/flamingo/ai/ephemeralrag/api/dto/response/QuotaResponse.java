package com.flamingo.ai.ephemeralrag.api.dto.response;

import com.flamingo.ai.ephemeralrag.service.quota.QuotaStatus;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a user's upload quota. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuotaResponse {

  private String userId;
  private int currentCount;
  private int limit;
  private int remaining;
  private boolean hasQuota;
  private Instant windowResetAt;

  public static QuotaResponse fromStatus(QuotaStatus status) {
    return QuotaResponse.builder()
        .userId(status.userId())
        .currentCount(status.currentCount())
        .limit(status.limit())
        .remaining(status.remaining())
        .hasQuota(status.hasQuota())
        .windowResetAt(status.windowResetAt())
        .build();
  }
}
