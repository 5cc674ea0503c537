package com.flamingo.ai.ephemeralrag.service.quota;

import java.time.Instant;

/**
 * Read-only view of a user's quota.
 *
 * @param windowResetAt end of the current window, or {@code null} when no window is open
 */
public record QuotaStatus(
    String userId, int currentCount, int limit, int remaining, Instant windowResetAt) {

  public boolean hasQuota() {
    return remaining > 0;
  }
}
