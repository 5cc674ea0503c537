package com.flamingo.ai.ephemeralrag.exception;

import java.time.Instant;

/** Exception thrown when an ingestion would push a user past the per-window chunk ceiling. */
public class QuotaExceededException extends StoreException {

  private final String userId;
  private final int currentCount;
  private final int limit;
  private final Instant windowResetAt;

  public QuotaExceededException(
      String userId, int currentCount, int limit, Instant windowResetAt) {
    super(
        ApiError.QUOTA_EXCEEDED,
        String.format(
            "Quota exceeded for user %s: %d/%d chunks, window resets at %s",
            userId, currentCount, limit, windowResetAt),
        "Upload quota exceeded. Please try again after the quota window resets.");
    this.userId = userId;
    this.currentCount = currentCount;
    this.limit = limit;
    this.windowResetAt = windowResetAt;
  }

  public String getUserId() {
    return userId;
  }

  public int getCurrentCount() {
    return currentCount;
  }

  public int getLimit() {
    return limit;
  }

  public int getRemaining() {
    return Math.max(0, limit - currentCount);
  }

  public Instant getWindowResetAt() {
    return windowResetAt;
  }
}
