package com.flamingo.ai.ephemeralrag.exception;

import java.time.Instant;

/** Exception thrown when a session still exists but has been idle past its time-to-live. */
public class SessionExpiredException extends StoreException {

  private final String sessionId;
  private final Instant expiredAt;

  public SessionExpiredException(String sessionId, Instant expiredAt) {
    super(
        ApiError.SESSION_EXPIRED,
        "Session " + sessionId + " expired at " + expiredAt,
        "Session has expired. Upload documents to start a new session.");
    this.sessionId = sessionId;
    this.expiredAt = expiredAt;
  }

  public String getSessionId() {
    return sessionId;
  }

  public Instant getExpiredAt() {
    return expiredAt;
  }
}
