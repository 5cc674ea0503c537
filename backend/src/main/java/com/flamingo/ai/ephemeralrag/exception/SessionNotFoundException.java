package com.flamingo.ai.ephemeralrag.exception;

/** Exception thrown when a session is unknown or has already been reclaimed. */
public class SessionNotFoundException extends StoreException {

  private final String sessionId;

  public SessionNotFoundException(String sessionId) {
    super(
        ApiError.SESSION_NOT_FOUND,
        "Session not found: " + sessionId,
        "Session not found. Upload documents to start a new session.");
    this.sessionId = sessionId;
  }

  public String getSessionId() {
    return sessionId;
  }
}
