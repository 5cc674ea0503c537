package com.flamingo.ai.ephemeralrag.exception;

/** Exception thrown when a user tries to write into a session owned by someone else. */
public class SessionAccessDeniedException extends StoreException {

  private final String sessionId;
  private final String userId;

  public SessionAccessDeniedException(String sessionId, String userId) {
    super(
        ApiError.SESSION_ACCESS_DENIED,
        String.format("Session %s does not belong to user %s", sessionId, userId),
        "Access to this session is denied");
    this.sessionId = sessionId;
    this.userId = userId;
  }

  public String getSessionId() {
    return sessionId;
  }

  public String getUserId() {
    return userId;
  }
}
