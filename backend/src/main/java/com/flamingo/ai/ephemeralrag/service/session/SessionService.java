package com.flamingo.ai.ephemeralrag.service.session;

import com.flamingo.ai.ephemeralrag.store.SessionInfo;

/** Service interface for session inspection and deletion. */
public interface SessionService {

  /**
   * Describes a session without extending its lifetime.
   *
   * @param sessionId the session ID
   * @return the session description
   * @throws com.flamingo.ai.ephemeralrag.exception.SessionNotFoundException if not found
   * @throws com.flamingo.ai.ephemeralrag.exception.SessionExpiredException if idle past its TTL
   */
  SessionInfo getSession(String sessionId);

  /**
   * Deletes a session and everything in it. Deleting an unknown session succeeds.
   *
   * @param sessionId the session ID
   * @return true if a session was removed
   */
  boolean deleteSession(String sessionId);
}
