package com.flamingo.ai.ephemeralrag.service.session;

import com.flamingo.ai.ephemeralrag.store.SessionInfo;
import com.flamingo.ai.ephemeralrag.store.SessionStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of SessionService over the in-memory session store. */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionServiceImpl implements SessionService {

  private final SessionStore sessionStore;
  private final MeterRegistry meterRegistry;

  @Override
  public SessionInfo getSession(String sessionId) {
    return sessionStore.describe(sessionId);
  }

  @Override
  @Timed(value = "sessions.delete", description = "Time to delete a session")
  public boolean deleteSession(String sessionId) {
    boolean removed = sessionStore.delete(sessionId);
    if (removed) {
      meterRegistry.counter("sessions.deleted", "reason", "explicit").increment();
    } else {
      log.debug("Delete of unknown session {} ignored", sessionId);
    }
    return removed;
  }
}
