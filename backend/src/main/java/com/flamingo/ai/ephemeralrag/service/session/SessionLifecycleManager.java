package com.flamingo.ai.ephemeralrag.service.session;

import com.flamingo.ai.ephemeralrag.service.quota.QuotaTracker;
import com.flamingo.ai.ephemeralrag.store.SessionStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically reclaims idle sessions and elapsed quota windows. */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionLifecycleManager {

  private final SessionStore sessionStore;
  private final QuotaTracker quotaTracker;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  /** Sessions evicted and quota records dropped by one sweep. */
  public record SweepResult(int sessionsEvicted, int quotaRecordsEvicted) {}

  @Scheduled(
      fixedDelayString = "#{@ragConfig.session.sweepInterval.toMillis()}",
      initialDelayString = "#{@ragConfig.session.sweepInterval.toMillis()}")
  public void scheduledSweep() {
    try {
      sweep();
    } catch (RuntimeException e) {
      // keep the schedule alive; the next sweep retries
      log.error("Session sweep failed: {}", e.getMessage(), e);
    }
  }

  /** Runs one sweep against the current clock. */
  public SweepResult sweep() {
    Instant now = clock.instant();
    int sessions = sessionStore.evictExpired(now);
    int quotas = quotaTracker.evictExpired(now);
    if (sessions > 0) {
      meterRegistry.counter("sessions.deleted", "reason", "expired").increment(sessions);
      log.info("Sweep evicted {} expired sessions", sessions);
    }
    log.debug("Sweep done: {} sessions, {} quota records evicted", sessions, quotas);
    return new SweepResult(sessions, quotas);
  }
}
