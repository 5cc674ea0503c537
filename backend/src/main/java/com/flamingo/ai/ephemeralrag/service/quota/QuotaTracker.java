package com.flamingo.ai.ephemeralrag.service.quota;

import com.flamingo.ai.ephemeralrag.config.RagConfig;
import com.flamingo.ai.ephemeralrag.exception.InvalidRequestException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Per-user chunk counter over a fixed window.
 *
 * <p>A window opens with the first admission after the previous one elapsed and lasts
 * {@code rag.quota.window}. Updates for one user are serialized through
 * {@link ConcurrentHashMap#compute}, so two concurrent admissions can never both pass a ceiling
 * that only one of them fits under. Different users never contend.
 */
@Component
@Slf4j
public class QuotaTracker {

  private final Map<String, QuotaRecord> records = new ConcurrentHashMap<>();
  private final Clock clock;
  private final int limit;
  private final Duration window;

  public QuotaTracker(RagConfig ragConfig, Clock clock) {
    this.clock = clock;
    this.limit = ragConfig.getQuota().getMaxChunksPerWindow();
    this.window = ragConfig.getQuota().getWindow();
  }

  /**
   * Admits {@code requestedCount} chunks for the user if the window total stays within the limit.
   * A rejected request changes nothing.
   *
   * @throws InvalidRequestException if {@code requestedCount} is not positive
   */
  public QuotaDecision admit(String userId, int requestedCount) {
    if (requestedCount <= 0) {
      throw new InvalidRequestException("Requested chunk count must be positive");
    }
    Instant now = clock.instant();
    QuotaDecision[] decision = new QuotaDecision[1];
    records.compute(
        userId,
        (id, current) -> {
          QuotaRecord active =
              current == null || current.elapsed(now, window) ? new QuotaRecord(0, now) : current;
          long total = (long) active.count() + requestedCount;
          Instant resetAt = active.windowStart().plus(window);
          if (total > limit) {
            decision[0] =
                new QuotaDecision(false, active.count(), limit, active.windowStart(), resetAt);
            return current;
          }
          decision[0] = new QuotaDecision(true, (int) total, limit, active.windowStart(), resetAt);
          return new QuotaRecord((int) total, active.windowStart());
        });

    if (!decision[0].allowed()) {
      log.warn(
          "Quota rejected for user {}: {} + {} > {}",
          userId,
          decision[0].currentCount(),
          requestedCount,
          limit);
    }
    return decision[0];
  }

  /**
   * Gives back chunks admitted by {@code decision} whose ingestion failed. Does nothing if the
   * window the admission was counted in has since been replaced.
   */
  public void release(String userId, QuotaDecision decision, int count) {
    if (!decision.allowed() || count <= 0) {
      return;
    }
    records.computeIfPresent(
        userId,
        (id, current) ->
            current.windowStart().equals(decision.windowStart())
                ? new QuotaRecord(Math.max(0, current.count() - count), current.windowStart())
                : current);
    log.debug("Released {} chunks of quota for user {}", count, userId);
  }

  /** Returns the user's quota without changing it. */
  public QuotaStatus status(String userId) {
    Instant now = clock.instant();
    QuotaRecord current = records.get(userId);
    if (current == null || current.elapsed(now, window)) {
      return new QuotaStatus(userId, 0, limit, limit, null);
    }
    return new QuotaStatus(
        userId,
        current.count(),
        limit,
        Math.max(0, limit - current.count()),
        current.windowStart().plus(window));
  }

  /**
   * Drops records whose window has elapsed at {@code now}.
   *
   * @return the number of records dropped
   */
  public int evictExpired(Instant now) {
    int evicted = 0;
    for (Map.Entry<String, QuotaRecord> entry : records.entrySet()) {
      if (entry.getValue().elapsed(now, window)
          && records.remove(entry.getKey(), entry.getValue())) {
        evicted++;
      }
    }
    return evicted;
  }

  public int limit() {
    return limit;
  }

  private record QuotaRecord(int count, Instant windowStart) {

    boolean elapsed(Instant now, Duration window) {
      return !now.isBefore(windowStart.plus(window));
    }
  }
}
