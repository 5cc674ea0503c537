package com.flamingo.ai.ephemeralrag.service.quota;

import java.time.Instant;

/**
 * Outcome of a quota admission.
 *
 * @param allowed whether the request was admitted
 * @param currentCount chunks counted in the window after the decision
 * @param limit the per-window ceiling
 * @param windowStart start of the window the decision was made in
 * @param windowResetAt instant at which the window ends
 */
public record QuotaDecision(
    boolean allowed, int currentCount, int limit, Instant windowStart, Instant windowResetAt) {

  public int remaining() {
    return Math.max(0, limit - currentCount);
  }
}
