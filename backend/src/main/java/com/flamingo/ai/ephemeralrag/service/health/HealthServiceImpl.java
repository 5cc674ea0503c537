package com.flamingo.ai.ephemeralrag.service.health;

import com.flamingo.ai.ephemeralrag.api.dto.response.SystemStats;
import com.flamingo.ai.ephemeralrag.config.RagConfig;
import com.flamingo.ai.ephemeralrag.store.SessionStore;
import com.flamingo.ai.ephemeralrag.store.StoreStats;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of HealthService over the in-memory session store. */
@Service
@RequiredArgsConstructor
@Slf4j
public class HealthServiceImpl implements HealthService {

  private final SessionStore sessionStore;
  private final CircuitBreaker embeddingCircuitBreaker;
  private final RagConfig ragConfig;
  private final Clock clock;

  @Override
  @Timed(value = "health.stats", description = "Time to get system stats")
  public SystemStats getSystemStats() {
    StoreStats stats = sessionStore.stats();

    return SystemStats.builder()
        .activeSessions(stats.activeSessions())
        .totalChunks(stats.totalChunks())
        .dimension(stats.dimension())
        .embeddingModel(ragConfig.getEmbedding().getModelName())
        .embeddingCircuitState(embeddingCircuitBreaker.getState().name())
        .timestamp(clock.instant())
        .build();
  }
}
