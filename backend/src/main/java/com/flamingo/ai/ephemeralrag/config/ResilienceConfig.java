package com.flamingo.ai.ephemeralrag.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Guards around the embedding model: a bounded timeout and a circuit breaker. */
@Configuration
public class ResilienceConfig {

  public static final String EMBEDDING = "embedding";

  /** Configured under {@code resilience4j.circuitbreaker.instances.embedding}. */
  @Bean
  public CircuitBreaker embeddingCircuitBreaker(CircuitBreakerRegistry registry) {
    return registry.circuitBreaker(EMBEDDING);
  }

  @Bean
  public TimeLimiter embeddingTimeLimiter(RagConfig ragConfig) {
    TimeLimiterConfig config =
        TimeLimiterConfig.custom()
            .timeoutDuration(ragConfig.getEmbedding().getTimeout())
            .cancelRunningFuture(true)
            .build();
    return TimeLimiter.of(EMBEDDING, config);
  }
}
