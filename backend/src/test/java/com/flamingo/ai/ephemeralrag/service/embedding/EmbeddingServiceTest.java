package com.flamingo.ai.ephemeralrag.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.ephemeralrag.exception.EmbeddingUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingService Tests")
class EmbeddingServiceTest {

  @Mock private EmbeddingModel embeddingModel;

  private ThreadPoolTaskExecutor executor;
  private SimpleMeterRegistry meterRegistry;
  private CircuitBreaker circuitBreaker;
  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setThreadNamePrefix("embed-test-");
    executor.initialize();
    meterRegistry = new SimpleMeterRegistry();
    circuitBreaker =
        CircuitBreaker.of(
            "embedding-test",
            CircuitBreakerConfig.custom()
                .slidingWindowSize(2)
                .minimumNumberOfCalls(2)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofMinutes(1))
                .build());
    TimeLimiter timeLimiter =
        TimeLimiter.of(
            TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(200))
                .cancelRunningFuture(true)
                .build());

    embeddingService =
        new EmbeddingService(embeddingModel, executor, timeLimiter, circuitBreaker, meterRegistry);
  }

  @AfterEach
  void tearDown() {
    executor.shutdown();
  }

  @Test
  @DisplayName("Should return one vector per passage in order")
  void shouldEmbedPassagesInOrder() {
    // Given
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(
            Response.from(
                List.of(Embedding.from(new float[] {1, 0}), Embedding.from(new float[] {0, 1}))));

    // When
    List<float[]> vectors = embeddingService.embedPassages(List.of("first", "second"));

    // Then
    assertThat(vectors).hasSize(2);
    assertThat(vectors.get(0)).containsExactly(1f, 0f);
    assertThat(vectors.get(1)).containsExactly(0f, 1f);
    assertThat(
            meterRegistry.counter("embedding.requests.success", "kind", "passages").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should embed a query")
  void shouldEmbedQuery() {
    when(embeddingModel.embed(anyString()))
        .thenReturn(Response.from(Embedding.from(new float[] {0.5f, 0.5f})));

    assertThat(embeddingService.embedQuery("what?")).containsExactly(0.5f, 0.5f);
  }

  @Test
  @DisplayName("Should not call the model for an empty batch")
  void shouldSkipModel_whenNoPassages() {
    assertThat(embeddingService.embedPassages(List.of())).isEmpty();
  }

  @Test
  @DisplayName("Should fail with timeout flag when the model is too slow")
  void shouldTimeOut_whenModelIsSlow() {
    // Given
    when(embeddingModel.embed(anyString()))
        .thenAnswer(
            invocation -> {
              Thread.sleep(5000);
              return Response.from(Embedding.from(new float[] {1, 0}));
            });

    // When / Then
    assertThatThrownBy(() -> embeddingService.embedQuery("slow"))
        .isInstanceOfSatisfying(
            EmbeddingUnavailableException.class,
            ex -> {
              assertThat(ex.isTimedOut()).isTrue();
              assertThat(ex.getCode()).isEqualTo("EMBEDDING_002");
            });
  }

  @Test
  @DisplayName("Should wrap model failures without retrying")
  void shouldWrapFailure_whenModelThrows() {
    when(embeddingModel.embed(anyString())).thenThrow(new RuntimeException("boom"));

    assertThatThrownBy(() -> embeddingService.embedQuery("q"))
        .isInstanceOfSatisfying(
            EmbeddingUnavailableException.class,
            ex -> {
              assertThat(ex.isTimedOut()).isFalse();
              assertThat(ex.getCode()).isEqualTo("EMBEDDING_001");
            });
    verify(embeddingModel, times(1)).embed(anyString());
  }

  @Test
  @DisplayName("Should fail when the model returns fewer vectors than passages")
  void shouldFail_whenVectorCountMismatch() {
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(Response.from(List.of(Embedding.from(new float[] {1, 0}))));

    assertThatThrownBy(() -> embeddingService.embedPassages(List.of("a", "b")))
        .isInstanceOf(EmbeddingUnavailableException.class)
        .hasMessageContaining("1 vectors for 2 passages");
  }

  @Test
  @DisplayName("Should fail when the model returns a zero vector")
  void shouldFail_whenVectorIsZero() {
    when(embeddingModel.embed(anyString()))
        .thenReturn(Response.from(Embedding.from(new float[] {0, 0})));

    assertThatThrownBy(() -> embeddingService.embedQuery("q"))
        .isInstanceOf(EmbeddingUnavailableException.class);
  }

  @Test
  @DisplayName("Should fail fast once the circuit breaker opens")
  void shouldFailFast_whenCircuitOpen() {
    when(embeddingModel.embed(anyString())).thenThrow(new RuntimeException("down"));

    assertThatThrownBy(() -> embeddingService.embedQuery("a"))
        .isInstanceOf(EmbeddingUnavailableException.class);
    assertThatThrownBy(() -> embeddingService.embedQuery("b"))
        .isInstanceOf(EmbeddingUnavailableException.class);
    assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);

    assertThatThrownBy(() -> embeddingService.embedQuery("c"))
        .isInstanceOf(EmbeddingUnavailableException.class)
        .hasMessageContaining("circuit breaker is open");
    verify(embeddingModel, times(2)).embed(anyString());
  }
}
