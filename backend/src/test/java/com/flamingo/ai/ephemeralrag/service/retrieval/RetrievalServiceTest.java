package com.flamingo.ai.ephemeralrag.service.retrieval;

import static com.flamingo.ai.ephemeralrag.support.TestFixtures.draft;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.ephemeralrag.config.RagConfig;
import com.flamingo.ai.ephemeralrag.domain.enums.ContentKind;
import com.flamingo.ai.ephemeralrag.exception.DimensionMismatchException;
import com.flamingo.ai.ephemeralrag.exception.InvalidRequestException;
import com.flamingo.ai.ephemeralrag.exception.SessionExpiredException;
import com.flamingo.ai.ephemeralrag.exception.SessionNotFoundException;
import com.flamingo.ai.ephemeralrag.service.embedding.EmbeddingService;
import com.flamingo.ai.ephemeralrag.store.SessionStore;
import com.flamingo.ai.ephemeralrag.support.MutableClock;
import com.flamingo.ai.ephemeralrag.support.TestFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("RetrievalService Tests")
class RetrievalServiceTest {

  @Mock private EmbeddingService embeddingService;

  private MutableClock clock;
  private SessionStore sessionStore;
  private RetrievalService retrievalService;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2026-03-01T08:00:00Z");
    RagConfig config = TestFixtures.config(2);
    config.getRetrieval().setMaxK(10);
    config.getRetrieval().setDefaultK(5);
    config.getRetrieval().setMaxQueryLength(20);
    config.getRetrieval().setMaxBatchQueries(3);
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    sessionStore = new SessionStore(config, clock, meterRegistry);
    retrievalService = new RetrievalService(sessionStore, embeddingService, config, meterRegistry);

    sessionStore.createOrGet("s1", "alice");
    sessionStore.appendChunks(
        "s1",
        "alice",
        List.of(draft(0, "east", ContentKind.TEXT), draft(1, "north", ContentKind.TABLE)),
        List.of(new float[] {1, 0}, new float[] {0, 1}));
  }

  private RetrievalQuery query(String text, Integer k) {
    return new RetrievalQuery("s1", text, k, null, false);
  }

  @Test
  @DisplayName("Should return the nearest chunk for k=1")
  void shouldReturnNearest_whenKIsOne() {
    // Given
    when(embeddingService.embedQuery("mostly east")).thenReturn(new float[] {0.9f, 0.1f});

    // When
    RetrievalResult result = retrievalService.retrieve(query("mostly east", 1));

    // Then
    assertThat(result.results()).hasSize(1);
    assertThat(result.results().get(0).text()).isEqualTo("east");
    assertThat(result.results().get(0).vector()).isNull();
    assertThat(result.totalChunks()).isEqualTo(2);
    assertThat(result.tookMilliseconds()).isNotNegative();
  }

  @Test
  @DisplayName("Should return both chunks best first for k=2")
  void shouldRankBothChunks_whenKIsTwo() {
    when(embeddingService.embedQuery("mostly north")).thenReturn(new float[] {0.1f, 0.9f});

    RetrievalResult result = retrievalService.retrieve(query("mostly north", 2));

    assertThat(result.results()).extracting(RetrievedChunk::text).containsExactly("north", "east");
    assertThat(result.results().get(0).score()).isGreaterThan(result.results().get(1).score());
  }

  @Test
  @DisplayName("Should return score 1.0 and the stored vector for an exact match")
  void shouldReturnExactMatch_withVector() {
    when(embeddingService.embedQuery("east")).thenReturn(new float[] {2, 0});

    RetrievalResult result =
        retrievalService.retrieve(new RetrievalQuery("s1", "east", 1, null, true));

    assertThat(result.results().get(0).score()).isCloseTo(1.0, within(1e-6));
    assertThat(result.results().get(0).vector()).containsExactly(1f, 0f);
  }

  @Test
  @DisplayName("Should clamp k to the number of chunks and default k when absent")
  void shouldClampK() {
    when(embeddingService.embedQuery(anyString())).thenReturn(new float[] {1, 1});

    assertThat(retrievalService.retrieve(query("any", 10)).results()).hasSize(2);
    RetrievalResult defaulted = retrievalService.retrieve(query("any", null));
    assertThat(defaulted.k()).isEqualTo(5);
    assertThat(defaulted.results()).hasSize(2);
  }

  @Test
  @DisplayName("Should restrict results to the requested content kind")
  void shouldFilterByKind() {
    when(embeddingService.embedQuery("east")).thenReturn(new float[] {1, 0});

    RetrievalResult result =
        retrievalService.retrieve(new RetrievalQuery("s1", "east", 5, ContentKind.TABLE, false));

    assertThat(result.results()).extracting(RetrievedChunk::text).containsExactly("north");
  }

  @Test
  @DisplayName("Should reject k outside [1, max-k] before embedding")
  void shouldRejectInvalidK() {
    assertThatThrownBy(() -> retrievalService.retrieve(query("q", 0)))
        .isInstanceOf(InvalidRequestException.class);
    assertThatThrownBy(() -> retrievalService.retrieve(query("q", -3)))
        .isInstanceOf(InvalidRequestException.class);
    assertThatThrownBy(() -> retrievalService.retrieve(query("q", 11)))
        .isInstanceOf(InvalidRequestException.class);
    verify(embeddingService, never()).embedQuery(anyString());
  }

  @Test
  @DisplayName("Should reject blank and overlong queries")
  void shouldRejectInvalidQueryText() {
    assertThatThrownBy(() -> retrievalService.retrieve(query("  ", 1)))
        .isInstanceOf(InvalidRequestException.class);
    assertThatThrownBy(() -> retrievalService.retrieve(query("x".repeat(21), 1)))
        .isInstanceOf(InvalidRequestException.class);
  }

  @Test
  @DisplayName("Should reject a query vector of the wrong dimension")
  void shouldRejectDimensionMismatch() {
    when(embeddingService.embedQuery("q")).thenReturn(new float[] {1, 0, 0});

    assertThatThrownBy(() -> retrievalService.retrieve(query("q", 1)))
        .isInstanceOfSatisfying(
            DimensionMismatchException.class,
            ex -> {
              assertThat(ex.getExpected()).isEqualTo(2);
              assertThat(ex.getActual()).isEqualTo(3);
            });
  }

  @Test
  @DisplayName("Should fail fast on unknown or expired sessions without embedding")
  void shouldFailFast_whenSessionUnavailable() {
    assertThatThrownBy(
            () -> retrievalService.retrieve(new RetrievalQuery("nope", "q", 1, null, false)))
        .isInstanceOf(SessionNotFoundException.class);

    clock.advance(Duration.ofHours(2));
    assertThatThrownBy(() -> retrievalService.retrieve(query("q", 1)))
        .isInstanceOf(SessionExpiredException.class);
    verify(embeddingService, never()).embedQuery(anyString());
  }

  @Test
  @DisplayName("Should return empty results for an empty session without embedding")
  void shouldReturnEmpty_whenSessionHasNoChunks() {
    sessionStore.createOrGet("empty", "bob");

    RetrievalResult result =
        retrievalService.retrieve(new RetrievalQuery("empty", "q", 3, null, false));

    assertThat(result.results()).isEmpty();
    assertThat(result.tookMilliseconds()).isNotNegative();
    verify(embeddingService, never()).embedQuery(anyString());
  }

  @Test
  @DisplayName("Should extend the TTL when querying an empty session")
  void shouldRefreshLastAccess_whenSessionHasNoChunks() {
    // Given
    sessionStore.createOrGet("empty", "bob");
    clock.advance(Duration.ofMinutes(40));

    // When
    retrievalService.retrieve(new RetrievalQuery("empty", "q", 3, null, false));
    clock.advance(Duration.ofMinutes(40));

    // Then
    assertThat(sessionStore.describe("empty").lastAccessedAt())
        .isEqualTo(clock.instant().minus(Duration.ofMinutes(40)));
  }

  @Test
  @DisplayName("Should report per-query failures in a batch")
  void shouldReportPerItemFailures_inBatch() {
    when(embeddingService.embedQuery(eq("east"))).thenReturn(new float[] {1, 0});

    List<BatchItemResult> results =
        retrievalService.retrieveBatch(
            List.of(
                query("east", 1),
                new RetrievalQuery("missing", "east", 1, null, false),
                query("east", 0)));

    assertThat(results).hasSize(3);
    assertThat(results.get(0).succeeded()).isTrue();
    assertThat(results.get(0).result().results().get(0).text()).isEqualTo("east");
    assertThat(results.get(1).errorCode()).isEqualTo("SESSION_001");
    assertThat(results.get(2).errorCode()).isEqualTo("VALIDATION_001");
  }

  @Test
  @DisplayName("Should reject empty and oversized batches")
  void shouldRejectInvalidBatchSize() {
    assertThatThrownBy(() -> retrievalService.retrieveBatch(List.of()))
        .isInstanceOf(InvalidRequestException.class);
    assertThatThrownBy(
            () ->
                retrievalService.retrieveBatch(
                    List.of(query("a", 1), query("b", 1), query("c", 1), query("d", 1))))
        .isInstanceOf(InvalidRequestException.class);
  }
}
