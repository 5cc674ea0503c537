package com.flamingo.ai.ephemeralrag.service.retrieval;

import com.flamingo.ai.ephemeralrag.config.RagConfig;
import com.flamingo.ai.ephemeralrag.domain.model.Chunk;
import com.flamingo.ai.ephemeralrag.exception.DimensionMismatchException;
import com.flamingo.ai.ephemeralrag.exception.InvalidRequestException;
import com.flamingo.ai.ephemeralrag.exception.StoreException;
import com.flamingo.ai.ephemeralrag.service.embedding.EmbeddingService;
import com.flamingo.ai.ephemeralrag.store.SearchHit;
import com.flamingo.ai.ephemeralrag.store.SessionInfo;
import com.flamingo.ai.ephemeralrag.store.SessionStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Answers similarity queries against a single session. */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalService {

  private final SessionStore sessionStore;
  private final EmbeddingService embeddingService;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Ranks the session's chunks against the query text.
   *
   * <p>The session is resolved before the query is embedded, so unknown or expired sessions fail
   * without a model call. A session without chunks yields an empty result, also without a model
   * call. Both paths refresh the session's last access.
   *
   * <p>{@code tookMilliseconds} covers session resolution, query embedding and ranking.
   *
   * @throws InvalidRequestException if the query is blank or too long, or k is outside [1, max-k]
   * @throws DimensionMismatchException if the query vector does not match the session
   */
  public RetrievalResult retrieve(RetrievalQuery query) {
    int k = resolveK(query.k());
    validateQueryText(query.query());

    Timer.Sample sample = Timer.start(meterRegistry);
    SessionInfo info = sessionStore.access(query.sessionId());
    if (info.chunkCount() == 0) {
      log.debug("Session {} holds no chunks, skipping query embedding", query.sessionId());
      return new RetrievalResult(query.sessionId(), query.query(), k, 0, List.of(), stop(sample));
    }

    float[] vector = embeddingService.embedQuery(query.query());
    if (vector.length != info.dimension()) {
      throw new DimensionMismatchException(info.dimension(), vector.length);
    }

    List<SearchHit> hits = sessionStore.search(query.sessionId(), vector, k, query.kind());
    List<RetrievedChunk> results = new ArrayList<>(hits.size());
    for (SearchHit hit : hits) {
      Chunk chunk = hit.chunk();
      results.add(
          new RetrievedChunk(
              chunk.index(),
              chunk.sequence(),
              chunk.text(),
              chunk.metadata(),
              hit.score(),
              query.includeVectors() ? chunk.vectorCopy() : null));
    }
    meterRegistry.counter("rag.retrieve.results").increment(results.size());
    log.debug(
        "Query on session {} returned {} of {} chunks",
        query.sessionId(),
        results.size(),
        info.chunkCount());
    return new RetrievalResult(
        query.sessionId(), query.query(), k, info.chunkCount(), results, stop(sample));
  }

  private long stop(Timer.Sample sample) {
    long nanos = sample.stop(meterRegistry.timer("rag.retrieve"));
    return TimeUnit.NANOSECONDS.toMillis(nanos);
  }

  /**
   * Runs each query independently. A failing query is reported in its slot and does not affect
   * the others.
   *
   * @throws InvalidRequestException if the batch is empty or larger than allowed
   */
  @Timed(value = "rag.retrieve.batch", description = "Time to run a batch of queries")
  public List<BatchItemResult> retrieveBatch(List<RetrievalQuery> queries) {
    int max = ragConfig.getRetrieval().getMaxBatchQueries();
    if (queries == null || queries.isEmpty()) {
      throw new InvalidRequestException("At least one query is required");
    }
    if (queries.size() > max) {
      throw new InvalidRequestException(
          "At most " + max + " queries per batch, got " + queries.size());
    }

    List<BatchItemResult> results = new ArrayList<>(queries.size());
    for (int i = 0; i < queries.size(); i++) {
      try {
        results.add(BatchItemResult.success(i, retrieve(queries.get(i))));
      } catch (StoreException e) {
        log.warn("Batch query {} failed [{}]: {}", i, e.getCode(), e.getMessage());
        results.add(BatchItemResult.failure(i, e.getCode(), e.getUserMessage()));
      }
    }
    return results;
  }

  private int resolveK(Integer requested) {
    if (requested == null) {
      return ragConfig.getRetrieval().getDefaultK();
    }
    int maxK = ragConfig.getRetrieval().getMaxK();
    if (requested <= 0 || requested > maxK) {
      throw new InvalidRequestException("k must be between 1 and " + maxK + ", got " + requested);
    }
    return requested;
  }

  private void validateQueryText(String text) {
    if (text == null || text.isBlank()) {
      throw new InvalidRequestException("Query text is required");
    }
    int max = ragConfig.getRetrieval().getMaxQueryLength();
    if (text.length() > max) {
      throw new InvalidRequestException("Query exceeds " + max + " characters");
    }
  }
}
