package com.flamingo.ai.ephemeralrag.service.embedding;

import com.flamingo.ai.ephemeralrag.exception.EmbeddingUnavailableException;
import com.flamingo.ai.ephemeralrag.store.VectorMath;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Turns passages and queries into vectors through the configured {@link EmbeddingModel}.
 *
 * <p>Each call runs on the embedding executor and is abandoned, with the worker interrupted, once
 * the time limit passes. Calls fail fast while the circuit breaker is open. Nothing is retried
 * here; a failed call surfaces as {@link EmbeddingUnavailableException} and the caller decides.
 */
@Service
@Slf4j
public class EmbeddingService {

  private final EmbeddingModel embeddingModel;
  private final AsyncTaskExecutor embeddingExecutor;
  private final TimeLimiter timeLimiter;
  private final CircuitBreaker circuitBreaker;
  private final MeterRegistry meterRegistry;

  public EmbeddingService(
      EmbeddingModel embeddingModel,
      @Qualifier("embeddingExecutor") AsyncTaskExecutor embeddingExecutor,
      TimeLimiter embeddingTimeLimiter,
      CircuitBreaker embeddingCircuitBreaker,
      MeterRegistry meterRegistry) {
    this.embeddingModel = embeddingModel;
    this.embeddingExecutor = embeddingExecutor;
    this.timeLimiter = embeddingTimeLimiter;
    this.circuitBreaker = embeddingCircuitBreaker;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Embeds a batch of passages in one model call.
   *
   * @param texts the passages, in order
   * @return one vector per passage, in the same order
   * @throws EmbeddingUnavailableException if the model fails, times out, is short-circuited, or
   *     returns an unusable result
   */
  public List<float[]> embedPassages(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    List<TextSegment> segments = new ArrayList<>(texts.size());
    for (String text : texts) {
      segments.add(TextSegment.from(text));
    }

    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Response<List<Embedding>> response = call(() -> embeddingModel.embedAll(segments));
      List<Embedding> embeddings = response == null ? null : response.content();
      if (embeddings == null || embeddings.size() != texts.size()) {
        throw failure(
            String.format(
                "Embedding model returned %d vectors for %d passages",
                embeddings == null ? 0 : embeddings.size(), texts.size()),
            null);
      }
      List<float[]> vectors = new ArrayList<>(embeddings.size());
      for (Embedding embedding : embeddings) {
        vectors.add(checked(embedding));
      }
      meterRegistry.counter("embedding.requests.success", "kind", "passages").increment();
      log.debug("Embedded {} passages", texts.size());
      return vectors;
    } finally {
      sample.stop(meterRegistry.timer("embedding.batch.duration"));
    }
  }

  /**
   * Embeds a single query.
   *
   * @param text the query text
   * @return the query vector
   */
  public float[] embedQuery(String text) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Response<Embedding> response = call(() -> embeddingModel.embed(text));
      float[] vector = checked(response == null ? null : response.content());
      meterRegistry.counter("embedding.requests.success", "kind", "query").increment();
      return vector;
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration"));
    }
  }

  private <T> T call(Callable<T> task) {
    try {
      return circuitBreaker.executeCallable(
          () -> timeLimiter.executeFutureSupplier(() -> embeddingExecutor.submit(task)));
    } catch (TimeoutException e) {
      meterRegistry.counter("embedding.requests.failure", "reason", "timeout").increment();
      log.warn(
          "Embedding call exceeded {}", timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
      throw new EmbeddingUnavailableException("Embedding call timed out", e, true);
    } catch (CallNotPermittedException e) {
      meterRegistry.counter("embedding.requests.failure", "reason", "circuit_open").increment();
      log.warn("Embedding circuit breaker is open, failing fast");
      throw new EmbeddingUnavailableException("Embedding circuit breaker is open", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new EmbeddingUnavailableException("Interrupted while waiting for embeddings", e);
    } catch (EmbeddingUnavailableException e) {
      throw e;
    } catch (Exception e) {
      throw failure("Embedding model call failed: " + e.getMessage(), e);
    }
  }

  private float[] checked(Embedding embedding) {
    float[] vector = embedding == null ? null : embedding.vector();
    if (!VectorMath.isUsable(vector)) {
      throw failure("Embedding model returned an empty, zero or non-finite vector", null);
    }
    return vector;
  }

  private EmbeddingUnavailableException failure(String message, Throwable cause) {
    meterRegistry.counter("embedding.requests.failure", "reason", "error").increment();
    log.error("Embedding failed: {}", message, cause);
    return new EmbeddingUnavailableException(message, cause);
  }
}
