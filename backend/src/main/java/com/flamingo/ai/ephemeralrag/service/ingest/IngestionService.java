package com.flamingo.ai.ephemeralrag.service.ingest;

import com.flamingo.ai.ephemeralrag.config.RagConfig;
import com.flamingo.ai.ephemeralrag.domain.model.ChunkDraft;
import com.flamingo.ai.ephemeralrag.exception.DimensionMismatchException;
import com.flamingo.ai.ephemeralrag.exception.InvalidRequestException;
import com.flamingo.ai.ephemeralrag.exception.QuotaExceededException;
import com.flamingo.ai.ephemeralrag.service.embedding.EmbeddingService;
import com.flamingo.ai.ephemeralrag.service.quota.QuotaDecision;
import com.flamingo.ai.ephemeralrag.service.quota.QuotaTracker;
import com.flamingo.ai.ephemeralrag.store.SessionInfo;
import com.flamingo.ai.ephemeralrag.store.SessionStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Stores a batch of passages in a session: validate, charge the user's quota, embed, append.
 *
 * <p>Every failure after the quota was charged refunds it, and a session created for this batch is
 * only registered once its passages are embedded, so a failed ingestion leaves no trace.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionService {

  private final SessionStore sessionStore;
  private final QuotaTracker quotaTracker;
  private final EmbeddingService embeddingService;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Ingests passages for a user.
   *
   * @param userId the uploading user
   * @param sessionId an existing session of the same user, or {@code null} to start a new one
   * @param drafts the passages, in order
   * @return what was stored and the user's remaining quota
   */
  @Timed(value = "rag.ingest", description = "Time to embed and store a chunk batch")
  public IngestionResult ingest(String userId, String sessionId, List<ChunkDraft> drafts) {
    validate(userId, drafts);

    boolean newSession = sessionId == null || sessionId.isBlank();
    String targetId = newSession ? UUID.randomUUID().toString() : sessionId;
    if (newSession) {
      int maxChunks = ragConfig.getSession().getMaxChunks();
      if (drafts.size() > maxChunks) {
        throw new InvalidRequestException(
            "A session holds at most " + maxChunks + " chunks, got " + drafts.size());
      }
    } else {
      sessionStore.checkWritable(targetId, userId, drafts.size());
    }

    QuotaDecision decision = quotaTracker.admit(userId, drafts.size());
    if (!decision.allowed()) {
      meterRegistry.counter("rag.ingest.rejected", "reason", "quota").increment();
      throw new QuotaExceededException(
          userId, decision.currentCount(), decision.limit(), decision.windowResetAt());
    }

    try {
      List<float[]> vectors =
          embeddingService.embedPassages(drafts.stream().map(ChunkDraft::text).toList());
      int dimension = sessionStore.dimension();
      for (float[] vector : vectors) {
        if (vector.length != dimension) {
          throw new DimensionMismatchException(dimension, vector.length);
        }
      }

      SessionInfo info = store(targetId, userId, newSession, drafts, vectors);
      meterRegistry.counter("rag.ingest.chunks").increment(drafts.size());
      log.info(
          "Stored {} chunks in session {} for user {} (total {})",
          drafts.size(),
          targetId,
          userId,
          info.chunkCount());
      return new IngestionResult(
          targetId,
          newSession,
          drafts.size(),
          info.chunkCount(),
          decision.remaining(),
          decision.windowResetAt(),
          info.expiresAt());
    } catch (RuntimeException e) {
      quotaTracker.release(userId, decision, drafts.size());
      log.warn("Ingestion into session {} failed, quota refunded: {}", targetId, e.getMessage());
      throw e;
    }
  }

  private SessionInfo store(
      String sessionId,
      String userId,
      boolean newSession,
      List<ChunkDraft> drafts,
      List<float[]> vectors) {
    if (!newSession) {
      return sessionStore.appendChunks(sessionId, userId, drafts, vectors);
    }
    sessionStore.createOrGet(sessionId, userId);
    try {
      return sessionStore.appendChunks(sessionId, userId, drafts, vectors);
    } catch (RuntimeException e) {
      sessionStore.delete(sessionId);
      throw e;
    }
  }

  private void validate(String userId, List<ChunkDraft> drafts) {
    if (userId == null || userId.isBlank()) {
      throw new InvalidRequestException("User id is required");
    }
    if (drafts == null || drafts.isEmpty()) {
      throw new InvalidRequestException("At least one chunk is required");
    }
    int maxBatch = ragConfig.getIngestion().getMaxBatchSize();
    if (drafts.size() > maxBatch) {
      throw new InvalidRequestException(
          "At most " + maxBatch + " chunks per request, got " + drafts.size());
    }
    int maxText = ragConfig.getIngestion().getMaxTextLength();
    for (int i = 0; i < drafts.size(); i++) {
      ChunkDraft draft = drafts.get(i);
      if (draft.text() == null || draft.text().isBlank()) {
        throw new InvalidRequestException("Chunk " + i + " has empty text");
      }
      if (draft.text().length() > maxText) {
        throw new InvalidRequestException(
            "Chunk " + i + " exceeds " + maxText + " characters");
      }
      if (draft.metadata() == null
          || draft.metadata().sourceId() == null
          || draft.metadata().sourceId().isBlank()) {
        throw new InvalidRequestException("Chunk " + i + " has no source id");
      }
      if (draft.metadata().position() != null && draft.metadata().position() < 0) {
        throw new InvalidRequestException("Chunk " + i + " has a negative position");
      }
    }
  }
}
