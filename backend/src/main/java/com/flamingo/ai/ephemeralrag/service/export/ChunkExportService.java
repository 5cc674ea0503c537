package com.flamingo.ai.ephemeralrag.service.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.ephemeralrag.config.RagConfig;
import com.flamingo.ai.ephemeralrag.domain.enums.ContentKind;
import com.flamingo.ai.ephemeralrag.domain.model.Chunk;
import com.flamingo.ai.ephemeralrag.exception.InvalidRequestException;
import com.flamingo.ai.ephemeralrag.store.SessionSnapshot;
import com.flamingo.ai.ephemeralrag.store.SessionStore;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Browsing and bulk export of the chunks stored in a session. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChunkExportService {

  private final SessionStore sessionStore;
  private final RagConfig ragConfig;
  private final ObjectMapper objectMapper;

  /**
   * Lists chunks in insertion order.
   *
   * @param kind only chunks of this kind, or {@code null}
   * @param search case-insensitive substring the text must contain, or {@code null}
   */
  public ChunkPage listChunks(
      String sessionId,
      int offset,
      int limit,
      ContentKind kind,
      String search,
      boolean includeVectors) {
    int maxPage = ragConfig.getExport().getMaxPageSize();
    if (offset < 0) {
      throw new InvalidRequestException("offset must not be negative");
    }
    if (limit < 1 || limit > maxPage) {
      throw new InvalidRequestException("limit must be between 1 and " + maxPage);
    }

    SessionSnapshot snapshot = sessionStore.get(sessionId);
    String needle =
        search == null || search.isBlank() ? null : search.toLowerCase(Locale.ROOT);
    List<Chunk> matching =
        snapshot.chunks().stream()
            .filter(chunk -> kind == null || chunk.metadata().kind() == kind)
            .filter(
                chunk -> needle == null || chunk.text().toLowerCase(Locale.ROOT).contains(needle))
            .toList();

    String model = embeddingModel();
    List<ChunkView> page =
        matching.stream()
            .skip(offset)
            .limit(limit)
            .map(chunk -> ChunkView.of(sessionId, chunk, model, includeVectors))
            .toList();
    return new ChunkPage(sessionId, offset, limit, matching.size(), page);
  }

  /** Point lookup of one chunk by its insertion index. */
  public ChunkView getChunk(String sessionId, int chunkIndex, boolean includeVector) {
    Chunk chunk = sessionStore.chunk(sessionId, chunkIndex);
    return ChunkView.of(sessionId, chunk, embeddingModel(), includeVector);
  }

  /**
   * Binds an export to the session's current content. Missing or expired sessions fail here,
   * before anything is written.
   */
  public SessionExport openExport(
      String sessionId, boolean includeVectors, ContentKind kind, ExportFormat format) {
    SessionSnapshot snapshot = sessionStore.get(sessionId);
    log.info(
        "Exporting {} chunks of session {} as {}",
        snapshot.chunks().size(),
        sessionId,
        format.getExtension());
    return new SessionExport(
        snapshot, format, kind, includeVectors, embeddingModel(), objectMapper);
  }

  private String embeddingModel() {
    return ragConfig.getEmbedding().getModelName();
  }
}
