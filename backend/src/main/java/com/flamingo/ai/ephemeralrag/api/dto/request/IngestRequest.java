package com.flamingo.ai.ephemeralrag.api.dto.request;

import com.flamingo.ai.ephemeralrag.domain.model.ChunkDraft;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for ingesting a batch of already-extracted passages. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestRequest {

  /** Existing session to extend; a new session is created when absent. */
  private String sessionId;

  @Valid
  @NotEmpty(message = "At least one chunk is required")
  private List<ChunkInput> chunks;

  /**
   * Converts the passages to drafts. Passages without an explicit sequence are numbered in request
   * order, per source.
   */
  public List<ChunkDraft> toDrafts() {
    Map<String, Integer> nextSequence = new HashMap<>();
    List<ChunkDraft> drafts = new ArrayList<>(chunks.size());
    for (ChunkInput chunk : chunks) {
      String source = chunk.getMetadata().getSourceId();
      int implicit = nextSequence.getOrDefault(source, 0);
      int sequence = chunk.getSequence() != null ? chunk.getSequence() : implicit;
      nextSequence.put(source, Math.max(implicit, sequence + 1));
      drafts.add(new ChunkDraft(sequence, chunk.getText(), chunk.getMetadata().toMetadata()));
    }
    return drafts;
  }
}
