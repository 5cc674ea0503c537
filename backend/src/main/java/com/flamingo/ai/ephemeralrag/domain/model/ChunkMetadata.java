package com.flamingo.ai.ephemeralrag.domain.model;

import com.flamingo.ai.ephemeralrag.domain.enums.ContentKind;

/**
 * Closed metadata set attached to every chunk.
 *
 * @param sourceId identifier of the source document, typically its file name
 * @param position page or position marker inside the source; {@code null} when the source has no
 *     pages
 * @param kind the kind of content the chunk was extracted from
 */
public record ChunkMetadata(String sourceId, Integer position, ContentKind kind) {

  public ChunkMetadata {
    if (kind == null) {
      kind = ContentKind.TEXT;
    }
  }
}
