package com.flamingo.ai.ephemeralrag.service.export;

import java.util.List;

/**
 * One page of a session's chunks.
 *
 * @param total number of chunks matching the filters
 */
public record ChunkPage(
    String sessionId, int offset, int limit, int total, List<ChunkView> chunks) {

  public boolean hasMore() {
    return offset + chunks.size() < total;
  }
}
