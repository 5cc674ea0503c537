package com.flamingo.ai.ephemeralrag.store;

import com.flamingo.ai.ephemeralrag.domain.model.Chunk;
import java.util.List;

/**
 * Point-in-time view of a session's chunks. Later appends are not visible through a snapshot.
 *
 * @param info the session description at snapshot time
 * @param chunks the chunks in insertion order
 */
public record SessionSnapshot(SessionInfo info, List<Chunk> chunks) {

  public SessionSnapshot {
    chunks = List.copyOf(chunks);
  }

  public String sessionId() {
    return info.sessionId();
  }
}
