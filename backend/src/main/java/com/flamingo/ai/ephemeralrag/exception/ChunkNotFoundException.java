package com.flamingo.ai.ephemeralrag.exception;

/** Exception thrown when a chunk index is outside the range stored in a session. */
public class ChunkNotFoundException extends StoreException {

  private final String sessionId;
  private final int chunkIndex;

  public ChunkNotFoundException(String sessionId, int chunkIndex) {
    super(
        ApiError.CHUNK_NOT_FOUND,
        "Chunk " + chunkIndex + " not found in session " + sessionId,
        "Chunk not found");
    this.sessionId = sessionId;
    this.chunkIndex = chunkIndex;
  }

  public String getSessionId() {
    return sessionId;
  }

  public int getChunkIndex() {
    return chunkIndex;
  }
}
