package com.flamingo.ai.ephemeralrag.exception;

/** Exception thrown when the embedding model fails, times out or is short-circuited. */
public class EmbeddingUnavailableException extends StoreException {

  private final boolean timedOut;

  public EmbeddingUnavailableException(String message, Throwable cause) {
    super(
        ApiError.EMBEDDING_UNAVAILABLE,
        message,
        "Embedding service is temporarily unavailable. Please try again later.",
        cause);
    this.timedOut = false;
  }

  public EmbeddingUnavailableException(String message, Throwable cause, boolean timedOut) {
    super(
        timedOut ? ApiError.EMBEDDING_TIMEOUT : ApiError.EMBEDDING_UNAVAILABLE,
        message,
        timedOut
            ? "Embedding service did not respond in time. Please try again."
            : "Embedding service is temporarily unavailable. Please try again later.",
        cause);
    this.timedOut = timedOut;
  }

  public boolean isTimedOut() {
    return timedOut;
  }
}
