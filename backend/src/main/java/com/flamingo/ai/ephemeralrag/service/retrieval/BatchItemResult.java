package com.flamingo.ai.ephemeralrag.service.retrieval;

/**
 * Result of one query inside a batch: either {@code result} or an error code and message.
 *
 * @param position position of the query in the batch
 */
public record BatchItemResult(
    int position, RetrievalResult result, String errorCode, String errorMessage) {

  public static BatchItemResult success(int position, RetrievalResult result) {
    return new BatchItemResult(position, result, null, null);
  }

  public static BatchItemResult failure(int position, String errorCode, String errorMessage) {
    return new BatchItemResult(position, null, errorCode, errorMessage);
  }

  public boolean succeeded() {
    return result != null;
  }
}
