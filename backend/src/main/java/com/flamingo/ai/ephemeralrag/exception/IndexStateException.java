package com.flamingo.ai.ephemeralrag.exception;

/** Exception thrown when a vector index is asked to do something its current state forbids. */
public class IndexStateException extends StoreException {

  public IndexStateException(String message) {
    super(ApiError.INDEX_STATE, message, "The session index is in an inconsistent state.");
  }
}
