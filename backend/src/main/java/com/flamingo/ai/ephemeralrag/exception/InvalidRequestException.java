package com.flamingo.ai.ephemeralrag.exception;

/** Exception thrown when a request is rejected before it touches any shared state. */
public class InvalidRequestException extends StoreException {

  public InvalidRequestException(String message) {
    super(ApiError.VALIDATION_ERROR, message, message);
  }
}
