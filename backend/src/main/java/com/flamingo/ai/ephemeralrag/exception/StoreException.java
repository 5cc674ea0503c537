package com.flamingo.ai.ephemeralrag.exception;

/**
 * Base class for the typed failures raised by the session store and the services around it. Each
 * failure carries the {@link ApiError} code it is reported under, so batch operations can report
 * per-item failures without going through the web layer.
 */
public abstract class StoreException extends RuntimeException {

  private final String code;
  private final String userMessage;

  protected StoreException(String code, String message, String userMessage) {
    super(message);
    this.code = code;
    this.userMessage = userMessage;
  }

  protected StoreException(String code, String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.code = code;
    this.userMessage = userMessage;
  }

  public String getCode() {
    return code;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
