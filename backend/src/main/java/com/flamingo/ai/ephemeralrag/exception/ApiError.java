package com.flamingo.ai.ephemeralrag.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

  // Error codes
  public static final String SESSION_NOT_FOUND = "SESSION_001";
  public static final String SESSION_EXPIRED = "SESSION_002";
  public static final String SESSION_ACCESS_DENIED = "SESSION_003";
  public static final String QUOTA_EXCEEDED = "QUOTA_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String EMBEDDING_UNAVAILABLE = "EMBEDDING_001";
  public static final String EMBEDDING_TIMEOUT = "EMBEDDING_002";
  public static final String DIMENSION_MISMATCH = "INDEX_001";
  public static final String INDEX_STATE = "INDEX_002";
  public static final String CHUNK_NOT_FOUND = "CHUNK_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details (only in dev mode). */
  private final String details;

  /** Structured values the caller can act on, such as remaining quota. */
  private final Map<String, Object> attributes;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
