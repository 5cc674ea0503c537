package com.flamingo.ai.ephemeralrag.service.export;

import com.flamingo.ai.ephemeralrag.exception.InvalidRequestException;
import java.util.Locale;

/** Wire formats of a session export. */
public enum ExportFormat {
  /** One JSON record per line. */
  JSONL("application/x-ndjson", "jsonl"),

  /** A single JSON array. */
  JSON("application/json", "json");

  private final String mediaType;
  private final String extension;

  ExportFormat(String mediaType, String extension) {
    this.mediaType = mediaType;
    this.extension = extension;
  }

  public String getMediaType() {
    return mediaType;
  }

  public String getExtension() {
    return extension;
  }

  public static ExportFormat fromValue(String value) {
    if (value == null || value.isBlank()) {
      return JSONL;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "jsonl", "ndjson" -> JSONL;
      case "json" -> JSON;
      default -> throw new InvalidRequestException("Unsupported export format: " + value);
    };
  }
}
