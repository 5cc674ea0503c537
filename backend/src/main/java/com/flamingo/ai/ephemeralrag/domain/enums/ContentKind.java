package com.flamingo.ai.ephemeralrag.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Defines the kind of content a chunk was extracted from. */
public enum ContentKind {
  /** Running prose extracted from a page or a plain text file. */
  TEXT("text"),

  /** A table flattened into text. */
  TABLE("table"),

  /** A figure, chart or image caption turned into text. */
  FIGURE("figure");

  private final String value;

  ContentKind(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /**
   * Parses a content kind from its wire form. Accepts {@code graph} as an alias of {@link #FIGURE}
   * for clients of the upload pipeline that still use the older label.
   *
   * @param value the wire value, case-insensitive
   * @return the matching kind
   * @throws IllegalArgumentException if the value names no known kind
   */
  @JsonCreator
  public static ContentKind fromValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Content kind must not be null");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if ("graph".equals(normalized)) {
      return FIGURE;
    }
    for (ContentKind kind : values()) {
      if (kind.value.equals(normalized)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown content kind: " + value);
  }
}
