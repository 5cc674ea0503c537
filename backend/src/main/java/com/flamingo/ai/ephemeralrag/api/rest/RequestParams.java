package com.flamingo.ai.ephemeralrag.api.rest;

import com.flamingo.ai.ephemeralrag.domain.enums.ContentKind;
import com.flamingo.ai.ephemeralrag.exception.InvalidRequestException;

/** Parsing of query parameters that Spring's default enum conversion does not cover. */
final class RequestParams {

  private RequestParams() {}

  /** Parses a content kind from its wire form; {@code null} or blank means no filter. */
  static ContentKind contentKind(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return ContentKind.fromValue(value);
    } catch (IllegalArgumentException e) {
      throw new InvalidRequestException(e.getMessage());
    }
  }
}
