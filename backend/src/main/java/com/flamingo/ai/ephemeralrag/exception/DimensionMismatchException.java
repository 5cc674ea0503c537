package com.flamingo.ai.ephemeralrag.exception;

/**
 * Exception thrown when a vector does not have the dimension the session was built with. This
 * points at a misconfigured or swapped embedding model, never at caller input.
 */
public class DimensionMismatchException extends StoreException {

  private final int expected;
  private final int actual;

  public DimensionMismatchException(int expected, int actual) {
    super(
        ApiError.DIMENSION_MISMATCH,
        String.format("Embedding dimension mismatch: expected %d, got %d", expected, actual),
        "The embedding model does not match the stored vectors.");
    this.expected = expected;
    this.actual = actual;
  }

  public int getExpected() {
    return expected;
  }

  public int getActual() {
    return actual;
  }
}
