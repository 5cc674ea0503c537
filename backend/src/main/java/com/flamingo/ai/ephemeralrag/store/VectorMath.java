package com.flamingo.ai.ephemeralrag.store;

/** Vector helpers shared by the index and the embedding boundary. */
public final class VectorMath {

  private VectorMath() {}

  /**
   * Computes the Euclidean norm with double accumulation.
   *
   * @param vector the vector
   * @return the norm, or {@code NaN} if any component is not finite
   */
  public static double norm(float[] vector) {
    double sum = 0.0;
    for (float component : vector) {
      if (!Float.isFinite(component)) {
        return Double.NaN;
      }
      sum += (double) component * component;
    }
    return Math.sqrt(sum);
  }

  /** Returns true if every component is finite and the norm is strictly positive. */
  public static boolean isUsable(float[] vector) {
    if (vector == null || vector.length == 0) {
      return false;
    }
    double norm = norm(vector);
    return Double.isFinite(norm) && norm > 0.0;
  }

  /**
   * Returns a unit-length copy of the vector.
   *
   * @throws IllegalArgumentException if the vector has a zero norm or a non-finite component
   */
  public static float[] normalizedCopy(float[] vector) {
    double norm = norm(vector);
    if (!Double.isFinite(norm) || norm == 0.0) {
      throw new IllegalArgumentException("Vector has zero norm or non-finite components");
    }
    float[] normalized = new float[vector.length];
    for (int i = 0; i < vector.length; i++) {
      normalized[i] = (float) (vector[i] / norm);
    }
    return normalized;
  }

  /** Dot product with double accumulation. Both vectors must have the same length. */
  public static double dot(float[] a, float[] b) {
    double sum = 0.0;
    for (int i = 0; i < a.length; i++) {
      sum += (double) a[i] * b[i];
    }
    return sum;
  }
}
