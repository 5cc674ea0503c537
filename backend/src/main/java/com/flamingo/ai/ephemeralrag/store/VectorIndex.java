package com.flamingo.ai.ephemeralrag.store;

import com.flamingo.ai.ephemeralrag.exception.DimensionMismatchException;
import com.flamingo.ai.ephemeralrag.exception.IndexStateException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.function.IntPredicate;

/**
 * Exact inner-product index over unit-normalized vectors, so scores are cosine similarities.
 *
 * <p>Rows are identified by their insertion index. Queries are a linear scan with a bounded heap of
 * size k, which keeps memory at O(k) regardless of the number of rows. Ties are broken by the lower
 * insertion index, so identical queries always return identical orderings.
 *
 * <p>Not thread-safe. The owning {@link Session} guards every call with its read/write lock.
 */
public final class VectorIndex {

  private static final int INITIAL_CAPACITY = 16;

  /** Orders the heap so that its head is the weakest hit kept so far. */
  private static final Comparator<ScoredIndex> WEAKEST_FIRST =
      Comparator.comparingDouble(ScoredIndex::score)
          .thenComparing(Comparator.comparingInt(ScoredIndex::index).reversed());

  private static final Comparator<ScoredIndex> BEST_FIRST = WEAKEST_FIRST.reversed();

  private final int dimension;
  private float[][] rows;
  private int size;

  public VectorIndex(int dimension) {
    if (dimension <= 0) {
      throw new IllegalArgumentException("Dimension must be positive: " + dimension);
    }
    this.dimension = dimension;
    this.rows = new float[INITIAL_CAPACITY][];
  }

  public int dimension() {
    return dimension;
  }

  public int size() {
    return size;
  }

  /**
   * Appends vectors in order. Every vector is checked before any row is added, so a failing append
   * leaves the index unchanged.
   *
   * @param vectors the raw vectors to append
   * @param startIndex the insertion index the first vector must receive; must equal {@link #size()}
   * @return the normalized rows as stored, in the same order
   * @throws IndexStateException if {@code startIndex} does not match the current size
   * @throws DimensionMismatchException if a vector has the wrong dimension
   * @throws IllegalArgumentException if a vector has a zero norm or non-finite components
   */
  public List<float[]> append(List<float[]> vectors, int startIndex) {
    if (startIndex != size) {
      throw new IndexStateException(
          "Append expected to start at index " + startIndex + " but index holds " + size + " rows");
    }
    List<float[]> normalized = new ArrayList<>(vectors.size());
    for (float[] vector : vectors) {
      if (vector.length != dimension) {
        throw new DimensionMismatchException(dimension, vector.length);
      }
      normalized.add(VectorMath.normalizedCopy(vector));
    }
    ensureCapacity(size + normalized.size());
    for (float[] row : normalized) {
      rows[size++] = row;
    }
    return normalized;
  }

  /** Returns the stored (normalized) row at the given insertion index. */
  public float[] row(int index) {
    if (index < 0 || index >= size) {
      throw new IndexOutOfBoundsException("Row " + index + " outside [0, " + size + ")");
    }
    return rows[index];
  }

  /** Ranks every row against the query. */
  public List<ScoredIndex> query(float[] queryVector, int k) {
    return query(queryVector, k, index -> true);
  }

  /**
   * Ranks the rows accepted by {@code filter} against the query.
   *
   * @param queryVector the raw query vector; it is normalized before scoring
   * @param k the maximum number of hits; clamped to the number of matching rows
   * @param filter predicate on insertion indexes
   * @return hits ordered by descending score, ties by ascending index
   */
  public List<ScoredIndex> query(float[] queryVector, int k, IntPredicate filter) {
    if (queryVector.length != dimension) {
      throw new DimensionMismatchException(dimension, queryVector.length);
    }
    if (k <= 0) {
      throw new IllegalArgumentException("k must be positive: " + k);
    }
    float[] query = VectorMath.normalizedCopy(queryVector);
    int bound = Math.min(k, size);
    if (bound == 0) {
      return List.of();
    }

    PriorityQueue<ScoredIndex> heap = new PriorityQueue<>(bound + 1, WEAKEST_FIRST);
    for (int i = 0; i < size; i++) {
      if (!filter.test(i)) {
        continue;
      }
      double score = VectorMath.dot(query, rows[i]);
      if (heap.size() < bound) {
        heap.offer(new ScoredIndex(i, score));
      } else if (score > heap.peek().score()) {
        // equal scores never replace: rows are scanned in ascending index order
        heap.poll();
        heap.offer(new ScoredIndex(i, score));
      }
    }

    List<ScoredIndex> hits = new ArrayList<>(heap);
    hits.sort(BEST_FIRST);
    return hits;
  }

  private void ensureCapacity(int required) {
    if (required > rows.length) {
      int grown = Math.max(required, rows.length * 2);
      rows = Arrays.copyOf(rows, grown);
    }
  }
}
