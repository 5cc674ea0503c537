package com.flamingo.ai.ephemeralrag.store;

import com.flamingo.ai.ephemeralrag.domain.enums.ContentKind;
import com.flamingo.ai.ephemeralrag.domain.model.Chunk;
import com.flamingo.ai.ephemeralrag.domain.model.ChunkDraft;
import com.flamingo.ai.ephemeralrag.exception.InvalidRequestException;
import com.flamingo.ai.ephemeralrag.exception.SessionNotFoundException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.IntPredicate;

/**
 * One user's ephemeral working set: ordered chunks plus their vector index.
 *
 * <p>Appends take the write lock; searches, snapshots and lookups take the read lock. A read that
 * started before {@link #close()} completes against the state it saw, and every call after close
 * fails with {@link SessionNotFoundException}.
 */
final class Session {

  private final String id;
  private final String ownerId;
  private final Instant createdAt;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final List<Chunk> chunks = new ArrayList<>();
  private final VectorIndex index;

  private volatile Instant lastAccessedAt;
  private boolean closed;

  Session(String id, String ownerId, int dimension, Instant createdAt) {
    this.id = id;
    this.ownerId = ownerId;
    this.createdAt = createdAt;
    this.lastAccessedAt = createdAt;
    this.index = new VectorIndex(dimension);
  }

  String id() {
    return id;
  }

  String ownerId() {
    return ownerId;
  }

  Instant lastAccessedAt() {
    return lastAccessedAt;
  }

  /** Moves last access forward only; a late caller with an older instant is ignored. */
  synchronized void touch(Instant now) {
    if (now.isAfter(lastAccessedAt)) {
      lastAccessedAt = now;
    }
  }

  Instant expiresAt(Duration ttl) {
    return lastAccessedAt.plus(ttl);
  }

  /** Idle strictly longer than the TTL. */
  boolean isExpired(Instant now, Duration ttl) {
    return now.isAfter(expiresAt(ttl));
  }

  /**
   * Appends drafts and their vectors as one unit.
   *
   * @return the chunk count after the append
   */
  int append(List<ChunkDraft> drafts, List<float[]> vectors, int maxChunks) {
    if (drafts.size() != vectors.size()) {
      throw new IllegalArgumentException(
          "Got " + vectors.size() + " vectors for " + drafts.size() + " chunks");
    }
    lock.writeLock().lock();
    try {
      ensureOpen();
      if (chunks.size() + drafts.size() > maxChunks) {
        throw new InvalidRequestException(
            String.format(
                "Session %s holds %d chunks; adding %d would exceed the limit of %d",
                id, chunks.size(), drafts.size(), maxChunks));
      }
      int start = chunks.size();
      List<float[]> rows = index.append(vectors, start);
      for (int i = 0; i < drafts.size(); i++) {
        ChunkDraft draft = drafts.get(i);
        chunks.add(
            new Chunk(start + i, draft.sequence(), draft.text(), draft.metadata(), rows.get(i)));
      }
      return chunks.size();
    } finally {
      lock.writeLock().unlock();
    }
  }

  List<SearchHit> search(float[] query, int k, ContentKind kindFilter) {
    lock.readLock().lock();
    try {
      ensureOpen();
      IntPredicate filter =
          kindFilter == null ? i -> true : i -> chunks.get(i).metadata().kind() == kindFilter;
      List<ScoredIndex> ranked = index.query(query, k, filter);
      List<SearchHit> hits = new ArrayList<>(ranked.size());
      for (ScoredIndex scored : ranked) {
        hits.add(new SearchHit(chunks.get(scored.index()), scored.score()));
      }
      return hits;
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Returns the chunk at the index, or {@code null} when out of range. */
  Chunk chunk(int chunkIndex) {
    lock.readLock().lock();
    try {
      ensureOpen();
      return chunkIndex >= 0 && chunkIndex < chunks.size() ? chunks.get(chunkIndex) : null;
    } finally {
      lock.readLock().unlock();
    }
  }

  SessionSnapshot snapshot(Duration ttl) {
    lock.readLock().lock();
    try {
      ensureOpen();
      return new SessionSnapshot(infoLocked(ttl), chunks);
    } finally {
      lock.readLock().unlock();
    }
  }

  SessionInfo info(Duration ttl) {
    lock.readLock().lock();
    try {
      ensureOpen();
      return infoLocked(ttl);
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Returns the current chunk count, or zero once closed. */
  int size() {
    lock.readLock().lock();
    try {
      return closed ? 0 : chunks.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Waits for in-flight reads and appends, then releases the chunks. */
  void close() {
    lock.writeLock().lock();
    try {
      closed = true;
      chunks.clear();
    } finally {
      lock.writeLock().unlock();
    }
  }

  private SessionInfo infoLocked(Duration ttl) {
    Instant accessed = lastAccessedAt;
    return new SessionInfo(
        id, ownerId, chunks.size(), index.dimension(), createdAt, accessed, accessed.plus(ttl));
  }

  private void ensureOpen() {
    if (closed) {
      throw new SessionNotFoundException(id);
    }
  }
}
