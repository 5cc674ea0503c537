package com.flamingo.ai.ephemeralrag.store;

import com.flamingo.ai.ephemeralrag.config.RagConfig;
import com.flamingo.ai.ephemeralrag.domain.enums.ContentKind;
import com.flamingo.ai.ephemeralrag.domain.model.Chunk;
import com.flamingo.ai.ephemeralrag.domain.model.ChunkDraft;
import com.flamingo.ai.ephemeralrag.exception.ChunkNotFoundException;
import com.flamingo.ai.ephemeralrag.exception.DimensionMismatchException;
import com.flamingo.ai.ephemeralrag.exception.InvalidRequestException;
import com.flamingo.ai.ephemeralrag.exception.SessionAccessDeniedException;
import com.flamingo.ai.ephemeralrag.exception.SessionExpiredException;
import com.flamingo.ai.ephemeralrag.exception.SessionNotFoundException;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Registry of live sessions.
 *
 * <p>The id-to-session map is only touched for brief lookups, inserts and removals; all work on a
 * session's content happens under that session's own lock, so sessions never contend with each
 * other. An expired session stays registered, reported as expired, until it is swept or deleted,
 * and it is never revived by a later access.
 */
@Component
@Slf4j
public class SessionStore {

  private final Map<String, Session> sessions = new ConcurrentHashMap<>();
  private final Clock clock;
  private final int dimension;
  private final int maxChunks;
  private final Duration ttl;

  public SessionStore(RagConfig ragConfig, Clock clock, MeterRegistry meterRegistry) {
    this.clock = clock;
    this.dimension = ragConfig.getEmbedding().getDimension();
    this.maxChunks = ragConfig.getSession().getMaxChunks();
    this.ttl = ragConfig.getSession().getTtl();
    Gauge.builder("rag.sessions.active", sessions, Map::size)
        .description("Sessions currently held in memory")
        .register(meterRegistry);
  }

  public int dimension() {
    return dimension;
  }

  public Duration ttl() {
    return ttl;
  }

  /**
   * Returns the live session with this id, registering an empty one owned by {@code ownerId} if
   * none exists.
   *
   * @throws SessionAccessDeniedException if the session belongs to another user
   * @throws SessionExpiredException if the session is registered but idle past its TTL
   */
  public SessionInfo createOrGet(String sessionId, String ownerId) {
    Instant now = clock.instant();
    Session session =
        sessions.computeIfAbsent(
            sessionId,
            id -> {
              log.info("Creating session {} for user {}", id, ownerId);
              return new Session(id, ownerId, dimension, now);
            });
    ensureOwner(session, ownerId);
    ensureLive(session, now);
    return session.info(ttl);
  }

  /**
   * Checks, without changing anything, that {@code ownerId} could append {@code additional} chunks
   * to the session right now.
   */
  public SessionInfo checkWritable(String sessionId, String ownerId, int additional) {
    Session session = require(sessionId);
    ensureOwner(session, ownerId);
    ensureLive(session, clock.instant());
    SessionInfo info = session.info(ttl);
    if (info.chunkCount() + additional > maxChunks) {
      throw new InvalidRequestException(
          String.format(
              "Session %s holds %d chunks; adding %d would exceed the limit of %d",
              sessionId, info.chunkCount(), additional, maxChunks));
    }
    return info;
  }

  /**
   * Appends chunks and their vectors to a session as one unit. Either every chunk is stored or
   * none is.
   *
   * @return the session description after the append
   */
  public SessionInfo appendChunks(
      String sessionId, String ownerId, List<ChunkDraft> drafts, List<float[]> vectors) {
    Session session = require(sessionId);
    ensureOwner(session, ownerId);
    Instant now = clock.instant();
    ensureLive(session, now);
    int total = session.append(drafts, vectors, maxChunks);
    session.touch(now);
    log.debug("Appended {} chunks to session {} (total {})", drafts.size(), sessionId, total);
    return session.info(ttl);
  }

  /** Returns a snapshot of the session and refreshes its last access. */
  public SessionSnapshot get(String sessionId) {
    Session session = requireLive(sessionId);
    return session.snapshot(ttl);
  }

  /** Describes the session and refreshes its last access, as any query does. */
  public SessionInfo access(String sessionId) {
    return requireLive(sessionId).info(ttl);
  }

  /** Describes the session without refreshing its last access. */
  public SessionInfo describe(String sessionId) {
    Session session = require(sessionId);
    ensureLive(session, clock.instant());
    return session.info(ttl);
  }

  /**
   * Ranks the session's chunks against a query vector and refreshes its last access.
   *
   * @param kindFilter restrict to one content kind, or {@code null} for all
   */
  public List<SearchHit> search(String sessionId, float[] query, int k, ContentKind kindFilter) {
    if (query.length != dimension) {
      throw new DimensionMismatchException(dimension, query.length);
    }
    Session session = requireLive(sessionId);
    return session.search(query, k, kindFilter);
  }

  /** Point lookup by insertion index; refreshes last access. */
  public Chunk chunk(String sessionId, int chunkIndex) {
    Session session = requireLive(sessionId);
    Chunk chunk = session.chunk(chunkIndex);
    if (chunk == null) {
      throw new ChunkNotFoundException(sessionId, chunkIndex);
    }
    return chunk;
  }

  /**
   * Removes the session immediately. Reads already holding the session's lock finish first.
   *
   * @return true if a session was removed
   */
  public boolean delete(String sessionId) {
    Session session = sessions.remove(sessionId);
    if (session == null) {
      return false;
    }
    session.close();
    log.info("Deleted session {}", sessionId);
    return true;
  }

  /**
   * Removes every session idle for longer than the TTL at {@code now}.
   *
   * @return the number of sessions removed
   */
  public int evictExpired(Instant now) {
    int evicted = 0;
    for (Map.Entry<String, Session> entry : sessions.entrySet()) {
      Session session = entry.getValue();
      if (session.isExpired(now, ttl) && sessions.remove(entry.getKey(), session)) {
        session.close();
        evicted++;
        log.debug("Evicted expired session {}", entry.getKey());
      }
    }
    return evicted;
  }

  public StoreStats stats() {
    long totalChunks = 0;
    for (Session session : sessions.values()) {
      totalChunks += session.size();
    }
    return new StoreStats(sessions.size(), totalChunks, dimension);
  }

  private Session requireLive(String sessionId) {
    Session session = require(sessionId);
    Instant now = clock.instant();
    ensureLive(session, now);
    session.touch(now);
    return session;
  }

  private Session require(String sessionId) {
    Session session = sessionId == null ? null : sessions.get(sessionId);
    if (session == null) {
      throw new SessionNotFoundException(sessionId);
    }
    return session;
  }

  private void ensureLive(Session session, Instant now) {
    if (session.isExpired(now, ttl)) {
      throw new SessionExpiredException(session.id(), session.expiresAt(ttl));
    }
  }

  private void ensureOwner(Session session, String ownerId) {
    if (!session.ownerId().equals(ownerId)) {
      throw new SessionAccessDeniedException(session.id(), ownerId);
    }
  }
}
