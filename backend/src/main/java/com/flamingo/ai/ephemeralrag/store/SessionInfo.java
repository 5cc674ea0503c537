package com.flamingo.ai.ephemeralrag.store;

import java.time.Instant;

/** Read-only description of a session, taken without refreshing its last access time. */
public record SessionInfo(
    String sessionId,
    String ownerId,
    int chunkCount,
    int dimension,
    Instant createdAt,
    Instant lastAccessedAt,
    Instant expiresAt) {}
