package com.flamingo.ai.ephemeralrag.service.ingest;

import java.time.Instant;

/**
 * Outcome of a successful ingestion.
 *
 * @param sessionId the session the chunks were stored in
 * @param newSession whether the session was created by this ingestion
 * @param chunksStored chunks added by this ingestion
 * @param totalChunks chunks in the session afterwards
 * @param quotaRemaining chunks the user may still add in the current window
 * @param quotaResetAt end of the user's current quota window
 * @param expiresAt when the session expires if left idle
 */
public record IngestionResult(
    String sessionId,
    boolean newSession,
    int chunksStored,
    int totalChunks,
    int quotaRemaining,
    Instant quotaResetAt,
    Instant expiresAt) {}
