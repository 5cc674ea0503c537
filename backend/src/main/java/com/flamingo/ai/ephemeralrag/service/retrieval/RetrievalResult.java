package com.flamingo.ai.ephemeralrag.service.retrieval;

import java.util.List;

/**
 * Ranked results for one query, best first.
 *
 * @param k the effective k that was requested
 * @param totalChunks chunks held by the session at query time
 * @param tookMilliseconds wall time from session lookup through ranking
 */
public record RetrievalResult(
    String sessionId,
    String query,
    int k,
    int totalChunks,
    List<RetrievedChunk> results,
    long tookMilliseconds) {}
