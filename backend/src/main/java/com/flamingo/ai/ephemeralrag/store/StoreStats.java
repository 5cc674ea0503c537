package com.flamingo.ai.ephemeralrag.store;

/**
 * Aggregate counters over all live sessions.
 *
 * @param activeSessions number of registered sessions
 * @param totalChunks number of chunks across them
 * @param dimension embedding dimension every session is built with
 */
public record StoreStats(int activeSessions, long totalChunks, int dimension) {}
