package com.flamingo.ai.ephemeralrag.service.retrieval;

import com.flamingo.ai.ephemeralrag.domain.enums.ContentKind;

/**
 * A similarity query against one session.
 *
 * @param k number of results wanted, or {@code null} for the configured default
 * @param kind restrict results to one content kind, or {@code null} for all
 * @param includeVectors whether to return the stored vectors with each hit
 */
public record RetrievalQuery(
    String sessionId, String query, Integer k, ContentKind kind, boolean includeVectors) {}
