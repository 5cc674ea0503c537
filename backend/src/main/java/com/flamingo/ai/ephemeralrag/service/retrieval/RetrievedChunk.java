package com.flamingo.ai.ephemeralrag.service.retrieval;

import com.flamingo.ai.ephemeralrag.domain.model.ChunkMetadata;

/** A ranked chunk; {@code vector} is {@code null} unless vectors were requested. */
public record RetrievedChunk(
    int chunkIndex,
    int sequence,
    String text,
    ChunkMetadata metadata,
    double score,
    float[] vector) {}
