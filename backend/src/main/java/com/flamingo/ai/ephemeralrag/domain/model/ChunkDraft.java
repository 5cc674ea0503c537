package com.flamingo.ai.ephemeralrag.domain.model;

/**
 * A validated passage waiting to be embedded and appended to a session.
 *
 * @param sequence position of the passage within its source document (0-based)
 * @param text the passage text
 * @param metadata the passage metadata
 */
public record ChunkDraft(int sequence, String text, ChunkMetadata metadata) {}
