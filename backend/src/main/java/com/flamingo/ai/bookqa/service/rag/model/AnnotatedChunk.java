package com.flamingo.ai.bookqa.service.rag.model;

/**
 * A chunk paired with its propagated metadata, as produced at indexing time.
 *
 * @param chunk the chunk
 * @param metadata metadata after forward propagation
 */
public record AnnotatedChunk(Chunk chunk, ChunkMetadata metadata) {}
