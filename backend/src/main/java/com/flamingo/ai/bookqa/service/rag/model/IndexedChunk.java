package com.flamingo.ai.bookqa.service.rag.model;

import java.util.List;

/**
 * A chunk ready to be written to the vector store.
 *
 * @param chunk the chunk text and position
 * @param metadata propagated metadata
 * @param embedding the chunk's embedding vector
 * @param contentHash hash of the whole source document, used for duplicate detection
 */
public record IndexedChunk(
    Chunk chunk, ChunkMetadata metadata, List<Float> embedding, String contentHash) {}
