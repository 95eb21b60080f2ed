package com.flamingo.ai.bookqa.service.rag.model;

/**
 * A bounded slice of document text, the unit of retrieval.
 *
 * @param text the chunk text
 * @param sequentialId zero-based position of the chunk in document order
 * @param documentName the document the chunk was cut from
 */
public record Chunk(String text, int sequentialId, String documentName) {}
