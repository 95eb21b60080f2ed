package com.flamingo.ai.bookqa.service.rag.advanced;

import com.flamingo.ai.bookqa.domain.enums.RetrievalStatus;
import com.flamingo.ai.bookqa.service.rag.model.RetrievedChunk;
import java.util.List;

/**
 * Chunks found by several phrasings of the same question.
 *
 * @param status {@code SUCCESS}, or {@code ERROR} when every phrasing failed
 * @param chunks chunks carrying their consistency score, most consistent first
 * @param consistencyScore mean consistency score of the chunks
 * @param numRetrievals number of phrasings that succeeded
 * @param message human-readable summary
 */
public record ConsistencyResult(
    RetrievalStatus status,
    List<RetrievedChunk> chunks,
    double consistencyScore,
    int numRetrievals,
    String message) {

  public ConsistencyResult {
    chunks = List.copyOf(chunks);
  }
}
