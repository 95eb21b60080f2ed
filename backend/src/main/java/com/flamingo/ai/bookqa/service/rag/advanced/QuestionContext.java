package com.flamingo.ai.bookqa.service.rag.advanced;

import com.flamingo.ai.bookqa.domain.enums.RetrievalStatus;
import com.flamingo.ai.bookqa.service.rag.model.RetrievedChunk;
import java.util.List;

/**
 * Combined HyDE and multi-query context prepared for question generation.
 *
 * @param status outcome of the call
 * @param chunks reranked chunks, each tagged with its source
 * @param context rendered context
 * @param hydeChunks number of chunks that came from HyDE
 * @param advancedChunks number of chunks that came from multi-query retrieval
 * @param averageRelevance mean composite score
 * @param averageDensity mean information density
 * @param difficulty difficulty analysis of the chunks
 * @param message human-readable summary
 */
public record QuestionContext(
    RetrievalStatus status,
    List<RetrievedChunk> chunks,
    String context,
    int hydeChunks,
    int advancedChunks,
    double averageRelevance,
    double averageDensity,
    DifficultyAnalysis difficulty,
    String message) {

  public QuestionContext {
    chunks = List.copyOf(chunks);
  }
}
