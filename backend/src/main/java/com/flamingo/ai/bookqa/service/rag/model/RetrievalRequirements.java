package com.flamingo.ai.bookqa.service.rag.model;

import com.flamingo.ai.bookqa.domain.enums.ChunkSizePreference;

/**
 * Retrieval policy derived from a use-case and the query text.
 *
 * @param chunkSizePreference preferred amount of text per retrieved unit
 * @param sequentialContext whether results must keep document order
 * @param numChunks number of chunks the strategy should aim for
 * @param rerankingNeeded whether candidates go through the reranker
 * @param contextExpansion whether hits are widened with their neighbours
 */
public record RetrievalRequirements(
    ChunkSizePreference chunkSizePreference,
    boolean sequentialContext,
    int numChunks,
    boolean rerankingNeeded,
    boolean contextExpansion) {

  public RetrievalRequirements withNumChunks(int value) {
    return new RetrievalRequirements(
        chunkSizePreference, sequentialContext, value, rerankingNeeded, contextExpansion);
  }
}
