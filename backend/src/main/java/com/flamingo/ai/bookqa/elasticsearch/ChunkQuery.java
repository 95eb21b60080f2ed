package com.flamingo.ai.bookqa.elasticsearch;

import com.flamingo.ai.bookqa.service.rag.model.ChunkFilter;
import com.flamingo.ai.bookqa.service.rag.model.DocumentScope;

/**
 * Selection criteria for {@link BookChunkIndexService}: a mandatory scope plus optional metadata
 * restrictions.
 *
 * @param scope the document and user whose chunks are selected
 * @param filter additional restrictions
 */
public record ChunkQuery(DocumentScope scope, ChunkFilter filter) {

  public ChunkQuery {
    if (scope == null) {
      throw new IllegalArgumentException("scope is required for chunk queries");
    }
    filter = filter == null ? ChunkFilter.none() : filter;
  }

  public static ChunkQuery of(DocumentScope scope) {
    return new ChunkQuery(scope, ChunkFilter.none());
  }
}
