package com.flamingo.ai.bookqa.elasticsearch;

import com.flamingo.ai.bookqa.service.rag.model.ChunkMetadata;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A book chunk stored in Elasticsearch with its text, embedding and structural metadata.
 *
 * <p>{@code documentName} and {@code userToken} together form the scope every query filters on.
 * {@code contentHash} identifies the whole source text and is used to detect re-uploads under a
 * different name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookChunk implements AbstractElasticsearchIndexService.ScoredDocument {

  private String id;
  private String documentName;
  private String userToken;
  private int sequentialId;
  private String content;
  private List<Float> embedding;
  private String contentHash;

  @Builder.Default private ChunkMetadata metadata = ChunkMetadata.empty();

  // Raw Elasticsearch score from search results (set by search methods)
  private Double relevanceScore;
}
