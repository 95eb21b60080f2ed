package com.flamingo.ai.bookqa.service.rag.model;

import com.flamingo.ai.bookqa.domain.enums.ChunkSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A chunk returned for one query, with the scores assigned while ranking it.
 *
 * <p>Instances are created per request and never persisted. {@code score} is the cosine similarity
 * reported by the vector store and is {@code null} for chunks fetched by filter only.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RetrievedChunk {

  private String text;
  private int sequentialId;
  private String documentName;
  private Double score;
  @Builder.Default private ChunkMetadata metadata = ChunkMetadata.empty();

  private Double compositeScore;
  private Double densityScore;
  private Double consistencyScore;
  private ChunkSource source;

  /** Set when the chunk was added as a sequential neighbour of a search hit. */
  private boolean neighbor;

  /**
   * Returns the first {@code length} characters of the text, used as a deduplication key.
   *
   * @param length maximum prefix length
   * @return the text prefix, empty when the text is null
   */
  public String textPrefix(int length) {
    if (text == null) {
      return "";
    }
    return text.length() <= length ? text : text.substring(0, length);
  }
}
