package com.flamingo.ai.bookqa.service.rag.model;

import com.flamingo.ai.bookqa.domain.enums.ContentType;
import java.util.List;
import lombok.Builder;

/**
 * Structural metadata detected for one chunk.
 *
 * <p>{@code contentTypes} is never empty and {@code primaryContentType} is always its first
 * element; both fall back to {@link ContentType#CONTENT} when nothing was detected.
 *
 * @param chapterNumber chapter the chunk belongs to, declared or inherited
 * @param chapterTitle title of that chapter
 * @param sectionNumber dotted section number, e.g. {@code "2.3"}
 * @param sectionTitle title of that section
 * @param pageNumber page reference found in the chunk text
 * @param contentTypes detected content types in detection order
 * @param primaryContentType first detected content type
 * @param hasHeadings whether a heading line was found near the top of the chunk
 * @param minHeadingLevel smallest heading level found (1..6)
 * @param charCount number of characters
 * @param wordCount number of whitespace-separated words
 * @param sentenceCount number of sentence terminator runs
 * @param hasLists whether the chunk contains bullet list lines
 * @param hasCode whether the chunk contains code markers
 * @param hasQuestions whether the chunk contains a question mark
 * @param chunkPosition one-based position rendered as {@code "i/total"}
 * @param isFirst whether this is the first chunk of the document
 * @param isLast whether this is the last chunk of the document
 */
@Builder(toBuilder = true)
public record ChunkMetadata(
    Integer chapterNumber,
    String chapterTitle,
    String sectionNumber,
    String sectionTitle,
    Integer pageNumber,
    List<ContentType> contentTypes,
    ContentType primaryContentType,
    boolean hasHeadings,
    Integer minHeadingLevel,
    int charCount,
    int wordCount,
    int sentenceCount,
    boolean hasLists,
    boolean hasCode,
    boolean hasQuestions,
    String chunkPosition,
    boolean isFirst,
    boolean isLast) {

  public ChunkMetadata {
    contentTypes =
        contentTypes == null || contentTypes.isEmpty()
            ? List.of(ContentType.CONTENT)
            : List.copyOf(contentTypes);
    primaryContentType = contentTypes.get(0);
  }

  /** Metadata for chunks whose structure is unknown, e.g. results from an external store. */
  public static ChunkMetadata empty() {
    return ChunkMetadata.builder().build();
  }

  public boolean hasChapter() {
    return chapterNumber != null;
  }

  public boolean hasSection() {
    return sectionNumber != null;
  }
}
