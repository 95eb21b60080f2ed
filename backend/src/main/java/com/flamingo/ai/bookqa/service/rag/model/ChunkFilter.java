package com.flamingo.ai.bookqa.service.rag.model;

/**
 * Metadata restrictions applied inside a {@link DocumentScope}. Null fields do not restrict.
 *
 * @param chapterNumber only chunks of this chapter
 * @param sectionNumber only chunks of this section
 * @param minSequentialId lowest sequential id, inclusive
 * @param maxSequentialId highest sequential id, inclusive
 */
public record ChunkFilter(
    Integer chapterNumber, String sectionNumber, Integer minSequentialId, Integer maxSequentialId) {

  private static final ChunkFilter NONE = new ChunkFilter(null, null, null, null);

  public static ChunkFilter none() {
    return NONE;
  }

  public static ChunkFilter range(int minSequentialId, int maxSequentialId) {
    return new ChunkFilter(null, null, minSequentialId, maxSequentialId);
  }

  public ChunkFilter withChapter(Integer chapter) {
    return new ChunkFilter(chapter, sectionNumber, minSequentialId, maxSequentialId);
  }

  public ChunkFilter withSection(String section) {
    return new ChunkFilter(chapterNumber, section, minSequentialId, maxSequentialId);
  }

  public ChunkFilter withRange(int min, int max) {
    return new ChunkFilter(chapterNumber, sectionNumber, min, max);
  }

  /** True when neither a chapter nor a section restriction is set. */
  public boolean hasNoMetadataRestriction() {
    return chapterNumber == null && sectionNumber == null;
  }

  /** Checks a chunk against every restriction of this filter. */
  public boolean matches(int sequentialId, ChunkMetadata metadata) {
    if (chapterNumber != null && !chapterNumber.equals(metadata.chapterNumber())) {
      return false;
    }
    if (sectionNumber != null && !sectionNumber.equals(metadata.sectionNumber())) {
      return false;
    }
    if (minSequentialId != null && sequentialId < minSequentialId) {
      return false;
    }
    return maxSequentialId == null || sequentialId <= maxSequentialId;
  }
}
