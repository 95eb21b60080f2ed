package com.flamingo.ai.bookqa.service.rag.model;

import com.flamingo.ai.bookqa.domain.enums.RetrievalStatus;

/**
 * Outcome of indexing one document.
 *
 * @param status SUCCESS, DUPLICATE, ALREADY_INDEXED or ERROR
 * @param numChunks number of chunks stored
 * @param chaptersFound distinct chapters detected
 * @param sectionsFound distinct sections detected
 * @param message human-readable summary
 * @param originalDocumentName for duplicates, the document that already holds this content
 */
public record IndexingResult(
    RetrievalStatus status,
    int numChunks,
    int chaptersFound,
    int sectionsFound,
    String message,
    String originalDocumentName) {

  public static IndexingResult error(String message) {
    return new IndexingResult(RetrievalStatus.ERROR, 0, 0, 0, message, null);
  }
}
