package com.flamingo.ai.bookqa.service.rag.model;

/**
 * Partition key for stored chunks: one document as uploaded by one user. Both parts are opaque
 * and passed to the vector store unchanged.
 *
 * @param documentName the document (file) name
 * @param userToken the owning user's token
 */
public record DocumentScope(String documentName, String userToken) {

  public DocumentScope {
    if (documentName == null || documentName.isBlank()) {
      throw new IllegalArgumentException("documentName must not be blank");
    }
    if (userToken == null || userToken.isBlank()) {
      throw new IllegalArgumentException("userToken must not be blank");
    }
  }
}
