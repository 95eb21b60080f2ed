package com.flamingo.ai.bookqa.exception;

/** Exception thrown when a document cannot be chunked, embedded or stored. */
public class DocumentIndexingException extends RuntimeException {

  private final String documentName;
  private final String userMessage;

  public DocumentIndexingException(String documentName, String message) {
    super(message);
    this.documentName = documentName;
    this.userMessage = "Failed to index document";
  }

  public DocumentIndexingException(String documentName, String message, Throwable cause) {
    super(message, cause);
    this.documentName = documentName;
    this.userMessage = "Failed to index document";
  }

  public String getDocumentName() {
    return documentName;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
