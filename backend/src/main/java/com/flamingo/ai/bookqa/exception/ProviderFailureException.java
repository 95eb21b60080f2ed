package com.flamingo.ai.bookqa.exception;

/** Exception thrown when the embedding provider or the vector store fails or times out. */
public class ProviderFailureException extends RuntimeException {

  private final String provider;
  private final String userMessage;

  public ProviderFailureException(String provider, String message) {
    super(message);
    this.provider = provider;
    this.userMessage = "Retrieval is temporarily unavailable. Please try again.";
  }

  public ProviderFailureException(String provider, String message, Throwable cause) {
    super(message, cause);
    this.provider = provider;
    this.userMessage = "Retrieval is temporarily unavailable. Please try again.";
  }

  public String getProvider() {
    return provider;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
