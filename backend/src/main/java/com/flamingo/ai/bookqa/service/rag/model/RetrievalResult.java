package com.flamingo.ai.bookqa.service.rag.model;

import com.flamingo.ai.bookqa.domain.enums.RetrievalStatus;
import java.util.List;

/**
 * Result handed to the caller of every retrieval entry point. Always fully populated, including
 * on error, so callers can branch on {@link #status()} alone.
 *
 * @param status outcome of the call
 * @param chunks retrieved chunks in presentation order
 * @param context text assembled from the chunks for the downstream model
 * @param numChunks number of chunks returned
 * @param strategy name of the strategy that produced the result
 * @param message human-readable summary suitable for display or logging
 */
public record RetrievalResult(
    RetrievalStatus status,
    List<RetrievedChunk> chunks,
    String context,
    int numChunks,
    String strategy,
    String message) {

  public RetrievalResult {
    chunks = chunks == null ? List.of() : List.copyOf(chunks);
    context = context == null ? "" : context;
    numChunks = chunks.size();
    message = message == null ? "" : message;
  }

  public static RetrievalResult success(
      String strategy, List<RetrievedChunk> chunks, String context, String message) {
    return new RetrievalResult(
        RetrievalStatus.SUCCESS, chunks, context, 0, strategy, message);
  }

  public static RetrievalResult fallback(
      String strategy, List<RetrievedChunk> chunks, String context, String message) {
    return new RetrievalResult(
        RetrievalStatus.FALLBACK, chunks, context, 0, strategy, message);
  }

  public static RetrievalResult error(String strategy, String message) {
    return new RetrievalResult(RetrievalStatus.ERROR, List.of(), "", 0, strategy, message);
  }

  public boolean isError() {
    return status == RetrievalStatus.ERROR;
  }
}
