package com.flamingo.ai.bookqa.service.rag.advanced;

/**
 * Result of one {@link SearchBranch}: either a value or the failure that ended the branch.
 *
 * @param label the branch label
 * @param value the branch result, null when the branch failed
 * @param failure the failure, null when the branch succeeded
 * @param <T> the search result type
 */
public record BranchOutcome<T>(String label, T value, Throwable failure) {

  public static <T> BranchOutcome<T> success(String label, T value) {
    return new BranchOutcome<>(label, value, null);
  }

  public static <T> BranchOutcome<T> failed(String label, Throwable failure) {
    return new BranchOutcome<>(label, null, failure);
  }

  public boolean isSuccess() {
    return failure == null;
  }
}
