package com.flamingo.ai.bookqa.domain.enums;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Caller intent that selects the retrieval policy.
 *
 * <p>The priority decides which use-case wins when keyword scores tie; lower values win.
 */
public enum UseCase {
  /** Free-form question answering over the document. */
  CHAT("chat", 3),

  /** Checking a learner's answer against the source text. */
  EVALUATION("evaluation", 1),

  /** Producing quiz or practice questions from a chapter or topic. */
  QA_GENERATION("qa_generation", 0),

  /** Producing study notes that cover a whole chapter or section. */
  NOTES("notes", 2);

  private static final List<UseCase> BY_PRIORITY =
      Arrays.stream(values()).sorted(Comparator.comparingInt(UseCase::getPriority)).toList();

  private final String value;
  private final int priority;

  UseCase(String value, int priority) {
    this.value = value;
    this.priority = priority;
  }

  public String getValue() {
    return value;
  }

  public int getPriority() {
    return priority;
  }

  /** Use-cases ordered from highest to lowest tie-break priority. */
  public static List<UseCase> byPriority() {
    return BY_PRIORITY;
  }

  /**
   * Resolves a wire value such as {@code "qa_generation"}; matching ignores case.
   *
   * @param value the use-case name supplied by the caller
   * @return the matching use-case, or empty when blank or unknown
   */
  public static Optional<UseCase> fromValue(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(u -> u.value.equals(normalized)).findFirst();
  }
}
