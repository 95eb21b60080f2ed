package com.flamingo.ai.bookqa.service.rag.model;

import com.flamingo.ai.bookqa.domain.enums.Difficulty;

/**
 * Structured intent extracted from a query. Every field carries its own confidence.
 *
 * @param chapter requested chapter number
 * @param section requested section number
 * @param topic topic phrase
 * @param difficulty requested difficulty
 */
public record QueryMetadata(
    Extracted<Integer> chapter,
    Extracted<String> section,
    Extracted<String> topic,
    Extracted<Difficulty> difficulty) {

  /**
   * A value pulled out of the query together with the confidence of the match.
   *
   * @param value the extracted value, or {@code null} when nothing matched
   * @param confidence confidence in the range 0..1
   * @param <T> the value type
   */
  public record Extracted<T>(T value, double confidence) {

    public static <T> Extracted<T> none() {
      return new Extracted<>(null, 0.0);
    }

    public boolean isPresent() {
      return value != null;
    }

    /** True when a value is present and its confidence is strictly above the threshold. */
    public boolean isConfidentAbove(double threshold) {
      return value != null && confidence > threshold;
    }
  }
}
