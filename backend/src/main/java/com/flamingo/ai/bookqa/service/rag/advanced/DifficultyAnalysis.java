package com.flamingo.ai.bookqa.service.rag.advanced;

import com.flamingo.ai.bookqa.domain.enums.ContentDifficulty;
import java.util.List;

/**
 * How demanding a set of retrieved passages is, used to pitch generated questions.
 *
 * @param difficulty overall difficulty
 * @param levels cognitive levels questions should target
 * @param averageDensity mean information density of the passages
 * @param averageLength mean passage length in characters
 */
public record DifficultyAnalysis(
    ContentDifficulty difficulty,
    List<String> levels,
    double averageDensity,
    double averageLength) {

  public DifficultyAnalysis {
    levels = List.copyOf(levels);
  }
}
