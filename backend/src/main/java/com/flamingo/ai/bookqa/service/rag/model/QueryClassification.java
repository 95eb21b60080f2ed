package com.flamingo.ai.bookqa.service.rag.model;

import com.flamingo.ai.bookqa.domain.enums.UseCase;
import java.util.List;

/**
 * Use-case detected for a query.
 *
 * @param useCase the winning use-case
 * @param confidence confidence in the range 0..1
 * @param matchedKeywords keywords of the winning use-case found in the query
 */
public record QueryClassification(
    UseCase useCase, double confidence, List<String> matchedKeywords) {

  public QueryClassification {
    matchedKeywords = matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
  }

  /** Classification used when no keyword or pattern matched. */
  public static QueryClassification defaultChat() {
    return new QueryClassification(UseCase.CHAT, 0.5, List.of());
  }

  /** Classification for a use-case supplied explicitly by the caller. */
  public static QueryClassification explicit(UseCase useCase) {
    return new QueryClassification(useCase, 1.0, List.of());
  }
}
