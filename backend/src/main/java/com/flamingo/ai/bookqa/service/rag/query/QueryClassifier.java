package com.flamingo.ai.bookqa.service.rag.query;

import com.flamingo.ai.bookqa.domain.enums.ChunkSizePreference;
import com.flamingo.ai.bookqa.domain.enums.UseCase;
import com.flamingo.ai.bookqa.service.rag.model.QueryClassification;
import com.flamingo.ai.bookqa.service.rag.model.RetrievalRequirements;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Classifies free-text queries into a {@link UseCase} by keyword counting and regex overrides.
 *
 * <p>Keyword matches are counted per use-case; the highest count wins and ties go to the use-case
 * with the higher {@link UseCase#getPriority() priority}. Chat competes like any other use-case
 * but its confidence stays at the 0.5 default. Override patterns run afterwards and replace the
 * use-case; keywords matched before the override are kept alongside the override's own.
 */
@Service
@Slf4j
public class QueryClassifier {

  private static final double DEFAULT_CONFIDENCE = 0.5;
  private static final double BASE_CONFIDENCE = 0.6;
  private static final double CONFIDENCE_PER_MATCH = 0.15;
  private static final int MIN_QA_CHUNKS = 15;

  private static final Map<UseCase, List<String>> KEYWORDS = new EnumMap<>(UseCase.class);

  static {
    KEYWORDS.put(
        UseCase.QA_GENERATION,
        List.of(
            "generate questions",
            "create questions",
            "make questions",
            "generate quiz",
            "create quiz",
            "make quiz",
            "generate q&a",
            "create q&a",
            "question generation",
            "generate mcq",
            "create mcq",
            "multiple choice",
            "generate test",
            "create test"));
    KEYWORDS.put(
        UseCase.EVALUATION,
        List.of(
            "evaluate",
            "check answer",
            "grade",
            "assess",
            "is this correct",
            "is this right",
            "verify answer",
            "check my answer",
            "correct answer",
            "validate",
            "score",
            "marks",
            "feedback on"));
    KEYWORDS.put(
        UseCase.NOTES,
        List.of(
            "generate notes",
            "create notes",
            "make notes",
            "summarize",
            "summary",
            "overview",
            "outline",
            "key points",
            "main points",
            "important points",
            "explain chapter",
            "explain section",
            "notes on",
            "give me notes"));
    KEYWORDS.put(
        UseCase.CHAT,
        List.of(
            "what is",
            "explain",
            "how does",
            "why",
            "tell me about",
            "describe",
            "define",
            "can you explain",
            "help me understand"));
  }

  private static final List<OverrideRule> OVERRIDES =
      List.of(
          new OverrideRule(
              Pattern.compile("\\b\\d+\\s+questions?\\b"), UseCase.QA_GENERATION, 0.95),
          new OverrideRule(
              Pattern.compile("(my answer|the answer) (is|was)"), UseCase.EVALUATION, 0.90),
          new OverrideRule(
              Pattern.compile("(notes? (on|for|about)|summarize (chapter|section))"),
              UseCase.NOTES,
              0.90));

  private static final Pattern QUESTION_COUNT = Pattern.compile("(\\d+)\\s+questions?");

  private static final Map<UseCase, RetrievalRequirements> REQUIREMENTS =
      new EnumMap<>(
          Map.of(
              UseCase.CHAT,
              new RetrievalRequirements(ChunkSizePreference.MEDIUM, false, 5, true, false),
              UseCase.EVALUATION,
              new RetrievalRequirements(ChunkSizePreference.SMALL, false, 5, true, true),
              UseCase.QA_GENERATION,
              new RetrievalRequirements(
                  ChunkSizePreference.LARGE, true, MIN_QA_CHUNKS, true, false),
              UseCase.NOTES,
              new RetrievalRequirements(ChunkSizePreference.LARGE, true, 20, false, false)));

  /**
   * Classifies a query.
   *
   * @param query the user's query
   * @return the classification; chat at 0.5 when nothing matched
   */
  public QueryClassification classify(String query) {
    if (query == null || query.isBlank()) {
      log.warn("Empty query passed to classifier, defaulting to chat");
      return QueryClassification.defaultChat();
    }
    String lower = query.toLowerCase(Locale.ROOT);

    Map<UseCase, List<String>> matches = new EnumMap<>(UseCase.class);
    for (UseCase useCase : UseCase.byPriority()) {
      List<String> found = new ArrayList<>();
      for (String keyword : KEYWORDS.get(useCase)) {
        if (lower.contains(keyword)) {
          found.add(keyword);
        }
      }
      matches.put(useCase, found);
    }

    UseCase best = null;
    int bestCount = 0;
    for (UseCase useCase : UseCase.byPriority()) {
      int count = matches.get(useCase).size();
      if (count > bestCount) {
        best = useCase;
        bestCount = count;
      }
    }

    QueryClassification result;
    if (best == null || best == UseCase.CHAT) {
      result =
          new QueryClassification(UseCase.CHAT, DEFAULT_CONFIDENCE, matches.get(UseCase.CHAT));
    } else {
      result =
          new QueryClassification(
              best,
              Math.min(BASE_CONFIDENCE + CONFIDENCE_PER_MATCH * bestCount, 1.0),
              matches.get(best));
    }

    for (OverrideRule rule : OVERRIDES) {
      if (rule.pattern().matcher(lower).find()) {
        Set<String> keywords = new LinkedHashSet<>(matches.get(rule.useCase()));
        keywords.addAll(result.matchedKeywords());
        result =
            new QueryClassification(rule.useCase(), rule.confidence(), List.copyOf(keywords));
      }
    }

    log.info(
        "Query classified as {} (confidence={}, keywords={})",
        result.useCase().getValue(),
        String.format("%.2f", result.confidence()),
        result.matchedKeywords());
    return result;
  }

  /**
   * Derives the retrieval policy for a use-case.
   *
   * <p>For question generation, a request for "N questions" raises the chunk target to {@code
   * max(N, 15)}.
   *
   * @param query the user's query
   * @param useCase the resolved use-case
   * @return the retrieval requirements
   */
  public RetrievalRequirements extractContextRequirements(String query, UseCase useCase) {
    RetrievalRequirements requirements = REQUIREMENTS.get(useCase);
    if (useCase == UseCase.QA_GENERATION && query != null) {
      Matcher matcher = QUESTION_COUNT.matcher(query.toLowerCase(Locale.ROOT));
      if (matcher.find()) {
        try {
          int requested = Integer.parseInt(matcher.group(1));
          requirements = requirements.withNumChunks(Math.max(requested, MIN_QA_CHUNKS));
        } catch (NumberFormatException e) {
          log.debug("Ignoring out-of-range question count '{}'", matcher.group(1));
        }
      }
    }
    return requirements;
  }

  private record OverrideRule(Pattern pattern, UseCase useCase, double confidence) {}
}
