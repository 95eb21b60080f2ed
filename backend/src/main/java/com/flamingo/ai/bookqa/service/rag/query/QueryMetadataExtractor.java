package com.flamingo.ai.bookqa.service.rag.query;

import com.flamingo.ai.bookqa.domain.enums.Difficulty;
import com.flamingo.ai.bookqa.service.rag.model.QueryMetadata;
import com.flamingo.ai.bookqa.service.rag.model.QueryMetadata.Extracted;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Extracts chapter, section, topic and difficulty from a query. Each field is matched against its
 * own ordered pattern list and carries an independent confidence.
 */
@Service
@Slf4j
public class QueryMetadataExtractor {

  private static final List<Pattern> CHAPTER_PATTERNS =
      List.of(
          Pattern.compile("\\bchapter\\s+(\\d+)\\b"),
          Pattern.compile("\\bch\\.?\\s*(\\d+)\\b"),
          Pattern.compile("\\bunit\\s+(\\d+)\\b"),
          Pattern.compile("\\blesson\\s+(\\d+)\\b"));

  private static final List<Pattern> SECTION_PATTERNS =
      List.of(
          Pattern.compile("\\bsection\\s+(\\d+(?:\\.\\d+)?)\\b"),
          Pattern.compile("\\bsec\\.?\\s*(\\d+(?:\\.\\d+)?)\\b"));

  private static final String TOPIC_END = "(?:\\s+from|\\s+in|\\s+chapter|$)";

  private static final List<Pattern> TOPIC_PATTERNS =
      List.of(
          Pattern.compile("\\b(?:about|on|regarding|concerning)\\s+(.+?)" + TOPIC_END),
          Pattern.compile("\\bquestions? (?:on|about)\\s+(.+?)" + TOPIC_END),
          Pattern.compile("\\bnotes? (?:on|about)\\s+(.+?)" + TOPIC_END),
          Pattern.compile("\\b(?:explain|describe|summarize)\\s+(.+?)" + TOPIC_END));

  private static final Pattern TOPIC_TRAILER =
      Pattern.compile("\\s+(from|in|chapter|section)\\b.*$");

  private static final Set<String> TOPIC_STOPWORDS =
      Set.of(
          "generate", "create", "make", "questions", "question", "notes", "about", "from",
          "chapter", "what", "which", "does", "tell", "give", "please", "with", "that", "this");

  private static final List<DifficultyRule> DIFFICULTY_RULES =
      List.of(
          new DifficultyRule(Difficulty.EASY, List.of("easy", "simple", "basic", "beginner")),
          new DifficultyRule(Difficulty.HARD, List.of("hard", "difficult", "advanced", "complex")),
          new DifficultyRule(Difficulty.MEDIUM, List.of("medium", "moderate", "intermediate")));

  private static final double EXPLICIT_CHAPTER_CONFIDENCE = 0.95;
  private static final double CHAPTER_CONFIDENCE = 0.85;
  private static final double SECTION_CONFIDENCE = 0.90;
  private static final double TOPIC_PATTERN_CONFIDENCE = 0.80;
  private static final double TOPIC_FALLBACK_CONFIDENCE = 0.50;
  private static final double DIFFICULTY_CONFIDENCE = 0.90;
  private static final double DEFAULT_DIFFICULTY_CONFIDENCE = 0.50;
  private static final int MAX_FALLBACK_TOPIC_WORDS = 5;

  /**
   * Extracts every metadata field from the query.
   *
   * @param query the user's query
   * @return the extracted metadata; absent values have confidence 0.0
   */
  public QueryMetadata extractAll(String query) {
    String text = query == null ? "" : query;
    QueryMetadata metadata =
        new QueryMetadata(
            extractChapter(text),
            extractSection(text),
            extractTopic(text),
            extractDifficulty(text));
    log.debug(
        "Query metadata: chapter={}, section={}, topic='{}', difficulty={}",
        metadata.chapter().value(),
        metadata.section().value(),
        metadata.topic().value(),
        metadata.difficulty().value());
    return metadata;
  }

  /**
   * Extracts a chapter number. "from chapter N" and "in chapter N" are treated as explicit and get
   * a higher confidence than a bare mention.
   */
  public Extracted<Integer> extractChapter(String query) {
    String lower = query.toLowerCase(Locale.ROOT);
    for (Pattern pattern : CHAPTER_PATTERNS) {
      Matcher matcher = pattern.matcher(lower);
      if (matcher.find()) {
        try {
          int chapter = Integer.parseInt(matcher.group(1));
          boolean explicit = lower.contains("from chapter") || lower.contains("in chapter");
          return new Extracted<>(
              chapter, explicit ? EXPLICIT_CHAPTER_CONFIDENCE : CHAPTER_CONFIDENCE);
        } catch (NumberFormatException e) {
          log.debug("Ignoring out-of-range chapter number '{}'", matcher.group(1));
        }
      }
    }
    return Extracted.none();
  }

  public Extracted<String> extractSection(String query) {
    String lower = query.toLowerCase(Locale.ROOT);
    for (Pattern pattern : SECTION_PATTERNS) {
      Matcher matcher = pattern.matcher(lower);
      if (matcher.find()) {
        return new Extracted<>(matcher.group(1), SECTION_CONFIDENCE);
      }
    }
    return Extracted.none();
  }

  /**
   * Extracts a topic phrase, falling back to the first meaningful words of the query.
   *
   * @param query the user's query
   * @return the topic; empty at confidence 0.0 only when every word is a stopword
   */
  public Extracted<String> extractTopic(String query) {
    String lower = query.toLowerCase(Locale.ROOT).strip();
    for (Pattern pattern : TOPIC_PATTERNS) {
      Matcher matcher = pattern.matcher(lower);
      if (matcher.find()) {
        String topic = TOPIC_TRAILER.matcher(matcher.group(1).strip()).replaceAll("");
        topic = stripPunctuation(topic);
        if (!topic.isEmpty()) {
          return new Extracted<>(topic, TOPIC_PATTERN_CONFIDENCE);
        }
      }
    }

    String fallback =
        Arrays.stream(query.strip().split("\\s+"))
            .map(this::stripPunctuation)
            .filter(w -> w.length() > 3)
            .filter(w -> !TOPIC_STOPWORDS.contains(w.toLowerCase(Locale.ROOT)))
            .limit(MAX_FALLBACK_TOPIC_WORDS)
            .collect(Collectors.joining(" "));
    if (!fallback.isEmpty()) {
      return new Extracted<>(fallback, TOPIC_FALLBACK_CONFIDENCE);
    }
    return Extracted.none();
  }

  public Extracted<Difficulty> extractDifficulty(String query) {
    String lower = query.toLowerCase(Locale.ROOT);
    for (DifficultyRule rule : DIFFICULTY_RULES) {
      if (rule.keywords().stream().anyMatch(lower::contains)) {
        return new Extracted<>(rule.difficulty(), DIFFICULTY_CONFIDENCE);
      }
    }
    return new Extracted<>(Difficulty.MEDIUM, DEFAULT_DIFFICULTY_CONFIDENCE);
  }

  private String stripPunctuation(String word) {
    return word.replaceAll("^[\\p{Punct}]+|[\\p{Punct}]+$", "");
  }

  private record DifficultyRule(Difficulty difficulty, List<String> keywords) {}
}
