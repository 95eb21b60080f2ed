package com.flamingo.ai.bookqa.service.rag.rerank;

import com.flamingo.ai.bookqa.config.RagConfig;
import com.flamingo.ai.bookqa.service.rag.model.RetrievedChunk;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Density-aware reranking service with a diversity pass.
 *
 * <p>Candidates are ordered by a composite of vector similarity and information density, then
 * sampled so that near-duplicate passages do not crowd out the result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DiversityReranker {

  private static final Pattern NUMBER = Pattern.compile("\\b\\d+\\.?\\d*\\b");
  private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");

  private static final List<String> INFORMATIVE_PHRASES =
      List.of(
          "because",
          "therefore",
          "thus",
          "however",
          "important",
          "significant",
          "key",
          "main",
          "primary",
          "essential",
          "for example",
          "such as",
          "including",
          "defined as",
          "means that",
          "refers to",
          "results in",
          "causes");

  private static final List<String> DEFINITION_MARKERS =
      List.of("is defined as", "refers to", "means", "is a", "are");

  // Similarity assumed for chunks fetched without a score
  private static final double NEUTRAL_SIMILARITY = 0.5;

  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  private final AtomicInteger lastRejected = new AtomicInteger();

  /**
   * Reranks chunks by composite score and removes near-duplicates.
   *
   * <p>Algorithm:
   *
   * <ol>
   *   <li>Score each chunk: {@code w * similarity + (1 - w) * density / normalizer}
   *   <li>Sort by composite score (descending)
   *   <li>Walk the sorted list, rejecting a chunk whose leading words overlap too much with any of
   *       the most recently accepted chunks
   *   <li>Stop at top-K
   * </ol>
   *
   * <p>The input list and its chunks are not modified; returned chunks are copies carrying their
   * composite and density scores.
   *
   * @param chunks the candidate chunks
   * @param query the query the candidates were retrieved for
   * @param topK the number of chunks to return
   * @return reranked chunks, best first
   */
  public List<RetrievedChunk> rerank(List<RetrievedChunk> chunks, String query, int topK) {
    if (chunks == null || chunks.isEmpty() || topK <= 0) {
      return List.of();
    }
    if (!ragConfig.getReranking().isEnabled()) {
      log.debug("Reranking disabled, returning original order");
      return chunks.stream().limit(topK).toList();
    }

    RagConfig.Reranking config = ragConfig.getReranking();
    List<RetrievedChunk> scored = new ArrayList<>(chunks.size());
    for (RetrievedChunk chunk : chunks) {
      double density = calculateDensity(chunk.getText());
      scored.add(
          chunk.toBuilder()
              .densityScore(density)
              .compositeScore(compositeScore(chunk.getScore(), density))
              .build());
    }
    scored.sort(Comparator.comparingDouble(RetrievedChunk::getCompositeScore).reversed());

    List<RetrievedChunk> selected = diversitySample(scored, topK, config);
    int rejected = scored.size() - selected.size();

    meterRegistry.counter("rag.rerank.invocations").increment();
    lastRejected.set(rejected);
    meterRegistry.gauge("rag.rerank.rejected", lastRejected);

    log.debug(
        "Reranked {} candidates to {} for query '{}' (topK={})",
        chunks.size(),
        selected.size(),
        query,
        topK);
    return selected;
  }

  /**
   * Scores how much question-worthy information a passage carries.
   *
   * <p>Sums capped contributions from numbers, informative phrases and sentence count, a bonus for
   * passages of a useful length, and a bonus when the text reads like a definition. The total is
   * not capped.
   *
   * @param text the passage
   * @return density score, {@code 0.0} for empty text
   */
  public double calculateDensity(String text) {
    if (text == null || text.isEmpty()) {
      return 0.0;
    }
    String lower = text.toLowerCase(Locale.ROOT);
    double score = 0.0;

    score += Math.min(count(NUMBER.matcher(text)) * 0.1, 1.0);

    long phrases = INFORMATIVE_PHRASES.stream().filter(lower::contains).count();
    score += Math.min(phrases * 0.15, 1.5);

    score += Math.min(count(SENTENCE_END.matcher(text)) * 0.1, 1.0);

    int length = text.length();
    if (length >= 200 && length <= 800) {
      score += 1.0;
    } else if ((length >= 100 && length < 200) || (length > 800 && length <= 1200)) {
      score += 0.5;
    }

    if (DEFINITION_MARKERS.stream().anyMatch(lower::contains)) {
      score += 0.5;
    }
    return score;
  }

  /**
   * Combines similarity and density into one ranking score.
   *
   * @param similarity cosine similarity, or null when the chunk was not ranked by similarity
   * @param density density from {@link #calculateDensity(String)}
   * @return composite score
   */
  public double compositeScore(Double similarity, double density) {
    RagConfig.Reranking config = ragConfig.getReranking();
    double weight = config.getSimilarityWeight();
    double sim = similarity == null ? NEUTRAL_SIMILARITY : similarity;
    return weight * sim + (1 - weight) * (density / config.getDensityNormalizer());
  }

  private List<RetrievedChunk> diversitySample(
      List<RetrievedChunk> sorted, int topK, RagConfig.Reranking config) {
    List<RetrievedChunk> accepted = new ArrayList<>();
    List<Set<String>> acceptedWords = new ArrayList<>();

    for (RetrievedChunk candidate : sorted) {
      if (accepted.size() >= topK) {
        break;
      }
      Set<String> words = leadingWords(candidate.getText(), config.getOverlapPrefixChars());
      if (isDiverse(words, acceptedWords, config)) {
        accepted.add(candidate);
        acceptedWords.add(words);
      } else {
        log.debug("Rejected near-duplicate chunk {}", candidate.getSequentialId());
      }
    }
    return accepted;
  }

  private static boolean isDiverse(
      Set<String> words, List<Set<String>> acceptedWords, RagConfig.Reranking config) {
    int from = Math.max(0, acceptedWords.size() - config.getDiversityWindow());
    double limit = words.size() * config.getOverlapThreshold();
    for (Set<String> previous : acceptedWords.subList(from, acceptedWords.size())) {
      Set<String> overlap = new HashSet<>(words);
      overlap.retainAll(previous);
      if (overlap.size() > limit) {
        return false;
      }
    }
    return true;
  }

  private static Set<String> leadingWords(String text, int prefixChars) {
    if (text == null || text.isBlank()) {
      return Set.of();
    }
    String prefix = text.length() <= prefixChars ? text : text.substring(0, prefixChars);
    String lower = prefix.toLowerCase(Locale.ROOT).strip();
    return new HashSet<>(Arrays.asList(lower.split("\\s+")));
  }

  private static int count(Matcher matcher) {
    int n = 0;
    while (matcher.find()) {
      n++;
    }
    return n;
  }
}
