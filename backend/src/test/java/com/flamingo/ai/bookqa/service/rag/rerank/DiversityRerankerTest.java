package com.flamingo.ai.bookqa.service.rag.rerank;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.bookqa.config.RagConfig;
import com.flamingo.ai.bookqa.service.rag.model.RetrievedChunk;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DiversityReranker Tests")
class DiversityRerankerTest {

  private RagConfig ragConfig;
  private SimpleMeterRegistry meterRegistry;
  private DiversityReranker reranker;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    meterRegistry = new SimpleMeterRegistry();
    reranker = new DiversityReranker(ragConfig, meterRegistry);
  }

  private static RetrievedChunk chunk(int id, String text, Double score) {
    return RetrievedChunk.builder().sequentialId(id).text(text).score(score).build();
  }

  @Nested
  @DisplayName("calculateDensity")
  class DensityTests {

    @Test
    @DisplayName("should score empty text as zero")
    void shouldScoreEmptyTextAsZero() {
      assertThat(reranker.calculateDensity(null)).isZero();
      assertThat(reranker.calculateDensity("")).isZero();
    }

    @Test
    @DisplayName("should count numbers and sentences")
    void shouldCountNumbersAndSentences() {
      assertThat(reranker.calculateDensity("The value is 42.")).isCloseTo(0.2, within(1e-9));
    }

    @Test
    @DisplayName("should reward informative phrases and definitions")
    void shouldRewardDefinitions() {
      double density = reranker.calculateDensity("Entropy is defined as a measure of disorder.");

      // defined as (0.15) + one sentence (0.1) + definition marker (0.5)
      assertThat(density).isCloseTo(0.75, within(1e-9));
    }

    @Test
    @DisplayName("should give the length bonus by band")
    void shouldApplyLengthBands() {
      assertThat(reranker.calculateDensity("x".repeat(50))).isZero();
      assertThat(reranker.calculateDensity("x".repeat(150))).isCloseTo(0.5, within(1e-9));
      assertThat(reranker.calculateDensity("x".repeat(300))).isCloseTo(1.0, within(1e-9));
      assertThat(reranker.calculateDensity("x".repeat(1000))).isCloseTo(0.5, within(1e-9));
      assertThat(reranker.calculateDensity("x".repeat(1500))).isZero();
    }

    @Test
    @DisplayName("should cap the number contribution at 1.0")
    void shouldCapNumberContribution() {
      String numbers = "1 2 3 4 5 6 7 8 9 10 11 12 13 14 15";

      assertThat(reranker.calculateDensity(numbers)).isCloseTo(1.0, within(1e-9));
    }
  }

  @Nested
  @DisplayName("compositeScore")
  class CompositeTests {

    @Test
    @DisplayName("should blend similarity with normalised density")
    void shouldBlendScores() {
      assertThat(reranker.compositeScore(0.8, 2.5)).isCloseTo(0.65, within(1e-9));
    }

    @Test
    @DisplayName("should assume neutral similarity for unscored chunks")
    void shouldUseNeutralSimilarity_whenScoreMissing() {
      assertThat(reranker.compositeScore(null, 2.5)).isCloseTo(0.5, within(1e-9));
    }
  }

  @Nested
  @DisplayName("rerank")
  class RerankTests {

    @Test
    @DisplayName("should return nothing for empty input or non-positive topK")
    void shouldReturnEmpty_whenNothingToRank() {
      assertThat(reranker.rerank(List.of(), "q", 5)).isEmpty();
      assertThat(reranker.rerank(null, "q", 5)).isEmpty();
      assertThat(reranker.rerank(List.of(chunk(1, "text", 0.9)), "q", 0)).isEmpty();
    }

    @Test
    @DisplayName("should keep the original order when reranking is disabled")
    void shouldKeepOrder_whenDisabled() {
      ragConfig.getReranking().setEnabled(false);
      List<RetrievedChunk> chunks =
          List.of(chunk(1, "low", 0.1), chunk(2, "high", 0.9), chunk(3, "mid", 0.5));

      List<RetrievedChunk> result = reranker.rerank(chunks, "q", 2);

      assertThat(result).extracting(RetrievedChunk::getSequentialId).containsExactly(1, 2);
      assertThat(result.get(0).getCompositeScore()).isNull();
    }

    @Test
    @DisplayName("should order by composite score and attach scores to copies")
    void shouldOrderByCompositeScore() {
      RetrievedChunk weaker = chunk(1, "alpha beta gamma", 0.6);
      RetrievedChunk stronger = chunk(2, "delta epsilon zeta", 0.9);

      List<RetrievedChunk> result = reranker.rerank(List.of(weaker, stronger), "q", 5);

      assertThat(result).extracting(RetrievedChunk::getSequentialId).containsExactly(2, 1);
      assertThat(result.get(0).getCompositeScore()).isCloseTo(0.45, within(1e-9));
      assertThat(result.get(0).getDensityScore()).isZero();
      assertThat(stronger.getCompositeScore()).isNull();
    }

    @Test
    @DisplayName("should reject near-duplicates of recently accepted chunks")
    void shouldRejectNearDuplicates() {
      List<RetrievedChunk> chunks =
          List.of(
              chunk(1, "the cell membrane controls transport of molecules", 0.9),
              chunk(2, "the cell membrane controls transport of molecules extra", 0.85),
              chunk(3, "photosynthesis converts light energy", 0.5));

      List<RetrievedChunk> result = reranker.rerank(chunks, "cell membrane", 3);

      assertThat(result).extracting(RetrievedChunk::getSequentialId).containsExactly(1, 3);
      assertThat(meterRegistry.counter("rag.rerank.invocations").count()).isEqualTo(1.0);
      assertThat(meterRegistry.get("rag.rerank.rejected").gauge().value()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should only compare against the most recent accepted chunks")
    void shouldLimitComparisonToWindow() {
      List<RetrievedChunk> chunks =
          List.of(
              chunk(1, "apple banana cherry date elder", 0.9),
              chunk(2, "fig grape honeydew kiwi lemon", 0.8),
              chunk(3, "mango nectarine orange papaya quince", 0.7),
              chunk(4, "raspberry strawberry tangerine ugli vanilla", 0.6),
              chunk(5, "apple banana cherry date elder", 0.5));

      assertThat(reranker.rerank(chunks, "fruit", 5)).hasSize(5);

      ragConfig.getReranking().setDiversityWindow(5);
      assertThat(reranker.rerank(chunks, "fruit", 5))
          .extracting(RetrievedChunk::getSequentialId)
          .containsExactly(1, 2, 3, 4);
    }
  }
}
