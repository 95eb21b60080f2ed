package com.flamingo.ai.bookqa.service.rag.advanced;

import static com.flamingo.ai.bookqa.service.rag.advanced.AdvancedTestSupport.SCOPE;
import static com.flamingo.ai.bookqa.service.rag.advanced.AdvancedTestSupport.chunk;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.bookqa.config.RagConfig;
import com.flamingo.ai.bookqa.domain.enums.ChunkSource;
import com.flamingo.ai.bookqa.domain.enums.ContentDifficulty;
import com.flamingo.ai.bookqa.domain.enums.RetrievalStatus;
import com.flamingo.ai.bookqa.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.bookqa.service.rag.model.ChunkFilter;
import com.flamingo.ai.bookqa.service.rag.model.RetrievalResult;
import com.flamingo.ai.bookqa.service.rag.model.RetrievedChunk;
import com.flamingo.ai.bookqa.service.rag.rerank.DiversityReranker;
import com.flamingo.ai.bookqa.service.rag.store.VectorStore;
import com.flamingo.ai.bookqa.service.rag.strategy.ContextBuilder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("AdvancedRetrievalService Tests")
class AdvancedRetrievalServiceTest {

  private static final String TOPIC = "cell division";
  private static final List<Float> VECTOR = List.of(0.5f, 0.5f, 0.0f);

  private static final String DENSE_SENTENCE =
      "Mitosis is defined as division because cells grow, therefore 12 key phases such as "
          + "3 main steps matter. ";

  private static final RetrievedChunk PROPHASE =
      chunk(1, "Prophase condenses chromosomes into visible structures.", 0.9);
  private static final RetrievedChunk ANAPHASE =
      chunk(2, "Anaphase pulls sister chromatids toward opposite poles.", 0.85);
  private static final RetrievedChunk CYTOKINESIS =
      chunk(3, "Cytokinesis splits the cytoplasm after nuclear division ends.", 0.8);

  @Mock private MultiQueryRetriever multiQueryRetriever;
  @Mock private HydeRetriever hydeRetriever;
  @Mock private EmbeddingService embeddingService;
  @Mock private VectorStore vectorStore;

  private SimpleMeterRegistry meterRegistry;
  private AdvancedRetrievalService service;

  @BeforeEach
  void setUp() {
    RagConfig ragConfig = new RagConfig();
    meterRegistry = new SimpleMeterRegistry();
    service =
        new AdvancedRetrievalService(
            new QueryDecomposer(),
            multiQueryRetriever,
            hydeRetriever,
            new DiversityReranker(ragConfig, meterRegistry),
            embeddingService,
            vectorStore,
            new ContextBuilder(),
            ragConfig,
            meterRegistry);
    lenient()
        .when(multiQueryRetriever.multiQuery(anyString(), eq(SCOPE), anyInt(), anyInt()))
        .thenReturn(List.of());
  }

  private void stubSubtopics() {
    when(multiQueryRetriever.multiQuery(TOPIC, SCOPE, 3, 5))
        .thenReturn(List.of(PROPHASE, ANAPHASE));
    when(multiQueryRetriever.multiQuery("definition and meaning of " + TOPIC, SCOPE, 3, 5))
        .thenReturn(List.of(ANAPHASE, CYTOKINESIS));
  }

  @Nested
  @DisplayName("retrieveForQuestions")
  class RetrieveForQuestions {

    @Test
    @DisplayName("Should search the first three subtopics and rerank the merged chunks")
    void shouldSearchSubtopicsAndRerank() {
      stubSubtopics();

      RetrievalResult result = service.retrieveForQuestions(TOPIC, SCOPE, 5);

      assertThat(result.status()).isEqualTo(RetrievalStatus.SUCCESS);
      assertThat(result.strategy()).isEqualTo("advanced_rag");
      assertThat(result.chunks())
          .extracting(RetrievedChunk::getSequentialId)
          .containsExactlyInAnyOrder(1, 2, 3);
      assertThat(result.chunks())
          .allSatisfy(
              chunk -> {
                assertThat(chunk.getSource()).isEqualTo(ChunkSource.ADVANCED_RAG);
                assertThat(chunk.getCompositeScore()).isNotNull();
              });
      assertThat(result.message())
          .isEqualTo("Retrieved 3 high-quality chunks using advanced RAG");
      assertThat(result.context()).contains("Density:");
      verify(multiQueryRetriever)
          .multiQuery("examples and applications of " + TOPIC, SCOPE, 3, 5);
      verify(multiQueryRetriever, never()).multiQuery("key concepts in " + TOPIC, SCOPE, 3, 5);
    }

    @Test
    @DisplayName("Should fall back to a basic search when multi-query finds nothing")
    void shouldFallBackToBasicSearch() {
      when(embeddingService.embedQuery(TOPIC)).thenReturn(VECTOR);
      when(vectorStore.search(VECTOR, SCOPE, ChunkFilter.none(), 15, null))
          .thenReturn(List.of(PROPHASE));

      RetrievalResult result = service.retrieveForQuestions(TOPIC, SCOPE, 5);

      assertThat(result.status()).isEqualTo(RetrievalStatus.FALLBACK);
      assertThat(result.message()).isEqualTo("Retrieved 1 chunks using basic retrieval");
    }

    @Test
    @DisplayName("Should return an error when the basic search finds nothing either")
    void shouldReturnErrorWhenNothingFound() {
      when(embeddingService.embedQuery(TOPIC)).thenReturn(VECTOR);
      when(vectorStore.search(VECTOR, SCOPE, ChunkFilter.none(), 15, null))
          .thenReturn(List.of());

      RetrievalResult result = service.retrieveForQuestions(TOPIC, SCOPE, 5);

      assertThat(result.isError()).isTrue();
      assertThat(result.message()).isEqualTo("No relevant content found in biology.pdf");
    }

    @Test
    @DisplayName("Should turn a provider failure into an error result")
    void shouldReturnErrorOnFailure() {
      when(multiQueryRetriever.multiQuery(TOPIC, SCOPE, 3, 5))
          .thenThrow(new IllegalStateException("executor rejected"));

      RetrievalResult result = service.retrieveForQuestions(TOPIC, SCOPE, 5);

      assertThat(result.isError()).isTrue();
      assertThat(result.message()).isEqualTo("Advanced retrieval failed: executor rejected");
      assertThat(
              meterRegistry.counter("rag.retrieval.failure", "strategy", "advanced_rag").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject a blank query")
    void shouldRejectBlankQuery() {
      assertThat(service.retrieveForQuestions(" ", SCOPE, 5).isError()).isTrue();
    }
  }

  @Nested
  @DisplayName("buildQuestionContext")
  class BuildQuestionContext {

    @Test
    @DisplayName("Should combine HyDE and advanced chunks and count their sources")
    void shouldCombineSources() {
      stubSubtopics();
      RetrievedChunk telophase =
          chunk(9, "Telophase rebuilds the nuclear envelope around each chromosome set.", 0.88);
      when(hydeRetriever.hyde(TOPIC, SCOPE, 15))
          .thenReturn(RetrievalResult.success("hyde", List.of(telophase), "", "ok"));

      QuestionContext context = service.buildQuestionContext(TOPIC, SCOPE, 5);

      assertThat(context.status()).isEqualTo(RetrievalStatus.SUCCESS);
      assertThat(context.chunks()).hasSize(4);
      assertThat(context.hydeChunks()).isEqualTo(1);
      assertThat(context.advancedChunks()).isEqualTo(3);
      assertThat(context.averageRelevance()).isPositive();
      assertThat(context.context()).contains("Source: HyDE").contains("Source: Advanced_RAG");
      assertThat(context.message()).isEqualTo("Prepared 4 chunks for question generation");
    }

    @Test
    @DisplayName("Should report an error when both paths find nothing")
    void shouldReportErrorWhenEmpty() {
      when(hydeRetriever.hyde(TOPIC, SCOPE, 15))
          .thenReturn(RetrievalResult.error("hyde", "No relevant content found"));
      when(embeddingService.embedQuery(TOPIC)).thenReturn(VECTOR);
      when(vectorStore.search(VECTOR, SCOPE, ChunkFilter.none(), 15, null))
          .thenReturn(List.of());

      QuestionContext context = service.buildQuestionContext(TOPIC, SCOPE, 5);

      assertThat(context.status()).isEqualTo(RetrievalStatus.ERROR);
      assertThat(context.chunks()).isEmpty();
      assertThat(context.message())
          .isEqualTo(
              "No content found for 'cell division': "
                  + "No relevant content found in biology.pdf");
    }
  }

  @Nested
  @DisplayName("analyzeDifficulty")
  class AnalyzeDifficulty {

    @Test
    @DisplayName("Should default to medium with no levels for no chunks")
    void shouldDefaultForEmpty() {
      DifficultyAnalysis analysis = service.analyzeDifficulty(List.of());

      assertThat(analysis.difficulty()).isEqualTo(ContentDifficulty.MEDIUM);
      assertThat(analysis.levels()).isEmpty();
    }

    @Test
    @DisplayName("Should rate short sparse text as basic")
    void shouldRateSparseTextBasic() {
      DifficultyAnalysis analysis =
          service.analyzeDifficulty(List.of(chunk(1, "Cells divide.", 0.5)));

      assertThat(analysis.difficulty()).isEqualTo(ContentDifficulty.BASIC);
      assertThat(analysis.levels()).containsExactly("Remembering", "Understanding");
    }

    @Test
    @DisplayName("Should rate dense but short text as medium")
    void shouldRateDenseShortTextMedium() {
      DifficultyAnalysis analysis =
          service.analyzeDifficulty(List.of(chunk(1, DENSE_SENTENCE.repeat(2), 0.5)));

      assertThat(analysis.difficulty()).isEqualTo(ContentDifficulty.MEDIUM);
      assertThat(analysis.levels()).containsExactly("Understanding", "Applying", "Analyzing");
    }

    @Test
    @DisplayName("Should rate dense long text as advanced")
    void shouldRateDenseLongTextAdvanced() {
      DifficultyAnalysis analysis =
          service.analyzeDifficulty(List.of(chunk(1, DENSE_SENTENCE.repeat(5), 0.5)));

      assertThat(analysis.difficulty()).isEqualTo(ContentDifficulty.ADVANCED);
      assertThat(analysis.levels()).containsExactly("Analyzing", "Evaluating", "Creating");
      assertThat(analysis.averageLength()).isGreaterThan(500);
    }
  }
}
