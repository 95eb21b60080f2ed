package com.flamingo.ai.bookqa.service.rag.advanced;

import static com.flamingo.ai.bookqa.service.rag.advanced.AdvancedTestSupport.SCOPE;
import static com.flamingo.ai.bookqa.service.rag.advanced.AdvancedTestSupport.chunk;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.bookqa.config.RagConfig;
import com.flamingo.ai.bookqa.domain.enums.ChunkSource;
import com.flamingo.ai.bookqa.domain.enums.RetrievalStatus;
import com.flamingo.ai.bookqa.exception.ProviderFailureException;
import com.flamingo.ai.bookqa.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.bookqa.service.rag.model.ChunkFilter;
import com.flamingo.ai.bookqa.service.rag.model.RetrievalResult;
import com.flamingo.ai.bookqa.service.rag.model.RetrievedChunk;
import com.flamingo.ai.bookqa.service.rag.store.VectorStore;
import com.flamingo.ai.bookqa.service.rag.strategy.ContextBuilder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("HydeRetriever Tests")
class HydeRetrieverTest {

  private static final String QUERY = "the Krebs cycle";
  private static final List<Float> PASSAGE_VECTOR = List.of(1.0f, 0.0f, 0.0f);
  private static final List<Float> QUERY_VECTOR = List.of(0.0f, 1.0f, 0.0f);

  @Mock private EmbeddingService embeddingService;
  @Mock private VectorStore vectorStore;

  private SimpleMeterRegistry meterRegistry;
  private HydeRetriever retriever;
  private String passage;

  @BeforeEach
  void setUp() {
    RagConfig ragConfig = new RagConfig();
    meterRegistry = new SimpleMeterRegistry();
    retriever =
        new HydeRetriever(
            embeddingService,
            vectorStore,
            AdvancedTestSupport.directExecutor(ragConfig, meterRegistry),
            new ContextBuilder(),
            ragConfig,
            meterRegistry);
    passage = retriever.buildHypotheticalPassage(QUERY);
  }

  @Test
  @DisplayName("Should build an answer-shaped passage that mentions the query")
  void shouldBuildPassage() {
    assertThat(passage)
        .startsWith("This section explains the Krebs cycle.")
        .contains("practical applications of the Krebs cycle");
  }

  @Test
  @DisplayName("Should merge both branches with HyDE hits first")
  void shouldMergeBothBranches() {
    when(embeddingService.embed(passage)).thenReturn(PASSAGE_VECTOR);
    when(embeddingService.embedQuery(QUERY)).thenReturn(QUERY_VECTOR);
    when(vectorStore.search(PASSAGE_VECTOR, SCOPE, ChunkFilter.none(), 4, null))
        .thenReturn(
            List.of(
                chunk(10, "The cycle produces NADH.", 0.91),
                chunk(11, "Citrate is formed first.", 0.88)));
    when(vectorStore.search(QUERY_VECTOR, SCOPE, ChunkFilter.none(), 2, null))
        .thenReturn(
            List.of(
                chunk(10, "The cycle produces NADH.", 0.80),
                chunk(30, "It occurs in the mitochondria.", 0.75)));

    RetrievalResult result = retriever.hyde(QUERY, SCOPE, 4);

    assertThat(result.status()).isEqualTo(RetrievalStatus.SUCCESS);
    assertThat(result.strategy()).isEqualTo("hyde");
    assertThat(result.chunks())
        .extracting(RetrievedChunk::getSequentialId)
        .containsExactly(10, 11, 30);
    assertThat(result.chunks())
        .extracting(RetrievedChunk::getSource)
        .containsExactly(ChunkSource.HYDE, ChunkSource.HYDE, ChunkSource.REGULAR);
    assertThat(result.message()).isEqualTo("Retrieved 3 chunks using HyDE");
    assertThat(result.context()).contains("The cycle produces NADH.");
  }

  @Test
  @DisplayName("Should use the regular branch alone when the HyDE branch fails")
  void shouldSurviveHydeBranchFailure() {
    when(embeddingService.embed(passage))
        .thenThrow(new ProviderFailureException("openai", "timeout"));
    when(embeddingService.embedQuery(QUERY)).thenReturn(QUERY_VECTOR);
    when(vectorStore.search(QUERY_VECTOR, SCOPE, ChunkFilter.none(), 3, null))
        .thenReturn(List.of(chunk(30, "It occurs in the mitochondria.", 0.75)));

    RetrievalResult result = retriever.hyde(QUERY, SCOPE, 6);

    assertThat(result.status()).isEqualTo(RetrievalStatus.SUCCESS);
    assertThat(result.chunks())
        .extracting(RetrievedChunk::getSource)
        .containsExactly(ChunkSource.REGULAR);
  }

  @Test
  @DisplayName("Should fall back to a plain search when both branches fail")
  void shouldFallBackWhenBothBranchesFail() {
    when(embeddingService.embed(passage))
        .thenThrow(new ProviderFailureException("openai", "timeout"));
    when(embeddingService.embedQuery(QUERY))
        .thenThrow(new ProviderFailureException("openai", "timeout"))
        .thenReturn(QUERY_VECTOR);
    when(vectorStore.search(QUERY_VECTOR, SCOPE, ChunkFilter.none(), 5, null))
        .thenReturn(List.of(chunk(30, "It occurs in the mitochondria.", 0.75)));

    RetrievalResult result = retriever.hyde(QUERY, SCOPE, 5);

    assertThat(result.status()).isEqualTo(RetrievalStatus.FALLBACK);
    assertThat(result.message())
        .isEqualTo("Retrieved 1 chunks using regular search (HyDE failed)");
  }

  @Test
  @DisplayName("Should return an error when the fallback search fails too")
  void shouldReturnErrorWhenFallbackFails() {
    when(embeddingService.embed(passage))
        .thenThrow(new ProviderFailureException("openai", "timeout"));
    when(embeddingService.embedQuery(QUERY))
        .thenThrow(new ProviderFailureException("openai", "quota exceeded"));

    RetrievalResult result = retriever.hyde(QUERY, SCOPE, 5);

    assertThat(result.status()).isEqualTo(RetrievalStatus.ERROR);
    assertThat(result.message()).startsWith("Both HyDE and fallback failed: ");
    assertThat(result.chunks()).isEmpty();
  }

  @Test
  @DisplayName("Should return an error when neither branch finds anything")
  void shouldReturnErrorWhenNothingFound() {
    when(embeddingService.embed(passage)).thenReturn(PASSAGE_VECTOR);
    when(embeddingService.embedQuery(QUERY)).thenReturn(QUERY_VECTOR);
    when(vectorStore.search(PASSAGE_VECTOR, SCOPE, ChunkFilter.none(), 5, null))
        .thenReturn(List.of());
    when(vectorStore.search(QUERY_VECTOR, SCOPE, ChunkFilter.none(), 2, null))
        .thenReturn(List.of());

    RetrievalResult result = retriever.hyde(QUERY, SCOPE, 5);

    assertThat(result.isError()).isTrue();
    assertThat(result.message()).isEqualTo("No relevant content found in biology.pdf");
  }

  @Test
  @DisplayName("Should reject a blank query without searching")
  void shouldRejectBlankQuery() {
    RetrievalResult result = retriever.hyde("  ", SCOPE, 5);

    assertThat(result.isError()).isTrue();
    verifyNoInteractions(embeddingService, vectorStore);
  }

  @ParameterizedTest(name = "topK={0}")
  @ValueSource(ints = {0, -1})
  @DisplayName("Should reject a topK below one without searching")
  void shouldRejectNonPositiveTopK(int topK) {
    RetrievalResult result = retriever.hyde(QUERY, SCOPE, topK);

    assertThat(result.isError()).isTrue();
    assertThat(result.message()).isEqualTo("topK must be at least 1");
    verifyNoInteractions(embeddingService, vectorStore);
  }

  @Test
  @DisplayName("Should fall back to a plain search when the retrieval pool is saturated")
  void shouldFallBackWhenPoolRejectsBranches() {
    RagConfig ragConfig = new RagConfig();
    HydeRetriever saturated =
        new HydeRetriever(
            embeddingService,
            vectorStore,
            AdvancedTestSupport.rejectingExecutor(ragConfig, meterRegistry),
            new ContextBuilder(),
            ragConfig,
            meterRegistry);
    when(embeddingService.embedQuery(QUERY)).thenReturn(QUERY_VECTOR);
    when(vectorStore.search(QUERY_VECTOR, SCOPE, ChunkFilter.none(), 5, null))
        .thenReturn(List.of(chunk(30, "It occurs in the mitochondria.", 0.75)));

    RetrievalResult result = saturated.hyde(QUERY, SCOPE, 5);

    assertThat(result.status()).isEqualTo(RetrievalStatus.FALLBACK);
    assertThat(result.numChunks()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should never return more than topK chunks")
  void shouldTrimToTopK() {
    when(embeddingService.embed(anyString())).thenReturn(PASSAGE_VECTOR);
    when(embeddingService.embedQuery(QUERY)).thenReturn(QUERY_VECTOR);
    when(vectorStore.search(PASSAGE_VECTOR, SCOPE, ChunkFilter.none(), 2, null))
        .thenReturn(List.of(chunk(1, "First.", 0.9), chunk(2, "Second.", 0.8)));
    when(vectorStore.search(QUERY_VECTOR, SCOPE, ChunkFilter.none(), 1, null))
        .thenReturn(List.of(chunk(3, "Third.", 0.7)));

    RetrievalResult result = retriever.hyde(QUERY, SCOPE, 2);

    assertThat(result.numChunks()).isEqualTo(2);
  }
}
