package com.flamingo.ai.bookqa.service.rag.strategy;

import static com.flamingo.ai.bookqa.service.rag.strategy.TestRequests.SCOPE;
import static com.flamingo.ai.bookqa.service.rag.strategy.TestRequests.chunk;
import static com.flamingo.ai.bookqa.service.rag.strategy.TestRequests.metadata;
import static com.flamingo.ai.bookqa.service.rag.strategy.TestRequests.noMetadata;
import static com.flamingo.ai.bookqa.service.rag.strategy.TestRequests.request;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.bookqa.config.RagConfig;
import com.flamingo.ai.bookqa.domain.enums.RetrievalStatus;
import com.flamingo.ai.bookqa.domain.enums.UseCase;
import com.flamingo.ai.bookqa.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.bookqa.service.rag.model.ChunkFilter;
import com.flamingo.ai.bookqa.service.rag.model.RetrievalResult;
import com.flamingo.ai.bookqa.service.rag.model.RetrievedChunk;
import com.flamingo.ai.bookqa.service.rag.store.VectorStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotesRetrievalStrategy Tests")
class NotesRetrievalStrategyTest {

  private static final List<Float> VECTOR = List.of(0.1f, 0.2f, 0.3f);

  @Mock private EmbeddingService embeddingService;
  @Mock private VectorStore vectorStore;

  private NotesRetrievalStrategy strategy;

  @BeforeEach
  void setUp() {
    strategy =
        new NotesRetrievalStrategy(
            embeddingService,
            vectorStore,
            new ContextBuilder(),
            new RagConfig(),
            new SimpleMeterRegistry());
    lenient().when(embeddingService.embedQuery(anyString())).thenReturn(VECTOR);
  }

  @Test
  @DisplayName("should read a whole chapter by metadata and group it by section")
  void shouldReadChapterByFilter() {
    when(vectorStore.getByFilter(SCOPE, ChunkFilter.none().withChapter(3), 500))
        .thenReturn(
            List.of(chunk(7, null, "3.2"), chunk(5, null, "3.1"), chunk(6, null, "3.1")));

    RetrievalResult result =
        strategy.retrieve(request(UseCase.NOTES, metadata(3, 0.95, null, 0), 20));

    assertThat(result.status()).isEqualTo(RetrievalStatus.SUCCESS);
    assertThat(result.chunks())
        .extracting(RetrievedChunk::getSequentialId)
        .containsExactly(5, 6, 7);
    assertThat(result.message()).isEqualTo("Retrieved 3 chunks in 2 sections using NOTES strategy");
    assertThat(result.context()).contains("=".repeat(60) + "\n3.1\n" + "=".repeat(60));
    assertThat(result.context().indexOf("\n3.1\n")).isLessThan(result.context().indexOf("\n3.2\n"));
    verify(embeddingService, never()).embedQuery(anyString());
  }

  @Test
  @DisplayName("should filter by section when no chapter is confidently named")
  void shouldReadSectionByFilter() {
    when(vectorStore.getByFilter(SCOPE, ChunkFilter.none().withSection("2.4"), 500))
        .thenReturn(List.of(chunk(11, null, "2.4")));

    RetrievalResult result =
        strategy.retrieve(request(UseCase.NOTES, metadata(2, 0.5, "2.4", 0.9), 20));

    assertThat(result.status()).isEqualTo(RetrievalStatus.SUCCESS);
    assertThat(result.numChunks()).isEqualTo(1);
  }

  @Test
  @DisplayName("should fall back to semantic search when the filter matches nothing")
  void shouldFallBack_whenFilterMatchesNothing() {
    when(vectorStore.getByFilter(SCOPE, ChunkFilter.none().withChapter(9), 500))
        .thenReturn(List.of());
    when(vectorStore.search(VECTOR, SCOPE, ChunkFilter.none(), 20, null))
        .thenReturn(List.of(chunk(3, 0.7), chunk(1, 0.8)));

    RetrievalResult result =
        strategy.retrieve(request(UseCase.NOTES, metadata(9, 0.95, null, 0), 20));

    assertThat(result.status()).isEqualTo(RetrievalStatus.FALLBACK);
    assertThat(result.chunks()).extracting(RetrievedChunk::getSequentialId).containsExactly(1, 3);
    assertThat(result.context()).contains("\nGeneral\n");
  }

  @Test
  @DisplayName("should search semantically without a filter")
  void shouldSearch_whenNoFilter() {
    when(vectorStore.search(VECTOR, SCOPE, ChunkFilter.none(), 20, null))
        .thenReturn(List.of(chunk(2, 0.7)));

    RetrievalResult result = strategy.retrieve(request(UseCase.NOTES, noMetadata(), 20));

    assertThat(result.status()).isEqualTo(RetrievalStatus.SUCCESS);
    verify(vectorStore, never()).getByFilter(any(), any(), anyInt());
  }

  @Test
  @DisplayName("should report an error when the document has nothing to offer")
  void shouldReturnError_whenNothingFound() {
    when(vectorStore.search(any(), any(), any(), anyInt(), any())).thenReturn(List.of());

    RetrievalResult result = strategy.retrieve(request(UseCase.NOTES, noMetadata(), 20));

    assertThat(result.isError()).isTrue();
    assertThat(result.message()).isEqualTo("No content found for notes in physics.pdf");
  }
}
