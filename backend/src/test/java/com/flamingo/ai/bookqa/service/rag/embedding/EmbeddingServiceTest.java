package com.flamingo.ai.bookqa.service.rag.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.bookqa.exception.ProviderFailureException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingService Tests")
class EmbeddingServiceTest {

  @Mock private EmbeddingModel embeddingModel;
  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    lenient().when(meterRegistry.counter(anyString())).thenReturn(counter);
    lenient()
        .when(meterRegistry.counter(anyString(), anyString(), anyString()))
        .thenReturn(counter);

    embeddingService = new EmbeddingService(embeddingModel, meterRegistry);
  }

  @Test
  @DisplayName("Should embed query and count a query request")
  void shouldEmbedQuery() {
    when(embeddingModel.embed("What is entropy?")).thenReturn(createResponse(0.1f, 0.2f, 0.3f));

    List<Float> result = embeddingService.embedQuery("What is entropy?");

    assertThat(result).containsExactly(0.1f, 0.2f, 0.3f);
    verify(meterRegistry).counter("embedding.requests.success", "type", "query");
    verify(counter).increment();
  }

  @Test
  @DisplayName("Should embed passage and count a passage request")
  void shouldEmbedPassage() {
    when(embeddingModel.embed(anyString())).thenReturn(createResponse(0.4f, 0.5f));

    List<Float> result = embeddingService.embed("Entropy measures disorder.");

    assertThat(result).containsExactly(0.4f, 0.5f);
    verify(meterRegistry).counter("embedding.requests.success", "type", "passage");
  }

  @Test
  @DisplayName("Should truncate text longer than 5000 characters")
  void shouldTruncateLongText() {
    when(embeddingModel.embed(anyString())).thenReturn(createResponse(0.1f));
    ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);

    embeddingService.embed("a".repeat(6000));

    verify(embeddingModel).embed(captor.capture());
    assertThat(captor.getValue()).hasSize(5000);
  }

  @Test
  @DisplayName("Should reject blank text without calling the model")
  void shouldRejectBlankText() {
    assertThatThrownBy(() -> embeddingService.embedQuery("   "))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Cannot embed empty query");
    assertThatThrownBy(() -> embeddingService.embed(null))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(embeddingModel);
  }

  @Test
  @DisplayName("Should embed a batch in one call and keep input order")
  void shouldEmbedBatchInOrder() {
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(
            Response.from(
                List.of(Embedding.from(new float[] {0.1f}), Embedding.from(new float[] {0.2f}))));

    List<List<Float>> result = embeddingService.embedAll(List.of("first", "second"));

    assertThat(result).containsExactly(List.of(0.1f), List.of(0.2f));
    verify(meterRegistry).counter("embedding.requests.success", "type", "batch");
  }

  @Test
  @DisplayName("Should truncate long passages in a batch")
  @SuppressWarnings("unchecked")
  void shouldTruncateBatchPassages() {
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(
            Response.from(
                List.of(Embedding.from(new float[] {0.1f}), Embedding.from(new float[] {0.2f}))));
    ArgumentCaptor<List<TextSegment>> captor = ArgumentCaptor.forClass(List.class);

    embeddingService.embedAll(List.of("c".repeat(6000), "short"));

    verify(embeddingModel).embedAll(captor.capture());
    assertThat(captor.getValue().get(0).text()).hasSize(5000);
    assertThat(captor.getValue().get(1).text()).isEqualTo("short");
  }

  @Test
  @DisplayName("Should fail when the provider returns the wrong number of vectors")
  void shouldFailOnCountMismatch() {
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(Response.from(List.of(Embedding.from(new float[] {0.1f}))));

    assertThatThrownBy(() -> embeddingService.embedAll(List.of("one", "two")))
        .isInstanceOf(ProviderFailureException.class)
        .hasMessage("Expected 2 embeddings but received 1");
  }

  @Test
  @DisplayName("Should return an empty list for an empty batch")
  void shouldHandleEmptyBatch() {
    assertThat(embeddingService.embedAll(List.of())).isEmpty();
    verifyNoInteractions(embeddingModel);
  }

  @Test
  @DisplayName("Should handle CJK text")
  void shouldHandleCjkText() {
    when(embeddingModel.embed(anyString())).thenReturn(createResponse(0.3f, 0.4f));

    assertThat(embeddingService.embedQuery("什么是熵？")).containsExactly(0.3f, 0.4f);
  }

  private Response<Embedding> createResponse(float... vector) {
    return Response.from(Embedding.from(vector));
  }
}
