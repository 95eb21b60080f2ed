package com.flamingo.ai.bookqa.service.rag.embedding;

import com.flamingo.ai.bookqa.exception.ProviderFailureException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Generates text embeddings through the configured LangChain4j {@link EmbeddingModel}.
 *
 * <p>Calls are not retried here: quota and rate-limit failures surface as {@link
 * ProviderFailureException} and retrying is left to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; stay well below for dense scripts
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a search query.
   *
   * @param query the query text
   * @return embedding vector
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedTextFallback")
  public List<Float> embedQuery(String query) {
    return embedSingle(query, "query");
  }

  /**
   * Embeds a passage, such as a document chunk or a hypothetical answer.
   *
   * @param text the passage text
   * @return embedding vector
   */
  @Timed(value = "embedding.embed", description = "Time to embed passage")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedTextFallback")
  public List<Float> embed(String text) {
    return embedSingle(text, "passage");
  }

  /**
   * Embeds several passages in one provider call.
   *
   * @param texts the passages to embed
   * @return one vector per input, in input order
   */
  @Timed(value = "embedding.embedBatch", description = "Time to embed batch")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedTextsFallback")
  public List<List<Float>> embedAll(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    List<TextSegment> segments = new ArrayList<>(texts.size());
    for (int i = 0; i < texts.size(); i++) {
      segments.add(TextSegment.from(truncate(texts.get(i), "passage " + i)));
    }

    Response<List<Embedding>> response = embeddingModel.embedAll(segments);
    List<Embedding> embeddings = response.content();
    if (embeddings == null || embeddings.size() != texts.size()) {
      throw new ProviderFailureException(
          "openai",
          String.format(
              "Expected %d embeddings but received %d",
              texts.size(), embeddings == null ? 0 : embeddings.size()));
    }
    meterRegistry.counter("embedding.requests.success", "type", "batch").increment();
    return embeddings.stream().map(Embedding::vectorAsList).toList();
  }

  private List<Float> embedSingle(String text, String type) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Cannot embed empty " + type);
    }
    String input = truncate(text, type);
    log.debug("Embedding {} of {} chars", type, input.length());

    Response<Embedding> response = embeddingModel.embed(input);
    meterRegistry.counter("embedding.requests.success", "type", type).increment();
    return response.content().vectorAsList();
  }

  private String truncate(String text, String label) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "{} too long for embedding, truncating from {} chars to {} chars",
        label,
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }

  @SuppressWarnings("unused")
  private List<Float> embedTextFallback(String text, Throwable t) {
    log.error("Embedding failed: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    throw toProviderFailure(t);
  }

  @SuppressWarnings("unused")
  private List<List<Float>> embedTextsFallback(List<String> texts, Throwable t) {
    log.error("Batch embedding of {} passages failed: {}", texts.size(), t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "batch").increment();
    throw toProviderFailure(t);
  }

  private ProviderFailureException toProviderFailure(Throwable t) {
    if (t instanceof ProviderFailureException providerFailure) {
      return providerFailure;
    }
    return new ProviderFailureException(
        "openai", "Embedding provider failed: " + t.getMessage(), t);
  }
}
