package com.flamingo.ai.bookqa.service.rag.strategy;

import com.flamingo.ai.bookqa.config.RagConfig;
import com.flamingo.ai.bookqa.exception.ProviderFailureException;
import com.flamingo.ai.bookqa.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.bookqa.service.rag.model.RetrievalResult;
import com.flamingo.ai.bookqa.service.rag.store.VectorStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for retrieval strategies.
 *
 * <p>Wraps {@link #doRetrieve(RetrievalRequest)} so that provider failures and unexpected runtime
 * failures become an error result named after the use-case. Subclasses only describe the happy
 * path and the expected empty outcomes.
 */
@Slf4j
public abstract class AbstractRetrievalStrategy implements RetrievalStrategy {

  protected final EmbeddingService embeddingService;
  protected final VectorStore vectorStore;
  protected final ContextBuilder contextBuilder;
  protected final RagConfig ragConfig;
  protected final MeterRegistry meterRegistry;

  protected AbstractRetrievalStrategy(
      EmbeddingService embeddingService,
      VectorStore vectorStore,
      ContextBuilder contextBuilder,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    this.embeddingService = embeddingService;
    this.vectorStore = vectorStore;
    this.contextBuilder = contextBuilder;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Runs the strategy for one request.
   *
   * @param request the resolved request
   * @return the result of the retrieval
   */
  protected abstract RetrievalResult doRetrieve(RetrievalRequest request);

  @Override
  public final RetrievalResult retrieve(RetrievalRequest request) {
    String strategy = strategyName();
    log.info(
        "Using {} retrieval strategy for {} (topK={})",
        useCase().name(),
        request.scope(),
        request.topK());
    try {
      RetrievalResult result = doRetrieve(request);
      String outcome = result.status().name().toLowerCase(Locale.ROOT);
      meterRegistry.counter("rag.retrieval." + outcome, "strategy", strategy).increment();
      log.info(
          "{} strategy finished with status {} and {} chunks",
          useCase().name(),
          result.status(),
          result.numChunks());
      return result;
    } catch (ProviderFailureException e) {
      log.error(
          "{} strategy failed, provider {} unavailable: {}",
          useCase().name(),
          e.getProvider(),
          e.getMessage());
      return failure(strategy, e);
    } catch (RuntimeException e) {
      log.error("{} strategy failed: {}", useCase().name(), e.getMessage(), e);
      return failure(strategy, e);
    }
  }

  /** Name reported in results and metrics, e.g. {@code qa_generation}. */
  protected String strategyName() {
    return useCase().getValue();
  }

  /** Message used for successful and fallback results. */
  protected String retrievedMessage(int count) {
    return "Retrieved " + count + " chunks using " + useCase().name() + " strategy";
  }

  private RetrievalResult failure(String strategy, RuntimeException e) {
    meterRegistry.counter("rag.retrieval.failure", "strategy", strategy).increment();
    return RetrievalResult.error(
        strategy, useCase().name() + " strategy failed: " + e.getMessage());
  }
}
