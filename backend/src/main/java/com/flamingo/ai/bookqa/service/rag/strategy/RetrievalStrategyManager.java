package com.flamingo.ai.bookqa.service.rag.strategy;

import com.flamingo.ai.bookqa.config.RagConfig;
import com.flamingo.ai.bookqa.domain.enums.UseCase;
import com.flamingo.ai.bookqa.service.rag.model.DocumentScope;
import com.flamingo.ai.bookqa.service.rag.model.QueryClassification;
import com.flamingo.ai.bookqa.service.rag.model.QueryMetadata;
import com.flamingo.ai.bookqa.service.rag.model.RetrievalRequirements;
import com.flamingo.ai.bookqa.service.rag.model.RetrievalResult;
import com.flamingo.ai.bookqa.service.rag.query.QueryClassifier;
import com.flamingo.ai.bookqa.service.rag.query.QueryMetadataExtractor;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for retrieval: resolves the use-case and query intent, then dispatches to the
 * matching {@link RetrievalStrategy}.
 *
 * <p>Expected conditions such as empty input, no matches or an unavailable provider come back as
 * an error result. Only programming errors propagate.
 */
@Service
@Slf4j
public class RetrievalStrategyManager {

  static final String NO_STRATEGY = "none";

  private final QueryClassifier queryClassifier;
  private final QueryMetadataExtractor queryMetadataExtractor;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final Map<UseCase, RetrievalStrategy> strategies;

  public RetrievalStrategyManager(
      QueryClassifier queryClassifier,
      QueryMetadataExtractor queryMetadataExtractor,
      List<RetrievalStrategy> strategyBeans,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    this.queryClassifier = queryClassifier;
    this.queryMetadataExtractor = queryMetadataExtractor;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    this.strategies = new EnumMap<>(UseCase.class);
    for (RetrievalStrategy strategy : strategyBeans) {
      RetrievalStrategy previous = strategies.put(strategy.useCase(), strategy);
      if (previous != null) {
        throw new IllegalStateException(
            "Multiple retrieval strategies registered for " + strategy.useCase());
      }
    }
    log.info("Registered retrieval strategies: {}", strategies.keySet());
  }

  /** Retrieves with an auto-detected use-case and the default top-K. */
  public RetrievalResult retrieve(String query, String token, String filename) {
    return retrieve(query, token, filename, null, null);
  }

  /**
   * Retrieves the chunks of one document that best serve a query.
   *
   * @param query the user's query
   * @param token the user token that owns the document
   * @param filename the document name
   * @param useCase explicit use-case such as {@code "notes"}; classified from the query when null
   *     or unknown
   * @param topK number of chunks wanted; the configured default when null or not positive
   * @return the result, never null
   */
  @Timed(value = "rag.retrieve", description = "Time to serve a retrieval request")
  public RetrievalResult retrieve(
      String query, String token, String filename, String useCase, Integer topK) {
    if (query == null || query.isBlank()) {
      log.warn("Empty query, nothing to retrieve");
      return rejected("Query must not be empty");
    }
    if (token == null || token.isBlank()) {
      log.warn("Retrieval requested without a user token");
      return rejected("User token must not be empty");
    }
    if (filename == null || filename.isBlank()) {
      log.warn("Retrieval requested without a document name");
      return rejected("Document name must not be empty");
    }

    QueryClassification classification = resolveUseCase(query, useCase);
    UseCase resolved = classification.useCase();
    int k = topK == null || topK <= 0 ? ragConfig.getRetrieval().getDefaultTopK() : topK;
    QueryMetadata metadata = queryMetadataExtractor.extractAll(query);
    RetrievalRequirements requirements =
        queryClassifier.extractContextRequirements(query, resolved);

    RetrievalStrategy strategy = strategies.get(resolved);
    if (strategy == null) {
      throw new IllegalStateException("No retrieval strategy registered for " + resolved);
    }

    meterRegistry.counter("rag.retrieve.requests", "useCase", resolved.getValue()).increment();
    RetrievalRequest request =
        new RetrievalRequest(
            query,
            new DocumentScope(filename, token),
            k,
            classification,
            metadata,
            requirements);
    return strategy.retrieve(request);
  }

  private QueryClassification resolveUseCase(String query, String useCase) {
    Optional<UseCase> explicit = UseCase.fromValue(useCase);
    if (explicit.isPresent()) {
      return QueryClassification.explicit(explicit.get());
    }
    if (useCase != null && !useCase.isBlank()) {
      log.warn("Unknown use case '{}', classifying query instead", useCase);
    }
    QueryClassification classification = queryClassifier.classify(query);
    log.info(
        "Auto-detected use case: {} (confidence={}, keywords={})",
        classification.useCase().getValue(),
        classification.confidence(),
        classification.matchedKeywords());
    return classification;
  }

  private RetrievalResult rejected(String message) {
    meterRegistry.counter("rag.retrieve.rejected").increment();
    return RetrievalResult.error(NO_STRATEGY, message);
  }
}
