package com.flamingo.ai.bookqa.service.rag.advanced;

import com.flamingo.ai.bookqa.config.RagConfig;
import com.flamingo.ai.bookqa.domain.enums.ChunkSource;
import com.flamingo.ai.bookqa.domain.enums.ContentDifficulty;
import com.flamingo.ai.bookqa.domain.enums.RetrievalStatus;
import com.flamingo.ai.bookqa.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.bookqa.service.rag.model.ChunkFilter;
import com.flamingo.ai.bookqa.service.rag.model.DocumentScope;
import com.flamingo.ai.bookqa.service.rag.model.RetrievalResult;
import com.flamingo.ai.bookqa.service.rag.model.RetrievedChunk;
import com.flamingo.ai.bookqa.service.rag.rerank.DiversityReranker;
import com.flamingo.ai.bookqa.service.rag.store.VectorStore;
import com.flamingo.ai.bookqa.service.rag.strategy.ContextBuilder;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Retrieval tuned for question generation.
 *
 * <p>Combines query decomposition, multi-query search, HyDE and density-aware reranking to collect
 * a broad, information-rich set of passages about a topic.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdvancedRetrievalService {

  static final String STRATEGY = "advanced_rag";

  private static final int CONTEXT_CHUNK_LIMIT = 20;

  private final QueryDecomposer queryDecomposer;
  private final MultiQueryRetriever multiQueryRetriever;
  private final HydeRetriever hydeRetriever;
  private final DiversityReranker reranker;
  private final EmbeddingService embeddingService;
  private final VectorStore vectorStore;
  private final ContextBuilder contextBuilder;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Collects passages to generate questions from.
   *
   * <p>The first few subtopics of the query are each searched with several phrasings. When that
   * finds nothing a plain search is used instead and the result is marked as a fallback.
   *
   * @param query the topic or query
   * @param scope the document and user to search
   * @param numQuestions number of questions that will be generated
   * @return reranked chunks tagged {@link ChunkSource#ADVANCED_RAG}
   */
  @Timed(value = "rag.advanced.retrieve", description = "Time to retrieve for questions")
  public RetrievalResult retrieveForQuestions(
      String query, DocumentScope scope, int numQuestions) {
    if (query == null || query.isBlank()) {
      return RetrievalResult.error(STRATEGY, "Query must not be empty");
    }
    RagConfig.AdvancedRag config = ragConfig.getAdvancedRag();
    int chunksNeeded = Math.max(numQuestions, config.getMinQuestionChunks());

    try {
      List<String> subtopics =
          queryDecomposer.decompose(query).stream().limit(config.getMaxSubtopics()).toList();
      List<RetrievedChunk> collected = new ArrayList<>();
      for (String subtopic : subtopics) {
        collected.addAll(
            multiQueryRetriever.multiQuery(
                subtopic, scope, config.getVariantsPerSubtopic(), config.getChunksPerVariant()));
      }
      collected =
          PrefixDeduplicator.deduplicate(
              collected, ragConfig.getMultiQuery().getDedupPrefixChars());

      if (collected.isEmpty()) {
        log.warn("No chunks from multi-query retrieval, falling back to basic retrieval");
        return basicRetrieval(query, scope);
      }

      List<RetrievedChunk> reranked =
          reranker.rerank(collected, query, chunksNeeded).stream()
              .map(chunk -> chunk.toBuilder().source(ChunkSource.ADVANCED_RAG).build())
              .toList();
      log.info(
          "Advanced retrieval completed with {} chunks (avg density {})",
          reranked.size(),
          averageDensity(reranked));
      meterRegistry.counter("rag.retrieval.success", "strategy", STRATEGY).increment();
      return RetrievalResult.success(
          STRATEGY,
          reranked,
          contextBuilder.withDensity(reranked),
          "Retrieved " + reranked.size() + " high-quality chunks using advanced RAG");
    } catch (RuntimeException e) {
      log.error("Advanced retrieval failed: {}", e.getMessage(), e);
      meterRegistry.counter("rag.retrieval.failure", "strategy", STRATEGY).increment();
      return RetrievalResult.error(STRATEGY, "Advanced retrieval failed: " + e.getMessage());
    }
  }

  /**
   * Builds the full question-generation context for a topic from HyDE and advanced retrieval.
   *
   * @param topic the topic
   * @param scope the document and user to search
   * @param numQuestions number of questions that will be generated
   * @return the combined context with source counts and a difficulty analysis
   */
  @Timed(value = "rag.advanced.questionContext", description = "Time to build question context")
  public QuestionContext buildQuestionContext(
      String topic, DocumentScope scope, int numQuestions) {
    RagConfig.AdvancedRag config = ragConfig.getAdvancedRag();
    RetrievalResult hyde = hydeRetriever.hyde(topic, scope, config.getHydeChunks());
    RetrievalResult advanced = retrieveForQuestions(topic, scope, numQuestions);

    List<RetrievedChunk> combined = new ArrayList<>();
    hyde.chunks()
        .forEach(chunk -> combined.add(chunk.toBuilder().source(ChunkSource.HYDE).build()));
    advanced
        .chunks()
        .forEach(
            chunk -> combined.add(chunk.toBuilder().source(ChunkSource.ADVANCED_RAG).build()));
    List<RetrievedChunk> unique =
        PrefixDeduplicator.deduplicate(combined, ragConfig.getMultiQuery().getDedupPrefixChars());

    if (unique.isEmpty()) {
      return new QuestionContext(
          RetrievalStatus.ERROR,
          List.of(),
          "",
          0,
          0,
          0.0,
          0.0,
          analyzeDifficulty(List.of()),
          "No content found for '" + topic + "': " + advanced.message());
    }

    int limit = Math.min(numQuestions + 10, config.getMaxCombinedChunks());
    List<RetrievedChunk> reranked = reranker.rerank(unique, topic, limit);
    int hydeCount = countSource(reranked, ChunkSource.HYDE);
    int advancedCount = countSource(reranked, ChunkSource.ADVANCED_RAG);
    double averageRelevance =
        reranked.stream()
            .mapToDouble(c -> c.getCompositeScore() != null ? c.getCompositeScore() : 0.0)
            .average()
            .orElse(0.0);

    log.info(
        "Question context for '{}' built from {} chunks ({} HyDE, {} advanced)",
        topic,
        reranked.size(),
        hydeCount,
        advancedCount);
    return new QuestionContext(
        RetrievalStatus.SUCCESS,
        reranked,
        contextBuilder.withSource(reranked, CONTEXT_CHUNK_LIMIT),
        hydeCount,
        advancedCount,
        averageRelevance,
        averageDensity(reranked),
        analyzeDifficulty(reranked),
        "Prepared " + reranked.size() + " chunks for question generation");
  }

  /**
   * Estimates how demanding a set of passages is from their density and length.
   *
   * @param chunks the passages
   * @return the analysis; medium with no levels when there are no passages
   */
  public DifficultyAnalysis analyzeDifficulty(List<RetrievedChunk> chunks) {
    if (chunks.isEmpty()) {
      return new DifficultyAnalysis(ContentDifficulty.MEDIUM, List.of(), 0.0, 0.0);
    }
    double density =
        chunks.stream()
            .mapToDouble(c -> reranker.calculateDensity(c.getText()))
            .average()
            .orElse(0);
    double length =
        chunks.stream()
            .mapToInt(c -> c.getText() == null ? 0 : c.getText().length())
            .average()
            .orElse(0);

    if (density > 3.0 && length > 500) {
      return new DifficultyAnalysis(
          ContentDifficulty.ADVANCED,
          List.of("Analyzing", "Evaluating", "Creating"),
          density,
          length);
    }
    if (density > 2.0) {
      return new DifficultyAnalysis(
          ContentDifficulty.MEDIUM,
          List.of("Understanding", "Applying", "Analyzing"),
          density,
          length);
    }
    return new DifficultyAnalysis(
        ContentDifficulty.BASIC, List.of("Remembering", "Understanding"), density, length);
  }

  private RetrievalResult basicRetrieval(String query, DocumentScope scope) {
    List<Float> vector = embeddingService.embedQuery(query);
    int limit = ragConfig.getAdvancedRag().getFallbackChunks();
    List<RetrievedChunk> chunks =
        vectorStore.search(vector, scope, ChunkFilter.none(), limit, null);
    if (chunks.isEmpty()) {
      return RetrievalResult.error(
          STRATEGY, "No relevant content found in " + scope.documentName());
    }
    meterRegistry.counter("rag.retrieval.fallback", "strategy", STRATEGY).increment();
    return RetrievalResult.fallback(
        STRATEGY,
        chunks,
        contextBuilder.conversational(chunks),
        "Retrieved " + chunks.size() + " chunks using basic retrieval");
  }

  private double averageDensity(List<RetrievedChunk> chunks) {
    return chunks.stream()
        .mapToDouble(c -> c.getDensityScore() != null ? c.getDensityScore() : 0.0)
        .average()
        .orElse(0.0);
  }

  private static int countSource(List<RetrievedChunk> chunks, ChunkSource source) {
    return (int) chunks.stream().filter(c -> c.getSource() == source).count();
  }
}
