package com.flamingo.ai.bookqa.service.rag.advanced;

import com.flamingo.ai.bookqa.config.RagConfig;
import com.flamingo.ai.bookqa.domain.enums.ChunkSource;
import com.flamingo.ai.bookqa.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.bookqa.service.rag.model.ChunkFilter;
import com.flamingo.ai.bookqa.service.rag.model.DocumentScope;
import com.flamingo.ai.bookqa.service.rag.model.RetrievalResult;
import com.flamingo.ai.bookqa.service.rag.model.RetrievedChunk;
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
 * Hypothetical-document retrieval (HyDE).
 *
 * <p>An answer-shaped passage is built from the query and embedded as a passage, which tends to
 * land closer to explanatory text than the bare question. It is searched alongside a regular query
 * search; passage hits are preferred when merging.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HydeRetriever {

  static final String STRATEGY = "hyde";

  private static final String PASSAGE_TEMPLATE =
      "This section explains %1$s. It provides detailed information about the key concepts, "
          + "definitions, examples, and practical applications of %1$s. The text includes "
          + "specific facts, figures, and explanations that help understand %1$s thoroughly. "
          + "It describes the main points, important details, and critical aspects related to "
          + "%1$s.";

  private final EmbeddingService embeddingService;
  private final VectorStore vectorStore;
  private final ConcurrentSearchExecutor searchExecutor;
  private final ContextBuilder contextBuilder;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Builds the hypothetical passage searched in place of the query.
   *
   * @param query the user's query
   * @return an answer-shaped passage mentioning the query
   */
  public String buildHypotheticalPassage(String query) {
    return String.format(PASSAGE_TEMPLATE, query);
  }

  /**
   * Retrieves with the hypothetical passage and the plain query concurrently.
   *
   * <p>If one branch fails the other's results are used. If both fail, a single plain search is
   * attempted and reported as a fallback.
   *
   * @param query the user's query
   * @param scope the document and user to search
   * @param topK number of chunks wanted
   * @return the merged result; HyDE hits first, tagged with their source
   */
  @Timed(value = "rag.hyde", description = "Time to run HyDE retrieval")
  public RetrievalResult hyde(String query, DocumentScope scope, int topK) {
    if (query == null || query.isBlank()) {
      return RetrievalResult.error(STRATEGY, "Query must not be empty");
    }
    if (topK < 1) {
      return RetrievalResult.error(STRATEGY, "topK must be at least 1");
    }
    String passage = buildHypotheticalPassage(query);
    log.debug("Generated hypothetical passage of {} chars", passage.length());
    int regularLimit = Math.max(topK / 2, 1);

    List<SearchBranch<List<RetrievedChunk>>> branches =
        List.of(
            new SearchBranch<>(
                ChunkSource.HYDE.getLabel(),
                () -> search(embeddingService.embed(passage), scope, topK, ChunkSource.HYDE)),
            new SearchBranch<>(
                ChunkSource.REGULAR.getLabel(),
                () ->
                    search(
                        embeddingService.embedQuery(query),
                        scope,
                        regularLimit,
                        ChunkSource.REGULAR)));
    List<BranchOutcome<List<RetrievedChunk>>> outcomes = searchExecutor.runAll(branches);

    if (outcomes.stream().noneMatch(BranchOutcome::isSuccess)) {
      return fallbackSearch(query, scope, topK);
    }

    List<RetrievedChunk> merged = new ArrayList<>();
    for (BranchOutcome<List<RetrievedChunk>> outcome : outcomes) {
      if (outcome.isSuccess()) {
        merged.addAll(outcome.value());
      } else {
        log.warn("HyDE branch {} failed: {}", outcome.label(), outcome.failure().getMessage());
      }
    }
    List<RetrievedChunk> unique =
        PrefixDeduplicator.deduplicate(merged, ragConfig.getMultiQuery().getDedupPrefixChars());
    List<RetrievedChunk> chunks = unique.subList(0, Math.min(topK, unique.size()));

    if (chunks.isEmpty()) {
      return RetrievalResult.error(
          STRATEGY, "No relevant content found in " + scope.documentName());
    }
    meterRegistry.counter("rag.retrieval.success", "strategy", STRATEGY).increment();
    log.info("HyDE combined retrieval: {} unique chunks", chunks.size());
    return RetrievalResult.success(
        STRATEGY,
        chunks,
        contextBuilder.conversational(chunks),
        "Retrieved " + chunks.size() + " chunks using HyDE");
  }

  private RetrievalResult fallbackSearch(String query, DocumentScope scope, int topK) {
    log.warn("Both HyDE branches failed, falling back to a regular search");
    try {
      List<RetrievedChunk> chunks =
          search(embeddingService.embedQuery(query), scope, topK, ChunkSource.REGULAR);
      if (chunks.isEmpty()) {
        return RetrievalResult.error(
            STRATEGY, "No relevant content found in " + scope.documentName());
      }
      meterRegistry.counter("rag.retrieval.fallback", "strategy", STRATEGY).increment();
      return RetrievalResult.fallback(
          STRATEGY,
          chunks,
          contextBuilder.conversational(chunks),
          "Retrieved " + chunks.size() + " chunks using regular search (HyDE failed)");
    } catch (RuntimeException e) {
      log.error("Regular search after HyDE failure also failed: {}", e.getMessage());
      meterRegistry.counter("rag.retrieval.failure", "strategy", STRATEGY).increment();
      return RetrievalResult.error(
          STRATEGY, "Both HyDE and fallback failed: " + e.getMessage());
    }
  }

  private List<RetrievedChunk> search(
      List<Float> vector, DocumentScope scope, int limit, ChunkSource source) {
    return vectorStore.search(vector, scope, ChunkFilter.none(), limit, null).stream()
        .map(chunk -> chunk.toBuilder().source(source).build())
        .toList();
  }
}
