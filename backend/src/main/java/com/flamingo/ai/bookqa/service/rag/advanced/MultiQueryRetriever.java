package com.flamingo.ai.bookqa.service.rag.advanced;

import com.flamingo.ai.bookqa.config.RagConfig;
import com.flamingo.ai.bookqa.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.bookqa.service.rag.model.ChunkFilter;
import com.flamingo.ai.bookqa.service.rag.model.DocumentScope;
import com.flamingo.ai.bookqa.service.rag.model.RetrievedChunk;
import com.flamingo.ai.bookqa.service.rag.store.VectorStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Multi-query retrieval: searches several phrasings of the same query concurrently and merges the
 * results.
 *
 * <p>Variants are generated from fixed templates, so the same query always produces the same
 * searches. A variant that fails is logged and skipped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MultiQueryRetriever {

  private static final List<String> VARIANT_TEMPLATES =
      List.of(
          "%s",
          "Explain the key concepts related to: %s",
          "What are the main points about: %s",
          "Describe the important aspects of: %s",
          "What information is provided about: %s");

  private final EmbeddingService embeddingService;
  private final VectorStore vectorStore;
  private final ConcurrentSearchExecutor searchExecutor;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Generates deterministic rephrasings of a query, the query itself first.
   *
   * @param baseQuery the query to rephrase
   * @param count number of variants wanted, at most five are available
   * @return the variants
   */
  public List<String> generateQueryVariants(String baseQuery, int count) {
    return VARIANT_TEMPLATES.stream()
        .limit(Math.max(count, 0))
        .map(template -> String.format(template, baseQuery))
        .toList();
  }

  /** Multi-query retrieval with the configured number of variants and chunks per variant. */
  public List<RetrievedChunk> multiQuery(String baseQuery, DocumentScope scope) {
    RagConfig.MultiQuery config = ragConfig.getMultiQuery();
    return multiQuery(baseQuery, scope, config.getQueriesToGenerate(), config.getChunksPerQuery());
  }

  /**
   * Searches every variant of a query and merges the results.
   *
   * @param baseQuery the query
   * @param scope the document and user to search
   * @param queriesToGenerate number of variants
   * @param chunksPerQuery results per variant
   * @return unique chunks in variant order; empty when every variant failed or found nothing
   */
  @Timed(value = "rag.multiQuery", description = "Time to run multi-query retrieval")
  public List<RetrievedChunk> multiQuery(
      String baseQuery, DocumentScope scope, int queriesToGenerate, int chunksPerQuery) {
    List<String> variants = generateQueryVariants(baseQuery, queriesToGenerate);
    return searchAll(variants, scope, chunksPerQuery);
  }

  /**
   * Searches each query concurrently and deduplicates the merged results by text prefix.
   *
   * @param queries the queries to search, in priority order
   * @param scope the document and user to search
   * @param chunksPerQuery results per query
   * @return unique chunks, earlier queries first
   */
  public List<RetrievedChunk> searchAll(
      List<String> queries, DocumentScope scope, int chunksPerQuery) {
    List<SearchBranch<List<RetrievedChunk>>> branches = new ArrayList<>(queries.size());
    for (String query : queries) {
      branches.add(
          new SearchBranch<>(
              query,
              () -> {
                List<Float> vector = embeddingService.embedQuery(query);
                return vectorStore.search(vector, scope, ChunkFilter.none(), chunksPerQuery, null);
              }));
    }

    List<RetrievedChunk> merged = new ArrayList<>();
    int failed = 0;
    for (BranchOutcome<List<RetrievedChunk>> outcome : searchExecutor.runAll(branches)) {
      if (outcome.isSuccess()) {
        merged.addAll(outcome.value());
      } else {
        failed++;
        log.warn("Query variant failed: '{}'", abbreviate(outcome.label()));
      }
    }
    if (failed > 0) {
      meterRegistry.counter("rag.multiQuery.variant.failure").increment(failed);
    }

    List<RetrievedChunk> unique =
        PrefixDeduplicator.deduplicate(merged, ragConfig.getMultiQuery().getDedupPrefixChars());
    log.info(
        "Multi-query retrieval found {} unique chunks from {} queries ({} failed)",
        unique.size(),
        queries.size(),
        failed);
    return unique;
  }

  private static String abbreviate(String text) {
    return text.length() <= 30 ? text : text.substring(0, 30) + "...";
  }
}
