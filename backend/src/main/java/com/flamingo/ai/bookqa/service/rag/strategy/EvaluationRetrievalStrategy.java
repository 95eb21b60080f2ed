package com.flamingo.ai.bookqa.service.rag.strategy;

import com.flamingo.ai.bookqa.config.RagConfig;
import com.flamingo.ai.bookqa.domain.enums.UseCase;
import com.flamingo.ai.bookqa.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.bookqa.service.rag.model.ChunkFilter;
import com.flamingo.ai.bookqa.service.rag.model.DocumentScope;
import com.flamingo.ai.bookqa.service.rag.model.QueryMetadata;
import com.flamingo.ai.bookqa.service.rag.model.RetrievalResult;
import com.flamingo.ai.bookqa.service.rag.model.RetrievedChunk;
import com.flamingo.ai.bookqa.service.rag.rerank.DiversityReranker;
import com.flamingo.ai.bookqa.service.rag.store.VectorStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Evaluation strategy: precise, thresholded search widened with the surrounding passages.
 *
 * <p>Answers are judged against the exact wording of the source, so hits are expanded with their
 * sequential neighbours and presented in document order.
 */
@Service
@Slf4j
public class EvaluationRetrievalStrategy extends AbstractRetrievalStrategy {

  private final DiversityReranker reranker;

  public EvaluationRetrievalStrategy(
      EmbeddingService embeddingService,
      VectorStore vectorStore,
      ContextBuilder contextBuilder,
      DiversityReranker reranker,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    super(embeddingService, vectorStore, contextBuilder, ragConfig, meterRegistry);
    this.reranker = reranker;
  }

  @Override
  public UseCase useCase() {
    return UseCase.EVALUATION;
  }

  @Override
  protected RetrievalResult doRetrieve(RetrievalRequest request) {
    RagConfig.Retrieval.Evaluation config = ragConfig.getRetrieval().getEvaluation();
    QueryMetadata metadata = request.metadata();

    ChunkFilter filter = ChunkFilter.none();
    if (metadata.chapter().isConfidentAbove(config.getChapterConfidence())) {
      filter = filter.withChapter(metadata.chapter().value());
    }
    if (metadata.section().isConfidentAbove(config.getSectionConfidence())) {
      filter = filter.withSection(metadata.section().value());
    }

    List<Float> queryVector = embeddingService.embedQuery(request.query());
    List<RetrievedChunk> results =
        vectorStore.search(
            queryVector, request.scope(), filter, request.topK(), config.getScoreThreshold());

    boolean relaxed = false;
    if (results.isEmpty()) {
      log.info(
          "No evaluation results above {} within {}, retrying unfiltered at {}",
          config.getScoreThreshold(),
          filter,
          config.getFallbackScoreThreshold());
      results =
          vectorStore.search(
              queryVector,
              request.scope(),
              ChunkFilter.none(),
              request.topK(),
              config.getFallbackScoreThreshold());
      relaxed = true;
    }
    if (results.isEmpty()) {
      return RetrievalResult.error(
          strategyName(),
          "No passages similar enough to evaluate against were found in "
              + request.scope().documentName());
    }

    List<RetrievedChunk> reranked = reranker.rerank(results, request.query(), request.topK());
    List<RetrievedChunk> expanded =
        expandWithNeighbors(request.scope(), reranked, config.getNeighborWindow());

    String context = contextBuilder.detailed(expanded);
    String message = retrievedMessage(expanded.size()) + " (with expansion)";
    return relaxed
        ? RetrievalResult.fallback(strategyName(), expanded, context, message)
        : RetrievalResult.success(strategyName(), expanded, context, message);
  }

  /**
   * Adds up to {@code window} chunks on each side of every hit. Overlapping windows are fetched
   * once; the result is in document order and neighbours are flagged.
   */
  private List<RetrievedChunk> expandWithNeighbors(
      DocumentScope scope, List<RetrievedChunk> hits, int window) {
    Map<Integer, RetrievedChunk> bySequentialId = new TreeMap<>();
    hits.forEach(hit -> bySequentialId.put(hit.getSequentialId(), hit));
    if (window <= 0) {
      return new ArrayList<>(bySequentialId.values());
    }

    for (int[] range : mergedRanges(bySequentialId.keySet().stream().toList(), window)) {
      int limit = range[1] - range[0] + 1;
      for (RetrievedChunk neighbor :
          vectorStore.getByFilter(scope, ChunkFilter.range(range[0], range[1]), limit)) {
        bySequentialId.putIfAbsent(
            neighbor.getSequentialId(), neighbor.toBuilder().neighbor(true).build());
      }
    }
    List<RetrievedChunk> expanded = new ArrayList<>(bySequentialId.values());
    expanded.sort(Comparator.comparingInt(RetrievedChunk::getSequentialId));
    log.debug("Expanded {} hits to {} chunks (window={})", hits.size(), expanded.size(), window);
    return expanded;
  }

  private static List<int[]> mergedRanges(List<Integer> sortedIds, int window) {
    List<int[]> ranges = new ArrayList<>();
    for (int id : sortedIds) {
      int low = Math.max(0, id - window);
      int high = id + window;
      if (!ranges.isEmpty() && low <= ranges.get(ranges.size() - 1)[1] + 1) {
        ranges.get(ranges.size() - 1)[1] = high;
      } else {
        ranges.add(new int[] {low, high});
      }
    }
    return ranges;
  }
}
