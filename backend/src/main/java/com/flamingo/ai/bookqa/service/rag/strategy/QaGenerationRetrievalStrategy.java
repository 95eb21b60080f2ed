package com.flamingo.ai.bookqa.service.rag.strategy;

import com.flamingo.ai.bookqa.config.RagConfig;
import com.flamingo.ai.bookqa.domain.enums.UseCase;
import com.flamingo.ai.bookqa.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.bookqa.service.rag.model.ChunkFilter;
import com.flamingo.ai.bookqa.service.rag.model.DocumentScope;
import com.flamingo.ai.bookqa.service.rag.model.QueryMetadata;
import com.flamingo.ai.bookqa.service.rag.model.RetrievalResult;
import com.flamingo.ai.bookqa.service.rag.model.RetrievedChunk;
import com.flamingo.ai.bookqa.service.rag.store.VectorStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Question-generation strategy: a contiguous stretch of the requested chapter or topic.
 *
 * <p>Questions must come from one chapter's worth of text, so an empty filtered search is a
 * terminal error rather than a reason to widen the search.
 */
@Service
@Slf4j
public class QaGenerationRetrievalStrategy extends AbstractRetrievalStrategy {

  static final String NO_CONTENT_MESSAGE =
      "No content found matching the criteria. Please check chapter/topic specification.";

  public QaGenerationRetrievalStrategy(
      EmbeddingService embeddingService,
      VectorStore vectorStore,
      ContextBuilder contextBuilder,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    super(embeddingService, vectorStore, contextBuilder, ragConfig, meterRegistry);
  }

  @Override
  public UseCase useCase() {
    return UseCase.QA_GENERATION;
  }

  @Override
  protected RetrievalResult doRetrieve(RetrievalRequest request) {
    RagConfig.Retrieval.QaGeneration config = ragConfig.getRetrieval().getQaGeneration();
    QueryMetadata metadata = request.metadata();

    ChunkFilter filter = ChunkFilter.none();
    if (metadata.chapter().isConfidentAbove(config.getChapterConfidence())) {
      filter = filter.withChapter(metadata.chapter().value());
    }
    if (metadata.section().isConfidentAbove(config.getSectionConfidence())) {
      filter = filter.withSection(metadata.section().value());
    }
    int target = Math.max(request.requirements().numChunks(), request.topK());

    List<Float> queryVector = embeddingService.embedQuery(request.query());
    List<RetrievedChunk> hits =
        vectorStore.search(queryVector, request.scope(), filter, target, null);
    if (hits.isEmpty()) {
      log.warn("No content for question generation within {} in {}", filter, request.scope());
      return RetrievalResult.error(strategyName(), NO_CONTENT_MESSAGE);
    }

    List<RetrievedChunk> window = fillWindow(request.scope(), filter, hits, target);
    return RetrievalResult.success(
        strategyName(),
        window,
        contextBuilder.structured(window),
        "Retrieved " + window.size() + " sequential chunks using QA_GENERATION strategy");
  }

  /**
   * Grows the hits into a run of sequential chunks within the same filter. Candidates closest to a
   * hit are taken first; ties go to the earlier chunk.
   */
  private List<RetrievedChunk> fillWindow(
      DocumentScope scope, ChunkFilter filter, List<RetrievedChunk> hits, int target) {
    List<RetrievedChunk> selected = new ArrayList<>(hits);
    if (selected.size() < target) {
      Set<Integer> hitIds = new HashSet<>();
      hits.forEach(hit -> hitIds.add(hit.getSequentialId()));
      int min = hitIds.stream().mapToInt(Integer::intValue).min().orElse(0);
      int max = hitIds.stream().mapToInt(Integer::intValue).max().orElse(0);
      int low = Math.max(0, min - target);
      int high = max + target;

      List<RetrievedChunk> candidates =
          new ArrayList<>(
              vectorStore.getByFilter(scope, filter.withRange(low, high), high - low + 1));
      candidates.removeIf(candidate -> hitIds.contains(candidate.getSequentialId()));
      candidates.sort(
          Comparator.comparingInt((RetrievedChunk c) -> distance(c.getSequentialId(), hitIds))
              .thenComparingInt(RetrievedChunk::getSequentialId));

      for (RetrievedChunk candidate : candidates) {
        if (selected.size() >= target) {
          break;
        }
        selected.add(candidate);
      }
      log.debug("Filled {} hits to {} chunks (target={})", hits.size(), selected.size(), target);
    }
    selected.sort(Comparator.comparingInt(RetrievedChunk::getSequentialId));
    return selected;
  }

  private static int distance(int sequentialId, Set<Integer> hitIds) {
    int best = Integer.MAX_VALUE;
    for (int hitId : hitIds) {
      best = Math.min(best, Math.abs(sequentialId - hitId));
    }
    return best;
  }
}
