package com.flamingo.ai.bookqa.service.rag.strategy;

import com.flamingo.ai.bookqa.config.RagConfig;
import com.flamingo.ai.bookqa.domain.enums.UseCase;
import com.flamingo.ai.bookqa.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.bookqa.service.rag.model.ChunkFilter;
import com.flamingo.ai.bookqa.service.rag.model.QueryMetadata;
import com.flamingo.ai.bookqa.service.rag.model.RetrievalResult;
import com.flamingo.ai.bookqa.service.rag.model.RetrievedChunk;
import com.flamingo.ai.bookqa.service.rag.store.VectorStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Notes strategy: complete coverage of a chapter or section, grouped by section.
 *
 * <p>With a chapter or section filter every matching chunk is read by metadata alone. Results are
 * never reranked because notes follow the order of the book.
 */
@Service
@Slf4j
public class NotesRetrievalStrategy extends AbstractRetrievalStrategy {

  static final String DEFAULT_SECTION = "General";

  public NotesRetrievalStrategy(
      EmbeddingService embeddingService,
      VectorStore vectorStore,
      ContextBuilder contextBuilder,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    super(embeddingService, vectorStore, contextBuilder, ragConfig, meterRegistry);
  }

  @Override
  public UseCase useCase() {
    return UseCase.NOTES;
  }

  @Override
  protected RetrievalResult doRetrieve(RetrievalRequest request) {
    RagConfig.Retrieval.Notes config = ragConfig.getRetrieval().getNotes();
    QueryMetadata metadata = request.metadata();

    ChunkFilter filter = ChunkFilter.none();
    if (metadata.chapter().isConfidentAbove(config.getChapterConfidence())) {
      filter = filter.withChapter(metadata.chapter().value());
    } else if (metadata.section().isConfidentAbove(config.getSectionConfidence())) {
      filter = filter.withSection(metadata.section().value());
    }

    List<RetrievedChunk> chunks = List.of();
    boolean relaxed = false;
    if (!filter.hasNoMetadataRestriction()) {
      chunks = vectorStore.getByFilter(request.scope(), filter, config.getMaxChunks());
      if (chunks.isEmpty()) {
        log.info("No chunks within {}, falling back to semantic search", filter);
        relaxed = true;
      }
    }
    if (chunks.isEmpty()) {
      int limit = Math.max(request.requirements().numChunks(), request.topK());
      List<Float> queryVector = embeddingService.embedQuery(request.query());
      chunks = vectorStore.search(queryVector, request.scope(), ChunkFilter.none(), limit, null);
    }
    if (chunks.isEmpty()) {
      return RetrievalResult.error(
          strategyName(), "No content found for notes in " + request.scope().documentName());
    }

    List<RetrievedChunk> ordered = new ArrayList<>(chunks);
    ordered.sort(Comparator.comparingInt(RetrievedChunk::getSequentialId));
    Map<String, List<RetrievedChunk>> sections = groupBySection(ordered);

    String context = contextBuilder.hierarchical(sections);
    String message =
        "Retrieved "
            + ordered.size()
            + " chunks in "
            + sections.size()
            + " sections using NOTES strategy";
    return relaxed
        ? RetrievalResult.fallback(strategyName(), ordered, context, message)
        : RetrievalResult.success(strategyName(), ordered, context, message);
  }

  private static Map<String, List<RetrievedChunk>> groupBySection(List<RetrievedChunk> chunks) {
    Map<String, List<RetrievedChunk>> sections = new LinkedHashMap<>();
    for (RetrievedChunk chunk : chunks) {
      String section = chunk.getMetadata().sectionNumber();
      sections
          .computeIfAbsent(section != null ? section : DEFAULT_SECTION, key -> new ArrayList<>())
          .add(chunk);
    }
    return sections;
  }
}
