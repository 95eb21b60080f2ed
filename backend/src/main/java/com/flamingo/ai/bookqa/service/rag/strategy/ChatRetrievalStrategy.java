package com.flamingo.ai.bookqa.service.rag.strategy;

import com.flamingo.ai.bookqa.config.RagConfig;
import com.flamingo.ai.bookqa.domain.enums.UseCase;
import com.flamingo.ai.bookqa.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.bookqa.service.rag.model.ChunkFilter;
import com.flamingo.ai.bookqa.service.rag.model.QueryMetadata.Extracted;
import com.flamingo.ai.bookqa.service.rag.model.RetrievalResult;
import com.flamingo.ai.bookqa.service.rag.model.RetrievedChunk;
import com.flamingo.ai.bookqa.service.rag.rerank.DiversityReranker;
import com.flamingo.ai.bookqa.service.rag.store.VectorStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Chat strategy: broad semantic search, reranked for the best few passages.
 *
 * <p>A chapter filter is used only when the query names a chapter with very high confidence, and
 * is dropped again when it yields nothing.
 */
@Service
@Slf4j
public class ChatRetrievalStrategy extends AbstractRetrievalStrategy {

  private final DiversityReranker reranker;

  public ChatRetrievalStrategy(
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
    return UseCase.CHAT;
  }

  @Override
  protected RetrievalResult doRetrieve(RetrievalRequest request) {
    RagConfig.Retrieval.Chat config = ragConfig.getRetrieval().getChat();
    int candidates = request.topK() * config.getCandidateMultiplier();

    ChunkFilter filter = ChunkFilter.none();
    Extracted<Integer> chapter = request.metadata().chapter();
    if (chapter.isConfidentAbove(config.getChapterConfidence())) {
      filter = filter.withChapter(chapter.value());
    }

    List<Float> queryVector = embeddingService.embedQuery(request.query());
    List<RetrievedChunk> results =
        vectorStore.search(queryVector, request.scope(), filter, candidates, null);

    boolean relaxed = false;
    if (results.isEmpty() && !filter.hasNoMetadataRestriction()) {
      log.info("No chat results within {}, retrying without filter", filter);
      results =
          vectorStore.search(queryVector, request.scope(), ChunkFilter.none(), candidates, null);
      relaxed = true;
    }
    if (results.isEmpty()) {
      return RetrievalResult.error(
          strategyName(), "No relevant content found in " + request.scope().documentName());
    }

    List<RetrievedChunk> reranked = reranker.rerank(results, request.query(), request.topK());
    String context = contextBuilder.conversational(reranked);
    String message = retrievedMessage(reranked.size());
    return relaxed
        ? RetrievalResult.fallback(strategyName(), reranked, context, message)
        : RetrievalResult.success(strategyName(), reranked, context, message);
  }
}
