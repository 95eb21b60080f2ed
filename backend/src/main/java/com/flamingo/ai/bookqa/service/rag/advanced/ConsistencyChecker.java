package com.flamingo.ai.bookqa.service.rag.advanced;

import com.flamingo.ai.bookqa.config.RagConfig;
import com.flamingo.ai.bookqa.domain.enums.RetrievalStatus;
import com.flamingo.ai.bookqa.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.bookqa.service.rag.model.ChunkFilter;
import com.flamingo.ai.bookqa.service.rag.model.DocumentScope;
import com.flamingo.ai.bookqa.service.rag.model.RetrievedChunk;
import com.flamingo.ai.bookqa.service.rag.store.VectorStore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Self-consistency check: searches a question under several phrasings and scores each chunk by
 * how many phrasings found it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConsistencyChecker {

  private static final List<String> PHRASINGS =
      List.of("%s", "Information about: %s", "Explain: %s");

  private final EmbeddingService embeddingService;
  private final VectorStore vectorStore;
  private final ConcurrentSearchExecutor searchExecutor;
  private final RagConfig ragConfig;

  /** Consistency check with the configured number of samples. */
  public ConsistencyResult checkConsistency(String question, DocumentScope scope) {
    return checkConsistency(question, scope, ragConfig.getAdvancedRag().getConsistencySamples());
  }

  /**
   * Runs the consistency check.
   *
   * @param question the question
   * @param scope the document and user to search
   * @param samples number of phrasings to search, at most three are available
   * @return chunks sorted by consistency; {@code ERROR} when every phrasing failed
   */
  public ConsistencyResult checkConsistency(String question, DocumentScope scope, int samples) {
    int limit = ragConfig.getAdvancedRag().getConsistencyChunksPerSample();
    List<SearchBranch<List<RetrievedChunk>>> branches = new ArrayList<>();
    int phrasings = Math.max(0, Math.min(samples, PHRASINGS.size()));
    for (String phrasing : PHRASINGS.subList(0, phrasings)) {
      String variant = String.format(phrasing, question);
      branches.add(
          new SearchBranch<>(
              variant,
              () -> {
                List<Float> vector = embeddingService.embedQuery(variant);
                return vectorStore.search(vector, scope, ChunkFilter.none(), limit, null);
              }));
    }

    List<List<RetrievedChunk>> retrievals = new ArrayList<>();
    for (BranchOutcome<List<RetrievedChunk>> outcome : searchExecutor.runAll(branches)) {
      if (outcome.isSuccess()) {
        retrievals.add(outcome.value());
      } else {
        log.warn("Consistency check retrieval failed for '{}'", outcome.label());
      }
    }
    if (retrievals.isEmpty()) {
      return new ConsistencyResult(
          RetrievalStatus.ERROR, List.of(), 0.0, 0, "All retrieval attempts failed");
    }

    int prefixChars = ragConfig.getMultiQuery().getDedupPrefixChars();
    Map<String, RetrievedChunk> firstSeen = new LinkedHashMap<>();
    Map<String, Integer> frequency = new LinkedHashMap<>();
    for (List<RetrievedChunk> retrieval : retrievals) {
      Set<String> seenInRetrieval = new HashSet<>();
      for (RetrievedChunk chunk : retrieval) {
        String key = chunk.textPrefix(prefixChars);
        if (seenInRetrieval.add(key)) {
          frequency.merge(key, 1, Integer::sum);
          firstSeen.putIfAbsent(key, chunk);
        }
      }
    }

    int sampleCount = branches.size();
    List<RetrievedChunk> scored = new ArrayList<>();
    for (Map.Entry<String, RetrievedChunk> entry : firstSeen.entrySet()) {
      double consistency = (double) frequency.get(entry.getKey()) / sampleCount;
      scored.add(entry.getValue().toBuilder().consistencyScore(consistency).build());
    }
    scored.sort(Comparator.comparingDouble(RetrievedChunk::getConsistencyScore).reversed());

    double average =
        scored.stream().mapToDouble(RetrievedChunk::getConsistencyScore).average().orElse(0.0);
    log.info("Consistency check found {} chunks (avg consistency {})", scored.size(), average);
    return new ConsistencyResult(
        RetrievalStatus.SUCCESS,
        scored,
        average,
        retrievals.size(),
        "Found "
            + scored.size()
            + " consistent chunks across "
            + retrievals.size()
            + " retrievals");
  }
}
