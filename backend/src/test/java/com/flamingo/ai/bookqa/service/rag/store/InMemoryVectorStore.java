package com.flamingo.ai.bookqa.service.rag.store;

import com.flamingo.ai.bookqa.service.rag.model.ChunkFilter;
import com.flamingo.ai.bookqa.service.rag.model.DocumentScope;
import com.flamingo.ai.bookqa.service.rag.model.IndexedChunk;
import com.flamingo.ai.bookqa.service.rag.model.RetrievedChunk;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/** Map-backed {@link VectorStore} for tests, ranking by plain cosine similarity. */
public class InMemoryVectorStore implements VectorStore {

  private final Map<DocumentScope, TreeMap<Integer, IndexedChunk>> chunksByScope =
      new ConcurrentHashMap<>();

  @Override
  public List<RetrievedChunk> search(
      List<Float> queryVector,
      DocumentScope scope,
      ChunkFilter filter,
      int limit,
      Double scoreThreshold) {
    List<RetrievedChunk> results = new ArrayList<>();
    for (IndexedChunk chunk : chunksByScope.getOrDefault(scope, new TreeMap<>()).values()) {
      if (!filter.matches(chunk.chunk().sequentialId(), chunk.metadata())) {
        continue;
      }
      double similarity = cosine(queryVector, chunk.embedding());
      if (scoreThreshold != null && similarity < scoreThreshold) {
        continue;
      }
      results.add(toRetrieved(chunk, similarity));
    }
    results.sort(Comparator.comparingDouble(RetrievedChunk::getScore).reversed());
    return results.stream().limit(Math.max(limit, 0)).toList();
  }

  @Override
  public List<RetrievedChunk> getByFilter(DocumentScope scope, ChunkFilter filter, int limit) {
    return chunksByScope.getOrDefault(scope, new TreeMap<>()).values().stream()
        .filter(chunk -> filter.matches(chunk.chunk().sequentialId(), chunk.metadata()))
        .limit(Math.max(limit, 0))
        .map(chunk -> toRetrieved(chunk, null))
        .toList();
  }

  @Override
  public void upsert(List<IndexedChunk> chunks, DocumentScope scope) {
    TreeMap<Integer, IndexedChunk> stored =
        chunksByScope.computeIfAbsent(scope, key -> new TreeMap<>());
    chunks.forEach(chunk -> stored.put(chunk.chunk().sequentialId(), chunk));
  }

  @Override
  public void delete(DocumentScope scope) {
    chunksByScope.remove(scope);
  }

  @Override
  public boolean exists(DocumentScope scope) {
    return !chunksByScope.getOrDefault(scope, new TreeMap<>()).isEmpty();
  }

  @Override
  public Optional<String> findDocumentByContentHash(String userToken, String contentHash) {
    return chunksByScope.entrySet().stream()
        .filter(entry -> entry.getKey().userToken().equals(userToken))
        .filter(
            entry ->
                entry.getValue().values().stream()
                    .anyMatch(chunk -> contentHash.equals(chunk.contentHash())))
        .map(entry -> entry.getKey().documentName())
        .findFirst();
  }

  public int size(DocumentScope scope) {
    return chunksByScope.getOrDefault(scope, new TreeMap<>()).size();
  }

  private static RetrievedChunk toRetrieved(IndexedChunk chunk, Double score) {
    return RetrievedChunk.builder()
        .text(chunk.chunk().text())
        .sequentialId(chunk.chunk().sequentialId())
        .documentName(chunk.chunk().documentName())
        .score(score)
        .metadata(chunk.metadata())
        .build();
  }

  private static double cosine(List<Float> a, List<Float> b) {
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
      dot += a.get(i) * b.get(i);
      normA += a.get(i) * a.get(i);
      normB += b.get(i) * b.get(i);
    }
    return normA == 0 || normB == 0 ? 0 : dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }
}
