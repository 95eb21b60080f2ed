package com.flamingo.ai.bookqa.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.bookqa.domain.enums.ContentType;
import com.flamingo.ai.bookqa.exception.ProviderFailureException;
import com.flamingo.ai.bookqa.service.rag.model.ChunkFilter;
import com.flamingo.ai.bookqa.service.rag.model.ChunkMetadata;
import com.flamingo.ai.bookqa.service.rag.model.DocumentScope;
import com.flamingo.ai.bookqa.service.rag.model.IndexedChunk;
import com.flamingo.ai.bookqa.service.rag.model.RetrievedChunk;
import com.flamingo.ai.bookqa.service.rag.store.VectorStore;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.hash.Hashing;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch index service for {@link BookChunk} documents and the {@link VectorStore} used by
 * retrieval and indexing.
 *
 * <p>Every query is a bool filter on {@code documentName} and {@code userToken}, so no request can
 * reach chunks outside its {@link DocumentScope}. Similarity scores are converted back from the
 * Elasticsearch cosine score {@code (1 + cos) / 2} to the raw cosine before thresholds apply.
 */
@Service
@Slf4j
public class BookChunkIndexService
    extends AbstractElasticsearchIndexService<BookChunk, ChunkQuery> implements VectorStore {

  private static final int MIN_NUM_CANDIDATES = 50;

  @Value("${app.elasticsearch.index-name:book-qa-chunks}")
  private String indexName;

  @Value("${app.elasticsearch.vector-dimensions:1536}")
  private int vectorDimensions;

  @Autowired
  public BookChunkIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  /** Constructor for testing - allows setting index name and vector dimensions. */
  @VisibleForTesting
  public BookChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected int getVectorDimensions() {
    return vectorDimensions;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // scope fields MUST be keyword type for exact matching
    properties.put("documentName", Property.of(p -> p.keyword(k -> k)));
    properties.put("userToken", Property.of(p -> p.keyword(k -> k)));
    properties.put("contentHash", Property.of(p -> p.keyword(k -> k)));
    properties.put("sequentialId", Property.of(p -> p.integer(i -> i)));
    properties.put("content", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));

    // Structural metadata, flattened
    properties.put("chapterNumber", Property.of(p -> p.integer(i -> i)));
    properties.put("chapterTitle", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("sectionNumber", Property.of(p -> p.keyword(k -> k)));
    properties.put("sectionTitle", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("pageNumber", Property.of(p -> p.integer(i -> i)));
    properties.put("contentTypes", Property.of(p -> p.keyword(k -> k)));
    properties.put("primaryContentType", Property.of(p -> p.keyword(k -> k)));
    properties.put("hasHeadings", Property.of(p -> p.boolean_(b -> b)));
    properties.put("minHeadingLevel", Property.of(p -> p.integer(i -> i)));
    properties.put("charCount", Property.of(p -> p.integer(i -> i)));
    properties.put("wordCount", Property.of(p -> p.integer(i -> i)));
    properties.put("sentenceCount", Property.of(p -> p.integer(i -> i)));
    properties.put("hasLists", Property.of(p -> p.boolean_(b -> b)));
    properties.put("hasCode", Property.of(p -> p.boolean_(b -> b)));
    properties.put("hasQuestions", Property.of(p -> p.boolean_(b -> b)));
    properties.put("chunkPosition", Property.of(p -> p.keyword(k -> k)));
    properties.put("isFirst", Property.of(p -> p.boolean_(b -> b)));
    properties.put("isLast", Property.of(p -> p.boolean_(b -> b)));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(BookChunk chunk) {
    Map<String, Object> document = new HashMap<>();
    document.put("documentName", chunk.getDocumentName());
    document.put("userToken", chunk.getUserToken());
    document.put("sequentialId", chunk.getSequentialId());
    document.put("content", chunk.getContent());
    document.put("embedding", chunk.getEmbedding());
    if (chunk.getContentHash() != null) {
      document.put("contentHash", chunk.getContentHash());
    }

    ChunkMetadata metadata = chunk.getMetadata();
    if (metadata.chapterNumber() != null) {
      document.put("chapterNumber", metadata.chapterNumber());
    }
    if (metadata.chapterTitle() != null) {
      document.put("chapterTitle", metadata.chapterTitle());
    }
    if (metadata.sectionNumber() != null) {
      document.put("sectionNumber", metadata.sectionNumber());
    }
    if (metadata.sectionTitle() != null) {
      document.put("sectionTitle", metadata.sectionTitle());
    }
    if (metadata.pageNumber() != null) {
      document.put("pageNumber", metadata.pageNumber());
    }
    if (metadata.minHeadingLevel() != null) {
      document.put("minHeadingLevel", metadata.minHeadingLevel());
    }
    if (metadata.chunkPosition() != null) {
      document.put("chunkPosition", metadata.chunkPosition());
    }
    document.put("contentTypes", metadata.contentTypes().stream().map(Enum::name).toList());
    document.put("primaryContentType", metadata.primaryContentType().name());
    document.put("hasHeadings", metadata.hasHeadings());
    document.put("charCount", metadata.charCount());
    document.put("wordCount", metadata.wordCount());
    document.put("sentenceCount", metadata.sentenceCount());
    document.put("hasLists", metadata.hasLists());
    document.put("hasCode", metadata.hasCode());
    document.put("hasQuestions", metadata.hasQuestions());
    document.put("isFirst", metadata.isFirst());
    document.put("isLast", metadata.isLast());
    return document;
  }

  @Override
  @SuppressWarnings("unchecked")
  protected BookChunk convertFromDocument(Map<String, Object> source) {
    List<ContentType> contentTypes = new ArrayList<>();
    if (source.get("contentTypes") instanceof List<?> names) {
      for (Object name : names) {
        contentTypes.add(ContentType.valueOf((String) name));
      }
    }
    ChunkMetadata metadata =
        ChunkMetadata.builder()
            .chapterNumber(intOrNull(source.get("chapterNumber")))
            .chapterTitle((String) source.get("chapterTitle"))
            .sectionNumber((String) source.get("sectionNumber"))
            .sectionTitle((String) source.get("sectionTitle"))
            .pageNumber(intOrNull(source.get("pageNumber")))
            .contentTypes(contentTypes)
            .hasHeadings(Boolean.TRUE.equals(source.get("hasHeadings")))
            .minHeadingLevel(intOrNull(source.get("minHeadingLevel")))
            .charCount(intOrZero(source.get("charCount")))
            .wordCount(intOrZero(source.get("wordCount")))
            .sentenceCount(intOrZero(source.get("sentenceCount")))
            .hasLists(Boolean.TRUE.equals(source.get("hasLists")))
            .hasCode(Boolean.TRUE.equals(source.get("hasCode")))
            .hasQuestions(Boolean.TRUE.equals(source.get("hasQuestions")))
            .chunkPosition((String) source.get("chunkPosition"))
            .isFirst(Boolean.TRUE.equals(source.get("isFirst")))
            .isLast(Boolean.TRUE.equals(source.get("isLast")))
            .build();

    return BookChunk.builder()
        .id((String) source.get("id"))
        .documentName((String) source.get("documentName"))
        .userToken((String) source.get("userToken"))
        .sequentialId(intOrZero(source.get("sequentialId")))
        .content((String) source.get("content"))
        .contentHash((String) source.get("contentHash"))
        .metadata(metadata)
        .build();
  }

  @Override
  protected String getDocumentId(BookChunk entity) {
    return entity.getId();
  }

  @Override
  protected SearchRequest buildVectorSearchRequest(
      ChunkQuery criteria, List<Float> queryEmbedding, int topK) {
    Query filter = buildFilterQuery(criteria);
    log.debug(
        "vectorSearch for {} filter={} topK={} embedding size={}",
        criteria.scope(),
        criteria.filter(),
        topK,
        queryEmbedding.size());

    return SearchRequest.of(
        s ->
            s.index(indexName)
                .knn(
                    k ->
                        k.field("embedding")
                            .queryVector(queryEmbedding)
                            .k(topK)
                            .numCandidates(Math.max(topK * 2, MIN_NUM_CANDIDATES))
                            .filter(filter))
                .source(src -> src.filter(f -> f.excludes("embedding")))
                .size(topK));
  }

  @Override
  protected SearchRequest buildFilterSearchRequest(ChunkQuery criteria, int limit) {
    Query filter = buildFilterQuery(criteria);
    return SearchRequest.of(
        s ->
            s.index(indexName)
                .query(filter)
                .source(src -> src.filter(f -> f.excludes("embedding")))
                .sort(so -> so.field(f -> f.field("sequentialId").order(SortOrder.Asc)))
                .size(limit));
  }

  @Override
  protected Query buildFilterQuery(ChunkQuery criteria) {
    DocumentScope scope = criteria.scope();
    ChunkFilter filter = criteria.filter();
    return Query.of(
        q ->
            q.bool(
                b -> {
                  b.filter(f -> f.term(t -> t.field("documentName").value(scope.documentName())));
                  b.filter(f -> f.term(t -> t.field("userToken").value(scope.userToken())));
                  if (filter.chapterNumber() != null) {
                    long chapter = filter.chapterNumber();
                    b.filter(f -> f.term(t -> t.field("chapterNumber").value(chapter)));
                  }
                  if (filter.sectionNumber() != null) {
                    b.filter(
                        f -> f.term(t -> t.field("sectionNumber").value(filter.sectionNumber())));
                  }
                  if (filter.minSequentialId() != null || filter.maxSequentialId() != null) {
                    b.filter(
                        f ->
                            f.range(
                                r ->
                                    r.number(
                                        n -> {
                                          n.field("sequentialId");
                                          if (filter.minSequentialId() != null) {
                                            n.gte(filter.minSequentialId().doubleValue());
                                          }
                                          if (filter.maxSequentialId() != null) {
                                            n.lte(filter.maxSequentialId().doubleValue());
                                          }
                                          return n;
                                        })));
                  }
                  return b;
                }));
  }

  @Override
  protected String getMetricPrefix() {
    return "book_chunk";
  }

  // VectorStore

  @Override
  @Timed(value = "vectorstore.search", description = "Time to run a scoped similarity search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "searchFallback")
  public List<RetrievedChunk> search(
      List<Float> queryVector,
      DocumentScope scope,
      ChunkFilter filter,
      int limit,
      Double scoreThreshold) {
    if (limit <= 0) {
      return List.of();
    }
    List<BookChunk> hits = vectorSearch(new ChunkQuery(scope, filter), queryVector, limit);
    List<RetrievedChunk> results = new ArrayList<>(hits.size());
    for (BookChunk hit : hits) {
      Double similarity = toCosine(hit.getRelevanceScore());
      if (scoreThreshold != null && (similarity == null || similarity < scoreThreshold)) {
        continue;
      }
      results.add(toRetrievedChunk(hit, similarity));
    }
    log.debug(
        "Search in {} returned {} of {} hits above threshold {}",
        scope,
        results.size(),
        hits.size(),
        scoreThreshold);
    return results;
  }

  @Override
  @Timed(value = "vectorstore.getByFilter", description = "Time to fetch chunks by metadata")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "getByFilterFallback")
  public List<RetrievedChunk> getByFilter(DocumentScope scope, ChunkFilter filter, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    return filterSearch(new ChunkQuery(scope, filter), limit).stream()
        .map(chunk -> toRetrievedChunk(chunk, null))
        .toList();
  }

  @Override
  @Timed(value = "vectorstore.upsert", description = "Time to store chunks")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "upsertFallback")
  public void upsert(List<IndexedChunk> chunks, DocumentScope scope) {
    String scopeKey = scopeKey(scope);
    List<BookChunk> documents =
        chunks.stream()
            .map(
                indexed ->
                    BookChunk.builder()
                        .id(scopeKey + "_" + indexed.chunk().sequentialId())
                        .documentName(scope.documentName())
                        .userToken(scope.userToken())
                        .sequentialId(indexed.chunk().sequentialId())
                        .content(indexed.chunk().text())
                        .embedding(indexed.embedding())
                        .contentHash(indexed.contentHash())
                        .metadata(indexed.metadata())
                        .build())
            .toList();
    indexDocuments(documents);
    refresh();
  }

  @Override
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "deleteFallback")
  public void delete(DocumentScope scope) {
    deleteBy(ChunkQuery.of(scope));
  }

  @Override
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "existsFallback")
  public boolean exists(DocumentScope scope) {
    return count(ChunkQuery.of(scope)) > 0;
  }

  @Override
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "findByHashFallback")
  @SuppressWarnings("unchecked")
  public Optional<String> findDocumentByContentHash(String userToken, String contentHash) {
    try {
      Query query =
          Query.of(
              q ->
                  q.bool(
                      b ->
                          b.filter(f -> f.term(t -> t.field("userToken").value(userToken)))
                              .filter(
                                  f -> f.term(t -> t.field("contentHash").value(contentHash)))));
      SearchRequest request =
          SearchRequest.of(
              s ->
                  s.index(indexName)
                      .query(query)
                      .source(src -> src.filter(f -> f.includes("documentName")))
                      .size(1));
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      return response.hits().hits().stream()
          .map(Hit::source)
          .filter(source -> source != null && source.get("documentName") != null)
          .map(source -> (String) source.get("documentName"))
          .findFirst();
    } catch (IOException e) {
      log.error("Content hash lookup failed in {}: {}", indexName, e.getMessage(), e);
      throw new ProviderFailureException(PROVIDER, "Content hash lookup failed", e);
    }
  }

  /**
   * Builds the stable id prefix of a scope so that re-indexing overwrites instead of duplicating.
   */
  @VisibleForTesting
  static String scopeKey(DocumentScope scope) {
    return Hashing.sha256()
        .hashString(scope.userToken() + "\u0000" + scope.documentName(), StandardCharsets.UTF_8)
        .toString();
  }

  /** Elasticsearch reports cosine similarity as {@code (1 + cos) / 2}. */
  @VisibleForTesting
  static Double toCosine(Double elasticsearchScore) {
    return elasticsearchScore == null ? null : 2 * elasticsearchScore - 1;
  }

  private static RetrievedChunk toRetrievedChunk(BookChunk chunk, Double score) {
    return RetrievedChunk.builder()
        .text(chunk.getContent())
        .sequentialId(chunk.getSequentialId())
        .documentName(chunk.getDocumentName())
        .score(score)
        .metadata(chunk.getMetadata())
        .build();
  }

  private static Integer intOrNull(Object value) {
    return value instanceof Number number ? number.intValue() : null;
  }

  private static int intOrZero(Object value) {
    return value instanceof Number number ? number.intValue() : 0;
  }

  @SuppressWarnings("unused")
  private List<RetrievedChunk> searchFallback(
      List<Float> queryVector,
      DocumentScope scope,
      ChunkFilter filter,
      int limit,
      Double scoreThreshold,
      Throwable t) {
    throw storeFailure("search", t);
  }

  @SuppressWarnings("unused")
  private List<RetrievedChunk> getByFilterFallback(
      DocumentScope scope, ChunkFilter filter, int limit, Throwable t) {
    throw storeFailure("getByFilter", t);
  }

  @SuppressWarnings("unused")
  private void upsertFallback(List<IndexedChunk> chunks, DocumentScope scope, Throwable t) {
    throw storeFailure("upsert", t);
  }

  @SuppressWarnings("unused")
  private void deleteFallback(DocumentScope scope, Throwable t) {
    throw storeFailure("delete", t);
  }

  @SuppressWarnings("unused")
  private boolean existsFallback(DocumentScope scope, Throwable t) {
    throw storeFailure("exists", t);
  }

  @SuppressWarnings("unused")
  private Optional<String> findByHashFallback(String userToken, String contentHash, Throwable t) {
    throw storeFailure("findDocumentByContentHash", t);
  }

  private ProviderFailureException storeFailure(String operation, Throwable t) {
    log.error("Vector store {} failed: {}", operation, t.getMessage());
    meterRegistry.counter("vectorstore.requests.failure", "operation", operation).increment();
    if (t instanceof ProviderFailureException providerFailure) {
      return providerFailure;
    }
    return new ProviderFailureException(
        PROVIDER, "Vector store " + operation + " failed: " + t.getMessage(), t);
  }
}
