package com.flamingo.ai.bookqa.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import com.flamingo.ai.bookqa.exception.ProviderFailureException;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Abstract base class for Elasticsearch index services.
 *
 * <p>Provides index bootstrapping, bulk indexing, kNN search, filter-only search, counting and
 * deletion. Subclasses define the schema, the document conversion and how criteria turn into
 * queries. I/O failures are raised as {@link ProviderFailureException}.
 *
 * @param <T> the document type stored in the index
 * @param <C> the criteria type that selects documents
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T, C>
    implements ElasticsearchIndexOperations<T, C> {

  protected static final String PROVIDER = "elasticsearch";

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public abstract String getIndexName();

  /**
   * Returns the vector embedding dimensions.
   *
   * @return the vector dimensions (e.g., 1536 for text-embedding-3-small)
   */
  protected abstract int getVectorDimensions();

  /**
   * Defines the index properties (schema) for this document type.
   *
   * @return a map of field names to Elasticsearch property definitions
   */
  protected abstract Map<String, Property> defineIndexProperties();

  protected abstract Map<String, Object> convertToDocument(T entity);

  protected abstract T convertFromDocument(Map<String, Object> source);

  protected abstract String getDocumentId(T entity);

  /**
   * Builds the kNN search request restricted to the criteria.
   *
   * @param criteria the documents eligible for the search
   * @param queryEmbedding the query embedding
   * @param topK the number of results
   * @return the search request
   */
  protected abstract SearchRequest buildVectorSearchRequest(
      C criteria, List<Float> queryEmbedding, int topK);

  /**
   * Builds an unscored search request returning documents that match the criteria.
   *
   * @param criteria the selection criteria
   * @param limit maximum number of results
   * @return the search request
   */
  protected abstract SearchRequest buildFilterSearchRequest(C criteria, int limit);

  /**
   * Builds the query shared by counting and deletion.
   *
   * @param criteria the selection criteria
   * @return the filter query
   */
  protected abstract Query buildFilterQuery(C criteria);

  /**
   * Returns the metric prefix for this index (e.g., "book_chunk").
   *
   * @return the metric prefix
   */
  protected abstract String getMetricPrefix();

  @PostConstruct
  @Override
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn(
            "Elasticsearch client not available, skipping index initialization for {}",
            getIndexName());
        return;
      }
      boolean exists = indices.exists(e -> e.index(getIndexName())).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch index: {}", getIndexName());
      } else {
        updateAndValidateMappings();
      }
    } catch (Exception e) {
      log.error(
          "Failed to initialize Elasticsearch index '{}': {}", getIndexName(), e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + getIndexName() + "'", e);
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = defineIndexProperties();
    // dynamic=false keeps undeclared fields out of the mapping
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(getIndexName())
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  /**
   * Adds missing fields to the existing index and throws on type mismatches.
   *
   * <p>Elasticsearch allows new fields to be added via the Put Mapping API but not existing field
   * types to change. Type mismatches fail fast so the index can be recreated manually.
   */
  private void updateAndValidateMappings() throws IOException {
    Map<String, Property> expectedProperties = defineIndexProperties();
    var response = elasticsearchClient.indices().getMapping(g -> g.index(getIndexName()));
    var indexMapping = response.get(getIndexName());
    if (indexMapping == null) {
      return;
    }
    Map<String, Property> actualProperties = indexMapping.mappings().properties();

    List<String> mismatches = new ArrayList<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      Property actual = actualProperties.get(entry.getKey());
      if (actual != null && entry.getValue()._kind() != actual._kind()) {
        String msg =
            String.format(
                "Mapping mismatch in index '%s': field '%s' expected type '%s' but found '%s'. "
                    + "Delete the index and restart the application to apply correct mappings.",
                getIndexName(), entry.getKey(), entry.getValue()._kind(), actual._kind());
        log.error(msg);
        mismatches.add(msg);
      }
    }
    if (!mismatches.isEmpty()) {
      throw new IllegalStateException(
          "Index '"
              + getIndexName()
              + "' has incompatible field type(s). "
              + String.join("; ", mismatches));
    }

    Map<String, Property> missingFields = new HashMap<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      if (!actualProperties.containsKey(entry.getKey())) {
        missingFields.put(entry.getKey(), entry.getValue());
      }
    }

    if (!missingFields.isEmpty()) {
      PutMappingRequest putRequest =
          PutMappingRequest.of(p -> p.index(getIndexName()).properties(missingFields));
      elasticsearchClient.indices().putMapping(putRequest);
      log.info(
          "Added {} new field(s) to index '{}': {}",
          missingFields.size(),
          getIndexName(),
          missingFields.keySet());
    } else {
      log.debug("Index '{}' mapping verified correctly.", getIndexName());
    }
  }

  @Override
  public void indexDocuments(List<T> documents) {
    if (documents.isEmpty()) {
      return;
    }

    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
      for (T document : documents) {
        String id = getDocumentId(document);
        Map<String, Object> docMap = convertToDocument(document);
        bulkBuilder.operations(
            op -> op.index(idx -> idx.index(getIndexName()).id(id).document(docMap)));
      }

      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      if (response.errors()) {
        long failed = response.items().stream().filter(item -> item.error() != null).count();
        log.warn(
            "{} of {} documents failed to index in {}", failed, documents.size(), getIndexName());
        meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
        throw new ProviderFailureException(
            PROVIDER, "Bulk indexing failed for " + failed + " document(s)");
      }
      log.debug("Indexed {} documents to {}", documents.size(), getIndexName());
      meterRegistry.counter(getMetricPrefix() + ".indexed").increment(documents.size());
    } catch (IOException e) {
      log.error("Failed to index documents to {}: {}", getIndexName(), e.getMessage(), e);
      throw new ProviderFailureException(PROVIDER, "Failed to index documents", e);
    }
  }

  @Override
  public List<T> vectorSearch(C criteria, List<Float> queryEmbedding, int topK) {
    try {
      SearchRequest request = buildVectorSearchRequest(criteria, queryEmbedding, topK);
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      logSearchResults("vectorSearch", criteria, response);
      List<T> results = mapHitsToDocuments(response.hits().hits());
      meterRegistry.counter(getMetricPrefix() + ".vector_search").increment();
      return results;
    } catch (IOException e) {
      log.error("Vector search failed for {}: {}", getIndexName(), e.getMessage(), e);
      throw new ProviderFailureException(PROVIDER, "Vector search failed", e);
    }
  }

  @Override
  public List<T> filterSearch(C criteria, int limit) {
    try {
      SearchRequest request = buildFilterSearchRequest(criteria, limit);
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      logSearchResults("filterSearch", criteria, response);
      List<T> results = mapHitsToDocuments(response.hits().hits());
      meterRegistry.counter(getMetricPrefix() + ".filter_search").increment();
      return results;
    } catch (IOException e) {
      log.error("Filter search failed for {}: {}", getIndexName(), e.getMessage(), e);
      throw new ProviderFailureException(PROVIDER, "Filter search failed", e);
    }
  }

  @Override
  public long count(C criteria) {
    try {
      Query query = buildFilterQuery(criteria);
      return elasticsearchClient.count(c -> c.index(getIndexName()).query(query)).count();
    } catch (IOException e) {
      log.error("Count failed for {}: {}", getIndexName(), e.getMessage(), e);
      throw new ProviderFailureException(PROVIDER, "Count failed", e);
    }
  }

  @Override
  public void deleteBy(C criteria) {
    try {
      Query deleteQuery = buildFilterQuery(criteria);
      DeleteByQueryRequest request =
          DeleteByQueryRequest.of(d -> d.index(getIndexName()).query(deleteQuery).refresh(true));
      var response = elasticsearchClient.deleteByQuery(request);
      log.info(
          "Deleted {} documents from {} with criteria: {}",
          response.deleted(),
          getIndexName(),
          criteria);
      meterRegistry.counter(getMetricPrefix() + ".deleted").increment();
    } catch (IOException e) {
      log.error(
          "Failed to delete documents from {} with criteria {}: {}",
          getIndexName(),
          criteria,
          e.getMessage(),
          e);
      throw new ProviderFailureException(PROVIDER, "Failed to delete documents", e);
    }
  }

  @Override
  public void refresh() {
    try {
      elasticsearchClient.indices().refresh(r -> r.index(getIndexName()));
      log.debug("Refreshed index: {}", getIndexName());
    } catch (IOException e) {
      log.warn("Failed to refresh index {}: {}", getIndexName(), e.getMessage());
    }
  }

  @SuppressWarnings("unchecked")
  private void logSearchResults(String searchType, C criteria, SearchResponse<Map> response) {
    List<Hit<Map>> hits = response.hits().hits();
    long totalHits =
        response.hits().total() != null ? response.hits().total().value() : hits.size();
    log.info(
        "[{}] index={} criteria={} totalHits={} returned={}",
        searchType,
        getIndexName(),
        criteria,
        totalHits,
        hits.size());
    if (!log.isDebugEnabled()) {
      return;
    }
    for (int i = 0; i < hits.size(); i++) {
      Hit<Map> hit = hits.get(i);
      Map<String, Object> src = hit.source();
      String contentPreview = "";
      Object sequentialId = null;
      if (src != null) {
        Object content = src.get("content");
        if (content instanceof String s) {
          contentPreview = s.length() > 120 ? s.substring(0, 120) + "..." : s;
        }
        sequentialId = src.get("sequentialId");
      }
      log.debug(
          "  [{}] rank={} id={} score={} seq={} content='{}'",
          searchType,
          i + 1,
          hit.id(),
          hit.score(),
          sequentialId,
          contentPreview);
    }
  }

  @SuppressWarnings("unchecked")
  private List<T> mapHitsToDocuments(List<Hit<Map>> hits) {
    List<T> documents = new ArrayList<>();
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source();
      if (source != null) {
        // _id is metadata and not part of _source
        source.put("id", hit.id());
        T document = convertFromDocument(source);
        if (document instanceof ScoredDocument scored && hit.score() != null) {
          scored.setRelevanceScore(hit.score());
        }
        documents.add(document);
      }
    }
    return documents;
  }

  /** Marker interface for documents that support relevance scoring. */
  public interface ScoredDocument {
    void setRelevanceScore(Double score);
  }
}
