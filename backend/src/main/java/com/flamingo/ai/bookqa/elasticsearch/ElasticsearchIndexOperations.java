package com.flamingo.ai.bookqa.elasticsearch;

import java.util.List;

/**
 * Generic interface for Elasticsearch index operations.
 *
 * @param <T> the document type stored in the index
 * @param <C> the criteria type that selects documents
 */
public interface ElasticsearchIndexOperations<T, C> {

  /**
   * Initializes the index with appropriate mappings.
   *
   * <p>Creates the index if it doesn't exist, using the schema defined by the implementation.
   */
  void initIndex();

  /**
   * Indexes multiple documents in bulk.
   *
   * @param documents the documents to index
   */
  void indexDocuments(List<T> documents);

  /**
   * Performs kNN vector search restricted to the documents matching the criteria.
   *
   * @param criteria the documents eligible for the search
   * @param queryEmbedding the query vector
   * @param topK number of results to return
   * @return matching documents ordered by similarity
   */
  List<T> vectorSearch(C criteria, List<Float> queryEmbedding, int topK);

  /**
   * Fetches documents matching the criteria without scoring.
   *
   * @param criteria the selection criteria
   * @param limit maximum number of results
   * @return matching documents in the implementation's natural order
   */
  List<T> filterSearch(C criteria, int limit);

  /**
   * Counts documents matching the criteria.
   *
   * @param criteria the selection criteria
   * @return number of matching documents
   */
  long count(C criteria);

  /**
   * Deletes documents matching the given criteria.
   *
   * @param criteria the selection criteria
   */
  void deleteBy(C criteria);

  /**
   * Refreshes the index to make recent changes visible for search.
   *
   * <p>Useful after bulk indexing operations to ensure documents are immediately searchable.
   */
  void refresh();

  /**
   * Gets the name of the Elasticsearch index.
   *
   * @return the index name
   */
  String getIndexName();
}
