package com.flamingo.ai.bookqa.service.rag.store;

import com.flamingo.ai.bookqa.service.rag.model.ChunkFilter;
import com.flamingo.ai.bookqa.service.rag.model.DocumentScope;
import com.flamingo.ai.bookqa.service.rag.model.IndexedChunk;
import com.flamingo.ai.bookqa.service.rag.model.RetrievedChunk;
import java.util.List;
import java.util.Optional;

/**
 * Storage for chunk embeddings and metadata, partitioned by {@link DocumentScope}.
 *
 * <p>Every read and write is confined to a single scope; implementations must never return chunks
 * from another document or user. Failures are reported as {@link
 * com.flamingo.ai.bookqa.exception.ProviderFailureException}.
 */
public interface VectorStore {

  /**
   * Finds the chunks most similar to a query vector.
   *
   * @param queryVector the query embedding
   * @param scope the document and user to search
   * @param filter additional metadata restrictions
   * @param limit maximum number of results
   * @param scoreThreshold minimum cosine similarity, or null for no threshold
   * @return matching chunks, most similar first, each with its similarity score
   */
  List<RetrievedChunk> search(
      List<Float> queryVector,
      DocumentScope scope,
      ChunkFilter filter,
      int limit,
      Double scoreThreshold);

  /**
   * Fetches chunks by metadata alone, without similarity ranking.
   *
   * @param scope the document and user to read
   * @param filter metadata restrictions
   * @param limit maximum number of results
   * @return matching chunks in sequential order, with no score
   */
  List<RetrievedChunk> getByFilter(DocumentScope scope, ChunkFilter filter, int limit);

  /**
   * Stores chunks with their embeddings and metadata.
   *
   * @param chunks the chunks to store
   * @param scope the document and user that own the chunks
   */
  void upsert(List<IndexedChunk> chunks, DocumentScope scope);

  /** Removes every chunk of the scope. */
  void delete(DocumentScope scope);

  /** Whether any chunk is stored for the scope. */
  boolean exists(DocumentScope scope);

  /**
   * Looks up a document of the given user that was indexed from identical content.
   *
   * @param userToken the owning user
   * @param contentHash hash of the full document text
   * @return the name of that document, if any
   */
  Optional<String> findDocumentByContentHash(String userToken, String contentHash);
}
