package com.flamingo.ai.bookqa.service.rag;

import com.flamingo.ai.bookqa.config.RagConfig;
import com.flamingo.ai.bookqa.domain.enums.RetrievalStatus;
import com.flamingo.ai.bookqa.exception.DocumentIndexingException;
import com.flamingo.ai.bookqa.exception.ProviderFailureException;
import com.flamingo.ai.bookqa.service.rag.chunking.TextChunker;
import com.flamingo.ai.bookqa.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.bookqa.service.rag.model.AnnotatedChunk;
import com.flamingo.ai.bookqa.service.rag.model.ChunkMetadata;
import com.flamingo.ai.bookqa.service.rag.model.DocumentScope;
import com.flamingo.ai.bookqa.service.rag.model.IndexedChunk;
import com.flamingo.ai.bookqa.service.rag.model.IndexingResult;
import com.flamingo.ai.bookqa.service.rag.store.VectorStore;
import com.google.common.collect.Lists;
import com.google.common.hash.Hashing;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Service for indexing documents: chunking with metadata, embedding and storage.
 *
 * <p>Documents are keyed by name and user token. Re-uploading identical content under another
 * name is detected by a SHA-256 hash of the text and reported instead of indexed twice.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentIndexingService {

  private final TextChunker textChunker;
  private final EmbeddingService embeddingService;
  private final VectorStore vectorStore;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Indexes a document for a user.
   *
   * @param filename the document name
   * @param content the full document text
   * @param token the owning user's token
   * @return the outcome; failures are reported through its status, never thrown
   */
  @Timed(value = "document.index", description = "Time to index document")
  public IndexingResult index(String filename, String content, String token) {
    if (filename == null || filename.isBlank() || token == null || token.isBlank()) {
      log.warn("Indexing requested without document name or user token");
      return IndexingResult.error("Document name and user token are required");
    }
    if (content == null || content.isBlank()) {
      log.warn("No content to index for '{}'", filename);
      return IndexingResult.error("Failed to create chunks from document");
    }
    DocumentScope scope = new DocumentScope(filename, token);

    try {
      if (vectorStore.exists(scope)) {
        log.info("Document '{}' is already indexed", filename);
        return new IndexingResult(
            RetrievalStatus.ALREADY_INDEXED, 0, 0, 0, "Document is already indexed", null);
      }

      String contentHash = contentHash(content);
      Optional<String> original = vectorStore.findDocumentByContentHash(token, contentHash);
      if (original.isPresent() && !original.get().equals(filename)) {
        log.info("Document '{}' has the same content as '{}'", filename, original.get());
        meterRegistry.counter("document.index.duplicate").increment();
        return new IndexingResult(
            RetrievalStatus.DUPLICATE,
            0,
            0,
            0,
            "This document was already uploaded as '" + original.get() + "'",
            original.get());
      }

      return indexChunks(scope, content, contentHash);
    } catch (DocumentIndexingException e) {
      log.error("Failed to index document '{}': {}", filename, e.getMessage());
      meterRegistry.counter("document.index.failure").increment();
      return IndexingResult.error(e.getUserMessage() + ": " + e.getMessage());
    } catch (ProviderFailureException e) {
      log.error("Failed to index document '{}': {}", filename, e.getMessage());
      meterRegistry.counter("document.index.failure").increment();
      return IndexingResult.error(e.getUserMessage());
    }
  }

  /**
   * Removes every chunk of a document.
   *
   * @param filename the document name
   * @param token the owning user's token
   */
  public void delete(String filename, String token) {
    vectorStore.delete(new DocumentScope(filename, token));
    log.info("Deleted document '{}'", filename);
  }

  /**
   * Whether a document has been indexed for a user.
   *
   * @param filename the document name
   * @param token the owning user's token
   * @return true when at least one chunk is stored
   */
  public boolean isIndexed(String filename, String token) {
    return vectorStore.exists(new DocumentScope(filename, token));
  }

  private IndexingResult indexChunks(DocumentScope scope, String content, String contentHash) {
    String filename = scope.documentName();
    List<AnnotatedChunk> chunks = textChunker.chunkWithMetadata(content, filename);
    if (chunks.isEmpty()) {
      throw new DocumentIndexingException(filename, "Failed to create chunks from document");
    }

    List<List<Float>> embeddings = embedInBatches(chunks);
    if (embeddings.size() != chunks.size()) {
      throw new DocumentIndexingException(
          filename,
          String.format(
              "Embedding generation failed: expected %d embeddings, got %d",
              chunks.size(), embeddings.size()));
    }

    List<IndexedChunk> indexed = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      AnnotatedChunk chunk = chunks.get(i);
      indexed.add(
          new IndexedChunk(chunk.chunk(), chunk.metadata(), embeddings.get(i), contentHash));
    }
    try {
      vectorStore.upsert(indexed, scope);
    } catch (RuntimeException e) {
      removePartialDocument(scope, e);
      throw e;
    }

    List<ChunkMetadata> metadata = chunks.stream().map(AnnotatedChunk::metadata).toList();
    int chapters = distinctCount(metadata.stream().map(ChunkMetadata::chapterNumber).toList());
    int sections = distinctCount(metadata.stream().map(ChunkMetadata::sectionNumber).toList());

    meterRegistry.counter("document.index.success").increment();
    log.info(
        "Indexed '{}': {} chunks, {} chapters, {} sections",
        filename,
        chunks.size(),
        chapters,
        sections);
    return new IndexingResult(
        RetrievalStatus.SUCCESS,
        chunks.size(),
        chapters,
        sections,
        String.format(
            "Successfully indexed %d chunks with metadata (%d chapters, %d sections)",
            chunks.size(), chapters, sections),
        null);
  }

  /** Drops whatever a failed upsert managed to store so the document can be indexed again. */
  private void removePartialDocument(DocumentScope scope, RuntimeException failure) {
    try {
      vectorStore.delete(scope);
      log.warn("Removed partially indexed chunks of '{}'", scope.documentName());
    } catch (RuntimeException cleanupFailure) {
      log.error(
          "Could not remove partially indexed chunks of '{}'",
          scope.documentName(),
          cleanupFailure);
      failure.addSuppressed(cleanupFailure);
    }
  }

  private List<List<Float>> embedInBatches(List<AnnotatedChunk> chunks) {
    int batchSize = Math.max(1, ragConfig.getIndexing().getEmbeddingBatchSize());
    List<List<Float>> embeddings = new ArrayList<>(chunks.size());
    for (List<AnnotatedChunk> batch : Lists.partition(chunks, batchSize)) {
      List<String> texts = batch.stream().map(chunk -> chunk.chunk().text()).toList();
      embeddings.addAll(embeddingService.embedAll(texts));
      log.debug("Embedded {} of {} chunks", embeddings.size(), chunks.size());
    }
    return embeddings;
  }

  private static int distinctCount(List<?> values) {
    return (int) values.stream().filter(Objects::nonNull).distinct().count();
  }

  static String contentHash(String content) {
    return Hashing.sha256().hashString(content, StandardCharsets.UTF_8).toString();
  }
}
