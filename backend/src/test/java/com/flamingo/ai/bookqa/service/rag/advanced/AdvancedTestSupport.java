package com.flamingo.ai.bookqa.service.rag.advanced;

import com.flamingo.ai.bookqa.config.RagConfig;
import com.flamingo.ai.bookqa.service.rag.model.ChunkMetadata;
import com.flamingo.ai.bookqa.service.rag.model.DocumentScope;
import com.flamingo.ai.bookqa.service.rag.model.RetrievedChunk;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.RejectedExecutionException;

/** Fixtures shared by the advanced retrieval tests. */
final class AdvancedTestSupport {

  static final DocumentScope SCOPE = new DocumentScope("biology.pdf", "user-7");

  private AdvancedTestSupport() {}

  /** Runs branches on the calling thread with a single attempt each. */
  static ConcurrentSearchExecutor directExecutor(RagConfig ragConfig, MeterRegistry registry) {
    RetryRegistry retryRegistry = RetryRegistry.of(RetryConfig.custom().maxAttempts(1).build());
    return new ConcurrentSearchExecutor(Runnable::run, retryRegistry, ragConfig, registry);
  }

  /** Refuses every branch, as a saturated pool would. */
  static ConcurrentSearchExecutor rejectingExecutor(RagConfig ragConfig, MeterRegistry registry) {
    RetryRegistry retryRegistry = RetryRegistry.of(RetryConfig.custom().maxAttempts(1).build());
    return new ConcurrentSearchExecutor(
        task -> {
          throw new RejectedExecutionException("pool full");
        },
        retryRegistry,
        ragConfig,
        registry);
  }

  static RetrievedChunk chunk(int sequentialId, String text, double score) {
    return RetrievedChunk.builder()
        .sequentialId(sequentialId)
        .text(text)
        .documentName(SCOPE.documentName())
        .score(score)
        .metadata(ChunkMetadata.empty())
        .build();
  }
}
