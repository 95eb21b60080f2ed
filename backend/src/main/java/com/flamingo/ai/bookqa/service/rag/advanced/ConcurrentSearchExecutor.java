package com.flamingo.ai.bookqa.service.rag.advanced;

import com.flamingo.ai.bookqa.config.RagConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs independent searches concurrently on the retrieval pool and joins them, tolerating
 * individual failures.
 *
 * <p>Each branch is retried through the {@code fanOut} Resilience4j retry. All branches share one
 * deadline; a branch still running at the deadline is cancelled, which interrupts its worker, and
 * reported as failed. A branch the pool refuses is reported as failed without running. Outcomes
 * are returned in submission order.
 */
@Component
@Slf4j
public class ConcurrentSearchExecutor {

  static final String RETRY_NAME = "fanOut";

  private final Executor retrievalExecutor;
  private final Retry retry;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  public ConcurrentSearchExecutor(
      @Qualifier("retrievalExecutor") Executor retrievalExecutor,
      RetryRegistry retryRegistry,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    this.retrievalExecutor = retrievalExecutor;
    this.retry = retryRegistry.retry(RETRY_NAME);
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Runs every branch and waits for all of them.
   *
   * <p>If the calling thread is interrupted, the branches not yet joined are cancelled, reported as
   * failed, and the interrupt flag is restored.
   *
   * @param branches the searches to run
   * @param <T> the search result type
   * @return one outcome per branch, in submission order
   */
  public <T> List<BranchOutcome<T>> runAll(List<SearchBranch<T>> branches) {
    List<FutureTask<T>> futures = new ArrayList<>(branches.size());
    List<RejectedExecutionException> rejections = new ArrayList<>(branches.size());
    for (SearchBranch<T> branch : branches) {
      Supplier<T> withRetry = Retry.decorateSupplier(retry, branch.search());
      FutureTask<T> task = new FutureTask<>(withRetry::get);
      RejectedExecutionException rejection = null;
      try {
        retrievalExecutor.execute(task);
      } catch (RejectedExecutionException e) {
        log.warn("Search branch '{}' rejected by the retrieval pool", branch.label(), e);
        rejection = e;
      }
      futures.add(task);
      rejections.add(rejection);
    }

    long timeoutMs = ragConfig.getMultiQuery().getBranchTimeoutMs();
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
    List<BranchOutcome<T>> outcomes = new ArrayList<>(branches.size());

    for (int i = 0; i < futures.size(); i++) {
      String label = branches.get(i).label();
      FutureTask<T> future = futures.get(i);
      if (rejections.get(i) != null) {
        outcomes.add(failed(label, rejections.get(i), "rejected"));
        continue;
      }
      try {
        long remaining = Math.max(0L, deadline - System.nanoTime());
        outcomes.add(BranchOutcome.success(label, future.get(remaining, TimeUnit.NANOSECONDS)));
      } catch (TimeoutException e) {
        future.cancel(true);
        log.warn("Search branch '{}' timed out after {} ms", label, timeoutMs);
        outcomes.add(failed(label, e, "timeout"));
      } catch (ExecutionException | CancellationException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        log.warn("Search branch '{}' failed: {}", label, cause.getMessage());
        outcomes.add(failed(label, cause, "error"));
      } catch (InterruptedException e) {
        log.warn("Interrupted while joining search branches, cancelling the rest");
        for (int j = i; j < futures.size(); j++) {
          futures.get(j).cancel(true);
          String reason = rejections.get(j) != null ? "rejected" : "interrupted";
          Throwable cause = rejections.get(j) != null ? rejections.get(j) : e;
          outcomes.add(failed(branches.get(j).label(), cause, reason));
        }
        Thread.currentThread().interrupt();
        break;
      }
    }
    return outcomes;
  }

  private <T> BranchOutcome<T> failed(String label, Throwable cause, String reason) {
    meterRegistry.counter("rag.fanout.branch.failure", "reason", reason).increment();
    return BranchOutcome.failed(label, cause);
  }
}
