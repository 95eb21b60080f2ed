package com.flamingo.ai.bookqa.service.rag.advanced;

import java.util.function.Supplier;

/**
 * One independent search submitted to {@link ConcurrentSearchExecutor}.
 *
 * @param label name used in logs, e.g. the query variant
 * @param search the blocking search to run
 * @param <T> the search result type
 */
public record SearchBranch<T>(String label, Supplier<T> search) {}
