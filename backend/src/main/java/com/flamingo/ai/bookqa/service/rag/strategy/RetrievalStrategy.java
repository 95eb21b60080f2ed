package com.flamingo.ai.bookqa.service.rag.strategy;

import com.flamingo.ai.bookqa.domain.enums.UseCase;
import com.flamingo.ai.bookqa.service.rag.model.RetrievalResult;

/** Retrieval policy for one {@link UseCase}. One Spring bean exists per use-case. */
public interface RetrievalStrategy {

  /** The use-case this strategy serves. */
  UseCase useCase();

  /**
   * Retrieves chunks for a request.
   *
   * @param request the resolved request
   * @return the result; failures are reported through its status, never thrown
   */
  RetrievalResult retrieve(RetrievalRequest request);
}
