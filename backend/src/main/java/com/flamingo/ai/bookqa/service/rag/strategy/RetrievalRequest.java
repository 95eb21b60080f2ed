package com.flamingo.ai.bookqa.service.rag.strategy;

import com.flamingo.ai.bookqa.service.rag.model.DocumentScope;
import com.flamingo.ai.bookqa.service.rag.model.QueryClassification;
import com.flamingo.ai.bookqa.service.rag.model.QueryMetadata;
import com.flamingo.ai.bookqa.service.rag.model.RetrievalRequirements;

/**
 * Everything a strategy needs to serve one query, resolved before dispatch.
 *
 * @param query the user's query
 * @param scope the document and user to read from
 * @param topK number of chunks the caller asked for
 * @param classification detected or explicit use-case
 * @param metadata chapter, section, topic and difficulty extracted from the query
 * @param requirements retrieval policy for the use-case
 */
public record RetrievalRequest(
    String query,
    DocumentScope scope,
    int topK,
    QueryClassification classification,
    QueryMetadata metadata,
    RetrievalRequirements requirements) {}
