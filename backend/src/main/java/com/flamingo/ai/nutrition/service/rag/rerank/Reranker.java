package com.flamingo.ai.nutrition.service.rag.rerank;

import com.flamingo.ai.nutrition.domain.Document;
import java.util.List;

/**
 * Abstraction for reordering already-retrieved documents by additional relevance signals.
 * Implementations return a permutation of their input and never add or drop documents.
 */
public interface Reranker {

  /**
   * Reranks documents by relevance to the query.
   *
   * @param documents candidate documents, in retrieval order
   * @param query the user query
   * @return the same documents in reranked order
   */
  List<Document> rerank(List<Document> documents, String query);
}
