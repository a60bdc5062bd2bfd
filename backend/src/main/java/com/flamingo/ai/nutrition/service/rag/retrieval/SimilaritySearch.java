package com.flamingo.ai.nutrition.service.rag.retrieval;

import com.flamingo.ai.nutrition.domain.Document;
import java.util.List;

/**
 * Embedding-backed candidate search. Returns documents already ordered by vector similarity; the
 * retrievers layer their domain logic on top of it.
 */
@FunctionalInterface
public interface SimilaritySearch {

  /**
   * Finds candidate documents for a query.
   *
   * @param query the query text
   * @return candidates in descending similarity order
   * @throws com.flamingo.ai.nutrition.exception.SearchException when the search backend fails
   */
  List<Document> search(String query);
}
