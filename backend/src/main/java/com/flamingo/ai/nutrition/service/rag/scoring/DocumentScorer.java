package com.flamingo.ai.nutrition.service.rag.scoring;

import com.flamingo.ai.nutrition.domain.Document;
import java.util.List;

/**
 * One relevance signal used by the reranker. Implementations must not modify the documents and must
 * be deterministic for fixed inputs.
 */
public interface DocumentScorer {

  /**
   * Scores each document against the query.
   *
   * @param documents the candidates, in ranking order
   * @param query the user query
   * @return one score per document in input order, nominally within {@code [0, 1]}
   */
  List<Double> score(List<Document> documents, String query);

  /** Relative weight of this signal when scores are combined. */
  double weight();

  default String name() {
    return getClass().getSimpleName();
  }
}
