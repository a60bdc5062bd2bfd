package com.flamingo.ai.nutrition.service.rag.retrieval;

import com.flamingo.ai.nutrition.domain.Document;
import java.util.List;

/** Entry point of the retrieval pipeline, consumed by answer synthesis. */
@FunctionalInterface
public interface DocumentRetriever {

  /**
   * Retrieves the documents most relevant to a query. Upstream failures degrade to fewer (or no)
   * documents rather than an exception.
   *
   * @param query the user query
   * @return at most {@code k} documents, most relevant first
   */
  List<Document> retrieve(String query);
}
