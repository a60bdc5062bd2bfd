package com.flamingo.ai.nutrition.service.rag.retrieval;

import com.flamingo.ai.nutrition.domain.Document;
import com.flamingo.ai.nutrition.service.rag.query.QueryReformulator;
import com.flamingo.ai.nutrition.service.rag.query.TextCompletion;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Multi-query retriever. Reformulates the question into several phrasings, searches each one,
 * merges the candidates by content and ranks the merged set with the {@link NutritionRetriever}
 * domain filters against the original question.
 *
 * <p>Sub-queries run sequentially. A failed reformulation falls back to the original query alone; a
 * failed sub-query only loses that sub-query's candidates.
 */
@Slf4j
public class EnhancedNutritionRetriever implements DocumentRetriever {

  public static final int DEFAULT_MAX_QUERIES = 4;

  private final NutritionRetriever baseRetriever;
  private final QueryReformulator queryReformulator;
  private final int maxQueries;
  private final boolean useReformulation;
  private final MeterRegistry meterRegistry;

  public EnhancedNutritionRetriever(
      NutritionRetriever baseRetriever,
      QueryReformulator queryReformulator,
      int maxQueries,
      boolean useReformulation,
      MeterRegistry meterRegistry) {
    if (baseRetriever == null) {
      throw new IllegalArgumentException("baseRetriever is required");
    }
    if (maxQueries < 0) {
      throw new IllegalArgumentException("maxQueries must not be negative: " + maxQueries);
    }
    this.baseRetriever = baseRetriever;
    this.queryReformulator = queryReformulator;
    this.maxQueries = maxQueries;
    this.useReformulation = useReformulation;
    this.meterRegistry = meterRegistry != null ? meterRegistry : Metrics.globalRegistry;
  }

  /** Enhanced retriever with an LLM-driven {@link QueryReformulator} and no reranking. */
  public static EnhancedNutritionRetriever fromCompletion(
      SimilaritySearch similaritySearch,
      TextCompletion completion,
      int k,
      int maxQueries,
      boolean includeOriginal) {
    return new EnhancedNutritionRetriever(
        NutritionRetriever.create(similaritySearch, k),
        new QueryReformulator(completion, includeOriginal),
        maxQueries,
        true,
        null);
  }

  @Override
  public List<Document> retrieve(String query) {
    if (!useReformulation || queryReformulator == null) {
      return baseRetriever.retrieve(query);
    }

    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      List<String> queries = alternativeQueries(query);

      List<Document> allDocuments = new ArrayList<>();
      for (String alternative : queries) {
        try {
          List<Document> documents = baseRetriever.getSimilaritySearch().search(alternative);
          if (documents != null) {
            allDocuments.addAll(documents);
            log.debug("Retrieved {} docs for query: '{}'", documents.size(), alternative);
          }
        } catch (Exception e) {
          log.warn("Retrieval failed for query '{}': {}", alternative, e.getMessage());
          meterRegistry.counter("rag.retrieval.subquery.errors").increment();
        }
      }

      List<Document> unique = deduplicateDocuments(allDocuments);
      log.debug(
          "Total unique documents after deduplication: {} (from {} across {} queries)",
          unique.size(),
          allDocuments.size(),
          queries.size());

      List<Document> filtered = baseRetriever.applyDomainFilters(unique, query);
      meterRegistry.counter("rag.retrieval.success").increment();
      return baseRetriever.truncate(filtered);
    } finally {
      sample.stop(meterRegistry.timer("rag.retrieval.duration", "retriever", "enhanced"));
    }
  }

  /**
   * Collapses documents with identical content. Each content keeps the position of its first
   * occurrence and the instance of its last occurrence.
   */
  public static List<Document> deduplicateDocuments(List<Document> documents) {
    Map<String, Document> unique = new LinkedHashMap<>();
    for (Document document : documents) {
      unique.put(document.content(), document);
    }
    return new ArrayList<>(unique.values());
  }

  private List<String> alternativeQueries(String query) {
    List<String> queries;
    try {
      queries = queryReformulator.rewriteQuery(query);
      meterRegistry.counter("rag.reformulation.success").increment();
    } catch (Exception e) {
      log.error("Query reformulation failed, using original query: {}", e.getMessage());
      meterRegistry.counter("rag.reformulation.errors").increment();
      return List.of(query);
    }
    if (queries.size() > maxQueries) {
      log.debug("Dropping {} alternative queries over the limit", queries.size() - maxQueries);
      return queries.subList(0, maxQueries);
    }
    return queries;
  }

  public NutritionRetriever getBaseRetriever() {
    return baseRetriever;
  }

  public int getMaxQueries() {
    return maxQueries;
  }

  public boolean isUseReformulation() {
    return useReformulation;
  }
}
