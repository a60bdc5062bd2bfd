package com.flamingo.ai.nutrition.service.rag.retrieval;

import com.flamingo.ai.nutrition.domain.Document;
import com.flamingo.ai.nutrition.domain.DocumentMetadata;
import com.flamingo.ai.nutrition.domain.IsoDates;
import com.flamingo.ai.nutrition.domain.QueryIntent;
import com.flamingo.ai.nutrition.domain.QueryIntentScores;
import com.flamingo.ai.nutrition.service.rag.rerank.DocumentReRanker;
import com.flamingo.ai.nutrition.service.rag.rerank.ReRankingConfig;
import com.flamingo.ai.nutrition.service.rag.rerank.Reranker;
import com.flamingo.ai.nutrition.service.rag.scoring.QueryTerms;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * Hybrid retriever for nutrition questions. Takes the candidates of a {@link SimilaritySearch} and
 * reorders them by query intent, keyword evidence and document metadata, optionally handing the
 * result to a {@link Reranker}.
 *
 * <p>Stateless between calls; safe for concurrent use when the similarity search is.
 */
@Slf4j
public class NutritionRetriever implements DocumentRetriever {

  public static final int DEFAULT_K = 4;

  static final double TERM_OCCURRENCE_SCORE = 0.05;
  static final double MAX_TERM_OCCURRENCE_SCORE = 0.2;
  static final double EXACT_TOKEN_BONUS = 0.1;
  static final double BIGRAM_BONUS = 0.15;
  static final double NAME_MATCH_BONUS = 0.3;

  static final double NUTRIENT_TYPE_BOOST = 0.3;
  static final double RECIPE_TYPE_BOOST = 0.4;
  static final double DIET_ADVICE_TYPE_BOOST = 0.2;
  static final double AUTHORITY_SOURCE_BOOST = 0.3;
  static final double RECENT_DATE_BOOST = 0.1;
  static final int RECENT_DATE_DAYS = 365;

  private static final List<String> HEALTH_AUTHORITY_DOMAINS =
      List.of("nih.gov", "cdc.gov", "who.int", "mayoclinic");

  private final SimilaritySearch similaritySearch;
  private final int k;
  private final QueryIntentDetector intentDetector;
  private final Reranker reranker;
  private final boolean useReranking;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  @Builder
  private NutritionRetriever(
      SimilaritySearch similaritySearch,
      Integer k,
      QueryIntentDetector intentDetector,
      Reranker reranker,
      boolean useReranking,
      Clock clock,
      MeterRegistry meterRegistry) {
    if (similaritySearch == null) {
      throw new IllegalArgumentException("similaritySearch is required");
    }
    this.similaritySearch = similaritySearch;
    this.k = k != null ? k : DEFAULT_K;
    if (this.k < 0) {
      throw new IllegalArgumentException("k must not be negative: " + this.k);
    }
    this.intentDetector = intentDetector != null ? intentDetector : new QueryIntentDetector();
    this.reranker = reranker;
    this.useReranking = useReranking;
    this.clock = clock != null ? clock : Clock.systemDefaultZone();
    this.meterRegistry = meterRegistry != null ? meterRegistry : Metrics.globalRegistry;
  }

  /** Hybrid retriever without reranking. */
  public static NutritionRetriever create(SimilaritySearch similaritySearch, int k) {
    return builder().similaritySearch(similaritySearch).k(k).build();
  }

  /** Hybrid retriever whose domain-sorted results are reranked by a {@link DocumentReRanker}. */
  public static NutritionRetriever withReranker(
      SimilaritySearch similaritySearch, int k, ReRankingConfig rerankingConfig) {
    return builder()
        .similaritySearch(similaritySearch)
        .k(k)
        .reranker(new DocumentReRanker(rerankingConfig))
        .useReranking(true)
        .build();
  }

  @Override
  public List<Document> retrieve(String query) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      List<Document> initial;
      try {
        initial = similaritySearch.search(query);
      } catch (Exception e) {
        log.error("Similarity search failed for query '{}': {}", query, e.getMessage());
        meterRegistry.counter("rag.retrieval.search.errors").increment();
        return List.of();
      }
      if (initial == null) {
        initial = List.of();
      }

      List<Document> filtered = applyDomainFilters(initial, query);
      List<Document> results = truncate(filtered);
      log.debug(
          "Retrieved {}, filtered to {}, returning top {} docs for query: {}",
          initial.size(),
          filtered.size(),
          results.size(),
          query);
      meterRegistry.counter("rag.retrieval.success").increment();
      return results;
    } finally {
      sample.stop(meterRegistry.timer("rag.retrieval.duration", "retriever", "hybrid"));
    }
  }

  /**
   * Orders documents by {@code (1 + keywordScore) × (1 + metadataBoost)}, then reranks when
   * reranking is enabled. Does not truncate.
   */
  public List<Document> applyDomainFilters(List<Document> documents, String query) {
    if (documents.isEmpty()) {
      return List.of();
    }
    QueryIntentScores intent = detectQueryIntent(query);
    List<Double> keywordScores = scoreByKeywords(documents, query);
    log.debug("Query intent for '{}': {}", query, intent.asMap());

    List<ScoredDocument> scored = new ArrayList<>(documents.size());
    for (int i = 0; i < documents.size(); i++) {
      Document document = documents.get(i);
      double finalScore =
          (1.0 + keywordScores.get(i)) * (1.0 + getMetadataBoost(document, intent));
      scored.add(new ScoredDocument(document, finalScore));
    }
    scored.sort(Comparator.comparingDouble(ScoredDocument::score).reversed());
    List<Document> ordered = new ArrayList<>(scored.size());
    scored.forEach(entry -> ordered.add(entry.document()));

    if (useReranking && reranker != null) {
      return reranker.rerank(ordered, query);
    }
    return ordered;
  }

  public QueryIntentScores detectQueryIntent(String query) {
    return intentDetector.detect(query);
  }

  /**
   * Keyword evidence per document. Scores are unbounded sums, not probabilities.
   *
   * <ul>
   *   <li>each query term in the content: {@code min(0.2, 0.05 × occurrences)}, plus 0.1 when it
   *       is also a whole word
   *   <li>each adjacent pair of query terms found verbatim: 0.15
   *   <li>metadata {@code name} containing any query term: 0.3
   * </ul>
   */
  public List<Double> scoreByKeywords(List<Document> documents, String query) {
    List<String> queryTerms = keywordTerms(query);
    List<Double> scores = new ArrayList<>(documents.size());

    for (Document document : documents) {
      String content = document.content().toLowerCase(Locale.ROOT);
      Set<String> contentTokens = new HashSet<>();
      for (String token : QueryTerms.tokens(content)) {
        contentTokens.add(QueryTerms.trimPunctuation(token));
      }

      double score = 0.0;
      for (String term : queryTerms) {
        int occurrences = QueryTerms.countOccurrences(content, term);
        if (occurrences > 0) {
          score += Math.min(MAX_TERM_OCCURRENCE_SCORE, TERM_OCCURRENCE_SCORE * occurrences);
          if (contentTokens.contains(term)) {
            score += EXACT_TOKEN_BONUS;
          }
        }
      }
      for (int i = 0; i + 1 < queryTerms.size(); i++) {
        if (content.contains(queryTerms.get(i) + " " + queryTerms.get(i + 1))) {
          score += BIGRAM_BONUS;
        }
      }
      String name = document.metadata().name();
      if (name != null) {
        String nameLower = name.toLowerCase(Locale.ROOT);
        if (queryTerms.stream().anyMatch(nameLower::contains)) {
          score += NAME_MATCH_BONUS;
        }
      }
      scores.add(score);
    }
    return scores;
  }

  /** Additive boost from document type, source authority and recency, given the query intent. */
  public double getMetadataBoost(Document document, QueryIntentScores intent) {
    DocumentMetadata metadata = document.metadata();
    String type = metadata.typeValue().map(t -> t.toLowerCase(Locale.ROOT)).orElse("");
    double boost = 0.0;

    if ((type.equals("vitamin") || type.equals("mineral"))
        && intent.isActive(QueryIntent.NUTRIENT_INFO)) {
      boost += NUTRIENT_TYPE_BOOST;
    }
    if (type.equals("recipe") && intent.isActive(QueryIntent.RECIPE)) {
      boost += RECIPE_TYPE_BOOST;
    }
    if (type.equals("diet_advice") && intent.isActive(QueryIntent.GENERAL_NUTRITION)) {
      boost += DIET_ADVICE_TYPE_BOOST;
    }
    if (intent.isActive(QueryIntent.HEALTH_CONDITION)) {
      String source = metadata.sourceValue().map(s -> s.toLowerCase(Locale.ROOT)).orElse("");
      if (HEALTH_AUTHORITY_DOMAINS.stream().anyMatch(source::contains)) {
        boost += AUTHORITY_SOURCE_BOOST;
      }
    }
    Optional<LocalDateTime> date = IsoDates.parse(metadata.date(), clock.getZone());
    if (date.isPresent()
        && ChronoUnit.DAYS.between(date.get(), LocalDateTime.now(clock)) < RECENT_DATE_DAYS) {
      boost += RECENT_DATE_BOOST;
    }
    return boost;
  }

  public int getK() {
    return k;
  }

  public boolean isUseReranking() {
    return useReranking;
  }

  public Reranker getReranker() {
    return reranker;
  }

  SimilaritySearch getSimilaritySearch() {
    return similaritySearch;
  }

  List<Document> truncate(List<Document> documents) {
    return documents.size() <= k ? documents : List.copyOf(documents.subList(0, k));
  }

  private static List<String> keywordTerms(String query) {
    List<String> terms = new ArrayList<>();
    for (String token : QueryTerms.tokens(query)) {
      String term = QueryTerms.trimPunctuation(token);
      if (term.length() > 2) {
        terms.add(term);
      }
    }
    return terms;
  }

  private record ScoredDocument(Document document, double score) {}
}
