package com.flamingo.ai.nutrition.service.rag.rerank;

import com.flamingo.ai.nutrition.domain.Document;
import com.flamingo.ai.nutrition.service.rag.scoring.AuthorityScorer;
import com.flamingo.ai.nutrition.service.rag.scoring.DocumentScorer;
import com.flamingo.ai.nutrition.service.rag.scoring.FreshnessScorer;
import com.flamingo.ai.nutrition.service.rag.scoring.NutritionSpecificScorer;
import com.flamingo.ai.nutrition.service.rag.scoring.SemanticSimilarityScorer;
import com.flamingo.ai.nutrition.service.rag.scoring.TermProximityScorer;
import dev.langchain4j.model.embedding.EmbeddingModel;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * Multi-signal reranker. Combines semantic similarity, freshness, source authority, term proximity
 * and nutrition vocabulary scores into one weighted relevance score.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Score only the first {@code topNToRerank} documents; the tail keeps its position
 *   <li>Normalize each scorer's output by its maximum (a non-positive maximum counts as 1)
 *   <li>Combine with {@code Σ(score × weight) / Σ(weight)}, skipping scorers that fail
 *   <li>Stable sort the scored prefix by combined score, descending
 * </ol>
 */
@Slf4j
public class DocumentReRanker implements Reranker {

  private final ReRankingConfig config;
  private final List<DocumentScorer> scorers;
  private final MeterRegistry meterRegistry;

  public DocumentReRanker() {
    this(ReRankingConfig.defaults());
  }

  public DocumentReRanker(ReRankingConfig config) {
    this(config, null, null, null, null, null, null, null, null, null);
  }

  public DocumentReRanker(
      ReRankingConfig config, List<DocumentScorer> scorers, MeterRegistry meterRegistry) {
    this.config = config != null ? config : ReRankingConfig.defaults();
    this.scorers = List.copyOf(scorers);
    this.meterRegistry = meterRegistry != null ? meterRegistry : Metrics.globalRegistry;
  }

  /**
   * Builds a reranker with the five default scorers weighted from {@code config}. Any scorer given
   * explicitly replaces its default.
   */
  @Builder
  private DocumentReRanker(
      ReRankingConfig config,
      DocumentScorer semanticScorer,
      DocumentScorer freshnessScorer,
      DocumentScorer authorityScorer,
      DocumentScorer termProximityScorer,
      DocumentScorer nutritionScorer,
      EmbeddingModel embeddingModel,
      Map<String, Double> authoritySources,
      Clock clock,
      MeterRegistry meterRegistry) {
    ReRankingConfig effective = config != null ? config : ReRankingConfig.defaults();
    Clock effectiveClock = clock != null ? clock : Clock.systemDefaultZone();
    this.config = effective;
    this.scorers =
        List.of(
            semanticScorer != null
                ? semanticScorer
                : new SemanticSimilarityScorer(effective.semanticWeight(), embeddingModel),
            freshnessScorer != null
                ? freshnessScorer
                : new FreshnessScorer(
                    effective.freshnessWeight(), effective.maxAgeDays(), effectiveClock),
            authorityScorer != null
                ? authorityScorer
                : new AuthorityScorer(effective.authorityWeight(), authoritySources),
            termProximityScorer != null
                ? termProximityScorer
                : new TermProximityScorer(effective.termProximityWeight()),
            nutritionScorer != null
                ? nutritionScorer
                : new NutritionSpecificScorer(effective.nutrientMatchBonus()));
    this.meterRegistry = meterRegistry != null ? meterRegistry : Metrics.globalRegistry;
  }

  @Override
  public List<Document> rerank(List<Document> documents, String query) {
    if (documents.size() <= 1) {
      return documents;
    }

    int topN = Math.min(config.topNToRerank(), documents.size());
    List<Document> toRerank = documents.subList(0, topN);
    List<Document> remaining = documents.subList(topN, documents.size());
    if (toRerank.isEmpty()) {
      return documents;
    }

    double[] combined = combinedScores(toRerank, query);

    List<ScoredDocument> scored = new ArrayList<>(toRerank.size());
    for (int i = 0; i < toRerank.size(); i++) {
      scored.add(new ScoredDocument(toRerank.get(i), combined[i]));
    }
    // List.sort is stable, so exact ties keep their retrieval order
    scored.sort(Comparator.comparingDouble(ScoredDocument::score).reversed());

    List<Document> reranked = new ArrayList<>(documents.size());
    scored.forEach(entry -> reranked.add(entry.document()));
    reranked.addAll(remaining);

    meterRegistry.counter("rag.rerank.invocations").increment();
    log.debug(
        "Reranked {} documents ({} left in place), top score: {}",
        toRerank.size(),
        remaining.size(),
        String.format("%.2f", scored.get(0).score()));

    return reranked;
  }

  /**
   * Weighted average of every scorer's normalized output for each document.
   *
   * @return combined score per document; all zeros when no scorer contributed any weight
   */
  double[] combinedScores(List<Document> documents, String query) {
    double[] weightedSum = new double[documents.size()];
    double totalWeight = 0.0;

    for (DocumentScorer scorer : scorers) {
      List<Double> scores;
      try {
        scores = scorer.score(documents, query);
      } catch (Exception e) {
        log.warn("Scorer {} failed, skipping it: {}", scorer.name(), e.getMessage());
        meterRegistry.counter("rag.rerank.scorer.errors", "scorer", scorer.name()).increment();
        continue;
      }
      if (scores == null || scores.size() != documents.size()) {
        log.warn(
            "Scorer {} returned {} scores for {} documents, skipping it",
            scorer.name(),
            scores == null ? 0 : scores.size(),
            documents.size());
        meterRegistry.counter("rag.rerank.scorer.errors", "scorer", scorer.name()).increment();
        continue;
      }

      double max = scores.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
      double divisor = max > 0 ? max : 1.0;
      for (int i = 0; i < documents.size(); i++) {
        weightedSum[i] += (scores.get(i) / divisor) * scorer.weight();
      }
      totalWeight += scorer.weight();
    }

    double[] combined = new double[documents.size()];
    if (totalWeight > 0) {
      for (int i = 0; i < combined.length; i++) {
        combined[i] = weightedSum[i] / totalWeight;
      }
    }
    return combined;
  }

  public ReRankingConfig getConfig() {
    return config;
  }

  public List<DocumentScorer> getScorers() {
    return scorers;
  }

  private record ScoredDocument(Document document, double score) {}
}
