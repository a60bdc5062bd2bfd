package com.flamingo.ai.nutrition.service.rag.rerank;

import lombok.Builder;

/**
 * Weights and limits for {@link DocumentReRanker}. Weights need not sum to one since combined
 * scores are divided by the total weight.
 *
 * @param nutrientMatchBonus weight of the nutrition vocabulary scorer
 * @param topNToRerank only this many leading documents are scored; the rest keep their order
 */
@Builder(toBuilder = true)
public record ReRankingConfig(
    double semanticWeight,
    double freshnessWeight,
    double authorityWeight,
    double termProximityWeight,
    double nutrientMatchBonus,
    int maxAgeDays,
    int topNToRerank) {

  public static final double DEFAULT_SEMANTIC_WEIGHT = 0.6;
  public static final double DEFAULT_FRESHNESS_WEIGHT = 0.1;
  public static final double DEFAULT_AUTHORITY_WEIGHT = 0.15;
  public static final double DEFAULT_TERM_PROXIMITY_WEIGHT = 0.15;
  public static final double DEFAULT_NUTRIENT_MATCH_BONUS = 0.2;
  public static final int DEFAULT_MAX_AGE_DAYS = 365;
  public static final int DEFAULT_TOP_N_TO_RERANK = 20;

  public ReRankingConfig {
    if (maxAgeDays <= 0) {
      throw new IllegalArgumentException("maxAgeDays must be positive: " + maxAgeDays);
    }
    if (topNToRerank < 0) {
      throw new IllegalArgumentException("topNToRerank must not be negative: " + topNToRerank);
    }
  }

  public static ReRankingConfig defaults() {
    return new ReRankingConfig(
        DEFAULT_SEMANTIC_WEIGHT,
        DEFAULT_FRESHNESS_WEIGHT,
        DEFAULT_AUTHORITY_WEIGHT,
        DEFAULT_TERM_PROXIMITY_WEIGHT,
        DEFAULT_NUTRIENT_MATCH_BONUS,
        DEFAULT_MAX_AGE_DAYS,
        DEFAULT_TOP_N_TO_RERANK);
  }
}
