package com.flamingo.ai.nutrition.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Confidence per {@link QueryIntent} for one query. Scores are additive trigger weights and do not
 * sum to one. Every intent is present; intents that did not fire score zero.
 */
public final class QueryIntentScores {

  private final Map<QueryIntent, Double> scores;

  private QueryIntentScores(Map<QueryIntent, Double> scores) {
    EnumMap<QueryIntent, Double> copy = new EnumMap<>(QueryIntent.class);
    for (QueryIntent intent : QueryIntent.values()) {
      copy.put(intent, scores.getOrDefault(intent, 0.0));
    }
    this.scores = Collections.unmodifiableMap(copy);
  }

  public static QueryIntentScores of(Map<QueryIntent, Double> scores) {
    return new QueryIntentScores(scores);
  }

  public double score(QueryIntent intent) {
    return scores.get(intent);
  }

  public boolean isActive(QueryIntent intent) {
    return score(intent) > 0;
  }

  /** Highest scoring intent; ties resolve to the one declared first. */
  public Optional<QueryIntent> dominant() {
    QueryIntent best = null;
    for (Map.Entry<QueryIntent, Double> entry : scores.entrySet()) {
      if (entry.getValue() > 0 && (best == null || entry.getValue() > scores.get(best))) {
        best = entry.getKey();
      }
    }
    return Optional.ofNullable(best);
  }

  public Map<QueryIntent, Double> asMap() {
    return scores;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof QueryIntentScores other && scores.equals(other.scores);
  }

  @Override
  public int hashCode() {
    return scores.hashCode();
  }

  @Override
  public String toString() {
    return "QueryIntentScores" + scores;
  }
}
