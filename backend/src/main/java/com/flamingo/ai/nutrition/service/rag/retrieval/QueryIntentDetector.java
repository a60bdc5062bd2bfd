package com.flamingo.ai.nutrition.service.rag.retrieval;

import com.flamingo.ai.nutrition.domain.QueryIntent;
import com.flamingo.ai.nutrition.domain.QueryIntentScores;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword-triggered intent detection. Each trigger group adds its weight once when any of its terms
 * occurs in the lower-cased query; with no trigger at all the query is treated as general
 * nutrition.
 */
public class QueryIntentDetector {

  static final double FALLBACK_GENERAL_NUTRITION = 0.5;

  private static final List<Trigger> TRIGGERS =
      List.of(
          new Trigger(
              QueryIntent.NUTRIENT_INFO,
              0.3,
              List.of(
                  "vitamin",
                  "mineral",
                  "protein",
                  "carbohydrate",
                  "fat",
                  "omega",
                  "calcium",
                  "iron",
                  "zinc",
                  "magnesium",
                  "potassium")),
          new Trigger(
              QueryIntent.FOOD_SOURCES,
              0.3,
              List.of("source", "food", "contain", "rich in", "high in")),
          new Trigger(
              QueryIntent.HEALTH_CONDITION,
              0.2,
              List.of(
                  "deficiency",
                  "health",
                  "condition",
                  "disease",
                  "symptom",
                  "prevent",
                  "improve",
                  "boost",
                  "benefit")),
          new Trigger(
              QueryIntent.RECIPE, 0.4, List.of("recipe", "make", "cook", "prepare", "meal")),
          new Trigger(
              QueryIntent.COMPARISON,
              0.3,
              List.of("vs", "versus", "compared to", "difference", "better")),
          new Trigger(
              QueryIntent.DIETARY_RESTRICTION,
              0.3,
              List.of(
                  "vegan",
                  "vegetarian",
                  "keto",
                  "paleo",
                  "gluten",
                  "lactose",
                  "allergy",
                  "intolerance",
                  "diet")),
          new Trigger(
              QueryIntent.GENERAL_NUTRITION,
              0.5,
              List.of("nutrition", "nutrient", "healthy eating")));

  public QueryIntentScores detect(String query) {
    String queryLower = query == null ? "" : query.toLowerCase(Locale.ROOT);
    Map<QueryIntent, Double> scores = new EnumMap<>(QueryIntent.class);

    for (Trigger trigger : TRIGGERS) {
      if (trigger.terms().stream().anyMatch(queryLower::contains)) {
        scores.merge(trigger.intent(), trigger.weight(), Double::sum);
      }
    }

    if (scores.values().stream().allMatch(score -> score == 0.0)) {
      scores.put(QueryIntent.GENERAL_NUTRITION, FALLBACK_GENERAL_NUTRITION);
    }
    return QueryIntentScores.of(scores);
  }

  private record Trigger(QueryIntent intent, double weight, List<String> terms) {}
}
