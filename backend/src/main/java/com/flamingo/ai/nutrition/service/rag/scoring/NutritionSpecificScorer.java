package com.flamingo.ai.nutrition.service.rag.scoring;

import com.flamingo.ai.nutrition.domain.Document;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Nutrition vocabulary overlap. When the query mentions domain terms, documents mentioning the same
 * terms are lifted from 0.5 towards 1.0 in proportion to how many they share.
 */
public class NutritionSpecificScorer implements DocumentScorer {

  static final List<String> NUTRITION_TERMS =
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
          "potassium",
          "sodium",
          "fiber",
          "nutrient",
          "diet",
          "calorie",
          "supplement",
          "deficiency",
          "meal",
          "nutrition",
          "food",
          "health",
          "metabolism");

  static final double NEUTRAL_SCORE = 0.5;

  private final double weight;

  public NutritionSpecificScorer(double weight) {
    this.weight = weight;
  }

  @Override
  public List<Double> score(List<Document> documents, String query) {
    String queryLower = query.toLowerCase(Locale.ROOT);
    List<String> queryNutritionTerms =
        NUTRITION_TERMS.stream().filter(queryLower::contains).toList();

    List<Double> scores = new ArrayList<>(documents.size());
    for (Document document : documents) {
      if (queryNutritionTerms.isEmpty()) {
        scores.add(NEUTRAL_SCORE);
        continue;
      }
      String content = document.content().toLowerCase(Locale.ROOT);
      long matches = queryNutritionTerms.stream().filter(content::contains).count();
      scores.add(
          matches > 0
              ? Math.min(1.0, NEUTRAL_SCORE + ((double) matches / queryNutritionTerms.size()) * 0.5)
              : NEUTRAL_SCORE);
    }
    return scores;
  }

  @Override
  public double weight() {
    return weight;
  }
}
