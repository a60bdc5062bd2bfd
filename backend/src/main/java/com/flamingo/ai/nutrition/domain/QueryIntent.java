package com.flamingo.ai.nutrition.domain;

/** Purpose categories a nutrition query can express. Used to bias scoring. */
public enum QueryIntent {
  NUTRIENT_INFO("nutrient_info"),
  FOOD_SOURCES("food_sources"),
  HEALTH_CONDITION("health_condition"),
  RECIPE("recipe"),
  GENERAL_NUTRITION("general_nutrition"),
  COMPARISON("comparison"),
  DIETARY_RESTRICTION("dietary_restriction");

  private final String label;

  QueryIntent(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }
}
