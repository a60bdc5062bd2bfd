package com.flamingo.ai.nutrition.service.advice;

import com.flamingo.ai.nutrition.service.citation.Citation;
import java.util.List;

/** A synthesized answer and the citations of the documents it was grounded on. */
public record NutritionAdvice(String query, String response, List<Citation> citations) {}
