package com.flamingo.ai.nutrition.service.rag.scoring;

import com.flamingo.ai.nutrition.domain.Document;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rewards documents where query terms occur near each other: every 10-word window holding at least
 * two distinct query terms adds 0.1 on top of a 0.5 base, capped at 1.0.
 */
public class TermProximityScorer implements DocumentScorer {

  static final int WINDOW_SIZE = 10;
  static final double BASE_SCORE = 0.5;
  static final double WINDOW_BONUS = 0.1;

  private final double weight;

  public TermProximityScorer(double weight) {
    this.weight = weight;
  }

  @Override
  public List<Double> score(List<Document> documents, String query) {
    List<String> queryTerms = QueryTerms.distinctTermsLongerThan(query, 2);
    if (queryTerms.size() < 2) {
      return new ArrayList<>(Collections.nCopies(documents.size(), BASE_SCORE));
    }

    List<Double> scores = new ArrayList<>(documents.size());
    for (Document document : documents) {
      int windowsFound = countProximityWindows(QueryTerms.tokens(document.content()), queryTerms);
      scores.add(
          windowsFound > 0 ? Math.min(1.0, BASE_SCORE + windowsFound * WINDOW_BONUS) : BASE_SCORE);
    }
    return scores;
  }

  @Override
  public double weight() {
    return weight;
  }

  private int countProximityWindows(List<String> words, List<String> queryTerms) {
    int windowsFound = 0;
    for (int i = 0; i + WINDOW_SIZE <= words.size(); i++) {
      String window = String.join(" ", words.subList(i, i + WINDOW_SIZE));
      int termsInWindow = 0;
      for (String term : queryTerms) {
        if (window.contains(term)) {
          termsInWindow++;
        }
      }
      if (termsInWindow >= 2) {
        windowsFound++;
      }
    }
    return windowsFound;
  }
}
