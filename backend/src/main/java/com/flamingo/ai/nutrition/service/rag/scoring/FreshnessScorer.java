package com.flamingo.ai.nutrition.service.rag.scoring;

import com.flamingo.ai.nutrition.domain.Document;
import com.flamingo.ai.nutrition.domain.IsoDates;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Prefers recent documents. Score falls linearly from 1 (today) to 0 at {@code maxAgeDays};
 * documents without a parsable {@code date}/{@code created_at} get a neutral 0.5.
 */
public class FreshnessScorer implements DocumentScorer {

  static final double NEUTRAL_SCORE = 0.5;

  private final double weight;
  private final int maxAgeDays;
  private final Clock clock;

  public FreshnessScorer(double weight, int maxAgeDays) {
    this(weight, maxAgeDays, Clock.systemDefaultZone());
  }

  public FreshnessScorer(double weight, int maxAgeDays, Clock clock) {
    if (maxAgeDays <= 0) {
      throw new IllegalArgumentException("maxAgeDays must be positive: " + maxAgeDays);
    }
    this.weight = weight;
    this.maxAgeDays = maxAgeDays;
    this.clock = clock;
  }

  @Override
  public List<Double> score(List<Document> documents, String query) {
    LocalDateTime now = LocalDateTime.now(clock);
    List<Double> scores = new ArrayList<>(documents.size());
    for (Document document : documents) {
      Optional<LocalDateTime> documentDate =
          document
              .metadata()
              .dateOrCreatedAt()
              .flatMap(text -> IsoDates.parse(text, clock.getZone()));
      if (documentDate.isEmpty()) {
        scores.add(NEUTRAL_SCORE);
        continue;
      }
      long ageDays = ChronoUnit.DAYS.between(documentDate.get(), now);
      scores.add(Math.max(0.0, 1.0 - ((double) ageDays / maxAgeDays)));
    }
    return scores;
  }

  @Override
  public double weight() {
    return weight;
  }
}
