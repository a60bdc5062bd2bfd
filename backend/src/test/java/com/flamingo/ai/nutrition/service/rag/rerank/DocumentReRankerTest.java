package com.flamingo.ai.nutrition.service.rag.rerank;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.nutrition.domain.Document;
import com.flamingo.ai.nutrition.service.rag.scoring.DocumentScorer;
import com.flamingo.ai.nutrition.service.rag.scoring.SemanticSimilarityScorer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DocumentReRankerTest {

  private MeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
  }

  private static List<Document> documents(int count) {
    List<Document> documents = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      documents.add(Document.of("document " + i));
    }
    return documents;
  }

  @Nested
  @DisplayName("Ordering")
  class Ordering {

    @Test
    void shouldReturnInputUnchanged_whenEmptyOrSingle() {
      DocumentReRanker reRanker = new DocumentReRanker();
      List<Document> empty = List.of();
      List<Document> single = List.of(Document.of("only one"));

      assertThat(reRanker.rerank(empty, "query")).isSameAs(empty);
      assertThat(reRanker.rerank(single, "query")).isSameAs(single);
    }

    @Test
    void shouldSortByWeightedScoreDescending() {
      // Given
      DocumentReRanker reRanker =
          new DocumentReRanker(
              ReRankingConfig.defaults(),
              List.of(new FixedScorer(1.0, List.of(0.1, 0.9, 0.5))),
              meterRegistry);
      List<Document> input = documents(3);

      // When
      List<Document> result = reRanker.rerank(input, "query");

      // Then
      assertThat(result).containsExactly(input.get(1), input.get(2), input.get(0));
      assertThat(meterRegistry.counter("rag.rerank.invocations").count()).isEqualTo(1.0);
    }

    @Test
    void shouldKeepDocumentsBeyondTopNInPlace() {
      // Given
      ReRankingConfig config = ReRankingConfig.defaults().toBuilder().topNToRerank(2).build();
      DocumentReRanker reRanker =
          new DocumentReRanker(
              config, List.of(new FixedScorer(1.0, List.of(0.2, 0.8))), meterRegistry);
      List<Document> input = documents(5);

      // When
      List<Document> result = reRanker.rerank(input, "query");

      // Then
      assertThat(result).hasSize(5);
      assertThat(result.subList(0, 2)).containsExactly(input.get(1), input.get(0));
      assertThat(result.subList(2, 5)).containsExactlyElementsOf(input.subList(2, 5));
    }

    @Test
    void shouldKeepRetrievalOrder_forTies() {
      DocumentReRanker reRanker =
          new DocumentReRanker(
              ReRankingConfig.defaults(),
              List.of(new FixedScorer(1.0, List.of(0.5, 0.5, 0.5))),
              meterRegistry);
      List<Document> input = documents(3);

      assertThat(reRanker.rerank(input, "query")).containsExactlyElementsOf(input);
    }

    @Test
    void shouldRerankWithoutError_forEmptyQuery() {
      DocumentReRanker reRanker = new DocumentReRanker();
      List<Document> input =
          List.of(
              Document.of("Zinc supports immunity.", Map.of("source", "blog")),
              Document.of("Iron prevents anemia.", Map.of("source", "nih.gov")));

      List<Document> result = reRanker.rerank(input, "");

      // only authority differs, so the nih.gov document moves up
      assertThat(result).containsExactly(input.get(1), input.get(0));
    }

    @Test
    void shouldBeDeterministic() {
      DocumentReRanker reRanker = new DocumentReRanker();
      List<Document> input =
          List.of(
              Document.of("Iron deficiency can cause anemia.", Map.of("source", "mayoclinic.org")),
              Document.of("Vitamin D supports bone health.", Map.of("source", "nih.gov")),
              Document.of("Leafy greens are rich in iron.", Map.of("source", "blog")));

      List<Document> first = reRanker.rerank(input, "iron deficiency");
      List<Document> second = reRanker.rerank(input, "iron deficiency");

      assertThat(first).containsExactlyElementsOf(second);
    }
  }

  @Nested
  @DisplayName("Score combination")
  class ScoreCombination {

    @Test
    void shouldNormalizeEachScorerByItsMaximum() {
      DocumentReRanker reRanker =
          new DocumentReRanker(
              ReRankingConfig.defaults(),
              List.of(new FixedScorer(2.0, List.of(0.2, 0.4))),
              meterRegistry);

      assertThat(reRanker.combinedScores(documents(2), "query")).containsExactly(0.5, 1.0);
    }

    @Test
    void shouldSkipFailingScorer() {
      // Given
      DocumentReRanker reRanker =
          new DocumentReRanker(
              ReRankingConfig.defaults(),
              List.of(new FailingScorer(), new FixedScorer(1.0, List.of(0.3, 0.6))),
              meterRegistry);
      List<Document> input = documents(2);

      // When
      List<Document> result = reRanker.rerank(input, "query");

      // Then
      assertThat(result).containsExactly(input.get(1), input.get(0));
      assertThat(
              meterRegistry.counter("rag.rerank.scorer.errors", "scorer", "FailingScorer").count())
          .isEqualTo(1.0);
    }

    @Test
    void shouldSkipScorerReturningWrongNumberOfScores() {
      DocumentReRanker reRanker =
          new DocumentReRanker(
              ReRankingConfig.defaults(),
              List.of(new FixedScorer(5.0, List.of(1.0)), new FixedScorer(1.0, List.of(0.3, 0.6))),
              meterRegistry);

      assertThat(reRanker.combinedScores(documents(2), "query")).containsExactly(0.5, 1.0);
    }

    @Test
    void shouldReturnZeros_whenTotalWeightIsZero() {
      DocumentReRanker reRanker =
          new DocumentReRanker(
              ReRankingConfig.defaults(),
              List.of(new FixedScorer(0.0, List.of(0.3, 0.6))),
              meterRegistry);
      List<Document> input = documents(2);

      assertThat(reRanker.combinedScores(input, "query")).containsExactly(0.0, 0.0);
      assertThat(reRanker.rerank(input, "query")).containsExactlyElementsOf(input);
    }
  }

  @Nested
  @DisplayName("Construction")
  class Construction {

    @Test
    void shouldBuildFiveDefaultScorersWeightedFromConfig() {
      DocumentReRanker reRanker = new DocumentReRanker();

      assertThat(reRanker.getScorers()).hasSize(5);
      assertThat(reRanker.getScorers())
          .extracting(DocumentScorer::weight)
          .containsExactly(0.6, 0.1, 0.15, 0.15, 0.2);
      assertThat(reRanker.getConfig()).isEqualTo(ReRankingConfig.defaults());
    }

    @Test
    void shouldReplaceDefaultScorer_whenGivenExplicitly() {
      DocumentScorer semantic = new SemanticSimilarityScorer(0.9);

      DocumentReRanker reRanker =
          DocumentReRanker.builder().semanticScorer(semantic).meterRegistry(meterRegistry).build();

      assertThat(reRanker.getScorers().get(0)).isSameAs(semantic);
      assertThat(reRanker.getScorers()).hasSize(5);
    }

    @Test
    void shouldRejectInvalidConfig() {
      assertThatThrownBy(() -> ReRankingConfig.defaults().toBuilder().maxAgeDays(0).build())
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> ReRankingConfig.defaults().toBuilder().topNToRerank(-1).build())
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  private static class FixedScorer implements DocumentScorer {
    private final double weight;
    private final List<Double> scores;

    FixedScorer(double weight, List<Double> scores) {
      this.weight = weight;
      this.scores = scores;
    }

    @Override
    public List<Double> score(List<Document> documents, String query) {
      return scores;
    }

    @Override
    public double weight() {
      return weight;
    }
  }

  private static class FailingScorer implements DocumentScorer {
    @Override
    public List<Double> score(List<Document> documents, String query) {
      throw new IllegalStateException("scorer broke");
    }

    @Override
    public double weight() {
      return 1.0;
    }
  }
}
