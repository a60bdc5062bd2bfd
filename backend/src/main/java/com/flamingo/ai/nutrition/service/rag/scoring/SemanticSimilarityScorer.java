package com.flamingo.ai.nutrition.service.rag.scoring;

import com.flamingo.ai.nutrition.domain.Document;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.CosineSimilarity;
import dev.langchain4j.store.embedding.RelevanceScore;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;

/**
 * Scores query/document similarity. With an {@link EmbeddingModel} the score is the cosine
 * similarity of the two embeddings mapped to {@code [0, 1]}; without one it is the fraction of
 * query terms that occur in the content.
 */
@Slf4j
public class SemanticSimilarityScorer implements DocumentScorer {

  private final double weight;
  private final EmbeddingModel embeddingModel;

  public SemanticSimilarityScorer(double weight) {
    this(weight, null);
  }

  public SemanticSimilarityScorer(double weight, EmbeddingModel embeddingModel) {
    this.weight = weight;
    this.embeddingModel = embeddingModel;
  }

  @Override
  public List<Double> score(List<Document> documents, String query) {
    if (embeddingModel == null || documents.isEmpty()) {
      return keywordOverlap(documents, query);
    }
    try {
      return embeddingSimilarity(documents, query);
    } catch (RuntimeException e) {
      log.warn("Embedding similarity failed, using keyword overlap: {}", e.getMessage());
      return keywordOverlap(documents, query);
    }
  }

  @Override
  public double weight() {
    return weight;
  }

  private List<Double> keywordOverlap(List<Document> documents, String query) {
    List<String> queryTerms = QueryTerms.tokens(query);
    List<Double> scores = new ArrayList<>(documents.size());
    for (Document document : documents) {
      String content = document.content().toLowerCase(Locale.ROOT);
      long matches = queryTerms.stream().filter(content::contains).count();
      scores.add((double) matches / Math.max(1, queryTerms.size()));
    }
    return scores;
  }

  private List<Double> embeddingSimilarity(List<Document> documents, String query) {
    Embedding queryEmbedding = embeddingModel.embed(query).content();
    List<TextSegment> segments =
        documents.stream().map(document -> TextSegment.from(document.content())).toList();
    List<Embedding> documentEmbeddings = embeddingModel.embedAll(segments).content();
    if (documentEmbeddings.size() != documents.size()) {
      throw new IllegalStateException(
          "Expected " + documents.size() + " embeddings, got " + documentEmbeddings.size());
    }
    List<Double> scores = new ArrayList<>(documents.size());
    for (Embedding embedding : documentEmbeddings) {
      double cosine = CosineSimilarity.between(queryEmbedding, embedding);
      scores.add(RelevanceScore.fromCosineSimilarity(cosine));
    }
    return scores;
  }
}
