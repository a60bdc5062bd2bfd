package com.flamingo.ai.nutrition.service.rag.retrieval;

import com.flamingo.ai.nutrition.config.RagConfig;
import com.flamingo.ai.nutrition.domain.Document;
import com.flamingo.ai.nutrition.domain.DocumentMetadata;
import com.flamingo.ai.nutrition.exception.SearchException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link SimilaritySearch} over a LangChain4j {@link EmbeddingStore}. The query is embedded with
 * the same model used at ingestion time; the match score is kept in the document's extra metadata
 * under {@code similarity_score}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EmbeddingStoreSimilaritySearch implements SimilaritySearch {

  static final String SIMILARITY_SCORE_KEY = "similarity_score";

  private final EmbeddingModel embeddingModel;
  private final EmbeddingStore<TextSegment> embeddingStore;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @CircuitBreaker(name = "openai")
  @Retry(name = "openai")
  public List<Document> search(String query) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Embedding queryEmbedding = embeddingModel.embed(query).content();
      EmbeddingSearchRequest request =
          EmbeddingSearchRequest.builder()
              .queryEmbedding(queryEmbedding)
              .maxResults(ragConfig.getSimilarity().getMaxResults())
              .minScore(ragConfig.getSimilarity().getMinScore())
              .build();
      List<EmbeddingMatch<TextSegment>> matches = embeddingStore.search(request).matches();
      log.debug("Similarity search returned {} matches for query: {}", matches.size(), query);
      meterRegistry.counter("rag.similarity.success").increment();
      return matches.stream()
          .filter(match -> match.embedded() != null)
          .map(this::toDocument)
          .toList();
    } catch (RuntimeException e) {
      meterRegistry.counter("rag.similarity.errors").increment();
      throw new SearchException("Similarity search failed: " + e.getMessage(), e);
    } finally {
      sample.stop(meterRegistry.timer("rag.similarity.duration"));
    }
  }

  private Document toDocument(EmbeddingMatch<TextSegment> match) {
    TextSegment segment = match.embedded();
    Map<String, Object> metadata = new LinkedHashMap<>(segment.metadata().toMap());
    metadata.put(SIMILARITY_SCORE_KEY, match.score());
    return new Document(segment.text(), DocumentMetadata.from(metadata));
  }
}
