package com.flamingo.ai.nutrition.config;

import com.flamingo.ai.nutrition.service.citation.CitationGenerator;
import com.flamingo.ai.nutrition.service.citation.CitationStyle;
import com.flamingo.ai.nutrition.service.rag.query.QueryReformulator;
import com.flamingo.ai.nutrition.service.rag.query.TextCompletion;
import com.flamingo.ai.nutrition.service.rag.rerank.DocumentReRanker;
import com.flamingo.ai.nutrition.service.rag.retrieval.DocumentRetriever;
import com.flamingo.ai.nutrition.service.rag.retrieval.EnhancedNutritionRetriever;
import com.flamingo.ai.nutrition.service.rag.retrieval.NutritionRetriever;
import com.flamingo.ai.nutrition.service.rag.retrieval.SimilaritySearch;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/** Wires the retrieval pipeline from {@link RagConfig}. */
@Configuration
@Slf4j
public class RetrievalConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }

  /** Empty in-memory store; deployments provide their own populated store bean. */
  @Bean
  @ConditionalOnMissingBean
  public EmbeddingStore<TextSegment> embeddingStore() {
    log.warn("No EmbeddingStore configured, using an empty in-memory store");
    return new InMemoryEmbeddingStore<>();
  }

  @Bean
  public DocumentReRanker documentReRanker(
      RagConfig ragConfig, EmbeddingModel embeddingModel, Clock clock, MeterRegistry registry) {
    RagConfig.Reranking reranking = ragConfig.getReranking();
    return DocumentReRanker.builder()
        .config(reranking.toReRankingConfig())
        .embeddingModel(reranking.isSemanticEmbeddings() ? embeddingModel : null)
        .authoritySources(reranking.getAuthoritySources())
        .clock(clock)
        .meterRegistry(registry)
        .build();
  }

  @Bean
  public NutritionRetriever nutritionRetriever(
      SimilaritySearch similaritySearch,
      DocumentReRanker documentReRanker,
      RagConfig ragConfig,
      Clock clock,
      MeterRegistry registry) {
    return NutritionRetriever.builder()
        .similaritySearch(similaritySearch)
        .k(ragConfig.getRetrieval().getK())
        .reranker(documentReRanker)
        .useReranking(ragConfig.getRetrieval().isUseReranking())
        .clock(clock)
        .meterRegistry(registry)
        .build();
  }

  @Bean
  public QueryReformulator queryReformulator(TextCompletion textCompletion, RagConfig ragConfig) {
    return new QueryReformulator(
        textCompletion, ragConfig.getReformulation().isIncludeOriginal());
  }

  @Bean
  @Primary
  public DocumentRetriever documentRetriever(
      NutritionRetriever nutritionRetriever,
      QueryReformulator queryReformulator,
      RagConfig ragConfig,
      MeterRegistry registry) {
    RagConfig.Reformulation reformulation = ragConfig.getReformulation();
    return new EnhancedNutritionRetriever(
        nutritionRetriever,
        queryReformulator,
        reformulation.getMaxQueries(),
        reformulation.isEnabled(),
        registry);
  }

  @Bean
  public CitationGenerator citationGenerator(RagConfig ragConfig, Clock clock) {
    String style = ragConfig.getCitation().getDefaultStyle();
    return new CitationGenerator(
        CitationStyle.fromName(style).orElse(CitationStyle.MLA), clock);
  }
}
