package com.flamingo.ai.nutrition.config;

import com.flamingo.ai.nutrition.service.rag.rerank.ReRankingConfig;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the nutrition retrieval pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Retrieval retrieval = new Retrieval();
  private Reformulation reformulation = new Reformulation();
  private Reranking reranking = new Reranking();
  private Similarity similarity = new Similarity();
  private Citation citation = new Citation();

  @Getter
  @Setter
  public static class Retrieval {
    /** Number of documents returned per query. */
    private int k = 4;

    /** Rerank the domain-sorted candidates with the multi-signal reranker. */
    private boolean useReranking = false;
  }

  @Getter
  @Setter
  public static class Reformulation {
    private boolean enabled = true;

    /** Upper bound on queries searched per request, original included. */
    private int maxQueries = 4;

    private boolean includeOriginal = true;
  }

  @Getter
  @Setter
  public static class Reranking {
    private double semanticWeight = ReRankingConfig.DEFAULT_SEMANTIC_WEIGHT;
    private double freshnessWeight = ReRankingConfig.DEFAULT_FRESHNESS_WEIGHT;
    private double authorityWeight = ReRankingConfig.DEFAULT_AUTHORITY_WEIGHT;
    private double termProximityWeight = ReRankingConfig.DEFAULT_TERM_PROXIMITY_WEIGHT;
    private double nutrientMatchBonus = ReRankingConfig.DEFAULT_NUTRIENT_MATCH_BONUS;
    private int maxAgeDays = ReRankingConfig.DEFAULT_MAX_AGE_DAYS;
    private int topNToRerank = ReRankingConfig.DEFAULT_TOP_N_TO_RERANK;

    /** Score semantic similarity with embeddings instead of keyword overlap. */
    private boolean semanticEmbeddings = false;

    /** Source name or domain to authority score. Empty uses the built-in nutrition authorities. */
    private Map<String, Double> authoritySources = new LinkedHashMap<>();

    public ReRankingConfig toReRankingConfig() {
      return new ReRankingConfig(
          semanticWeight,
          freshnessWeight,
          authorityWeight,
          termProximityWeight,
          nutrientMatchBonus,
          maxAgeDays,
          topNToRerank);
    }
  }

  @Getter
  @Setter
  public static class Similarity {
    /** Candidates fetched from the embedding store per query. */
    private int maxResults = 10;

    private double minScore = 0.0;
  }

  @Getter
  @Setter
  public static class Citation {
    /** mla, apa or chicago. */
    private String defaultStyle = "mla";
  }
}
