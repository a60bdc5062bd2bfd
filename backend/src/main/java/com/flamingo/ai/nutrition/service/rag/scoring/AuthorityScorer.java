package com.flamingo.ai.nutrition.service.rag.scoring;

import com.flamingo.ai.nutrition.domain.Document;
import com.flamingo.ai.nutrition.domain.DocumentMetadata;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores documents by how trustworthy their source is. The {@code source} field is looked up
 * exactly first; otherwise the first known domain contained in the {@code url} wins. Unknown
 * sources score 0.5.
 */
public class AuthorityScorer implements DocumentScorer {

  static final double UNKNOWN_SOURCE_SCORE = 0.5;

  private static final Map<String, Double> DEFAULT_AUTHORITIES = defaultAuthorities();

  private final double weight;
  private final Map<String, Double> authoritySources;

  public AuthorityScorer(double weight) {
    this(weight, null);
  }

  /**
   * @param authoritySources source name or domain to score, checked in iteration order for URL
   *     matches; {@code null} or empty selects the built-in nutrition authorities
   */
  public AuthorityScorer(double weight, Map<String, Double> authoritySources) {
    this.weight = weight;
    this.authoritySources =
        authoritySources == null || authoritySources.isEmpty()
            ? DEFAULT_AUTHORITIES
            : Collections.unmodifiableMap(new LinkedHashMap<>(authoritySources));
  }

  public static Map<String, Double> defaultAuthorities() {
    Map<String, Double> authorities = new LinkedHashMap<>();
    authorities.put("nih.gov", 0.9);
    authorities.put("cdc.gov", 0.9);
    authorities.put("mayoclinic.org", 0.85);
    authorities.put("harvard.edu", 0.85);
    authorities.put("who.int", 0.9);
    authorities.put("nutrition.org", 0.8);
    authorities.put("nutritionfacts.org", 0.75);
    return Collections.unmodifiableMap(authorities);
  }

  @Override
  public List<Double> score(List<Document> documents, String query) {
    List<Double> scores = new ArrayList<>(documents.size());
    for (Document document : documents) {
      scores.add(authorityOf(document.metadata()));
    }
    return scores;
  }

  @Override
  public double weight() {
    return weight;
  }

  public Map<String, Double> getAuthoritySources() {
    return authoritySources;
  }

  private double authorityOf(DocumentMetadata metadata) {
    String source = metadata.source();
    if (source != null && !source.isEmpty() && authoritySources.containsKey(source)) {
      return authoritySources.get(source);
    }
    String url = metadata.url();
    if (url != null && !url.isEmpty()) {
      for (Map.Entry<String, Double> authority : authoritySources.entrySet()) {
        if (url.contains(authority.getKey())) {
          return authority.getValue();
        }
      }
    }
    return UNKNOWN_SOURCE_SCORE;
  }
}
