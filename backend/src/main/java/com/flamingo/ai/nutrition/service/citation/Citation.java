package com.flamingo.ai.nutrition.service.citation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A source reference derived from one retrieved document.
 *
 * @param text the citation as rendered by the generator's default style
 * @param sourceName source name, never null
 * @param sourceUrl source URL, may be null
 * @param dateAccessed access date such as {@code 17 October 2026}, may be null
 * @param originalContent content snippet of at most 100 characters, may be null
 * @param metadata the document metadata the citation was built from
 */
public record Citation(
    String text,
    String sourceName,
    String sourceUrl,
    String dateAccessed,
    String originalContent,
    Map<String, Object> metadata) {

  static final String UNKNOWN_SOURCE = "Unknown Source";

  public Citation {
    metadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  /**
   * Renders the citation in the named style. Unknown styles return {@link #text()} unchanged.
   *
   * @param style {@code mla}, {@code apa} or {@code chicago}, case-insensitive
   */
  public String toDisplayFormat(String style) {
    return CitationStyle.fromName(style).map(this::toDisplayFormat).orElse(text);
  }

  public String toDisplayFormat(CitationStyle style) {
    return switch (style) {
      case MLA -> toMlaFormat();
      case APA -> toApaFormat();
      case CHICAGO -> toChicagoFormat();
    };
  }

  private String toMlaFormat() {
    if (text != null && text.contains("Accessed")) {
      return text;
    }
    String url = sourceUrl != null ? ", " + sourceUrl : "";
    String date = dateAccessed != null ? ", Accessed " + dateAccessed : "";
    return "\"" + displayName() + "\"" + url + date + ".";
  }

  private String toApaFormat() {
    String url = sourceUrl != null ? ". Retrieved from " + sourceUrl : "";
    String date = dateAccessed != null ? " on " + dateAccessed : "";
    return displayName() + url + date + ".";
  }

  private String toChicagoFormat() {
    String url = sourceUrl != null ? ", " + sourceUrl : "";
    String date =
        dateAccessed != null ? ", accessed " + dateAccessed.toLowerCase(Locale.ROOT) : "";
    return "\"" + displayName() + "\"" + url + date + ".";
  }

  private String displayName() {
    return sourceName != null && !sourceName.isEmpty() ? sourceName : UNKNOWN_SOURCE;
  }
}
