package com.flamingo.ai.nutrition.service.citation;

import com.flamingo.ai.nutrition.domain.Document;
import com.flamingo.ai.nutrition.domain.DocumentMetadata;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/** Builds {@link Citation}s for the documents an answer was grounded on. */
public class CitationGenerator {

  private static final DateTimeFormatter ACCESS_DATE_FORMAT =
      DateTimeFormatter.ofPattern("dd MMMM yyyy", Locale.ENGLISH);
  private static final int SNIPPET_LIMIT = 100;
  private static final int SNIPPET_KEEP = 97;

  private final CitationStyle defaultStyle;
  private final Clock clock;

  public CitationGenerator() {
    this(CitationStyle.MLA, Clock.systemDefaultZone());
  }

  public CitationGenerator(CitationStyle defaultStyle, Clock clock) {
    this.defaultStyle = defaultStyle != null ? defaultStyle : CitationStyle.MLA;
    this.clock = clock;
  }

  public Citation generateCitation(Document document) {
    DocumentMetadata metadata = document.metadata();
    String sourceName =
        firstNonEmpty(metadata.source(), metadata.name(), Citation.UNKNOWN_SOURCE);
    String sourceUrl =
        metadata.url() != null && !metadata.url().isEmpty() ? metadata.url() : null;
    String dateAccessed = LocalDate.now(clock).format(ACCESS_DATE_FORMAT);

    String snippet = document.content();
    if (snippet.length() > SNIPPET_LIMIT) {
      snippet = snippet.substring(0, SNIPPET_KEEP) + "...";
    }

    return new Citation(
        buildCitationText(sourceName, sourceUrl, dateAccessed),
        sourceName,
        sourceUrl,
        dateAccessed,
        snippet,
        metadata.toMap());
  }

  public List<Citation> generateCitations(List<Document> documents) {
    return documents.stream().map(this::generateCitation).toList();
  }

  public CitationStyle getDefaultStyle() {
    return defaultStyle;
  }

  private String buildCitationText(String sourceName, String sourceUrl, String dateAccessed) {
    return switch (defaultStyle) {
      case APA ->
          sourceName
              + (sourceUrl != null ? ". Retrieved from " + sourceUrl : "")
              + " on "
              + dateAccessed
              + ".";
      case CHICAGO ->
          "\""
              + sourceName
              + "\""
              + (sourceUrl != null ? ", " + sourceUrl : "")
              + ", accessed "
              + dateAccessed
              + ".";
      case MLA ->
          "\""
              + sourceName
              + "\""
              + (sourceUrl != null ? ", " + sourceUrl : "")
              + ", Accessed "
              + dateAccessed
              + ".";
    };
  }

  private static String firstNonEmpty(String... values) {
    for (String value : values) {
      if (value != null && !value.isEmpty()) {
        return value;
      }
    }
    return null;
  }
}
