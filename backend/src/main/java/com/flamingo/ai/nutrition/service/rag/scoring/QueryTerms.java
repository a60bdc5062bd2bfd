package com.flamingo.ai.nutrition.service.rag.scoring;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/** Tokenization helpers shared by the lexical scorers. */
public final class QueryTerms {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern EDGE_PUNCTUATION =
      Pattern.compile("^[^\\p{L}\\p{N}]+|[^\\p{L}\\p{N}]+$");

  private QueryTerms() {}

  /** Lower-cased whitespace tokens, in order, duplicates kept. */
  public static List<String> tokens(String text) {
    if (text == null) {
      return List.of();
    }
    String trimmed = text.toLowerCase(Locale.ROOT).strip();
    if (trimmed.isEmpty()) {
      return List.of();
    }
    return Arrays.asList(WHITESPACE.split(trimmed));
  }

  /** Lower-cased tokens longer than {@code minExclusiveLength}, duplicates removed, order kept. */
  public static List<String> distinctTermsLongerThan(String text, int minExclusiveLength) {
    LinkedHashSet<String> terms = new LinkedHashSet<>();
    for (String token : tokens(text)) {
      if (token.length() > minExclusiveLength) {
        terms.add(token);
      }
    }
    return new ArrayList<>(terms);
  }

  /** Strips leading and trailing characters that are neither letters nor digits. */
  public static String trimPunctuation(String token) {
    return EDGE_PUNCTUATION.matcher(token).replaceAll("");
  }

  /** Number of non-overlapping occurrences of {@code term} in {@code text}. */
  public static int countOccurrences(String text, String term) {
    if (term.isEmpty()) {
      return 0;
    }
    int count = 0;
    int index = text.indexOf(term);
    while (index >= 0) {
      count++;
      index = text.indexOf(term, index + term.length());
    }
    return count;
  }
}
