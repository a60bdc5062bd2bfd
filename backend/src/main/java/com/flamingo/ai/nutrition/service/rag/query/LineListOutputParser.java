package com.flamingo.ai.nutrition.service.rag.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Splits completion output into one string per non-blank line, dropping list numbering such as
 * {@code "1. "}, {@code "2) "} or {@code "3- "}.
 */
public class LineListOutputParser {

  private static final Set<String> NUMBERING_SUFFIXES = Set.of(". ", ") ", "- ");

  public List<String> parse(String text) {
    List<String> lines = new ArrayList<>();
    if (text == null) {
      return lines;
    }
    for (String line : text.strip().split("\n")) {
      String cleaned = line.strip();
      if (cleaned.isEmpty()) {
        continue;
      }
      if (cleaned.length() >= 3
          && Character.isDigit(cleaned.charAt(0))
          && NUMBERING_SUFFIXES.contains(cleaned.substring(1, 3))) {
        cleaned = cleaned.substring(3).strip();
      }
      lines.add(cleaned);
    }
    return lines;
  }
}
