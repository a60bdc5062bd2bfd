package com.flamingo.ai.nutrition.service.citation;

import java.util.Locale;
import java.util.Optional;

/** Supported citation formats. */
public enum CitationStyle {
  MLA,
  APA,
  CHICAGO;

  /** Case-insensitive lookup; empty for unknown or blank names. */
  public static Optional<CitationStyle> fromName(String name) {
    if (name == null || name.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
