package com.flamingo.ai.nutrition.domain;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/** Lenient ISO-8601 parsing for metadata dates written by different ingestion jobs. */
public final class IsoDates {

  private IsoDates() {}

  /**
   * Parses a date, local date-time or offset date-time. A space may separate date and time, as in
   * {@code 2024-06-01 12:30:00}. Offset values are converted to the given zone and their offset
   * dropped.
   *
   * @return the parsed value, or empty when the text is blank or not ISO-8601
   */
  public static Optional<LocalDateTime> parse(String text, ZoneId zone) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    String value = text.trim();
    if (value.length() > 10 && value.charAt(10) == ' ') {
      value = value.substring(0, 10) + 'T' + value.substring(11);
    }
    try {
      if (value.length() == 10) {
        return Optional.of(LocalDate.parse(value).atStartOfDay());
      }
      return Optional.of(LocalDateTime.parse(value));
    } catch (DateTimeParseException notLocal) {
      try {
        return Optional.of(
            OffsetDateTime.parse(value).atZoneSameInstant(zone).toLocalDateTime());
      } catch (DateTimeParseException notOffset) {
        return Optional.empty();
      }
    }
  }
}
