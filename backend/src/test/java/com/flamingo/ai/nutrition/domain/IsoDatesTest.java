package com.flamingo.ai.nutrition.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class IsoDatesTest {

  @Test
  void shouldParsePlainDateAsStartOfDay() {
    assertThat(IsoDates.parse("2024-03-10", ZoneOffset.UTC))
        .contains(LocalDateTime.of(2024, 3, 10, 0, 0));
  }

  @Test
  void shouldParseLocalDateTime() {
    assertThat(IsoDates.parse("2024-03-10T14:30:00", ZoneOffset.UTC))
        .contains(LocalDateTime.of(2024, 3, 10, 14, 30));
  }

  @Test
  void shouldAcceptSpaceBetweenDateAndTime() {
    assertThat(IsoDates.parse("2024-06-01 00:00:00", ZoneOffset.UTC))
        .contains(LocalDateTime.of(2024, 6, 1, 0, 0));
    assertThat(IsoDates.parse("2024-06-01 08:15:30.123456", ZoneOffset.UTC))
        .contains(LocalDateTime.of(2024, 6, 1, 8, 15, 30, 123_456_000));
    assertThat(IsoDates.parse("2024-06-01 02:00:00+02:00", ZoneOffset.UTC))
        .contains(LocalDateTime.of(2024, 6, 1, 0, 0));
  }

  @Test
  void shouldConvertOffsetDateTimeToZone() {
    assertThat(IsoDates.parse("2024-03-10T23:00:00Z", ZoneId.of("Europe/Berlin")))
        .contains(LocalDateTime.of(2024, 3, 11, 0, 0));
  }

  @Test
  void shouldReturnEmpty_forBlankOrInvalidText() {
    assertThat(IsoDates.parse(null, ZoneOffset.UTC)).isEmpty();
    assertThat(IsoDates.parse(" ", ZoneOffset.UTC)).isEmpty();
    assertThat(IsoDates.parse("10/03/2024", ZoneOffset.UTC)).isEmpty();
  }
}
