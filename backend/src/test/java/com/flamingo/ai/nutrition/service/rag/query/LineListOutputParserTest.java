package com.flamingo.ai.nutrition.service.rag.query;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LineListOutputParserTest {

  private final LineListOutputParser parser = new LineListOutputParser();

  @Test
  void shouldStripDotNumbering() {
    assertThat(parser.parse("1. A\n2. B\n3. C")).containsExactly("A", "B", "C");
  }

  @Test
  void shouldStripParenthesisNumbering() {
    assertThat(parser.parse("1) A\n2) B")).containsExactly("A", "B");
  }

  @Test
  void shouldStripDashNumbering() {
    assertThat(parser.parse("1- Iron in spinach\n2- Iron in lentils"))
        .containsExactly("Iron in spinach", "Iron in lentils");
  }

  @Test
  void shouldSkipBlankLines() {
    assertThat(parser.parse("A\n\nB\n\n\nC")).containsExactly("A", "B", "C");
  }

  @Test
  void shouldTrimSurroundingWhitespace() {
    assertThat(parser.parse("\n   first question  \n\t second question\n"))
        .containsExactly("first question", "second question");
  }

  @Test
  void shouldKeepMultiDigitPrefixes() {
    // only a single leading digit counts as numbering
    assertThat(parser.parse("10. Too many")).containsExactly("10. Too many");
  }

  @Test
  void shouldKeepLinesStartingWithDecimalNumbers() {
    assertThat(parser.parse("1.5 mg of zinc per day")).containsExactly("1.5 mg of zinc per day");
  }

  @Test
  void shouldReturnEmptyList_whenTextIsNullOrBlank() {
    assertThat(parser.parse(null)).isEmpty();
    assertThat(parser.parse("  \n \n")).isEmpty();
  }
}
