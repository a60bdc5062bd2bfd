package com.flamingo.ai.nutrition.service.citation;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CitationTest {

  private final Citation citation =
      new Citation(
          "Mayo Clinic. Retrieved from https://www.mayoclinic.org on 17 October 2026.",
          "Mayo Clinic",
          "https://www.mayoclinic.org",
          "17 October 2026",
          "Iron deficiency anemia...",
          Map.of("source", "Mayo Clinic"));

  @Test
  void shouldRenderMla() {
    assertThat(citation.toDisplayFormat("mla"))
        .isEqualTo("\"Mayo Clinic\", https://www.mayoclinic.org, Accessed 17 October 2026.");
  }

  @Test
  void shouldKeepMlaText_whenAlreadyRendered() {
    Citation mla =
        new Citation(
            "\"Mayo Clinic\", Accessed 17 October 2026.",
            "Mayo Clinic",
            "https://www.mayoclinic.org",
            "17 October 2026",
            null,
            null);

    assertThat(mla.toDisplayFormat(CitationStyle.MLA)).isEqualTo(mla.text());
    assertThat(mla.metadata()).isEmpty();
  }

  @Test
  void shouldRenderApa() {
    assertThat(citation.toDisplayFormat("APA"))
        .isEqualTo("Mayo Clinic. Retrieved from https://www.mayoclinic.org on 17 October 2026.");
  }

  @Test
  void shouldRenderChicagoWithLowerCaseDate() {
    assertThat(citation.toDisplayFormat("Chicago"))
        .isEqualTo("\"Mayo Clinic\", https://www.mayoclinic.org, accessed 17 october 2026.");
  }

  @Test
  void shouldReturnText_forUnknownStyle() {
    assertThat(citation.toDisplayFormat("harvard")).isEqualTo(citation.text());
    assertThat(citation.toDisplayFormat((String) null)).isEqualTo(citation.text());
  }

  @Test
  void shouldUseUnknownSource_whenNameMissing() {
    Citation anonymous = new Citation("x", null, null, null, null, Map.of());

    assertThat(anonymous.toDisplayFormat(CitationStyle.APA)).isEqualTo("Unknown Source.");
  }
}
