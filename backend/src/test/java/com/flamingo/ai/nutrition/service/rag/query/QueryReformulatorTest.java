package com.flamingo.ai.nutrition.service.rag.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.nutrition.exception.LlmServiceException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class QueryReformulatorTest {

  private static final String QUESTION = "What are good sources of iron?";

  @Test
  void shouldPrependOriginalQuery_whenIncludeOriginalIsSet() {
    // Given
    QueryReformulator reformulator =
        new QueryReformulator(
            prompt -> "Which foods are rich in iron?\nHow can vegetarians get enough iron?");

    // When
    List<String> queries = reformulator.rewriteQuery(QUESTION);

    // Then
    assertThat(queries)
        .containsExactly(
            QUESTION, "Which foods are rich in iron?", "How can vegetarians get enough iron?");
  }

  @Test
  void shouldNotDuplicateOriginal_whenModelRepeatsIt() {
    QueryReformulator reformulator =
        new QueryReformulator(prompt -> "Which foods are rich in iron?\n" + QUESTION);

    assertThat(reformulator.rewriteQuery(QUESTION))
        .containsExactly("Which foods are rich in iron?", QUESTION);
  }

  @Test
  void shouldReturnOnlyAlternatives_whenOriginalExcluded() {
    QueryReformulator reformulator =
        new QueryReformulator(prompt -> "1. Iron rich foods\n2. Heme iron sources", false);

    assertThat(reformulator.isIncludeOriginal()).isFalse();
    assertThat(reformulator.rewriteQuery(QUESTION))
        .containsExactly("Iron rich foods", "Heme iron sources");
  }

  @Test
  void shouldFillQuestionIntoPrompt() {
    // Given
    List<String> prompts = new ArrayList<>();
    QueryReformulator reformulator =
        new QueryReformulator(
            prompt -> {
              prompts.add(prompt);
              return "";
            });

    // When
    List<String> queries = reformulator.rewriteQuery(QUESTION);

    // Then
    assertThat(prompts).hasSize(1);
    assertThat(prompts.get(0)).contains("For the question: \"" + QUESTION + "\"");
    assertThat(prompts.get(0)).doesNotContain("{{question}}");
    assertThat(queries).containsExactly(QUESTION);
  }

  @Test
  void shouldUseCustomTemplate() {
    List<String> prompts = new ArrayList<>();
    QueryReformulator reformulator =
        new QueryReformulator(
            prompt -> {
              prompts.add(prompt);
              return "alt";
            },
            "Rephrase: {{question}}",
            new LineListOutputParser(),
            false);

    assertThat(reformulator.rewriteQuery("zinc")).containsExactly("alt");
    assertThat(prompts).containsExactly("Rephrase: zinc");
  }

  @Test
  void shouldPropagateCompletionFailure() {
    QueryReformulator reformulator =
        new QueryReformulator(
            prompt -> {
              throw new LlmServiceException("model down");
            });

    assertThatThrownBy(() -> reformulator.rewriteQuery(QUESTION))
        .isInstanceOf(LlmServiceException.class)
        .hasMessage("model down");
  }
}
