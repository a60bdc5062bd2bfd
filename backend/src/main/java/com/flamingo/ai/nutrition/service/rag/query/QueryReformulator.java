package com.flamingo.ai.nutrition.service.rag.query;

import dev.langchain4j.model.input.PromptTemplate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Expands a nutrition question into alternative phrasings so retrieval can approach it from several
 * angles (nutrients, health effects, food sources, scientific framing).
 *
 * <p>Holds configuration only and can be shared across threads.
 */
@Slf4j
public class QueryReformulator {

  /** Prompt asking for four newline-separated rewrites of {@code {{question}}}. */
  public static final String NUTRITION_QUERY_PROMPT =
      """
      You are an AI nutrition expert. Your task is to generate four different versions
      of the given nutrition-related question to improve retrieval of relevant nutrition information.

      For the question: "{{question}}"

      Generate four different ways to ask this question, focusing on different aspects such as:
      1. Specific nutrients or components involved
      2. Health benefits or effects
      3. Food sources or dietary considerations
      4. Scientific or medical perspective

      Make each query detailed and specific to improve search results. Provide these alternative
      questions separated by newlines, without numbering or prefixes.
      """;

  private final TextCompletion completion;
  private final PromptTemplate promptTemplate;
  private final LineListOutputParser outputParser;
  private final boolean includeOriginal;

  public QueryReformulator(TextCompletion completion) {
    this(completion, true);
  }

  public QueryReformulator(TextCompletion completion, boolean includeOriginal) {
    this(completion, NUTRITION_QUERY_PROMPT, new LineListOutputParser(), includeOriginal);
  }

  /**
   * @param promptTemplate LangChain4j template with a {@code {{question}}} variable
   */
  public QueryReformulator(
      TextCompletion completion,
      String promptTemplate,
      LineListOutputParser outputParser,
      boolean includeOriginal) {
    this.completion = completion;
    this.promptTemplate = PromptTemplate.from(promptTemplate);
    this.outputParser = outputParser;
    this.includeOriginal = includeOriginal;
  }

  /**
   * Rewrites the query into alternatives.
   *
   * @param originalQuery the user's question
   * @return the original query (when included and not already generated) followed by the
   *     alternatives in generation order
   * @throws RuntimeException whatever the completion model throws; callers decide the fallback
   */
  public List<String> rewriteQuery(String originalQuery) {
    Map<String, Object> variables = Map.of("question", originalQuery);
    String prompt = promptTemplate.apply(variables).text();
    String output = completion.complete(prompt);
    List<String> alternatives = outputParser.parse(output);

    log.debug("Generated {} alternative queries for: {}", alternatives.size(), originalQuery);
    for (int i = 0; i < alternatives.size(); i++) {
      log.debug("  Query {}: {}", i + 1, alternatives.get(i));
    }

    if (includeOriginal && !alternatives.contains(originalQuery)) {
      List<String> all = new ArrayList<>(alternatives.size() + 1);
      all.add(originalQuery);
      all.addAll(alternatives);
      return all;
    }
    return alternatives;
  }

  public boolean isIncludeOriginal() {
    return includeOriginal;
  }
}
