package com.flamingo.ai.nutrition.service.rag.query;

/**
 * Text-in, text-out completion model. The retrieval core only needs this much from an LLM provider.
 */
@FunctionalInterface
public interface TextCompletion {

  /**
   * Completes the prompt.
   *
   * @param prompt the fully formatted prompt
   * @return the raw model output
   * @throws com.flamingo.ai.nutrition.exception.LlmServiceException when the model call fails
   */
  String complete(String prompt);
}
