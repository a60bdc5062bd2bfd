package com.flamingo.ai.nutrition.service.advice;

import com.flamingo.ai.nutrition.agent.NutritionAdvisorAgent;
import com.flamingo.ai.nutrition.domain.Document;
import com.flamingo.ai.nutrition.exception.LlmServiceException;
import com.flamingo.ai.nutrition.service.citation.Citation;
import com.flamingo.ai.nutrition.service.citation.CitationGenerator;
import com.flamingo.ai.nutrition.service.rag.retrieval.DocumentRetriever;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Answers nutrition questions: retrieve, synthesize with the advisor agent, cite. */
@Service
@RequiredArgsConstructor
@Slf4j
public class NutritionAdviceService {

  static final String NO_SOURCES_CONTEXT = "(no relevant sources were found)";

  private final DocumentRetriever documentRetriever;
  private final NutritionAdvisorAgent advisorAgent;
  private final CitationGenerator citationGenerator;
  private final MeterRegistry meterRegistry;

  /**
   * Produces a cited answer for the question.
   *
   * @param query the user's nutrition question
   * @return the answer with one citation per source document
   * @throws LlmServiceException when the advisor model fails
   */
  @Timed(value = "rag.advice", description = "Time to retrieve and synthesize an answer")
  public NutritionAdvice advise(String query) {
    List<Document> documents = documentRetriever.retrieve(query);
    log.debug("Synthesizing answer from {} documents for query: {}", documents.size(), query);
    if (documents.isEmpty()) {
      meterRegistry.counter("rag.advice.no_sources").increment();
    }

    String response;
    try {
      response = advisorAgent.advise(buildContext(documents), query);
    } catch (RuntimeException e) {
      log.error("Answer synthesis failed for query '{}': {}", query, e.getMessage());
      meterRegistry.counter("rag.advice.errors").increment();
      throw new LlmServiceException("Answer synthesis failed: " + e.getMessage(), e);
    }

    List<Citation> citations = citationGenerator.generateCitations(documents);
    meterRegistry.counter("rag.advice.success").increment();
    return new NutritionAdvice(query, response, citations);
  }

  /** Builds the numbered source context for the advisor prompt. */
  String buildContext(List<Document> documents) {
    if (documents.isEmpty()) {
      return NO_SOURCES_CONTEXT;
    }
    StringBuilder context = new StringBuilder();
    for (int i = 0; i < documents.size(); i++) {
      Document document = documents.get(i);
      context.append("[Source ").append(i + 1);
      document.metadata().nameValue().ifPresent(name -> context.append(": ").append(name));
      document
          .metadata()
          .sourceValue()
          .ifPresent(source -> context.append(" (").append(source).append(")"));
      context.append("]\n").append(document.content()).append("\n\n");
    }
    return context.toString().trim();
  }
}
