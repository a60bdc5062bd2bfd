package com.flamingo.ai.nutrition.service.rag.query;

import com.flamingo.ai.nutrition.exception.LlmServiceException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** {@link TextCompletion} backed by a LangChain4j {@link ChatModel}. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChatModelTextCompletion implements TextCompletion {

  private final ChatModel chatModel;
  private final MeterRegistry meterRegistry;

  @Override
  @CircuitBreaker(name = "openai")
  @Retry(name = "openai")
  public String complete(String prompt) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      log.debug("Calling chat model, prompt length: {} chars", prompt.length());
      String response = chatModel.chat(prompt);
      meterRegistry.counter("llm.completion.success").increment();
      return response == null ? "" : response;
    } catch (RuntimeException e) {
      meterRegistry.counter("llm.completion.errors").increment();
      throw new LlmServiceException(
          "Chat model call failed: " + e.getMessage(), e, e instanceof RateLimitException);
    } finally {
      sample.stop(meterRegistry.timer("llm.completion.duration"));
    }
  }
}
