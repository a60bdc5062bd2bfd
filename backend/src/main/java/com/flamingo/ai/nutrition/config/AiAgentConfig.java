package com.flamingo.ai.nutrition.config;

import com.flamingo.ai.nutrition.agent.NutritionAdvisorAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents built with LangChain4j AI Services.
 *
 * <p>Pattern: Define agent interfaces with @SystemMessage/@UserMessage, build concrete
 * implementations using AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /** Nutrition advisor agent answering questions from retrieved sources. */
  @Bean
  public NutritionAdvisorAgent nutritionAdvisorAgent(ChatModel chatModel) {
    return AiServices.builder(NutritionAdvisorAgent.class).chatModel(chatModel).build();
  }
}
