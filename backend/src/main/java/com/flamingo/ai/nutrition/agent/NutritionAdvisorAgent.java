package com.flamingo.ai.nutrition.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that answers nutrition questions from retrieved sources. Built with LangChain4j AI
 * Services.
 */
public interface NutritionAdvisorAgent {

  @SystemMessage(
      """
        You are a knowledgeable nutrition advisor. Answer the user's question using the
        numbered sources provided.

        Rules:
        1. Base factual claims on the sources and cite them as [Source N]
        2. If the sources do not cover the question, say so and give only general,
           widely accepted guidance
        3. Never diagnose conditions or replace advice from a healthcare professional
        4. Keep the answer concise and practical
        """)
  @UserMessage(
      """
        Sources:
        {{context}}

        Question: {{question}}
        """)
  String advise(@V("context") String context, @V("question") String question);
}
