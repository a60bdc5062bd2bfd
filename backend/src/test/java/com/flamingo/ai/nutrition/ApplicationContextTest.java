package com.flamingo.ai.nutrition;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.nutrition.config.RagConfig;
import com.flamingo.ai.nutrition.service.advice.NutritionAdviceService;
import com.flamingo.ai.nutrition.service.rag.rerank.DocumentReRanker;
import com.flamingo.ai.nutrition.service.rag.retrieval.DocumentRetriever;
import com.flamingo.ai.nutrition.service.rag.retrieval.EnhancedNutritionRetriever;
import com.flamingo.ai.nutrition.service.rag.retrieval.NutritionRetriever;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import io.micrometer.core.aop.TimedAspect;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the Spring application context loads. Uses @MockitoBean for the OpenAI models so the
 * test runs without an API key or network.
 */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean private ChatModel chatModel;
  @MockitoBean private EmbeddingModel embeddingModel;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("Retrieval pipeline should be wired from configuration")
  void retrievalPipelineShouldBeWired() {
    assertThat(applicationContext.getBean(NutritionAdviceService.class)).isNotNull();
    assertThat(applicationContext.getBean(DocumentReRanker.class).getScorers()).hasSize(5);
    assertThat(applicationContext.getBean(NutritionRetriever.class).getK()).isEqualTo(4);

    DocumentRetriever retriever = applicationContext.getBean(DocumentRetriever.class);
    assertThat(retriever).isInstanceOf(EnhancedNutritionRetriever.class);
    assertThat(((EnhancedNutritionRetriever) retriever).getMaxQueries()).isEqualTo(3);
    assertThat(applicationContext.getBean(RagConfig.class).getReformulation().getMaxQueries())
        .isEqualTo(3);
  }

  @Test
  @DisplayName("Advice service should be proxied for @Timed")
  void adviceServiceShouldBeTimed() {
    assertThat(applicationContext.getBean(TimedAspect.class)).isNotNull();
    assertThat(AopUtils.isAopProxy(applicationContext.getBean(NutritionAdviceService.class)))
        .isTrue();
  }
}
