package com.flamingo.ai.nutrition;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NutritionAdvisorApplication {

  public static void main(String[] args) {
    SpringApplication.run(NutritionAdvisorApplication.class, args);
  }
}
