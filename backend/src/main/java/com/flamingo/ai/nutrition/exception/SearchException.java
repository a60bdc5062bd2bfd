package com.flamingo.ai.nutrition.exception;

/** Exception thrown when the similarity search behind retrieval fails. */
public class SearchException extends RuntimeException {

  private final String userMessage;

  public SearchException(String message) {
    super(message);
    this.userMessage = "Nutrition sources are temporarily unavailable. Please try again.";
  }

  public SearchException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Nutrition sources are temporarily unavailable. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
