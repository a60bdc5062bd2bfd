package com.flamingo.ai.nutrition.domain;

import java.util.Map;
import java.util.Objects;

/**
 * A retrieved piece of nutrition content with its metadata. Flows unchanged through every stage of
 * the retrieval pipeline; scorers only read it and rerankers only reorder references.
 */
public record Document(String content, DocumentMetadata metadata) {

  public Document {
    Objects.requireNonNull(content, "content must not be null");
    if (metadata == null) {
      metadata = DocumentMetadata.empty();
    }
  }

  public static Document of(String content) {
    return new Document(content, DocumentMetadata.empty());
  }

  public static Document of(String content, Map<String, ?> metadata) {
    return new Document(content, DocumentMetadata.from(metadata));
  }
}
