package com.flamingo.ai.nlp.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * One turn of a conversation as supplied by the caller.
 *
 * @param role free-form sender role ("user", "assistant", "system")
 * @param content message text
 * @param embedding precomputed embedding vector, or null when the caller has none
 * @param timestamp opaque caller timestamp, may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConversationMessage(
    String role, String content, List<Float> embedding, String timestamp) {

  public ConversationMessage {
    embedding = embedding == null ? null : Immutables.list(embedding);
  }

  public static ConversationMessage of(String role, String content) {
    return new ConversationMessage(role, content, null, null);
  }

  public static ConversationMessage of(String role, String content, List<Float> embedding) {
    return new ConversationMessage(role, content, embedding, null);
  }

  public boolean hasEmbedding() {
    return embedding != null && !embedding.isEmpty();
  }
}
