package com.flamingo.ai.nlp.domain.model;

import java.util.List;

/**
 * Inbound call shape. Null optional fields fall back to the configured defaults.
 *
 * @param query raw user query
 * @param conversationHistory prior turns, may be null
 * @param enableDeduplication whether to deduplicate the history, null for the configured default
 * @param deduplicationThreshold cosine threshold, null for the configured default
 */
public record PreprocessingRequest(
    String query,
    List<ConversationMessage> conversationHistory,
    Boolean enableDeduplication,
    Double deduplicationThreshold) {

  public PreprocessingRequest {
    conversationHistory = conversationHistory == null ? null : Immutables.list(conversationHistory);
  }

  public static PreprocessingRequest of(String query) {
    return new PreprocessingRequest(query, null, null, null);
  }
}
