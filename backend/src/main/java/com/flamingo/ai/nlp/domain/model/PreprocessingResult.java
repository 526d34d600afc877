package com.flamingo.ai.nlp.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;
import lombok.Builder;

/**
 * Aggregate returned by the preprocessor. Built once per call and never mutated.
 *
 * @param intent classification outcome
 * @param entities extracted entities ordered by span
 * @param expandedQuery expansion outcome, null when the query was empty
 * @param deduplicatedHistory filtered history, null unless deduplication ran on a non-empty history
 * @param shouldCallLlm routing decision
 * @param directResponse payload that replaces the model call, null when the model is needed
 * @param processingTimeMs wall-clock time of the whole call
 * @param metadata diagnostics
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PreprocessingResult(
    Intent intent,
    List<Entity> entities,
    ExpandedQuery expandedQuery,
    List<ConversationMessage> deduplicatedHistory,
    boolean shouldCallLlm,
    Map<String, Object> directResponse,
    double processingTimeMs,
    Map<String, Object> metadata) {

  public PreprocessingResult {
    entities = Immutables.list(entities);
    deduplicatedHistory = deduplicatedHistory == null ? null : Immutables.list(deduplicatedHistory);
    directResponse = directResponse == null ? null : Immutables.map(directResponse);
    metadata = Immutables.map(metadata);
  }
}
