package com.flamingo.ai.nlp.service.preprocess;

import com.flamingo.ai.nlp.domain.model.ConversationMessage;
import com.flamingo.ai.nlp.domain.model.PreprocessingRequest;
import com.flamingo.ai.nlp.domain.model.PreprocessingResult;
import java.util.List;

/**
 * Turns a raw query and optional conversation history into a routing decision: whether the
 * language model must be called, and what to answer directly when it need not be.
 */
public interface NlpPreprocessor {

  /**
   * Runs the full pipeline.
   *
   * @param query raw user query, null is treated as empty
   * @param conversationHistory prior turns, may be null or empty
   * @param enableDeduplication whether to drop near-duplicate history turns
   * @param deduplicationThreshold cosine similarity a turn must strictly exceed to be dropped
   * @return the aggregate result
   * @throws com.flamingo.ai.nlp.exception.InvalidEmbeddingException when history embeddings are
   *     malformed
   */
  PreprocessingResult preprocess(
      String query,
      List<ConversationMessage> conversationHistory,
      boolean enableDeduplication,
      double deduplicationThreshold);

  /** Runs the pipeline with the configured deduplication defaults. */
  PreprocessingResult preprocess(String query, List<ConversationMessage> conversationHistory);

  /** Runs the pipeline on a query without history. */
  PreprocessingResult preprocess(String query);

  /** Runs the pipeline for a request, filling unset options from configuration. */
  PreprocessingResult preprocess(PreprocessingRequest request);
}
