package com.flamingo.ai.nlp.service.preprocess;

import com.flamingo.ai.nlp.config.NlpConfig;
import com.flamingo.ai.nlp.domain.model.ConversationMessage;
import com.flamingo.ai.nlp.domain.model.Entity;
import com.flamingo.ai.nlp.domain.model.ExpandedQuery;
import com.flamingo.ai.nlp.domain.model.Intent;
import com.flamingo.ai.nlp.domain.model.PreprocessingRequest;
import com.flamingo.ai.nlp.domain.model.PreprocessingResult;
import com.flamingo.ai.nlp.service.entity.EntityExtractor;
import com.flamingo.ai.nlp.service.expansion.QueryExpander;
import com.flamingo.ai.nlp.service.intent.IntentClassifier;
import com.flamingo.ai.nlp.service.similarity.SemanticDeduplicator;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Sequences classification, extraction, expansion and history deduplication into one stateless
 * call.
 *
 * <p>Expansion always runs on a non-empty query, including intents that bypass the model, because a
 * direct knowledge lookup uses the combined query too.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NlpPreprocessorImpl implements NlpPreprocessor {

  // Rough characters-per-token ratio for English text
  private static final double CHARS_PER_TOKEN = 4.0;

  private final IntentClassifier intentClassifier;
  private final EntityExtractor entityExtractor;
  private final QueryExpander queryExpander;
  private final SemanticDeduplicator semanticDeduplicator;
  private final DirectResponseBuilder directResponseBuilder;
  private final NlpConfig nlpConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "nlp.preprocess", description = "Time to preprocess a query")
  public PreprocessingResult preprocess(
      String query,
      List<ConversationMessage> conversationHistory,
      boolean enableDeduplication,
      double deduplicationThreshold) {
    long start = System.nanoTime();
    String text = query == null ? "" : query;

    Intent intent = intentClassifier.classify(text);
    List<Entity> entities = entityExtractor.extract(text);
    ExpandedQuery expandedQuery = text.isBlank() ? null : queryExpander.expand(text);

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("entity_count", entities.size());
    metadata.put("expansion_count", expandedQuery == null ? 0 : expandedQuery.expansions().size());

    List<ConversationMessage> deduplicatedHistory = null;
    if (enableDeduplication && conversationHistory != null && !conversationHistory.isEmpty()) {
      SemanticDeduplicator.HistoryDeduplication outcome =
          semanticDeduplicator.deduplicateHistory(conversationHistory, deduplicationThreshold);
      deduplicatedHistory = outcome.retained();
      recordDeduplication(conversationHistory, outcome, deduplicationThreshold, metadata);
    }

    boolean shouldCallLlm = intent.shouldCallLlm();
    Map<String, Object> directResponse =
        directResponseBuilder.build(text, intent, entities, expandedQuery);

    meterRegistry
        .counter("nlp.preprocess.intent", "intent", intent.intentType().value())
        .increment();
    if (!shouldCallLlm) {
      meterRegistry.counter("nlp.preprocess.llm_bypassed").increment();
    }

    double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
    log.debug(
        "Preprocessed query: intent={}, entities={}, expansions={}, shouldCallLlm={}, took {}ms",
        intent.intentType().value(),
        entities.size(),
        metadata.get("expansion_count"),
        shouldCallLlm,
        String.format("%.3f", elapsedMs));

    return PreprocessingResult.builder()
        .intent(intent)
        .entities(entities)
        .expandedQuery(expandedQuery)
        .deduplicatedHistory(deduplicatedHistory)
        .shouldCallLlm(shouldCallLlm)
        .directResponse(directResponse)
        .processingTimeMs(elapsedMs)
        .metadata(metadata)
        .build();
  }

  @Override
  @Timed(value = "nlp.preprocess", description = "Time to preprocess a query")
  public PreprocessingResult preprocess(
      String query, List<ConversationMessage> conversationHistory) {
    NlpConfig.Deduplication defaults = nlpConfig.getDeduplication();
    return preprocess(query, conversationHistory, defaults.isEnabled(), defaults.getThreshold());
  }

  @Override
  @Timed(value = "nlp.preprocess", description = "Time to preprocess a query")
  public PreprocessingResult preprocess(String query) {
    return preprocess(query, null);
  }

  @Override
  @Timed(value = "nlp.preprocess", description = "Time to preprocess a query")
  public PreprocessingResult preprocess(PreprocessingRequest request) {
    NlpConfig.Deduplication defaults = nlpConfig.getDeduplication();
    boolean enabled =
        request.enableDeduplication() != null
            ? request.enableDeduplication()
            : defaults.isEnabled();
    double threshold =
        request.deduplicationThreshold() != null
            ? request.deduplicationThreshold()
            : defaults.getThreshold();
    return preprocess(request.query(), request.conversationHistory(), enabled, threshold);
  }

  private void recordDeduplication(
      List<ConversationMessage> original,
      SemanticDeduplicator.HistoryDeduplication outcome,
      double threshold,
      Map<String, Object> metadata) {
    int removed = outcome.duplicatePositions().size();
    long removedChars =
        outcome.duplicatePositions().stream()
            .map(original::get)
            .mapToLong(m -> m.content() == null ? 0 : m.content().length())
            .sum();

    metadata.put("original_history_length", original.size());
    metadata.put("deduplicated_history_length", outcome.retained().size());
    metadata.put("duplicates_removed", removed);
    metadata.put("deduplication_threshold", threshold);
    metadata.put("estimated_token_savings", (long) Math.ceil(removedChars / CHARS_PER_TOKEN));

    if (removed > 0) {
      meterRegistry.counter("nlp.deduplication.removed").increment(removed);
    }
  }
}
