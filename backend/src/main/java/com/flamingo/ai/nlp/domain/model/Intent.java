package com.flamingo.ai.nlp.domain.model;

import com.flamingo.ai.nlp.domain.enums.IntentType;
import java.util.List;
import java.util.Map;

/**
 * Classification outcome for a single query.
 *
 * @param intentType the winning intent
 * @param confidence score of the winning intent, in [0, 1]
 * @param keywords lexicon keywords that triggered the match, in lexicon order
 * @param shouldCallLlm routing flag derived from the intent type
 * @param metadata diagnostics (query length, word count, every candidate score)
 */
public record Intent(
    IntentType intentType,
    double confidence,
    List<String> keywords,
    boolean shouldCallLlm,
    Map<String, Object> metadata) {

  public Intent {
    keywords = Immutables.list(keywords);
    metadata = Immutables.map(metadata);
  }

  public static Intent of(
      IntentType intentType, double confidence, List<String> keywords, Map<String, Object> metadata) {
    return new Intent(intentType, confidence, keywords, intentType.shouldCallLlm(), metadata);
  }
}
