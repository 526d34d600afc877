package com.flamingo.ai.nlp.service.intent;

import com.flamingo.ai.nlp.domain.enums.IntentType;
import com.flamingo.ai.nlp.domain.model.Intent;
import com.flamingo.ai.nlp.domain.model.KeywordPattern;

/** Assigns exactly one intent to a query and decides whether the language model is needed. */
public interface IntentClassifier {

  /**
   * Classifies a query. Never throws for any string, including empty or punctuation-only input, and
   * returns the same result for the same input.
   *
   * @param query raw user query, null is treated as empty
   * @return the winning intent, {@link IntentType#UNKNOWN} when nothing matches
   */
  Intent classify(String query);

  /**
   * Registers an additional keyword group for an intent. Visible to every later {@link
   * #classify(String)} call; concurrent classifications see either the old or the new rules.
   *
   * @param intentType intent the group votes for
   * @param pattern keywords and weight
   */
  void addKeywordPattern(IntentType intentType, KeywordPattern pattern);
}
