package com.flamingo.ai.nlp.domain.model;

import java.util.List;

/**
 * A group of interchangeable intent cues. The group contributes {@code weight} once when any of its
 * keywords occurs in the query as a whole word or phrase.
 */
public record KeywordPattern(List<String> keywords, double weight) {

  public KeywordPattern {
    keywords = Immutables.list(keywords);
  }

  public static KeywordPattern of(double weight, String... keywords) {
    return new KeywordPattern(List.of(keywords), weight);
  }
}
