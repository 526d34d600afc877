package com.flamingo.ai.nlp.domain.model;

import com.flamingo.ai.nlp.domain.enums.EntityType;
import java.util.Map;

/**
 * A typed span extracted from a query.
 *
 * @param text exact substring of the original query
 * @param entityType entity category
 * @param confidence fixed confidence of the strategy that produced it, in [0, 1]
 * @param span location in the original query
 * @param metadata extractor-specific detail such as the matching strategy
 */
public record Entity(
    String text, EntityType entityType, double confidence, Span span, Map<String, Object> metadata) {

  public Entity {
    metadata = Immutables.map(metadata);
  }
}
