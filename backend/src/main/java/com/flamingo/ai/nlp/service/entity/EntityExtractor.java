package com.flamingo.ai.nlp.service.entity;

import com.flamingo.ai.nlp.domain.model.Entity;
import java.util.List;

/** Finds typed spans in a query. */
public interface EntityExtractor {

  /**
   * Extracts entities from a query. Overlapping matches from different strategies are all kept.
   *
   * @param query raw user query, null is treated as empty
   * @return entities ordered by span start, span end, then type; empty when nothing matched
   */
  List<Entity> extract(String query);
}
