package com.flamingo.ai.nlp.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Synonym and acronym rewrites of a query.
 *
 * <p>When {@code expansions} is empty, {@code combined} equals {@code original} exactly.
 *
 * @param original verbatim input
 * @param expansions distinct rewritten queries, in generation order
 * @param combined original plus expansions OR-joined, each wrapped in parentheses
 * @param expansionTerms matched source term to its synonym list
 */
public record ExpandedQuery(
    String original,
    List<String> expansions,
    String combined,
    Map<String, List<String>> expansionTerms) {

  public ExpandedQuery {
    expansions = Immutables.list(expansions);
    expansionTerms = Immutables.multimap(expansionTerms);
  }

  public static ExpandedQuery unexpanded(String original) {
    return new ExpandedQuery(original, List.of(), original, Map.of());
  }

  public boolean hasExpansions() {
    return !expansions.isEmpty();
  }
}
