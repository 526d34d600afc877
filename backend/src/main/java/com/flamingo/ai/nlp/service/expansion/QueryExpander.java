package com.flamingo.ai.nlp.service.expansion;

import com.flamingo.ai.nlp.domain.model.ExpandedQuery;
import java.util.List;

/** Rewrites a query into synonym and acronym variants to widen search recall. */
public interface QueryExpander {

  /**
   * Expands a query. Deterministic; empty or blank input yields no expansions and a combined query
   * equal to the input.
   *
   * @param query raw user query, null is treated as empty
   * @return the expansion outcome
   */
  ExpandedQuery expand(String query);

  /**
   * Returns the synonyms registered for a term.
   *
   * @param term term to look up, case-insensitive
   * @return synonyms in registration order, empty when the term is unknown
   */
  List<String> getSynonyms(String term);

  /**
   * Registers synonyms for a term, merging with any already known. Visible to every later {@link
   * #expand(String)} call.
   *
   * @param term source term, stored lowercased
   * @param synonyms synonyms to add
   */
  void addSynonym(String term, List<String> synonyms);
}
