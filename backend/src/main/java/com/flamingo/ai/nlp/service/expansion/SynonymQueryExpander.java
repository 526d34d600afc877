package com.flamingo.ai.nlp.service.expansion;

import com.flamingo.ai.nlp.domain.model.ExpandedQuery;
import com.flamingo.ai.nlp.domain.model.Lexicon;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Dictionary-based query expander over the merged acronym, technology and education synonym
 * tables.
 *
 * <p>For every term found in the lowercased query as a whole word, each synonym yields one
 * expansion: the lowercased query with every occurrence of the term replaced by the synonym. The
 * combined query OR-joins the original and all expansions, e.g. {@code (ML courses) OR (machine
 * learning courses)}.
 */
@Service
@Slf4j
public class SynonymQueryExpander implements QueryExpander {

  private static final String OR = " OR ";

  private final SynonymTable synonymTable;

  public SynonymQueryExpander(Lexicon lexicon) {
    this.synonymTable =
        new SynonymTable(
            lexicon.acronyms(), lexicon.technologySynonyms(), lexicon.educationSynonyms());
  }

  @Override
  public ExpandedQuery expand(String query) {
    if (query == null || query.isBlank()) {
      return ExpandedQuery.unexpanded(query == null ? "" : query);
    }

    String lowered = query.toLowerCase(Locale.ROOT);
    Map<String, List<String>> expansionTerms = new LinkedHashMap<>();
    Set<String> expansions = new LinkedHashSet<>();

    for (Map.Entry<String, SynonymTable.Entry> entry :
        synonymTable.snapshot().entries().entrySet()) {
      SynonymTable.Entry terms = entry.getValue();
      Matcher matcher = terms.pattern().matcher(lowered);
      if (!matcher.find() || terms.synonyms().isEmpty()) {
        continue;
      }
      expansionTerms.put(entry.getKey(), terms.synonyms());
      for (String synonym : terms.synonyms()) {
        String expanded = matcher.replaceAll(Matcher.quoteReplacement(synonym));
        if (!expanded.equals(lowered)) {
          expansions.add(expanded);
        }
      }
    }

    if (expansions.isEmpty()) {
      return new ExpandedQuery(query, List.of(), query, expansionTerms);
    }

    List<String> parts = new ArrayList<>();
    parts.add("(" + query + ")");
    expansions.forEach(e -> parts.add("(" + e + ")"));
    String combined = String.join(OR, parts);

    log.debug(
        "Expanded query with {} terms into {} variants", expansionTerms.size(), expansions.size());
    return new ExpandedQuery(query, new ArrayList<>(expansions), combined, expansionTerms);
  }

  @Override
  public List<String> getSynonyms(String term) {
    return synonymTable.get(term);
  }

  @Override
  public void addSynonym(String term, List<String> synonyms) {
    synonymTable.add(term, synonyms);
    log.info("Registered synonyms for '{}': {}", term, synonymTable.get(term));
  }
}
