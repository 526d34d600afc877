package com.flamingo.ai.nlp.domain.model;

import com.flamingo.ai.nlp.domain.enums.IntentType;
import java.util.List;
import java.util.Map;
import lombok.Builder;

/**
 * Read-only vocabulary shared by the classifier, extractor and expander. Loaded once at startup and
 * shared by reference; all collections are immutable and keep their declaration order.
 *
 * @param intentPatterns weighted keyword groups per intent
 * @param difficultyLevels canonical level to its surface forms
 * @param topics topic names tagged as TOPIC entities
 * @param acronyms acronym to its long forms
 * @param technologySynonyms technology to its synonyms; keys double as the skill vocabulary
 * @param educationSynonyms education-domain term to its synonyms
 * @param courseContextWords words that make a quoted phrase read as a course name
 * @param questionWords interrogatives used by the prerequisite boost
 */
@Builder
public record Lexicon(
    Map<IntentType, List<KeywordPattern>> intentPatterns,
    Map<String, List<String>> difficultyLevels,
    List<String> topics,
    Map<String, List<String>> acronyms,
    Map<String, List<String>> technologySynonyms,
    Map<String, List<String>> educationSynonyms,
    List<String> courseContextWords,
    List<String> questionWords) {

  public Lexicon {
    intentPatterns = Immutables.multimap(intentPatterns);
    difficultyLevels = Immutables.multimap(difficultyLevels);
    topics = Immutables.list(topics);
    acronyms = Immutables.multimap(acronyms);
    technologySynonyms = Immutables.multimap(technologySynonyms);
    educationSynonyms = Immutables.multimap(educationSynonyms);
    courseContextWords = Immutables.list(courseContextWords);
    questionWords = Immutables.list(questionWords);
  }
}
