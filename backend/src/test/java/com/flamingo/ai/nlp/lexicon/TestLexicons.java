package com.flamingo.ai.nlp.lexicon;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.nlp.domain.enums.IntentType;
import com.flamingo.ai.nlp.domain.model.KeywordPattern;
import com.flamingo.ai.nlp.domain.model.Lexicon;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Lexicons for tests: the shipped one, and a small hand-built fixture. */
public final class TestLexicons {

  private static final Lexicon PRODUCTION =
      new LexiconLoader(new ObjectMapper()).load("/nlp-lexicon.json");

  private TestLexicons() {}

  public static Lexicon production() {
    return PRODUCTION;
  }

  public static Lexicon minimal() {
    Map<IntentType, List<KeywordPattern>> intents = new LinkedHashMap<>();
    intents.put(IntentType.GREETING, List.of(KeywordPattern.of(1.0, "hello", "hi")));
    intents.put(IntentType.COURSE_LOOKUP, List.of(KeywordPattern.of(0.5, "course", "courses")));
    intents.put(IntentType.QUESTION, List.of(KeywordPattern.of(0.4, "what", "why")));

    Map<String, List<String>> acronyms = new LinkedHashMap<>();
    acronyms.put("ml", List.of("machine learning"));

    Map<String, List<String>> technology = new LinkedHashMap<>();
    technology.put("python", List.of("python programming"));

    Map<String, List<String>> education = new LinkedHashMap<>();
    education.put("course", List.of("class"));

    return Lexicon.builder()
        .intentPatterns(intents)
        .difficultyLevels(Map.of("beginner", List.of("beginner", "novice")))
        .topics(List.of("machine learning"))
        .acronyms(acronyms)
        .technologySynonyms(technology)
        .educationSynonyms(education)
        .courseContextWords(List.of("course", "take"))
        .questionWords(List.of("what"))
        .build();
  }
}
