package com.flamingo.ai.nlp.lexicon;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.nlp.domain.enums.IntentType;
import com.flamingo.ai.nlp.domain.model.KeywordPattern;
import com.flamingo.ai.nlp.domain.model.Lexicon;
import com.flamingo.ai.nlp.exception.LexiconLoadException;
import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Loads the lexicon JSON from the classpath.
 *
 * <p>Intent keys are matched against {@link IntentType} names case-insensitively; term keys are
 * lowercased. A missing or malformed resource throws {@link LexiconLoadException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LexiconLoader {

  private final ObjectMapper objectMapper;

  public Lexicon load(String location) {
    try (InputStream is = LexiconLoader.class.getResourceAsStream(location)) {
      if (is == null) {
        throw new LexiconLoadException(location, "Lexicon resource not found: " + location);
      }
      LexiconFile file = objectMapper.readValue(is, LexiconFile.class);
      Lexicon lexicon = toLexicon(location, file);
      log.info(
          "Loaded lexicon from {}: {} intents, {} acronyms, {} technologies, {} education terms",
          location,
          lexicon.intentPatterns().size(),
          lexicon.acronyms().size(),
          lexicon.technologySynonyms().size(),
          lexicon.educationSynonyms().size());
      return lexicon;
    } catch (IOException e) {
      throw new LexiconLoadException(
          location, "Failed to read lexicon " + location + ": " + e.getMessage(), e);
    }
  }

  private Lexicon toLexicon(String location, LexiconFile file) {
    Map<IntentType, List<KeywordPattern>> intents = new EnumMap<>(IntentType.class);
    if (file.intents() != null) {
      file.intents()
          .forEach(
              (name, patterns) -> {
                IntentType type;
                try {
                  type = IntentType.valueOf(name.trim().toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException e) {
                  throw new LexiconLoadException(
                      location, "Unknown intent '" + name + "' in lexicon " + location, e);
                }
                intents.put(type, patterns == null ? List.of() : patterns);
              });
    }

    return Lexicon.builder()
        .intentPatterns(intents)
        .difficultyLevels(lowercaseKeys(file.difficultyLevels()))
        .topics(file.topics())
        .acronyms(lowercaseKeys(file.acronyms()))
        .technologySynonyms(lowercaseKeys(file.technologySynonyms()))
        .educationSynonyms(lowercaseKeys(file.educationSynonyms()))
        .courseContextWords(file.courseContextWords())
        .questionWords(file.questionWords())
        .build();
  }

  private Map<String, List<String>> lowercaseKeys(Map<String, List<String>> source) {
    Map<String, List<String>> result = new LinkedHashMap<>();
    if (source != null) {
      source.forEach((key, values) -> result.put(key.toLowerCase(Locale.ROOT), values));
    }
    return result;
  }

  /** On-disk shape of the lexicon. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record LexiconFile(
      Map<String, List<KeywordPattern>> intents,
      Map<String, List<String>> difficultyLevels,
      List<String> topics,
      Map<String, List<String>> acronyms,
      Map<String, List<String>> technologySynonyms,
      Map<String, List<String>> educationSynonyms,
      List<String> courseContextWords,
      List<String> questionWords) {}
}
