package com.flamingo.ai.nlp.service.entity;

import com.flamingo.ai.nlp.domain.enums.EntityType;
import com.flamingo.ai.nlp.domain.model.Entity;
import com.flamingo.ai.nlp.domain.model.Lexicon;
import com.flamingo.ai.nlp.domain.model.Span;
import com.flamingo.ai.nlp.lexicon.TermPatterns;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Pattern and lexicon based entity extractor.
 *
 * <p>Strategies, each with a fixed confidence:
 *
 * <ul>
 *   <li>quoted text: COURSE when the query reads like a course request, TOPIC otherwise (0.9)
 *   <li>duration: number plus time unit such as "6 weeks" (0.85)
 *   <li>difficulty lexicon (0.8)
 *   <li>skill lexicon, the technology synonym keys (0.8)
 *   <li>topic lexicon (0.7)
 * </ul>
 *
 * <p>All matching runs case-insensitively against the original query, so spans and text keep the
 * caller's casing.
 */
@Service
@Slf4j
public class LexiconEntityExtractor implements EntityExtractor {

  static final double QUOTED_CONFIDENCE = 0.9;
  static final double DURATION_CONFIDENCE = 0.85;
  static final double DIFFICULTY_CONFIDENCE = 0.8;
  static final double SKILL_CONFIDENCE = 0.8;
  static final double TOPIC_CONFIDENCE = 0.7;

  // Apostrophes inside words ("what's", "don't") never open or close a single-quoted phrase.
  private static final List<QuoteStyle> QUOTE_STYLES =
      List.of(
          new QuoteStyle("\"", Pattern.compile("\"([^\"]+)\"")),
          new QuoteStyle("“", Pattern.compile("“([^”]+)”")),
          new QuoteStyle("‘", Pattern.compile("‘([^’]+)’")),
          new QuoteStyle(
              "'", Pattern.compile("(?<![\\p{L}\\p{N}])'([^']+)'(?![\\p{L}\\p{N}])")));

  private static final Map<String, Integer> NUMBER_WORDS =
      Map.ofEntries(
          Map.entry("a", 1),
          Map.entry("an", 1),
          Map.entry("one", 1),
          Map.entry("two", 2),
          Map.entry("three", 3),
          Map.entry("four", 4),
          Map.entry("five", 5),
          Map.entry("six", 6),
          Map.entry("seven", 7),
          Map.entry("eight", 8),
          Map.entry("nine", 9),
          Map.entry("ten", 10),
          Map.entry("eleven", 11),
          Map.entry("twelve", 12));

  private static final Pattern DURATION =
      Pattern.compile(
          "(?<![\\p{L}\\p{N}_])(\\d+(?:\\.\\d+)?|a|an|one|two|three|four|five|six|seven|eight|nine"
              + "|ten|eleven|twelve)[\\s-]*(minutes?|mins?|hours?|hrs?|days?|weeks?|months?"
              + "|years?)(?![\\p{L}\\p{N}_])",
          Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

  private static final Map<String, String> CANONICAL_UNITS =
      Map.ofEntries(
          Map.entry("min", "minute"),
          Map.entry("mins", "minute"),
          Map.entry("minute", "minute"),
          Map.entry("minutes", "minute"),
          Map.entry("hr", "hour"),
          Map.entry("hrs", "hour"),
          Map.entry("hour", "hour"),
          Map.entry("hours", "hour"),
          Map.entry("day", "day"),
          Map.entry("days", "day"),
          Map.entry("week", "week"),
          Map.entry("weeks", "week"),
          Map.entry("month", "month"),
          Map.entry("months", "month"),
          Map.entry("year", "year"),
          Map.entry("years", "year"));

  private final List<LexiconTerm> difficultyTerms;
  private final List<LexiconTerm> skillTerms;
  private final List<LexiconTerm> topicTerms;
  private final List<Pattern> courseContext;

  public LexiconEntityExtractor(Lexicon lexicon) {
    List<LexiconTerm> difficulty = new ArrayList<>();
    lexicon
        .difficultyLevels()
        .forEach((level, forms) -> forms.forEach(f -> difficulty.add(LexiconTerm.of(f, level))));
    this.difficultyTerms = List.copyOf(difficulty);
    this.skillTerms =
        lexicon.technologySynonyms().keySet().stream().map(t -> LexiconTerm.of(t, t)).toList();
    this.topicTerms =
        lexicon.topics().stream()
            .map(t -> LexiconTerm.of(t, t.toLowerCase(Locale.ROOT)))
            .toList();
    this.courseContext =
        lexicon.courseContextWords().stream().map(TermPatterns::wholeWord).toList();
  }

  @Override
  public List<Entity> extract(String query) {
    if (query == null || query.isBlank()) {
      return List.of();
    }

    List<Entity> entities = new ArrayList<>();
    extractQuoted(query, entities);
    extractDurations(query, entities);
    extractLexicon(query, difficultyTerms, EntityType.DIFFICULTY, entities);
    extractLexicon(query, skillTerms, EntityType.SKILL, entities);
    extractLexicon(query, topicTerms, EntityType.TOPIC, entities);

    entities.sort(
        Comparator.comparingInt((Entity e) -> e.span().start())
            .thenComparingInt(e -> e.span().end())
            .thenComparing(Entity::entityType));

    log.debug("Extracted {} entities", entities.size());
    return List.copyOf(entities);
  }

  private void extractQuoted(String query, List<Entity> entities) {
    EntityType quotedType = null;
    for (QuoteStyle style : QUOTE_STYLES) {
      Matcher matcher = style.pattern().matcher(query);
      while (matcher.find()) {
        if (matcher.group(1).isBlank()) {
          continue;
        }
        if (quotedType == null) {
          quotedType = hasCourseContext(query) ? EntityType.COURSE : EntityType.TOPIC;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("strategy", "quoted");
        metadata.put("quote_char", style.quoteChar());
        entities.add(
            new Entity(
                matcher.group(1),
                quotedType,
                QUOTED_CONFIDENCE,
                new Span(matcher.start(1), matcher.end(1)),
                metadata));
      }
    }
  }

  private boolean hasCourseContext(String query) {
    return courseContext.stream().anyMatch(p -> p.matcher(query).find());
  }

  private void extractDurations(String query, List<Entity> entities) {
    Matcher matcher = DURATION.matcher(query);
    while (matcher.find()) {
      String amountText = matcher.group(1).toLowerCase(Locale.ROOT);
      Number amount =
          NUMBER_WORDS.containsKey(amountText)
              ? NUMBER_WORDS.get(amountText)
              : Double.valueOf(amountText);
      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("strategy", "duration_pattern");
      metadata.put("amount", amount);
      metadata.put("unit", CANONICAL_UNITS.get(matcher.group(2).toLowerCase(Locale.ROOT)));
      entities.add(
          new Entity(
              matcher.group(),
              EntityType.DURATION,
              DURATION_CONFIDENCE,
              new Span(matcher.start(), matcher.end()),
              metadata));
    }
  }

  private void extractLexicon(
      String query, List<LexiconTerm> terms, EntityType type, List<Entity> entities) {
    for (LexiconTerm term : terms) {
      Matcher matcher = term.pattern().matcher(query);
      while (matcher.find()) {
        entities.add(
            new Entity(
                matcher.group(),
                type,
                confidenceFor(type),
                new Span(matcher.start(), matcher.end()),
                metadataFor(type, term)));
      }
    }
  }

  private static double confidenceFor(EntityType type) {
    return switch (type) {
      case DIFFICULTY -> DIFFICULTY_CONFIDENCE;
      case SKILL -> SKILL_CONFIDENCE;
      default -> TOPIC_CONFIDENCE;
    };
  }

  private static Map<String, Object> metadataFor(EntityType type, LexiconTerm term) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    switch (type) {
      case DIFFICULTY -> {
        metadata.put("strategy", "difficulty_lexicon");
        metadata.put("level", term.canonical());
      }
      case SKILL -> {
        metadata.put("strategy", "skill_lexicon");
        metadata.put("skill", term.canonical());
      }
      default -> {
        metadata.put("strategy", "topic_lexicon");
        metadata.put("topic", term.canonical());
      }
    }
    return metadata;
  }

  private record QuoteStyle(String quoteChar, Pattern pattern) {}

  /** Surface form compiled once, with the canonical value it stands for. */
  private record LexiconTerm(Pattern pattern, String canonical) {

    static LexiconTerm of(String surfaceForm, String canonical) {
      return new LexiconTerm(TermPatterns.wholeWord(surfaceForm), canonical);
    }
  }
}
