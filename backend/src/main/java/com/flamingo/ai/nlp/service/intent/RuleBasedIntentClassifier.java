package com.flamingo.ai.nlp.service.intent;

import com.flamingo.ai.nlp.config.NlpConfig;
import com.flamingo.ai.nlp.domain.enums.IntentType;
import com.flamingo.ai.nlp.domain.model.Intent;
import com.flamingo.ai.nlp.domain.model.KeywordPattern;
import com.flamingo.ai.nlp.domain.model.Lexicon;
import com.flamingo.ai.nlp.lexicon.TermPatterns;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Keyword-driven intent classifier.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Score every intent: each of its keyword groups adds its weight once when any keyword
 *       occurs as a whole word or phrase; the sum is capped at 1.0
 *   <li>Apply structural boosts: quoted text favours a skill lookup when it names a known
 *       technology and a course lookup otherwise, a question word favours prerequisite checks, a
 *       command or explanation verb opening the query favours that intent, a trailing question
 *       mark favours plain questions
 *   <li>Drop candidates below the configured minimum confidence
 *   <li>Pick the highest score; equal scores go to the better tier (greeting, then direct
 *       lookups, then model-bound intents), then to the fixed priority order
 * </ol>
 *
 * <p>Compiled rules live in an immutable snapshot. Readers never lock; {@link
 * #addKeywordPattern(IntentType, KeywordPattern)} rebuilds the snapshot under a writer lock and
 * publishes it through a volatile field.
 */
@Service
@Slf4j
public class RuleBasedIntentClassifier implements IntentClassifier {

  /** Final tie-break between equally scored intents of the same tier. */
  static final List<IntentType> PRIORITY =
      List.of(
          IntentType.GREETING,
          IntentType.PREREQUISITE_CHECK,
          IntentType.COURSE_LOOKUP,
          IntentType.SKILL_LOOKUP,
          IntentType.LEARNING_PATH,
          IntentType.FEEDBACK,
          IntentType.CONCEPT_EXPLANATION,
          IntentType.COMMAND,
          IntentType.CLARIFICATION,
          IntentType.QUESTION);

  static final double QUOTED_LOOKUP_BOOST = 0.3;
  static final double QUESTION_WORD_PREREQUISITE_BOOST = 0.2;
  static final double QUESTION_MARK_BOOST = 0.3;
  static final double LEADING_VERB_BOOST = 0.2;

  /** Intents whose cue counts as a leading verb when it opens the query. */
  static final Set<IntentType> LEADING_VERB_INTENTS =
      EnumSet.of(IntentType.COMMAND, IntentType.CONCEPT_EXPLANATION);

  private static final double EMPTY_CONFIDENCE = 0.0;
  private static final double WEAK_MATCH_CONFIDENCE = 0.2;
  private static final double NO_MATCH_CONFIDENCE = 0.1;

  private static final Pattern QUOTED_TEXT =
      Pattern.compile(
          "\"[^\"]+\"|“[^”]+”|‘[^’]+’|(?<![\\p{L}\\p{N}])'[^']+'(?![\\p{L}\\p{N}])");

  private final double minConfidence;
  private final List<Pattern> questionWords;
  private final List<Pattern> technologies;
  private final ReentrantLock writeLock = new ReentrantLock();
  private volatile Map<IntentType, List<CompiledPattern>> rules;

  public RuleBasedIntentClassifier(Lexicon lexicon, NlpConfig nlpConfig) {
    this.minConfidence = nlpConfig.getIntent().getMinConfidence();
    this.questionWords = lexicon.questionWords().stream().map(TermPatterns::wholeWord).toList();
    this.technologies =
        lexicon.technologySynonyms().keySet().stream().map(TermPatterns::wholeWord).toList();
    this.rules = compile(lexicon.intentPatterns());
  }

  @Override
  public Intent classify(String query) {
    String text = query == null ? "" : query.strip();
    if (text.isEmpty()) {
      return Intent.of(
          IntentType.UNKNOWN, EMPTY_CONFIDENCE, List.of(), Map.of("reason", "empty_query"));
    }

    Map<IntentType, List<CompiledPattern>> snapshot = rules;
    List<String> quoted = quotedTexts(text);
    boolean hasQuotedText = !quoted.isEmpty();
    boolean hasQuestionWord = questionWords.stream().anyMatch(p -> p.matcher(text).find());

    Map<IntentType, Double> scores = new EnumMap<>(IntentType.class);
    Map<IntentType, List<String>> matchedKeywords = new EnumMap<>(IntentType.class);
    Set<IntentType> leadingVerb = EnumSet.noneOf(IntentType.class);

    for (Map.Entry<IntentType, List<CompiledPattern>> entry : snapshot.entrySet()) {
      double score = 0.0;
      List<String> keywords = new ArrayList<>();
      for (CompiledPattern pattern : entry.getValue()) {
        boolean groupMatched = false;
        for (int i = 0; i < pattern.keywords().size(); i++) {
          Matcher matcher = pattern.regexes().get(i).matcher(text);
          if (matcher.find()) {
            if (matcher.start() == 0 && LEADING_VERB_INTENTS.contains(entry.getKey())) {
              leadingVerb.add(entry.getKey());
            }
            if (!groupMatched) {
              score += pattern.weight();
              groupMatched = true;
            }
            keywords.add(pattern.keywords().get(i));
          }
        }
      }
      if (score > 0) {
        scores.put(entry.getKey(), score);
        matchedKeywords.put(entry.getKey(), keywords);
      }
    }

    applyBoosts(scores, text, quoted, hasQuestionWord, leadingVerb);
    scores.replaceAll((type, score) -> roundScore(Math.min(score, 1.0)));

    IntentType best =
        scores.entrySet().stream()
            .filter(e -> e.getValue() >= minConfidence)
            .min(
                Comparator.<Map.Entry<IntentType, Double>, Double>comparing(
                        Map.Entry::getValue, Comparator.reverseOrder())
                    .thenComparingInt(e -> e.getKey().tier())
                    .thenComparingInt(e -> priorityOf(e.getKey())))
            .map(Map.Entry::getKey)
            .orElse(IntentType.UNKNOWN);

    double confidence;
    List<String> keywords;
    if (best == IntentType.UNKNOWN) {
      confidence = scores.isEmpty() ? NO_MATCH_CONFIDENCE : WEAK_MATCH_CONFIDENCE;
      keywords = List.of();
    } else {
      confidence = scores.get(best);
      keywords = matchedKeywords.getOrDefault(best, List.of());
    }

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("query_length", query.length());
    metadata.put("word_count", text.split("\\s+").length);
    metadata.put("has_quoted_text", hasQuotedText);
    metadata.put("all_scores", wireScores(scores));

    log.debug(
        "Intent classification: intent={}, confidence={}, keywords={}",
        best.value(),
        String.format("%.2f", confidence),
        keywords);

    return Intent.of(best, confidence, keywords, metadata);
  }

  @Override
  public void addKeywordPattern(IntentType intentType, KeywordPattern pattern) {
    if (intentType == null || intentType == IntentType.UNKNOWN) {
      throw new IllegalArgumentException("Keyword patterns cannot target " + intentType);
    }
    if (pattern == null || pattern.keywords().isEmpty()) {
      throw new IllegalArgumentException("Keyword pattern must contain at least one keyword");
    }
    writeLock.lock();
    try {
      Map<IntentType, List<CompiledPattern>> next = new EnumMap<>(IntentType.class);
      next.putAll(rules);
      List<CompiledPattern> patterns = new ArrayList<>(next.getOrDefault(intentType, List.of()));
      patterns.add(CompiledPattern.of(pattern));
      next.put(intentType, Collections.unmodifiableList(patterns));
      rules = Collections.unmodifiableMap(next);
      log.info(
          "Registered keyword pattern for intent {}: {} (weight {})",
          intentType.value(),
          pattern.keywords(),
          pattern.weight());
    } finally {
      writeLock.unlock();
    }
  }

  private void applyBoosts(
      Map<IntentType, Double> scores,
      String text,
      List<String> quoted,
      boolean hasQuestionWord,
      Set<IntentType> leadingVerb) {
    if (!quoted.isEmpty()) {
      IntentType lookup =
          namesTechnology(quoted) ? IntentType.SKILL_LOOKUP : IntentType.COURSE_LOOKUP;
      scores.computeIfPresent(lookup, (t, s) -> s + QUOTED_LOOKUP_BOOST);
    }
    for (IntentType type : leadingVerb) {
      scores.computeIfPresent(type, (t, s) -> s + LEADING_VERB_BOOST);
    }
    if (hasQuestionWord) {
      scores.computeIfPresent(
          IntentType.PREREQUISITE_CHECK, (t, s) -> s + QUESTION_WORD_PREREQUISITE_BOOST);
    }
    if (text.endsWith("?")) {
      scores.merge(IntentType.QUESTION, QUESTION_MARK_BOOST, Double::sum);
    }
  }

  private boolean namesTechnology(List<String> quoted) {
    return quoted.stream()
        .anyMatch(q -> technologies.stream().anyMatch(p -> p.matcher(q).find()));
  }

  private static List<String> quotedTexts(String text) {
    List<String> quoted = new ArrayList<>();
    Matcher matcher = QUOTED_TEXT.matcher(text);
    while (matcher.find()) {
      String match = matcher.group();
      quoted.add(match.substring(1, match.length() - 1));
    }
    return quoted;
  }

  // Six decimals, so sums such as 0.6 + 0.2 compare equal to 0.8
  private static double roundScore(double score) {
    return Math.round(score * 1_000_000d) / 1_000_000d;
  }

  private static int priorityOf(IntentType type) {
    int index = PRIORITY.indexOf(type);
    return index < 0 ? PRIORITY.size() : index;
  }

  private static Map<String, Double> wireScores(Map<IntentType, Double> scores) {
    Map<String, Double> result = new LinkedHashMap<>();
    scores.forEach((type, score) -> result.put(type.value(), score));
    return result;
  }

  private static Map<IntentType, List<CompiledPattern>> compile(
      Map<IntentType, List<KeywordPattern>> intentPatterns) {
    Map<IntentType, List<CompiledPattern>> compiled = new EnumMap<>(IntentType.class);
    intentPatterns.forEach(
        (type, patterns) ->
            compiled.put(type, patterns.stream().map(CompiledPattern::of).toList()));
    return Collections.unmodifiableMap(compiled);
  }

  /** A keyword group with its regexes compiled once. */
  private record CompiledPattern(List<String> keywords, List<Pattern> regexes, double weight) {

    static CompiledPattern of(KeywordPattern pattern) {
      List<String> keywords =
          pattern.keywords().stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
      return new CompiledPattern(
          keywords, keywords.stream().map(TermPatterns::wholeWord).toList(), pattern.weight());
    }
  }
}
