package com.flamingo.ai.nlp.lexicon;

import java.util.regex.Pattern;

/**
 * Compiles lexicon terms into whole-word regular expressions.
 *
 * <p>A term matches only when it is not glued to a letter, digit or underscore on either side, so
 * "hi" does not match inside "this" while "c++" and "node.js" still match as written. Runs of
 * spaces inside a phrase match any whitespace, and {@code *} stands for one or more words.
 * Matching ignores case, so offsets always refer to the text as given.
 */
public final class TermPatterns {

  private static final String WORD_BEFORE = "(?<![\\p{L}\\p{N}_])";
  private static final String WORD_AFTER = "(?![\\p{L}\\p{N}_])";

  private TermPatterns() {}

  public static Pattern wholeWord(String term) {
    StringBuilder regex = new StringBuilder(WORD_BEFORE);
    String[] words = term.trim().split("\\s+");
    for (int i = 0; i < words.length; i++) {
      if (i > 0) {
        regex.append("\\s+");
      }
      if ("*".equals(words[i])) {
        regex.append("\\S.*?");
      } else {
        regex.append(Pattern.quote(words[i]));
      }
    }
    regex.append(WORD_AFTER);
    return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
  }
}
