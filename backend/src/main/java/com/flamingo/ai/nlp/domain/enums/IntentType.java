package com.flamingo.ai.nlp.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Closed taxonomy of query intents.
 *
 * <p>Each intent knows whether answering it structurally requires the language model. Intents that
 * can be served by a direct lookup or a canned reply bypass the model.
 */
public enum IntentType {
  /** General question that needs a generated answer. */
  QUESTION(true),

  /** Asks what is required before taking a course. */
  PREREQUISITE_CHECK(false),

  /** Looks up a specific course. */
  COURSE_LOOKUP(false),

  /** Looks up a skill or technology. */
  SKILL_LOOKUP(false),

  /** Asks for a learning path or roadmap. */
  LEARNING_PATH(false),

  /** Asks for an explanation of a concept. */
  CONCEPT_EXPLANATION(true),

  /** Thanks, praise or complaints. */
  FEEDBACK(false),

  /** Imperative request to create, update or delete something. */
  COMMAND(true),

  /** Follow-up asking to clarify an earlier answer. */
  CLARIFICATION(true),

  /** Greeting. */
  GREETING(false),

  /** Nothing matched. */
  UNKNOWN(true);

  private final boolean shouldCallLlm;

  IntentType(boolean shouldCallLlm) {
    this.shouldCallLlm = shouldCallLlm;
  }

  public boolean shouldCallLlm() {
    return shouldCallLlm;
  }

  /**
   * Selection tier used to break ties between matching intents. Lower wins: greetings first, then
   * intents resolvable without the model, then everything else.
   */
  public int tier() {
    if (this == GREETING) {
      return 0;
    }
    return shouldCallLlm ? 2 : 1;
  }

  /** Lowercase snake_case name used on the wire and in direct responses. */
  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
