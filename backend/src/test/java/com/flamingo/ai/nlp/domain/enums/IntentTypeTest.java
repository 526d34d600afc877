package com.flamingo.ai.nlp.domain.enums;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("IntentType Tests")
class IntentTypeTest {

  @ParameterizedTest
  @EnumSource(
      value = IntentType.class,
      names = {
        "PREREQUISITE_CHECK",
        "COURSE_LOOKUP",
        "SKILL_LOOKUP",
        "LEARNING_PATH",
        "FEEDBACK",
        "GREETING"
      })
  @DisplayName("Direct-answer intents should bypass the model")
  void directIntentsShouldBypassModel(IntentType type) {
    assertThat(type.shouldCallLlm()).isFalse();
  }

  @ParameterizedTest
  @EnumSource(
      value = IntentType.class,
      names = {"QUESTION", "CONCEPT_EXPLANATION", "COMMAND", "CLARIFICATION", "UNKNOWN"})
  @DisplayName("Generative intents should call the model")
  void generativeIntentsShouldCallModel(IntentType type) {
    assertThat(type.shouldCallLlm()).isTrue();
  }

  @Test
  @DisplayName("Greeting should sit alone in the first tier")
  void greetingShouldBeFirstTier() {
    assertThat(Arrays.stream(IntentType.values()).filter(t -> t.tier() == 0))
        .containsExactly(IntentType.GREETING);
    assertThat(IntentType.COURSE_LOOKUP.tier()).isEqualTo(1);
    assertThat(IntentType.QUESTION.tier()).isEqualTo(2);
  }

  @Test
  @DisplayName("Wire value should be the lowercase name")
  void wireValueShouldBeLowercaseName() {
    assertThat(IntentType.PREREQUISITE_CHECK.value()).isEqualTo("prerequisite_check");
    assertThat(IntentType.UNKNOWN.value()).isEqualTo("unknown");
  }
}
