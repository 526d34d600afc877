package com.flamingo.ai.nlp.service.preprocess;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.nlp.config.NlpConfig;
import com.flamingo.ai.nlp.domain.enums.EntityType;
import com.flamingo.ai.nlp.domain.enums.IntentType;
import com.flamingo.ai.nlp.domain.model.ConversationMessage;
import com.flamingo.ai.nlp.domain.model.Lexicon;
import com.flamingo.ai.nlp.domain.model.PreprocessingRequest;
import com.flamingo.ai.nlp.domain.model.PreprocessingResult;
import com.flamingo.ai.nlp.exception.InvalidEmbeddingException;
import com.flamingo.ai.nlp.lexicon.TestLexicons;
import com.flamingo.ai.nlp.service.entity.LexiconEntityExtractor;
import com.flamingo.ai.nlp.service.expansion.SynonymQueryExpander;
import com.flamingo.ai.nlp.service.intent.RuleBasedIntentClassifier;
import com.flamingo.ai.nlp.service.similarity.SemanticDeduplicator;
import com.flamingo.ai.nlp.service.similarity.SimilarityCalculator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("NlpPreprocessorImpl Tests")
class NlpPreprocessorImplTest {

  private NlpConfig nlpConfig;
  private SimpleMeterRegistry meterRegistry;
  private NlpPreprocessorImpl preprocessor;

  @BeforeEach
  void setUp() {
    nlpConfig = new NlpConfig();
    meterRegistry = new SimpleMeterRegistry();
    preprocessor = create(nlpConfig, meterRegistry);
  }

  static NlpPreprocessorImpl create(NlpConfig nlpConfig, SimpleMeterRegistry meterRegistry) {
    Lexicon lexicon = TestLexicons.production();
    return new NlpPreprocessorImpl(
        new RuleBasedIntentClassifier(lexicon, nlpConfig),
        new LexiconEntityExtractor(lexicon),
        new SynonymQueryExpander(lexicon),
        new SemanticDeduplicator(new SimilarityCalculator()),
        new DirectResponseBuilder(nlpConfig),
        nlpConfig,
        meterRegistry);
  }

  @Test
  @DisplayName("Should route a prerequisite question to a direct lookup and trim history")
  void shouldProcessPrerequisiteQuestion() {
    List<ConversationMessage> history =
        List.of(
            ConversationMessage.of("user", "What is ML?", List.of(1f, 0f, 0f)),
            ConversationMessage.of("assistant", "ML is a field of AI.", List.of(0f, 1f, 0f)),
            ConversationMessage.of("user", "What is machine learning?", List.of(0.99f, 0.1f, 0f)));

    PreprocessingResult result =
        preprocessor.preprocess(
            "What are the prerequisites for 'Machine Learning'?", history, true, 0.95);

    assertThat(result.intent().intentType()).isEqualTo(IntentType.PREREQUISITE_CHECK);
    assertThat(result.shouldCallLlm()).isFalse();
    assertThat(result.entities())
        .anySatisfy(
            e -> {
              assertThat(e.entityType()).isEqualTo(EntityType.COURSE);
              assertThat(e.text()).isEqualTo("Machine Learning");
            });
    assertThat(result.expandedQuery().hasExpansions()).isTrue();
    assertThat(result.deduplicatedHistory()).containsExactly(history.get(0), history.get(1));
    assertThat(result.directResponse())
        .containsEntry("type", "prerequisite_check")
        .containsEntry("course_name", "Machine Learning")
        .containsEntry("search_query", result.expandedQuery().combined());
    assertThat(result.metadata())
        .containsEntry("original_history_length", 3)
        .containsEntry("deduplicated_history_length", 2)
        .containsEntry("duplicates_removed", 1)
        .containsEntry("deduplication_threshold", 0.95)
        .containsEntry("estimated_token_savings", 7L)
        .containsEntry("entity_count", result.entities().size());
    assertThat(result.processingTimeMs()).isGreaterThanOrEqualTo(0.0);
  }

  @Test
  @DisplayName("Should answer a greeting directly")
  void shouldAnswerGreeting() {
    PreprocessingResult result = preprocessor.preprocess("Hello");

    assertThat(result.intent().intentType()).isEqualTo(IntentType.GREETING);
    assertThat(result.shouldCallLlm()).isFalse();
    assertThat(result.directResponse())
        .containsEntry("type", "greeting")
        .containsEntry("message", nlpConfig.getResponse().getGreetingMessage());
  }

  @Test
  @DisplayName("Should send a plain question to the model without a direct response")
  void shouldSendQuestionToModel() {
    PreprocessingResult result = preprocessor.preprocess("Why is the sky blue?");

    assertThat(result.intent().intentType()).isEqualTo(IntentType.QUESTION);
    assertThat(result.shouldCallLlm()).isTrue();
    assertThat(result.directResponse()).isNull();
    assertThat(result.expandedQuery()).isNotNull();
  }

  @Test
  @DisplayName("Should keep the routing flag consistent with the intent")
  void routingFlagShouldFollowIntent() {
    for (String query :
        List.of("Hello", "Find 'Python'", "Explain closures", "Create a course", "xyz", "")) {
      PreprocessingResult result = preprocessor.preprocess(query);

      assertThat(result.shouldCallLlm()).isEqualTo(result.intent().intentType().shouldCallLlm());
      assertThat(result.directResponse() == null).isEqualTo(result.shouldCallLlm());
    }
  }

  @Test
  @DisplayName("Should handle an empty query")
  void shouldHandleEmptyQuery() {
    PreprocessingResult result = preprocessor.preprocess("   ", List.of(), true, 0.95);

    assertThat(result.intent().intentType()).isEqualTo(IntentType.UNKNOWN);
    assertThat(result.intent().confidence()).isEqualTo(0.0);
    assertThat(result.entities()).isEmpty();
    assertThat(result.expandedQuery()).isNull();
    assertThat(result.deduplicatedHistory()).isNull();
    assertThat(result.shouldCallLlm()).isTrue();
    assertThat(result.metadata()).containsEntry("expansion_count", 0);
  }

  @Test
  @DisplayName("Should treat a null query as empty")
  void shouldHandleNullQuery() {
    PreprocessingResult result = preprocessor.preprocess((String) null);

    assertThat(result.intent().intentType()).isEqualTo(IntentType.UNKNOWN);
    assertThat(result.expandedQuery()).isNull();
  }

  @Test
  @DisplayName("Should leave history alone when deduplication is disabled")
  void shouldSkipDeduplicationWhenDisabled() {
    List<ConversationMessage> history =
        List.of(
            ConversationMessage.of("user", "a", List.of(1f, 0f)),
            ConversationMessage.of("user", "a", List.of(1f, 0f)));

    PreprocessingResult result = preprocessor.preprocess("Hello", history, false, 0.95);

    assertThat(result.deduplicatedHistory()).isNull();
    assertThat(result.metadata()).doesNotContainKey("duplicates_removed");
  }

  @Test
  @DisplayName("Should keep history without embeddings")
  void shouldKeepHistoryWithoutEmbeddings() {
    List<ConversationMessage> history =
        List.of(ConversationMessage.of("user", "hi"), ConversationMessage.of("user", "hi"));

    PreprocessingResult result = preprocessor.preprocess("Hello", history, true, 0.5);

    assertThat(result.deduplicatedHistory()).hasSize(2);
    assertThat(result.metadata())
        .containsEntry("duplicates_removed", 0)
        .containsEntry("estimated_token_savings", 0L);
  }

  @Test
  @DisplayName("Should count savings from dropped copies of equal messages")
  void shouldCountSavingsForEqualMessages() {
    ConversationMessage message = ConversationMessage.of("user", "12345678", List.of(1f, 0f));
    ConversationMessage copy = ConversationMessage.of("user", "12345678", List.of(1f, 0f));

    PreprocessingResult result =
        preprocessor.preprocess("Hello", List.of(message, copy), true, 0.95);

    assertThat(result.deduplicatedHistory()).hasSize(1);
    assertThat(result.metadata()).containsEntry("estimated_token_savings", 2L);
  }

  @Test
  @DisplayName("Should count savings when the same message appears twice")
  void shouldCountSavingsForRepeatedInstance() {
    ConversationMessage message = ConversationMessage.of("user", "12345678", List.of(1f, 0f));

    PreprocessingResult result =
        preprocessor.preprocess("Hello", List.of(message, message), true, 0.95);

    assertThat(result.deduplicatedHistory()).containsExactly(message);
    assertThat(result.metadata())
        .containsEntry("duplicates_removed", 1)
        .containsEntry("estimated_token_savings", 2L);
  }

  @Test
  @DisplayName("Should not report dropped null messages as duplicates")
  void shouldNotCountNullMessagesAsDuplicates() {
    ConversationMessage message = ConversationMessage.of("user", "12345678", List.of(1f, 0f));

    PreprocessingResult result =
        preprocessor.preprocess("Hello", Arrays.asList(null, message), true, 0.95);

    assertThat(result.deduplicatedHistory()).containsExactly(message);
    assertThat(result.metadata())
        .containsEntry("original_history_length", 2)
        .containsEntry("deduplicated_history_length", 1)
        .containsEntry("duplicates_removed", 0)
        .containsEntry("estimated_token_savings", 0L);
  }

  @Test
  @DisplayName("Should honour thresholds at both ends of the range")
  void shouldHonourThresholdBounds() {
    List<ConversationMessage> history =
        List.of(
            ConversationMessage.of("user", "a", List.of(1f, 0f)),
            ConversationMessage.of("user", "b", List.of(0.9f, 0.1f)),
            ConversationMessage.of("user", "c", List.of(0f, 1f)));

    assertThat(preprocessor.preprocess("Hello", history, true, 1.0).deduplicatedHistory())
        .hasSize(3);
    assertThat(preprocessor.preprocess("Hello", history, true, 0.0).deduplicatedHistory())
        .extracting(ConversationMessage::content)
        .containsExactly("a", "c");
  }

  @Test
  @DisplayName("Should propagate malformed history embeddings")
  void shouldPropagateInvalidEmbeddings() {
    List<ConversationMessage> history =
        List.of(
            ConversationMessage.of("user", "a", List.of(1f, 0f)),
            ConversationMessage.of("user", "b", List.of(1f, 0f, 0f)));

    assertThatThrownBy(() -> preprocessor.preprocess("Hello", history, true, 0.95))
        .isInstanceOf(InvalidEmbeddingException.class);
  }

  @Test
  @DisplayName("Should fill unset request options from configuration")
  void shouldApplyRequestDefaults() {
    nlpConfig.getDeduplication().setThreshold(0.9);
    List<ConversationMessage> history =
        List.of(ConversationMessage.of("user", "a", List.of(1f, 0f)));

    PreprocessingResult defaulted =
        preprocessor.preprocess(new PreprocessingRequest("Hello", history, null, null));
    PreprocessingResult disabled =
        preprocessor.preprocess(new PreprocessingRequest("Hello", history, false, null));

    assertThat(defaulted.metadata()).containsEntry("deduplication_threshold", 0.9);
    assertThat(disabled.deduplicatedHistory()).isNull();
    assertThat(preprocessor.preprocess(PreprocessingRequest.of("Hello")).intent().intentType())
        .isEqualTo(IntentType.GREETING);
  }

  @Test
  @DisplayName("Should record intent, bypass and deduplication counters")
  void shouldRecordMetrics() {
    List<ConversationMessage> history =
        List.of(
            ConversationMessage.of("user", "a", List.of(1f, 0f)),
            ConversationMessage.of("user", "a", List.of(1f, 0f)));

    preprocessor.preprocess("Hello", history, true, 0.95);
    preprocessor.preprocess("Why is the sky blue?");

    assertThat(meterRegistry.counter("nlp.preprocess.intent", "intent", "greeting").count())
        .isEqualTo(1.0);
    assertThat(meterRegistry.counter("nlp.preprocess.intent", "intent", "question").count())
        .isEqualTo(1.0);
    assertThat(meterRegistry.counter("nlp.preprocess.llm_bypassed").count()).isEqualTo(1.0);
    assertThat(meterRegistry.counter("nlp.deduplication.removed").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should not mutate the caller's history")
  void shouldNotMutateHistory() {
    List<ConversationMessage> history =
        new ArrayList<>(
            List.of(
                ConversationMessage.of("user", "a", List.of(1f, 0f)),
                ConversationMessage.of("user", "a", List.of(1f, 0f))));

    preprocessor.preprocess("Hello", history, true, 0.95);

    assertThat(history).hasSize(2);
  }
}
