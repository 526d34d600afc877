package com.flamingo.ai.nlp.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the preprocessing pipeline. */
@Configuration
@ConfigurationProperties(prefix = "nlp")
@Validated
@Getter
@Setter
public class NlpConfig {

  @Valid private Deduplication deduplication = new Deduplication();
  @Valid private IntentClassification intent = new IntentClassification();
  @Valid private Lexicon lexicon = new Lexicon();
  private Response response = new Response();

  @Getter
  @Setter
  public static class Deduplication {
    /** Default for requests that do not say whether to deduplicate history. */
    private boolean enabled = true;

    /** Cosine similarity a pair must strictly exceed to count as duplicate. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double threshold = 0.95;
  }

  @Getter
  @Setter
  public static class IntentClassification {
    /** Candidates scoring below this are discarded and the query falls through to UNKNOWN. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minConfidence = 0.3;
  }

  @Getter
  @Setter
  public static class Lexicon {
    /** Classpath location of the lexicon JSON. */
    @NotBlank private String location = "/nlp-lexicon.json";
  }

  @Getter
  @Setter
  public static class Response {
    private String greetingMessage =
        "Hello! I can help you find courses, check prerequisites, plan a learning path or"
            + " explain a concept. What would you like to do?";

    private String feedbackMessage = "Thanks for the feedback!";
  }
}
