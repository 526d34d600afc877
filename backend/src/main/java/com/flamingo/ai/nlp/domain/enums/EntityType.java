package com.flamingo.ai.nlp.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Closed set of entity types the extractor can tag. */
public enum EntityType {
  COURSE,
  TOPIC,
  SKILL,
  CONCEPT,
  PERSON,
  ORGANIZATION,
  DIFFICULTY,
  DURATION;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
