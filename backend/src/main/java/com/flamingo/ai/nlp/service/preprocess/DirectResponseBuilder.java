package com.flamingo.ai.nlp.service.preprocess;

import com.flamingo.ai.nlp.config.NlpConfig;
import com.flamingo.ai.nlp.domain.enums.EntityType;
import com.flamingo.ai.nlp.domain.model.Entity;
import com.flamingo.ai.nlp.domain.model.ExpandedQuery;
import com.flamingo.ai.nlp.domain.model.Intent;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds the payload that replaces the model call for intents answerable without it.
 *
 * <p>Every payload carries {@code type} (the intent's wire value) and {@code query}. The remaining
 * keys depend on the intent and are meant for the downstream lookup or canned-reply handler.
 */
@Component
@RequiredArgsConstructor
public class DirectResponseBuilder {

  private final NlpConfig nlpConfig;

  /**
   * @return the payload, or null when the intent needs the model
   */
  public Map<String, Object> build(
      String query, Intent intent, List<Entity> entities, ExpandedQuery expandedQuery) {
    if (intent.shouldCallLlm()) {
      return null;
    }

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("type", intent.intentType().value());
    payload.put("query", query);

    switch (intent.intentType()) {
      case GREETING -> payload.put("message", nlpConfig.getResponse().getGreetingMessage());
      case FEEDBACK -> payload.put("message", nlpConfig.getResponse().getFeedbackMessage());
      case PREREQUISITE_CHECK, COURSE_LOOKUP -> {
        courseName(entities).ifPresent(name -> payload.put("course_name", name));
        if (expandedQuery != null) {
          payload.put("search_query", expandedQuery.combined());
        }
      }
      case SKILL_LOOKUP -> payload.put("skills", texts(entities, EntityType.SKILL));
      case LEARNING_PATH -> {
        List<String> topics = texts(entities, EntityType.TOPIC);
        if (!topics.isEmpty()) {
          payload.put("topics", topics);
        }
        first(entities, EntityType.DIFFICULTY)
            .ifPresent(e -> payload.put("difficulty", e.metadata().get("level")));
      }
      default -> {
        // no intent-specific detail
      }
    }
    return payload;
  }

  private Optional<String> courseName(List<Entity> entities) {
    return first(entities, EntityType.COURSE)
        .or(() -> first(entities, EntityType.TOPIC))
        .map(Entity::text);
  }

  private static Optional<Entity> first(List<Entity> entities, EntityType type) {
    return entities.stream().filter(e -> e.entityType() == type).findFirst();
  }

  private static List<String> texts(List<Entity> entities, EntityType type) {
    return entities.stream()
        .filter(e -> e.entityType() == type)
        .map(Entity::text)
        .distinct()
        .toList();
  }
}
