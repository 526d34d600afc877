package com.flamingo.ai.nlp.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Order-preserving unmodifiable copies for the value records in this package. */
final class Immutables {

  private Immutables() {}

  static <T> List<T> list(List<T> source) {
    if (source == null || source.isEmpty()) {
      return List.of();
    }
    return Collections.unmodifiableList(new ArrayList<>(source));
  }

  static <K, V> Map<K, V> map(Map<K, V> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }

  static <K, V> Map<K, List<V>> multimap(Map<K, List<V>> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    Map<K, List<V>> copy = new LinkedHashMap<>();
    source.forEach((key, values) -> copy.put(key, list(values)));
    return Collections.unmodifiableMap(copy);
  }
}
