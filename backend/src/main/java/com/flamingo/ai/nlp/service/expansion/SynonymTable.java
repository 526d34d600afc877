package com.flamingo.ai.nlp.service.expansion;

import com.flamingo.ai.nlp.lexicon.TermPatterns;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * Term to synonym table with copy-on-write updates.
 *
 * <p>Readers take the current {@link Snapshot} without locking. Writers serialize on a lock, build
 * a new snapshot with the term's pattern compiled once, and publish it through a volatile field, so
 * a reader never observes a half-applied update.
 */
class SynonymTable {

  private final ReentrantLock writeLock = new ReentrantLock();
  private volatile Snapshot snapshot;

  /**
   * Builds the table from several source tables. A term present in more than one table gets the
   * union of its synonyms, first table first.
   */
  @SafeVarargs
  SynonymTable(Map<String, List<String>>... tables) {
    Map<String, Set<String>> merged = new LinkedHashMap<>();
    for (Map<String, List<String>> table : tables) {
      table.forEach((term, synonyms) -> merge(merged, term, synonyms));
    }
    this.snapshot = Snapshot.of(merged);
  }

  Snapshot snapshot() {
    return snapshot;
  }

  List<String> get(String term) {
    if (term == null) {
      return List.of();
    }
    Entry entry = snapshot.entries().get(normalize(term));
    return entry == null ? List.of() : entry.synonyms();
  }

  void add(String term, List<String> synonyms) {
    if (term == null || term.isBlank()) {
      throw new IllegalArgumentException("Synonym term must not be blank");
    }
    writeLock.lock();
    try {
      Map<String, Set<String>> next = new LinkedHashMap<>();
      snapshot
          .entries()
          .forEach((key, entry) -> next.put(key, new LinkedHashSet<>(entry.synonyms())));
      merge(next, term, synonyms == null ? List.of() : synonyms);
      snapshot = Snapshot.of(next);
    } finally {
      writeLock.unlock();
    }
  }

  private static void merge(Map<String, Set<String>> target, String term, List<String> synonyms) {
    String key = normalize(term);
    Set<String> values = target.computeIfAbsent(key, k -> new LinkedHashSet<>());
    for (String synonym : synonyms) {
      if (synonym != null && !synonym.isBlank()) {
        String normalized = normalize(synonym);
        if (!normalized.equals(key)) {
          values.add(normalized);
        }
      }
    }
  }

  private static String normalize(String text) {
    return text.strip().toLowerCase(Locale.ROOT);
  }

  /** A term's synonyms and its compiled whole-word pattern. */
  record Entry(List<String> synonyms, Pattern pattern) {}

  /** Immutable view of the table, in insertion order. */
  record Snapshot(Map<String, Entry> entries) {

    static Snapshot of(Map<String, Set<String>> table) {
      Map<String, Entry> entries = new LinkedHashMap<>();
      table.forEach(
          (term, synonyms) ->
              entries.put(
                  term,
                  new Entry(
                      Collections.unmodifiableList(new ArrayList<>(synonyms)),
                      TermPatterns.wholeWord(term))));
      return new Snapshot(Collections.unmodifiableMap(entries));
    }
  }
}
