package com.flamingo.ai.nlp.service.similarity;

import com.flamingo.ai.nlp.domain.model.ConversationMessage;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Removes near-duplicate conversation turns by embedding similarity.
 *
 * <p>Greedy first-kept policy: walk the entries in order and keep an entry unless its similarity to
 * some already kept entry strictly exceeds the threshold. Entries are compared only against kept
 * entries, never against dropped ones.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SemanticDeduplicator {

  private final SimilarityCalculator similarityCalculator;

  /**
   * Indices of the entries to keep.
   *
   * @param embeddings vectors in conversation order, all the same length
   * @param threshold similarity an entry must strictly exceed to be dropped
   * @return ascending indices; contains 0 whenever the input is non-empty
   */
  public List<Integer> deduplicate(List<List<Float>> embeddings, double threshold) {
    SimilarityCalculator.VectorBatch batch = similarityCalculator.toBatch(embeddings);
    List<Integer> kept = new ArrayList<>();
    for (int candidate = 0; candidate < batch.size(); candidate++) {
      boolean duplicate = false;
      for (int keptIndex : kept) {
        if (batch.similarity(keptIndex, candidate) > threshold) {
          duplicate = true;
          break;
        }
      }
      if (!duplicate) {
        kept.add(candidate);
      }
    }
    log.debug(
        "Deduplicated {} embeddings to {} (threshold {})", batch.size(), kept.size(), threshold);
    return kept;
  }

  /**
   * Filters a conversation history. Messages without an embedding are always kept and never
   * compared; the rest go through {@link #deduplicate(List, double)}. Relative order is preserved.
   *
   * @param history messages in conversation order
   * @param threshold duplicate threshold
   * @return the retained messages
   */
  public List<ConversationMessage> deduplicateMessages(
      List<ConversationMessage> history, double threshold) {
    return deduplicateHistory(history, threshold).retained();
  }

  /**
   * Filters a conversation history like {@link #deduplicateMessages(List, double)} and also
   * reports which positions were dropped as duplicates. Null entries are dropped but are not
   * duplicates.
   *
   * @param history messages in conversation order
   * @param threshold duplicate threshold
   * @return retained messages and the ascending positions of dropped duplicates
   */
  public HistoryDeduplication deduplicateHistory(
      List<ConversationMessage> history, double threshold) {
    if (history == null || history.isEmpty()) {
      return new HistoryDeduplication(List.of(), List.of());
    }

    List<Integer> embeddedPositions = new ArrayList<>();
    List<List<Float>> embeddings = new ArrayList<>();
    for (int i = 0; i < history.size(); i++) {
      ConversationMessage message = history.get(i);
      if (message != null && message.hasEmbedding()) {
        embeddedPositions.add(i);
        embeddings.add(message.embedding());
      }
    }

    boolean[] keep = new boolean[history.size()];
    for (int i = 0; i < keep.length; i++) {
      keep[i] = history.get(i) != null && !history.get(i).hasEmbedding();
    }
    for (int keptIndex : deduplicate(embeddings, threshold)) {
      keep[embeddedPositions.get(keptIndex)] = true;
    }

    List<ConversationMessage> retained = new ArrayList<>();
    List<Integer> duplicatePositions = new ArrayList<>();
    for (int i = 0; i < keep.length; i++) {
      if (keep[i]) {
        retained.add(history.get(i));
      } else if (history.get(i) != null) {
        duplicatePositions.add(i);
      }
    }
    return new HistoryDeduplication(List.copyOf(retained), List.copyOf(duplicatePositions));
  }

  /**
   * Outcome of {@link #deduplicateHistory(List, double)}.
   *
   * @param retained kept messages in conversation order
   * @param duplicatePositions positions in the input history of messages dropped as duplicates
   */
  public record HistoryDeduplication(
      List<ConversationMessage> retained, List<Integer> duplicatePositions) {}
}
