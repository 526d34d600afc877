package com.flamingo.ai.nlp.domain.model;

/**
 * Pairwise comparison of two history entries, {@code index1 < index2}.
 *
 * @param index1 position of the earlier entry
 * @param index2 position of the later entry
 * @param similarity cosine similarity in [-1, 1]
 * @param isDuplicate whether the similarity strictly exceeds the threshold used
 */
public record SemanticSimilarity(int index1, int index2, double similarity, boolean isDuplicate) {}
