package com.flamingo.ai.nlp.service.similarity;

import com.flamingo.ai.nlp.domain.model.SemanticSimilarity;
import com.flamingo.ai.nlp.exception.InvalidEmbeddingException;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Cosine similarity kernel over embedding vectors.
 *
 * <p>Vectors are validated before use: a null vector or component, a NaN or infinite component, or
 * two vectors of different lengths raise {@link InvalidEmbeddingException}. A zero-magnitude vector
 * is not an error; its similarity to anything is exactly 0.0. Results are clamped into [-1, 1].
 *
 * <p>Batch operations convert the input once into a {@link VectorBatch} with precomputed norms and
 * then reuse the single-pair arithmetic, so a pair scores bit-for-bit the same whichever entry
 * point computed it.
 */
@Component
public class SimilarityCalculator {

  /**
   * Cosine similarity of two vectors.
   *
   * @return 1.0 for identical directions, 0.0 for orthogonal or zero vectors, -1.0 for opposite
   */
  public double cosineSimilarity(List<Float> a, List<Float> b) {
    double[] x = toArray(a);
    double[] y = toArray(b);
    requireSameLength(x, y);
    return cosine(x, norm(x), y, norm(y));
  }

  /**
   * Similarity of one vector against each row, in row order.
   *
   * @param query vector compared against every row
   * @param vectors rows, each the same length as {@code query}
   * @return one score per row
   */
  public double[] batchSimilarity(List<Float> query, List<List<Float>> vectors) {
    double[] q = toArray(query);
    double queryNorm = norm(q);
    VectorBatch batch = toBatch(vectors);
    double[] scores = new double[batch.size()];
    for (int i = 0; i < scores.length; i++) {
      requireSameLength(q, batch.rows()[i]);
      scores[i] = cosine(q, queryNorm, batch.rows()[i], batch.norms()[i]);
    }
    return scores;
  }

  /**
   * Every pair {@code i < j} of the given vectors with its similarity and duplicate flag.
   *
   * @param embeddings vectors to compare
   * @param threshold a pair is a duplicate when its similarity strictly exceeds this
   * @return pairs ordered by {@code index1}, then {@code index2}
   */
  public List<SemanticSimilarity> computePairwise(List<List<Float>> embeddings, double threshold) {
    VectorBatch batch = toBatch(embeddings);
    List<SemanticSimilarity> pairs = new ArrayList<>();
    for (int i = 0; i < batch.size(); i++) {
      for (int j = i + 1; j < batch.size(); j++) {
        double similarity = batch.similarity(i, j);
        pairs.add(new SemanticSimilarity(i, j, similarity, similarity > threshold));
      }
    }
    return pairs;
  }

  /**
   * Pairs {@code i < j} whose similarity strictly exceeds the threshold.
   *
   * @param embeddings vectors to compare
   * @param threshold duplicate threshold
   * @return duplicate pairs ordered by {@code index1}, then {@code index2}
   */
  public List<SemanticSimilarity> findDuplicatePairs(
      List<List<Float>> embeddings, double threshold) {
    return computePairwise(embeddings, threshold).stream()
        .filter(SemanticSimilarity::isDuplicate)
        .toList();
  }

  /**
   * Validates vectors and precomputes their norms.
   *
   * @throws InvalidEmbeddingException when a vector is malformed or lengths differ
   */
  VectorBatch toBatch(List<List<Float>> vectors) {
    if (vectors == null) {
      throw new InvalidEmbeddingException("Embedding batch must not be null");
    }
    double[][] rows = new double[vectors.size()][];
    double[] norms = new double[rows.length];
    for (int i = 0; i < rows.length; i++) {
      rows[i] = toArray(vectors.get(i));
      requireSameLength(rows[0], rows[i]);
      norms[i] = norm(rows[i]);
    }
    return new VectorBatch(rows, norms);
  }

  /** Validated vectors with their norms. */
  record VectorBatch(double[][] rows, double[] norms) {

    int size() {
      return rows.length;
    }

    double similarity(int i, int j) {
      return cosine(rows[i], norms[i], rows[j], norms[j]);
    }
  }

  private static double cosine(double[] a, double normA, double[] b, double normB) {
    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    return clamp(dot(a, b) / (normA * normB));
  }

  private static double[] toArray(List<Float> vector) {
    if (vector == null) {
      throw new InvalidEmbeddingException("Embedding vector must not be null");
    }
    double[] result = new double[vector.size()];
    for (int i = 0; i < result.length; i++) {
      Float value = vector.get(i);
      if (value == null) {
        throw new InvalidEmbeddingException("Embedding component " + i + " is null");
      }
      if (!Float.isFinite(value)) {
        throw new InvalidEmbeddingException(
            "Embedding component " + i + " is not finite: " + value);
      }
      result[i] = value;
    }
    return result;
  }

  private static void requireSameLength(double[] a, double[] b) {
    if (a.length != b.length) {
      throw new InvalidEmbeddingException(
          "Embedding dimensions differ: " + a.length + " vs " + b.length);
    }
  }

  private static double dot(double[] a, double[] b) {
    double sum = 0.0;
    for (int i = 0; i < a.length; i++) {
      sum += a[i] * b[i];
    }
    return sum;
  }

  private static double norm(double[] vector) {
    return Math.sqrt(dot(vector, vector));
  }

  private static double clamp(double value) {
    return Math.max(-1.0, Math.min(1.0, value));
  }
}
