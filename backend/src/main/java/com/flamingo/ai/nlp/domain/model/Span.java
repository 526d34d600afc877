package com.flamingo.ai.nlp.domain.model;

/**
 * Half-open character range {@code [start, end)} into the original query.
 *
 * @param start inclusive start offset
 * @param end exclusive end offset
 */
public record Span(int start, int end) {

  public Span {
    if (start < 0 || start >= end) {
      throw new IllegalArgumentException(
          "Invalid span [" + start + ", " + end + "): start must be >= 0 and < end");
    }
  }

  public int length() {
    return end - start;
  }
}
