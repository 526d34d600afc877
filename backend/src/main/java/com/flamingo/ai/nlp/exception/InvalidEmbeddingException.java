package com.flamingo.ai.nlp.exception;

/**
 * Exception thrown when an embedding vector cannot take part in a similarity comparison: vectors of
 * different lengths, null vectors or components, NaN or infinite components.
 */
public class InvalidEmbeddingException extends RuntimeException {

  private final String userMessage;

  public InvalidEmbeddingException(String message) {
    super(message);
    this.userMessage = "Conversation history contains an invalid embedding vector";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
