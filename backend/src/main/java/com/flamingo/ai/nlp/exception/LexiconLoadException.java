package com.flamingo.ai.nlp.exception;

/** Exception thrown when the lexicon resource is missing or malformed. */
public class LexiconLoadException extends RuntimeException {

  private final String location;
  private final String userMessage;

  public LexiconLoadException(String location, String message) {
    super(message);
    this.location = location;
    this.userMessage = "Language resources are unavailable";
  }

  public LexiconLoadException(String location, String message, Throwable cause) {
    super(message, cause);
    this.location = location;
    this.userMessage = "Language resources are unavailable";
  }

  public String getLocation() {
    return location;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
